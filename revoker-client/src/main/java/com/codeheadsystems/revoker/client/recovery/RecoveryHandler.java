package com.codeheadsystems.revoker.client.recovery;

import com.codeheadsystems.revoker.model.outcome.RetryRequested;
import java.time.Duration;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides what the runtime should do after an invocation failed.
 * <p>
 * Retryable failures become a {@link RetryRequested} outcome carrying a back-off delay: the
 * configured delay when a rate-limit or gateway status was recognized, no delay when the
 * failure merely fell through to the default.  Fatal failures are rethrown unchanged.
 */
@Singleton
public class RecoveryHandler {

  /**
   * Back-off applied when a 429/5xx status was recognized.
   */
  public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(5);

  private static final Logger log = LoggerFactory.getLogger(RecoveryHandler.class);

  private final FailureClassifier classifier;
  private final Duration retryDelay;

  /**
   * Instantiates a new Recovery handler with the default delay.
   *
   * @param classifier the classifier
   */
  @Inject
  public RecoveryHandler(final FailureClassifier classifier) {
    this(classifier, DEFAULT_RETRY_DELAY);
  }

  /**
   * Instantiates a new Recovery handler.
   *
   * @param classifier the classifier
   * @param retryDelay back-off for recognized transient failures
   */
  public RecoveryHandler(final FailureClassifier classifier, final Duration retryDelay) {
    this.classifier = classifier;
    this.retryDelay = retryDelay;
  }

  /**
   * Handles a failure.
   *
   * @param error the failure raised by the workflow
   * @return a retry request
   * @throws RuntimeException the original error, if it is fatal
   */
  public RetryRequested recover(final RuntimeException error) {
    log.error("Error removing user from permission set: {}", error.getMessage());
    boolean recognized = classifier.explicitDecision(error).isPresent();
    if (classifier.classify(error) == FailureDecision.FATAL) {
      log.error("Not retrying {}", error.getClass().getSimpleName());
      throw error;
    }
    long delay = recognized ? retryDelay.toMillis() : 0L;
    log.info("Retryable error, requesting retry in {} ms", delay);
    return new RetryRequested(delay);
  }
}

package com.codeheadsystems.revoker.client.recovery;

import com.codeheadsystems.revoker.client.exceptions.RevokerException;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Maps a failure to {@link FailureDecision#RETRYABLE} or {@link FailureDecision#FATAL} by looking
 * for HTTP status codes in the failure's status and message.
 * <ul>
 *   <li>{@code 429}, {@code 502}, {@code 503}, {@code 504}: retryable (rate limit, gateway).</li>
 *   <li>{@code 401}, {@code 403}: fatal (credentials or permissions are wrong).</li>
 *   <li>anything else: the configured default.</li>
 * </ul>
 * Retryable markers are checked first.  Pure; no I/O.
 */
@Singleton
public class FailureClassifier {

  /**
   * Markers for rate limiting and transient upstream failures.
   */
  public static final List<String> RETRYABLE_MARKERS = List.of("429", "502", "503", "504");

  /**
   * Markers for authentication and authorization failures.
   */
  public static final List<String> FATAL_MARKERS = List.of("401", "403");

  private final FailureDecision defaultDecision;

  /**
   * Instantiates a new Failure classifier that retries unrecognized failures.
   */
  @Inject
  public FailureClassifier() {
    this(FailureDecision.RETRYABLE);
  }

  /**
   * Instantiates a new Failure classifier.
   *
   * @param defaultDecision decision for failures that match no marker
   */
  public FailureClassifier(final FailureDecision defaultDecision) {
    this.defaultDecision = defaultDecision;
  }

  /**
   * Classifies a failure.
   *
   * @param error the error
   * @return the decision
   */
  public FailureDecision classify(final Throwable error) {
    return explicitDecision(error).orElse(defaultDecision);
  }

  /**
   * Whether the failure matched one of the explicit markers rather than falling through to the
   * default.
   *
   * @param error the error
   * @return the decision from a marker, if any matched
   */
  public Optional<FailureDecision> explicitDecision(final Throwable error) {
    String signal = signal(error);
    if (RETRYABLE_MARKERS.stream().anyMatch(signal::contains)) {
      return Optional.of(FailureDecision.RETRYABLE);
    }
    if (FATAL_MARKERS.stream().anyMatch(signal::contains)) {
      return Optional.of(FailureDecision.FATAL);
    }
    return Optional.empty();
  }

  private static String signal(final Throwable error) {
    StringBuilder signal = new StringBuilder();
    if (error instanceof RevokerException revokerException) {
      revokerException.status().ifPresent(status -> signal.append(status).append(' '));
    }
    if (error.getMessage() != null) {
      signal.append(error.getMessage());
    }
    return signal.toString();
  }
}

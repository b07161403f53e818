package com.codeheadsystems.revoker.model.outcome;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Returned by the error handler when a failure is worth retrying.  The scheduler should invoke
 * the action again no sooner than {@code retryAfterMillis} from now.
 *
 * @param retryAfterMillis suggested delay before the next attempt
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"status", "retryAfterMillis"})
public record RetryRequested(@JsonProperty("retryAfterMillis") long retryAfterMillis)
    implements RemovalOutcome {

  /**
   * The status value for this outcome.
   */
  public static final String STATUS = "retry_requested";

  @Override
  @JsonProperty("status")
  public String status() {
    return STATUS;
  }
}

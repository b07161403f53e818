package com.codeheadsystems.revoker.model.outcome;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The surrounding runtime asked the action to stop before it finished.
 *
 * @param username the username being processed, or {@value #UNKNOWN_USER} if none was supplied
 * @param reason   the halt reason given by the runtime
 * @param haltedAt ISO-8601 instant at which the halt was recorded
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"status", "username", "reason", "haltedAt"})
public record HaltedResult(
    @JsonProperty("username") String username,
    @JsonProperty("reason") String reason,
    @JsonProperty("haltedAt") String haltedAt) implements RemovalOutcome {

  /**
   * The status value for this outcome.
   */
  public static final String STATUS = "halted";

  /**
   * Placeholder username when the halt arrives before a username is known.
   */
  public static final String UNKNOWN_USER = "unknown";

  /**
   * Substitutes {@value #UNKNOWN_USER} for a missing username.
   */
  public HaltedResult {
    if (username == null || username.isBlank()) {
      username = UNKNOWN_USER;
    }
  }

  @Override
  @JsonProperty("status")
  public String status() {
    return STATUS;
  }
}

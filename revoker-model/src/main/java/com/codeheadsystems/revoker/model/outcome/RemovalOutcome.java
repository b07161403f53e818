package com.codeheadsystems.revoker.model.outcome;

/**
 * Structured result of one invocation of the permission set removal action.
 * <p>
 * Every outcome serializes with a {@code status} discriminator: {@code success},
 * {@code halted} or {@code retry_requested}.  Fatal failures are never represented here; they
 * surface as exceptions.
 */
public interface RemovalOutcome {

  /**
   * The status discriminator.
   *
   * @return the status
   */
  String status();
}

package com.codeheadsystems.revoker.client.recovery;

/**
 * What to do with a failed invocation.
 */
public enum FailureDecision {

  /**
   * Transient; ask the scheduler to run the action again later.
   */
  RETRYABLE,

  /**
   * Retrying the same request cannot succeed; surface the error to an operator.
   */
  FATAL
}

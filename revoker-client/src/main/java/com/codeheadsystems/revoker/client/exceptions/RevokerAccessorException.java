package com.codeheadsystems.revoker.client.exceptions;

/**
 * Transport-level failure: the HTTP exchange could not be completed, or its response was unusable.
 */
public class RevokerAccessorException extends RevokerException {

  /**
   * Instantiates a new Revoker accessor exception for a response that arrived but cannot be used.
   *
   * @param message the message
   */
  public RevokerAccessorException(final String message) {
    super(message, null, null);
  }

  /**
   * Instantiates a new Revoker accessor exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public RevokerAccessorException(final String message, final Throwable cause) {
    super(message, null, cause);
  }
}

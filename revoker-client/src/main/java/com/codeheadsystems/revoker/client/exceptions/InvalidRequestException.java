package com.codeheadsystems.revoker.client.exceptions;

/**
 * A required input parameter was missing or blank.
 */
public class InvalidRequestException extends RevokerException {

  /**
   * Instantiates a new Invalid request exception.
   *
   * @param message the message
   */
  public InvalidRequestException(final String message) {
    super(message);
  }
}

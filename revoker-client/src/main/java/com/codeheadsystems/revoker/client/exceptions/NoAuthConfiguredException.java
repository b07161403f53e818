package com.codeheadsystems.revoker.client.exceptions;

/**
 * No complete credential bundle was found in the secrets and environment.
 */
public class NoAuthConfiguredException extends RevokerException {

  /**
   * The base message.
   */
  public static final String MESSAGE = "No authentication configured";

  /**
   * Instantiates a new No auth configured exception.
   */
  public NoAuthConfiguredException() {
    super(MESSAGE);
  }

  /**
   * Instantiates a new No auth configured exception with extra detail.
   *
   * @param detail what was missing
   */
  public NoAuthConfiguredException(final String detail) {
    super(MESSAGE + ": " + detail);
  }
}

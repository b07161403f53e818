package com.codeheadsystems.revoker.client.exceptions;

/**
 * The configured Salesforce base URL is not an absolute http(s) URL.
 */
public class InvalidAddressException extends RevokerException {

  /**
   * Instantiates a new Invalid address exception.
   *
   * @param address the rejected address
   * @param detail  why it was rejected
   * @param cause   the parse failure, may be null
   */
  public InvalidAddressException(final String address, final String detail, final Throwable cause) {
    super("Invalid Salesforce address '" + address + "': " + detail, null, cause);
  }
}

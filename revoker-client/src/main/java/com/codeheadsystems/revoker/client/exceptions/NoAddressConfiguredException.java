package com.codeheadsystems.revoker.client.exceptions;

/**
 * Neither the request nor the environment supplied a Salesforce base URL.
 */
public class NoAddressConfiguredException extends RevokerException {

  /**
   * Instantiates a new No address configured exception.
   */
  public NoAddressConfiguredException() {
    super("No URL specified. Provide address parameter or ADDRESS environment variable");
  }
}

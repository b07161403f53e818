package com.codeheadsystems.revoker.client.exceptions;

/**
 * The token endpoint returned 2xx but no {@code access_token}.
 */
public class MissingAccessTokenException extends RevokerException {

  /**
   * Instantiates a new Missing access token exception.
   */
  public MissingAccessTokenException() {
    super("No access_token in OAuth2 response");
  }
}

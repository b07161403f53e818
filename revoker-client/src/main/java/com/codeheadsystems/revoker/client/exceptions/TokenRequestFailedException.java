package com.codeheadsystems.revoker.client.exceptions;

/**
 * The OAuth2 token endpoint answered the client credentials grant with a non-2xx status.
 */
public class TokenRequestFailedException extends RevokerException {

  private final String responseBody;

  /**
   * Instantiates a new Token request failed exception.
   *
   * @param status       the status
   * @param statusText   the status text
   * @param responseBody the response body
   */
  public TokenRequestFailedException(final int status, final String statusText, final String responseBody) {
    super("OAuth2 token request failed: " + status + " " + statusText + " - " + responseBody, status, null);
    this.responseBody = responseBody;
  }

  /**
   * The raw body returned by the token endpoint.
   *
   * @return the body
   */
  public String responseBody() {
    return responseBody;
  }
}

package com.codeheadsystems.revoker.client.auth;

/**
 * Where the client id and secret go on an OAuth2 client credentials token request.
 */
public enum AuthStyle {

  /**
   * HTTP Basic {@code Authorization} header on the token request (RFC 6749 §2.3.1, default).
   */
  IN_HEADER,

  /**
   * {@code client_id} and {@code client_secret} form parameters in the request body.
   */
  IN_PARAMS;

  /**
   * Parses the {@code OAUTH2_CLIENT_CREDENTIALS_AUTH_STYLE} value.  Only {@code InParams}
   * (case-insensitive) selects body credentials; anything else, including null, is the header.
   *
   * @param value the configured value
   * @return the auth style
   */
  public static AuthStyle fromConfig(final String value) {
    return value != null && value.trim().equalsIgnoreCase("InParams") ? IN_PARAMS : IN_HEADER;
  }
}

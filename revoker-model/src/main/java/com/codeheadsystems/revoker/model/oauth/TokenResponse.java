package com.codeheadsystems.revoker.model.oauth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * OAuth 2.0 token endpoint response (RFC 6749 §5.1), reduced to the fields we read.
 *
 * @param accessToken the issued access token, may be null if the server omitted it
 * @param tokenType   the token type, usually {@code Bearer}
 * @param expiresIn   lifetime in seconds, or null when not supplied
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("expires_in") Long expiresIn) {

  /**
   * Whether the response actually carries a usable access token.
   *
   * @return true if the access token is present and not blank
   */
  public boolean hasAccessToken() {
    return accessToken != null && !accessToken.isBlank();
  }
}

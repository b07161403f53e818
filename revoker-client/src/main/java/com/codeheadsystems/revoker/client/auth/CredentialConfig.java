package com.codeheadsystems.revoker.client.auth;

import java.util.Objects;
import java.util.Optional;

/**
 * The four supported credential bundles.  Exactly one is selected per invocation by
 * {@link CredentialResolver#select}.
 */
public interface CredentialConfig {

  /**
   * A static bearer token, with or without its {@code Bearer } prefix.
   *
   * @param token the token
   */
  record BearerToken(String token) implements CredentialConfig {
    /**
     * Secret key.
     */
    public static final String TOKEN = "BEARER_AUTH_TOKEN";

    public BearerToken {
      Objects.requireNonNull(token, "token");
    }

    @Override
    public String toString() {
      return "BearerToken[***]";
    }
  }

  /**
   * HTTP basic credentials.
   *
   * @param username the username
   * @param password the password
   */
  record BasicAuth(String username, String password) implements CredentialConfig {
    /**
     * Secret key for the username.
     */
    public static final String USERNAME = "BASIC_USERNAME";
    /**
     * Secret key for the password.
     */
    public static final String PASSWORD = "BASIC_PASSWORD";

    public BasicAuth {
      Objects.requireNonNull(username, "username");
      Objects.requireNonNull(password, "password");
    }

    @Override
    public String toString() {
      return "BasicAuth[username=" + username + "]";
    }
  }

  /**
   * An access token previously obtained through the authorization code flow.
   *
   * @param accessToken the access token
   */
  record AuthorizationCode(String accessToken) implements CredentialConfig {
    /**
     * Secret key.
     */
    public static final String ACCESS_TOKEN = "OAUTH2_AUTHORIZATION_CODE_ACCESS_TOKEN";

    public AuthorizationCode {
      Objects.requireNonNull(accessToken, "accessToken");
    }

    @Override
    public String toString() {
      return "AuthorizationCode[***]";
    }
  }

  /**
   * Client credentials grant parameters; a token is fetched from {@code tokenUrl} at resolution.
   *
   * @param tokenUrl     the token endpoint
   * @param clientId     the client id
   * @param clientSecret the client secret
   * @param scope        the scope, may be null
   * @param audience     the audience, may be null
   * @param authStyle    where to send the client credentials
   */
  record ClientCredentials(String tokenUrl, String clientId, String clientSecret,
                           String scope, String audience,
                           AuthStyle authStyle) implements CredentialConfig {
    /**
     * Secret key for the client secret.
     */
    public static final String CLIENT_SECRET = "OAUTH2_CLIENT_CREDENTIALS_CLIENT_SECRET";
    /**
     * Environment key for the token URL.
     */
    public static final String TOKEN_URL = "OAUTH2_CLIENT_CREDENTIALS_TOKEN_URL";
    /**
     * Environment key for the client id.
     */
    public static final String CLIENT_ID = "OAUTH2_CLIENT_CREDENTIALS_CLIENT_ID";
    /**
     * Environment key for the scope.
     */
    public static final String SCOPE = "OAUTH2_CLIENT_CREDENTIALS_SCOPE";
    /**
     * Environment key for the audience.
     */
    public static final String AUDIENCE = "OAUTH2_CLIENT_CREDENTIALS_AUDIENCE";
    /**
     * Environment key for the auth style.
     */
    public static final String AUTH_STYLE = "OAUTH2_CLIENT_CREDENTIALS_AUTH_STYLE";

    public ClientCredentials {
      Objects.requireNonNull(tokenUrl, "tokenUrl");
      Objects.requireNonNull(clientId, "clientId");
      Objects.requireNonNull(clientSecret, "clientSecret");
      authStyle = authStyle == null ? AuthStyle.IN_HEADER : authStyle;
    }

    /**
     * The scope to request, if configured.
     *
     * @return the scope
     */
    public Optional<String> optionalScope() {
      return Optional.ofNullable(scope).filter(s -> !s.isBlank());
    }

    /**
     * The audience to request, if configured.
     *
     * @return the audience
     */
    public Optional<String> optionalAudience() {
      return Optional.ofNullable(audience).filter(a -> !a.isBlank());
    }

    @Override
    public String toString() {
      return "ClientCredentials[tokenUrl=" + tokenUrl + ", clientId=" + clientId
          + ", scope=" + scope + ", audience=" + audience + ", authStyle=" + authStyle + "]";
    }
  }
}

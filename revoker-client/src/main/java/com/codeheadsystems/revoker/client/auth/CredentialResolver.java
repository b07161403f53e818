package com.codeheadsystems.revoker.client.auth;

import com.codeheadsystems.revoker.client.accessor.OAuth2TokenAccessor;
import com.codeheadsystems.revoker.client.auth.CredentialConfig.AuthorizationCode;
import com.codeheadsystems.revoker.client.auth.CredentialConfig.BasicAuth;
import com.codeheadsystems.revoker.client.auth.CredentialConfig.BearerToken;
import com.codeheadsystems.revoker.client.auth.CredentialConfig.ClientCredentials;
import com.codeheadsystems.revoker.client.config.RevokerContext;
import com.codeheadsystems.revoker.client.exceptions.NoAuthConfiguredException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the secrets and environment of an invocation into a single {@code Authorization} header.
 * <p>
 * Bundles are checked in a fixed order and the first complete one wins:
 * <ol>
 *   <li>{@code BEARER_AUTH_TOKEN}</li>
 *   <li>{@code BASIC_USERNAME} + {@code BASIC_PASSWORD}</li>
 *   <li>{@code OAUTH2_AUTHORIZATION_CODE_ACCESS_TOKEN}</li>
 *   <li>{@code OAUTH2_CLIENT_CREDENTIALS_CLIENT_SECRET} with its token URL and client id</li>
 * </ol>
 * Lower-precedence bundles are not inspected once a higher one is complete, so a half-configured
 * client credentials setup does not matter when a bearer token is present.  Only the client
 * credentials bundle touches the network.
 */
@Singleton
public class CredentialResolver {

  /**
   * Bearer scheme prefix, including the separating space.
   */
  public static final String BEARER_PREFIX = "Bearer ";

  /**
   * Basic scheme prefix, including the separating space.
   */
  public static final String BASIC_PREFIX = "Basic ";

  private static final Logger log = LoggerFactory.getLogger(CredentialResolver.class);

  private final OAuth2TokenAccessor tokenAccessor;

  /**
   * Instantiates a new Credential resolver.
   *
   * @param tokenAccessor used for the client credentials grant
   */
  @Inject
  public CredentialResolver(final OAuth2TokenAccessor tokenAccessor) {
    log.info("CredentialResolver()");
    this.tokenAccessor = tokenAccessor;
  }

  /**
   * Selects the active credential bundle.
   *
   * @param context the invocation context
   * @return the credential config
   * @throws NoAuthConfiguredException if no bundle is complete
   */
  public CredentialConfig select(final RevokerContext context) {
    Optional<String> bearer = context.secret(BearerToken.TOKEN);
    if (bearer.isPresent()) {
      return new BearerToken(bearer.get());
    }

    Optional<String> basicUser = context.secret(BasicAuth.USERNAME);
    Optional<String> basicPassword = context.secret(BasicAuth.PASSWORD);
    if (basicUser.isPresent() && basicPassword.isPresent()) {
      return new BasicAuth(basicUser.get(), basicPassword.get());
    }

    Optional<String> authCode = context.secret(AuthorizationCode.ACCESS_TOKEN);
    if (authCode.isPresent()) {
      return new AuthorizationCode(authCode.get());
    }

    Optional<String> clientSecret = context.secret(ClientCredentials.CLIENT_SECRET);
    if (clientSecret.isPresent()) {
      Optional<String> tokenUrl = context.env(ClientCredentials.TOKEN_URL);
      Optional<String> clientId = context.env(ClientCredentials.CLIENT_ID);
      if (tokenUrl.isEmpty() || clientId.isEmpty()) {
        List<String> missing = new ArrayList<>();
        if (tokenUrl.isEmpty()) {
          missing.add(ClientCredentials.TOKEN_URL);
        }
        if (clientId.isEmpty()) {
          missing.add(ClientCredentials.CLIENT_ID);
        }
        throw new NoAuthConfiguredException(
            "client credentials secret is set but missing " + String.join(", ", missing));
      }
      return new ClientCredentials(tokenUrl.get(), clientId.get(), clientSecret.get(),
          context.env(ClientCredentials.SCOPE).orElse(null),
          context.env(ClientCredentials.AUDIENCE).orElse(null),
          AuthStyle.fromConfig(context.env(ClientCredentials.AUTH_STYLE).orElse(null)));
    }

    throw new NoAuthConfiguredException();
  }

  /**
   * Selects the active bundle and renders it as an {@code Authorization} header value.
   *
   * @param context the invocation context
   * @return the header value, including its scheme
   */
  public String resolve(final RevokerContext context) {
    CredentialConfig config = select(context);
    log.debug("resolve(scheme={})", config.getClass().getSimpleName());
    return authorizationHeader(config);
  }

  /**
   * Renders a selected bundle as an {@code Authorization} header value.  Fetches a token for
   * {@link ClientCredentials}.
   *
   * @param config the credential config
   * @return the header value
   */
  public String authorizationHeader(final CredentialConfig config) {
    if (config instanceof BearerToken bearer) {
      return bearerHeader(bearer.token());
    }
    if (config instanceof BasicAuth basic) {
      return basicHeader(basic.username(), basic.password());
    }
    if (config instanceof AuthorizationCode code) {
      return bearerHeader(code.accessToken());
    }
    if (config instanceof ClientCredentials clientCredentials) {
      return bearerHeader(tokenAccessor.fetchToken(clientCredentials));
    }
    throw new IllegalStateException("Unsupported credential config: " + config.getClass().getName());
  }

  /**
   * Prefixes a token with {@code Bearer } unless it already carries the prefix.
   *
   * @param token the token
   * @return the header value
   */
  public static String bearerHeader(final String token) {
    return token.startsWith(BEARER_PREFIX) ? token : BEARER_PREFIX + token;
  }

  /**
   * Encodes {@code username:password} as an HTTP basic header value.
   *
   * @param username the username
   * @param password the password
   * @return the header value
   */
  public static String basicHeader(final String username, final String password) {
    String credentials = username + ":" + password;
    return BASIC_PREFIX + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
  }
}

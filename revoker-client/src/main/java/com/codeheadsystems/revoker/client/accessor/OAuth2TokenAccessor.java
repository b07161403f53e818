package com.codeheadsystems.revoker.client.accessor;

import com.codeheadsystems.revoker.client.auth.AuthStyle;
import com.codeheadsystems.revoker.client.auth.CredentialConfig.ClientCredentials;
import com.codeheadsystems.revoker.client.auth.CredentialResolver;
import com.codeheadsystems.revoker.client.config.ClientConfig;
import com.codeheadsystems.revoker.client.exceptions.MissingAccessTokenException;
import com.codeheadsystems.revoker.client.exceptions.RevokerAccessorException;
import com.codeheadsystems.revoker.client.exceptions.TokenRequestFailedException;
import com.codeheadsystems.revoker.model.oauth.TokenResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.StringJoiner;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Performs the OAuth 2.0 client credentials grant (RFC 6749 §4.4).
 * <p>
 * One {@code POST} per call; tokens are not cached because every invocation of the action
 * resolves its credentials from scratch.
 */
@Singleton
public class OAuth2TokenAccessor {

  private static final Logger log = LoggerFactory.getLogger(OAuth2TokenAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final ClientConfig clientConfig;

  /**
   * Instantiates a new OAuth2 token accessor.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param clientConfig the client config
   */
  @Inject
  public OAuth2TokenAccessor(final HttpClient httpClient,
                             final ObjectMapper objectMapper,
                             final ClientConfig clientConfig) {
    log.info("OAuth2TokenAccessor()");
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.clientConfig = clientConfig;
  }

  /**
   * Requests an access token.
   *
   * @param credentials the client credentials bundle
   * @return the raw access token, without scheme prefix
   * @throws TokenRequestFailedException on a non-2xx response
   * @throws MissingAccessTokenException if the response has no access token
   */
  public String fetchToken(final ClientCredentials credentials) {
    log.debug("fetchToken(tokenUrl={}, clientId={}, authStyle={})",
        credentials.tokenUrl(), credentials.clientId(), credentials.authStyle());
    URI uri = URI.create(credentials.tokenUrl());
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(uri)
        .header("Content-Type", "application/x-www-form-urlencoded")
        .header("Accept", "application/json")
        .header("User-Agent", clientConfig.userAgent())
        .POST(HttpRequest.BodyPublishers.ofString(formBody(credentials)));
    if (credentials.authStyle() == AuthStyle.IN_HEADER) {
      builder.header("Authorization",
          CredentialResolver.basicHeader(credentials.clientId(), credentials.clientSecret()));
    }

    HttpResponse<String> response = send(builder.build(), uri);
    int status = response.statusCode();
    if (!StatusText.isSuccess(status)) {
      throw new TokenRequestFailedException(status, StatusText.of(status), response.body());
    }
    String body = response.body();
    if (body == null || body.isBlank()) {
      throw new MissingAccessTokenException();
    }
    TokenResponse tokenResponse;
    try {
      tokenResponse = objectMapper.readValue(body, TokenResponse.class);
    } catch (JsonProcessingException e) {
      throw new RevokerAccessorException("Malformed OAuth2 token response from " + uri, e);
    }
    if (!tokenResponse.hasAccessToken()) {
      throw new MissingAccessTokenException();
    }
    return tokenResponse.accessToken();
  }

  /**
   * The form-encoded token request body.
   *
   * @param credentials the credentials
   * @return the body
   */
  static String formBody(final ClientCredentials credentials) {
    StringJoiner body = new StringJoiner("&");
    body.add("grant_type=client_credentials");
    credentials.optionalScope().ifPresent(scope -> body.add("scope=" + SoqlQueries.encode(scope)));
    credentials.optionalAudience().ifPresent(audience -> body.add("audience=" + SoqlQueries.encode(audience)));
    if (credentials.authStyle() == AuthStyle.IN_PARAMS) {
      body.add("client_id=" + SoqlQueries.encode(credentials.clientId()));
      body.add("client_secret=" + SoqlQueries.encode(credentials.clientSecret()));
    }
    return body.toString();
  }

  private HttpResponse<String> send(final HttpRequest request, final URI uri) {
    try {
      return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new RevokerAccessorException("HTTP request failed for " + uri, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RevokerAccessorException("HTTP request interrupted for " + uri, e);
    }
  }
}

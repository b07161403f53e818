package com.codeheadsystems.revoker.client.accessor;

import com.codeheadsystems.revoker.client.config.ClientConfig;
import com.codeheadsystems.revoker.client.exceptions.DeleteFailedException;
import com.codeheadsystems.revoker.client.exceptions.QueryFailedException;
import com.codeheadsystems.revoker.client.exceptions.RevokerAccessorException;
import com.codeheadsystems.revoker.client.model.LookupResult;
import com.codeheadsystems.revoker.client.model.SalesforceSession;
import com.codeheadsystems.revoker.model.salesforce.QueryResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the Salesforce REST endpoints used by the removal workflow.
 * <p>
 * Two read paths ({@code /query}) and one write path ({@code /sobjects/.../{id}}).  Every
 * request carries the session's {@code Authorization} header, {@code Accept: application/json}
 * and the configured {@code User-Agent}.  A non-2xx status is raised as
 * {@link QueryFailedException} or {@link DeleteFailedException}; I/O errors and interruptions
 * are wrapped in {@link RevokerAccessorException}.
 */
@Singleton
public class SalesforceAccessor {

  private static final Logger log = LoggerFactory.getLogger(SalesforceAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final ClientConfig clientConfig;

  /**
   * Instantiates a new Salesforce accessor.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param clientConfig the client config
   */
  @Inject
  public SalesforceAccessor(final HttpClient httpClient,
                            final ObjectMapper objectMapper,
                            final ClientConfig clientConfig) {
    log.info("SalesforceAccessor()");
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.clientConfig = clientConfig;
  }

  // ── Lookups ───────────────────────────────────────────────────────────────

  /**
   * Looks up users by username.
   *
   * @param session  the session
   * @param username the username
   * @return the lookup result, empty if no such user
   */
  public LookupResult findUserByUsername(final SalesforceSession session, final String username) {
    log.debug("findUserByUsername(session={}, username={})", session, username);
    return query(session, SoqlQueries.userByUsername(username), "user");
  }

  /**
   * Looks up the assignment of a permission set to a user.
   *
   * @param session         the session
   * @param userId          the user id
   * @param permissionSetId the permission set id
   * @return the lookup result, empty if the user is not assigned
   */
  public LookupResult findPermissionSetAssignment(final SalesforceSession session,
                                                  final String userId,
                                                  final String permissionSetId) {
    log.debug("findPermissionSetAssignment(session={}, userId={}, permissionSetId={})",
        session, userId, permissionSetId);
    return query(session, SoqlQueries.permissionSetAssignment(userId, permissionSetId),
        "permission set assignment");
  }

  // ── Mutation ──────────────────────────────────────────────────────────────

  /**
   * Deletes a permission set assignment by id.
   *
   * @param session      the session
   * @param assignmentId the assignment id
   */
  public void deletePermissionSetAssignment(final SalesforceSession session, final String assignmentId) {
    log.debug("deletePermissionSetAssignment(session={}, assignmentId={})", session, assignmentId);
    URI uri = URI.create(dataUrl(session) + "/sobjects/PermissionSetAssignment/"
        + SoqlQueries.encode(assignmentId));
    HttpRequest request = requestBuilder(session, uri).DELETE().build();
    HttpResponse<String> response = send(request, uri);
    int status = response.statusCode();
    if (!StatusText.isSuccess(status)) {
      throw new DeleteFailedException(status, StatusText.of(status));
    }
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private LookupResult query(final SalesforceSession session, final String soql, final String subject) {
    URI uri = URI.create(dataUrl(session) + "/query?q=" + soql);
    HttpRequest request = requestBuilder(session, uri).GET().build();
    HttpResponse<String> response = send(request, uri);
    int status = response.statusCode();
    if (!StatusText.isSuccess(status)) {
      throw new QueryFailedException(subject, status, StatusText.of(status));
    }
    QueryResponse body = parse(response.body(), uri);
    if (!body.records().isEmpty()) {
      String firstId = body.records().get(0).id();
      if (firstId == null || firstId.isBlank()) {
        throw new RevokerAccessorException("Malformed query response from " + uri
            + ": " + subject + " record has no Id");
      }
    }
    LookupResult result = LookupResult.from(body);
    if (result.count() > 1) {
      log.warn("{} lookup matched {} records, using the first", subject, result.count());
    }
    return result;
  }

  private QueryResponse parse(final String body, final URI uri) {
    if (body == null || body.isBlank()) {
      return new QueryResponse(0, true, null);
    }
    try {
      return objectMapper.readValue(body, QueryResponse.class);
    } catch (JsonProcessingException e) {
      throw new RevokerAccessorException("Malformed query response from " + uri, e);
    }
  }

  private String dataUrl(final SalesforceSession session) {
    return session.address() + "/services/data/" + session.apiVersion();
  }

  private HttpRequest.Builder requestBuilder(final SalesforceSession session, final URI uri) {
    return HttpRequest.newBuilder()
        .uri(uri)
        .header("Authorization", session.authorizationHeader())
        .header("Accept", "application/json")
        .header("User-Agent", clientConfig.userAgent());
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

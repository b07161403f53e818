package com.codeheadsystems.revoker.client.action;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.revoker.client.config.ClientConfig;
import com.codeheadsystems.revoker.client.config.RevokerContext;
import com.codeheadsystems.revoker.client.exceptions.DeleteFailedException;
import com.codeheadsystems.revoker.client.exceptions.NoAddressConfiguredException;
import com.codeheadsystems.revoker.client.exceptions.NoAuthConfiguredException;
import com.codeheadsystems.revoker.client.exceptions.QueryFailedException;
import com.codeheadsystems.revoker.client.manager.HaltSignal;
import com.codeheadsystems.revoker.client.model.RemovalRequest;
import com.codeheadsystems.revoker.model.outcome.HaltedResult;
import com.codeheadsystems.revoker.model.outcome.RemovalOutcome;
import com.codeheadsystems.revoker.model.outcome.RemovalResult;
import com.codeheadsystems.revoker.model.outcome.RetryRequested;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * End-to-end tests for {@link RemovePermissionSetAction}: everything is real except the
 * {@link HttpClient}, whose responses are scripted per test.
 */
@ExtendWith(MockitoExtension.class)
class RemovePermissionSetActionTest {

  private static final String USER_AGENT = "revoker-test/1.0";
  private static final RevokerContext CONTEXT = new RevokerContext(
      Map.of("ADDRESS", "https://test.salesforce.com"),
      Map.of("BEARER_AUTH_TOKEN", "test-access-token"));
  private static final RemovalRequest REQUEST = new RemovalRequest("test@example.com", "0PS000000000001");
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<String> userResponse;
  @Mock private HttpResponse<String> assignmentResponse;
  @Mock private HttpResponse<String> deleteResponse;
  @Mock private HttpResponse<String> tokenResponse;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private RemovePermissionSetAction action;

  @BeforeEach
  void setUp() {
    action = RemovePermissionSetAction.create(httpClient, objectMapper, new ClientConfig(USER_AGENT, "v61.0"), CLOCK);
  }

  private List<HttpRequest> sentRequests(int expected) throws Exception {
    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient, times(expected)).send(captor.capture(), any());
    return captor.getAllValues();
  }

  @Test
  @SuppressWarnings("unchecked")
  void invoke_removesUserFromPermissionSet() throws Exception {
    when(userResponse.statusCode()).thenReturn(200);
    when(userResponse.body()).thenReturn("{\"records\":[{\"Id\":\"005000000000001\"}]}");
    when(assignmentResponse.statusCode()).thenReturn(200);
    when(assignmentResponse.body()).thenReturn("{\"records\":[{\"Id\":\"0PA000000000001\"}]}");
    when(deleteResponse.statusCode()).thenReturn(204);
    doReturn(userResponse, assignmentResponse, deleteResponse).when(httpClient).send(any(), any());

    RemovalOutcome outcome = action.invoke(REQUEST, CONTEXT, HaltSignal.NEVER);

    assertThat(outcome).isInstanceOf(RemovalResult.class);
    RemovalResult result = (RemovalResult) outcome;
    assertThat(result.status()).isEqualTo("success");
    assertThat(result.username()).isEqualTo("test@example.com");
    assertThat(result.userId()).isEqualTo("005000000000001");
    assertThat(result.permissionSetId()).isEqualTo("0PS000000000001");
    assertThat(result.assignmentId()).isEqualTo("0PA000000000001");
    assertThat(result.removed()).isTrue();
    assertThat(result.address()).isEqualTo("https://test.salesforce.com");

    List<HttpRequest> requests = sentRequests(3);
    assertThat(requests).extracting(HttpRequest::method).containsExactly("GET", "GET", "DELETE");
    for (HttpRequest request : requests) {
      assertThat(request.headers().firstValue("User-Agent")).contains(USER_AGENT);
      assertThat(request.headers().firstValue("Authorization")).contains("Bearer test-access-token");
      assertThat(request.headers().firstValue("Accept")).contains("application/json");
    }

    JsonNode json = objectMapper.valueToTree(result);
    assertThat(json.get("status").asText()).isEqualTo("success");
    assertThat(json.get("userId").asText()).isEqualTo("005000000000001");
    assertThat(json.get("assignmentId").asText()).isEqualTo("0PA000000000001");
    assertThat(json.get("removed").asBoolean()).isTrue();
  }

  @Test
  @SuppressWarnings("unchecked")
  void invoke_noAssignment_makesTwoCallsAndReportsNotRemoved() throws Exception {
    when(userResponse.statusCode()).thenReturn(200);
    when(userResponse.body()).thenReturn("{\"records\":[{\"Id\":\"005000000000001\"}]}");
    when(assignmentResponse.statusCode()).thenReturn(200);
    when(assignmentResponse.body()).thenReturn("{\"records\":[]}");
    doReturn(userResponse, assignmentResponse).when(httpClient).send(any(), any());

    RemovalResult result = (RemovalResult) action.invoke(REQUEST, CONTEXT, HaltSignal.NEVER);

    assertThat(result.removed()).isFalse();
    assertThat(result.assignmentId()).isNull();
    sentRequests(2);
    assertThat(objectMapper.valueToTree(result).get("assignmentId").isNull()).isTrue();
  }

  @Test
  @SuppressWarnings("unchecked")
  void invoke_clientCredentials_fetchesTokenFirst() throws Exception {
    RevokerContext context = new RevokerContext(
        Map.of("ADDRESS", "https://test.salesforce.com/",
            "OAUTH2_CLIENT_CREDENTIALS_TOKEN_URL", "https://login.salesforce.com/services/oauth2/token",
            "OAUTH2_CLIENT_CREDENTIALS_CLIENT_ID", "client-1"),
        Map.of("OAUTH2_CLIENT_CREDENTIALS_CLIENT_SECRET", "secret-1"));
    when(tokenResponse.statusCode()).thenReturn(200);
    when(tokenResponse.body()).thenReturn("{\"access_token\":\"cc-token\",\"token_type\":\"Bearer\"}");
    when(userResponse.statusCode()).thenReturn(200);
    when(userResponse.body()).thenReturn("{\"records\":[{\"Id\":\"005000000000001\"}]}");
    when(assignmentResponse.statusCode()).thenReturn(200);
    when(assignmentResponse.body()).thenReturn("{\"records\":[]}");
    doReturn(tokenResponse, userResponse, assignmentResponse).when(httpClient).send(any(), any());

    RemovalResult result = (RemovalResult) action.invoke(REQUEST, context, HaltSignal.NEVER);

    assertThat(result.address()).isEqualTo("https://test.salesforce.com");
    List<HttpRequest> requests = sentRequests(3);
    assertThat(requests.get(0).method()).isEqualTo("POST");
    assertThat(requests.get(0).headers().firstValue("User-Agent")).contains(USER_AGENT);
    assertThat(requests.get(1).headers().firstValue("Authorization")).contains("Bearer cc-token");
    assertThat(requests.get(2).headers().firstValue("Authorization")).contains("Bearer cc-token");
  }

  @Test
  @SuppressWarnings("unchecked")
  void invoke_userQueryFails_surfacesStatus() throws Exception {
    when(userResponse.statusCode()).thenReturn(400);
    doReturn(userResponse).when(httpClient).send(any(), any());

    assertThatThrownBy(() -> action.invoke(REQUEST, CONTEXT, HaltSignal.NEVER))
        .isInstanceOf(QueryFailedException.class)
        .hasMessage("Failed to query user: 400 Bad Request");
  }

  @Test
  void invoke_missingAddress_failsWithoutNetwork() {
    RevokerContext context = new RevokerContext(Map.of(), Map.of("BEARER_AUTH_TOKEN", "token"));

    assertThatThrownBy(() -> action.invoke(REQUEST, context, HaltSignal.NEVER))
        .isInstanceOf(NoAddressConfiguredException.class);
    verifyNoInteractions(httpClient);
  }

  @Test
  void invoke_missingCredentials_failsWithoutNetwork() {
    RevokerContext context = new RevokerContext(Map.of("ADDRESS", "https://test.salesforce.com"), Map.of());

    assertThatThrownBy(() -> action.invoke(REQUEST, context, HaltSignal.NEVER))
        .isInstanceOf(NoAuthConfiguredException.class)
        .hasMessage("No authentication configured");
    verifyNoInteractions(httpClient);
  }

  @Test
  void error_retryableFailure_requestsRetry() {
    RetryRequested retry = action.error(new DeleteFailedException(503, "Service Unavailable"));

    assertThat(retry.status()).isEqualTo("retry_requested");
    assertThat(retry.retryAfterMillis()).isEqualTo(5000L);
  }

  @Test
  void error_forbidden_rethrows() {
    DeleteFailedException failure = new DeleteFailedException(403, "Forbidden");

    assertThatThrownBy(() -> action.error(failure)).isSameAs(failure);
  }

  @Test
  void halt_reportsHaltedStatus() {
    HaltedResult result = action.halt("test@example.com", "timeout");

    assertThat(result.status()).isEqualTo("halted");
    assertThat(result.username()).isEqualTo("test@example.com");
    assertThat(result.reason()).isEqualTo("timeout");
    assertThat(result.haltedAt()).isEqualTo("2026-01-01T00:00:00Z");
  }

  @Test
  void halt_withoutUsername_reportsUnknown() {
    HaltedResult result = action.halt(null, "system_shutdown");

    assertThat(result.username()).isEqualTo("unknown");
    assertThat(result.reason()).isEqualTo("system_shutdown");
  }
}

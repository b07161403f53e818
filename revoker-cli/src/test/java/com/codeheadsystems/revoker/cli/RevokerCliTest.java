package com.codeheadsystems.revoker.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.revoker.client.action.RemovePermissionSetAction;
import com.codeheadsystems.revoker.client.config.ClientConfig;
import com.codeheadsystems.revoker.client.config.RevokerContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RevokerCliTest {

  @Test
  void parse_positionalAndOptions() {
    RevokerCli.Options options = RevokerCli.parse(new String[] {
        "alice@example.com", "--address", "https://my.salesforce.com", "0PS000000000001",
        "--api-version", "v60.0", "--user-agent", "ops-tool/2"});

    assertThat(options.username()).isEqualTo("alice@example.com");
    assertThat(options.permissionSetId()).isEqualTo("0PS000000000001");
    assertThat(options.address()).isEqualTo("https://my.salesforce.com");
    assertThat(options.apiVersion()).isEqualTo("v60.0");
    assertThat(options.userAgent()).isEqualTo("ops-tool/2");
  }

  @Test
  void parse_defaults() {
    RevokerCli.Options options = RevokerCli.parse(new String[] {"alice@example.com", "0PS000000000001"});

    assertThat(options.address()).isNull();
    assertThat(options.apiVersion()).isNull();
    assertThat(options.userAgent()).isEqualTo(ClientConfig.DEFAULT_USER_AGENT);
  }

  @Test
  void parse_wrongArity_throws() {
    assertThatThrownBy(() -> RevokerCli.parse(new String[] {"alice@example.com"}))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void parse_optionWithoutValue_throws() {
    assertThatThrownBy(() -> RevokerCli.parse(new String[] {"a", "b", "--address"}))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("--address");
  }

  @Test
  void run_unauthorizedConfiguration_printsRetryAndExits75() {
    ObjectMapper objectMapper = new ObjectMapper();
    RemovePermissionSetAction action = RemovePermissionSetAction.create(
        HttpClient.newHttpClient(), objectMapper, new ClientConfig(), Clock.systemUTC());
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ByteArrayOutputStream err = new ByteArrayOutputStream();

    // No ADDRESS and no credentials: fails before any network call and falls through to the
    // default (retryable) classification.
    int exit = RevokerCli.run(action, objectMapper,
        RevokerCli.parse(new String[] {"alice@example.com", "0PS000000000001"}),
        new RevokerContext(Map.of(), Map.of()),
        new PrintStream(out, true, StandardCharsets.UTF_8),
        new PrintStream(err, true, StandardCharsets.UTF_8));

    assertThat(exit).isEqualTo(RevokerCli.EXIT_RETRY);
    assertThat(out.toString(StandardCharsets.UTF_8)).contains("retry_requested");
  }
}

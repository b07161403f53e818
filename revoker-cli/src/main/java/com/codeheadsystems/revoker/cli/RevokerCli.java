package com.codeheadsystems.revoker.cli;

import com.codeheadsystems.revoker.client.action.RemovePermissionSetAction;
import com.codeheadsystems.revoker.client.config.ClientConfig;
import com.codeheadsystems.revoker.client.config.RevokerContext;
import com.codeheadsystems.revoker.client.manager.HaltSignal;
import com.codeheadsystems.revoker.client.model.RemovalRequest;
import com.codeheadsystems.revoker.model.outcome.RemovalOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintStream;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Command-line runner for the permission set removal action.
 *
 * <pre>
 * Usage:
 *   java -jar revoker-cli.jar &lt;username&gt; &lt;permissionSetId&gt; [options]
 *
 * Options:
 *   --address &lt;url&gt;        Salesforce base URL     (default: $ADDRESS)
 *   --api-version &lt;v&gt;      REST API version        (default: v61.0)
 *   --user-agent &lt;string&gt;  User-Agent header value (default: permset-revoker/1.0)
 *
 * Credentials are read from the process environment, first complete bundle wins:
 *   BEARER_AUTH_TOKEN
 *   BASIC_USERNAME + BASIC_PASSWORD
 *   OAUTH2_AUTHORIZATION_CODE_ACCESS_TOKEN
 *   OAUTH2_CLIENT_CREDENTIALS_CLIENT_SECRET + _TOKEN_URL + _CLIENT_ID [+ _SCOPE, _AUDIENCE, _AUTH_STYLE]
 * </pre>
 *
 * <p>Prints the JSON outcome on stdout.  Exit codes: 0 success, 75 retryable failure (the
 * retry request is printed), 1 fatal failure, 2 usage error.
 */
public class RevokerCli {

  static final int EXIT_OK = 0;
  static final int EXIT_FATAL = 1;
  static final int EXIT_USAGE = 2;
  static final int EXIT_RETRY = 75;

  /**
   * Parsed command line.
   *
   * @param username        the username
   * @param permissionSetId the permission set id
   * @param address         the address override, may be null
   * @param apiVersion      the api version override, may be null
   * @param userAgent       the user agent
   */
  record Options(String username, String permissionSetId, String address, String apiVersion,
                 String userAgent) {

    RemovalRequest toRequest() {
      return new RemovalRequest(username, permissionSetId, address, apiVersion);
    }
  }

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    Options options;
    try {
      options = parse(args);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      printUsage(System.err);
      System.exit(EXIT_USAGE);
      return;
    }

    ObjectMapper objectMapper = new ObjectMapper();
    HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(30))
        .build();
    ClientConfig clientConfig = new ClientConfig(options.userAgent(), ClientConfig.DEFAULT_API_VERSION);
    RemovePermissionSetAction action = RemovePermissionSetAction.create(
        httpClient, objectMapper, clientConfig, Clock.systemUTC());
    Map<String, String> env = System.getenv();

    System.exit(run(action, objectMapper, options, new RevokerContext(env, env), System.out, System.err));
  }

  /**
   * Runs the action and prints the outcome.
   *
   * @param action       the action
   * @param objectMapper the object mapper
   * @param options      the options
   * @param context      the context
   * @param out          stdout
   * @param err          stderr
   * @return the exit code
   */
  static int run(RemovePermissionSetAction action, ObjectMapper objectMapper, Options options,
                 RevokerContext context, PrintStream out, PrintStream err) {
    try {
      RemovalOutcome outcome = action.invoke(options.toRequest(), context, HaltSignal.NEVER);
      out.println(toJson(objectMapper, outcome));
      return EXIT_OK;
    } catch (RuntimeException e) {
      try {
        RemovalOutcome retry = action.error(e);
        out.println(toJson(objectMapper, retry));
        return EXIT_RETRY;
      } catch (RuntimeException fatal) {
        err.println("Fatal: " + fatal.getMessage());
        return EXIT_FATAL;
      }
    }
  }

  /**
   * Parses the command line.
   *
   * @param args the args
   * @return the options
   * @throws IllegalArgumentException on a usage error
   */
  static Options parse(String[] args) {
    String address = null;
    String apiVersion = null;
    String userAgent = ClientConfig.DEFAULT_USER_AGENT;
    List<String> positional = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      switch (args[i]) {
        case "--address"     -> address    = value(args, ++i);
        case "--api-version" -> apiVersion = value(args, ++i);
        case "--user-agent"  -> userAgent  = value(args, ++i);
        default              -> positional.add(args[i]);
      }
    }

    if (positional.size() != 2) {
      throw new IllegalArgumentException("Expected <username> <permissionSetId>, got " + positional);
    }
    return new Options(positional.get(0), positional.get(1), address, apiVersion, userAgent);
  }

  private static String value(String[] args, int index) {
    if (index >= args.length) {
      throw new IllegalArgumentException("Missing value for " + args[index - 1]);
    }
    return args[index];
  }

  private static String toJson(ObjectMapper objectMapper, RemovalOutcome outcome) {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(outcome);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialize " + outcome.status() + " outcome", e);
    }
  }

  private static void printUsage(PrintStream stream) {
    stream.println("Usage: revoker-cli <username> <permissionSetId>"
        + " [--address <url>] [--api-version <v>] [--user-agent <string>]");
  }
}

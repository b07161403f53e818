package com.codeheadsystems.revoker.client.config;

import java.util.Map;
import java.util.Optional;

/**
 * The per-invocation bag of environment values and secrets handed to the action by its runtime.
 * <p>
 * Values that are null or blank are reported as absent.  Secrets are never logged; use
 * {@link #toString()} freely.
 *
 * @param environment non-secret configuration (addresses, client ids, token URLs)
 * @param secrets     secret material (tokens, passwords, client secrets)
 */
public record RevokerContext(Map<String, String> environment, Map<String, String> secrets) {

  /**
   * Environment key holding the default Salesforce base URL.
   */
  public static final String ADDRESS = "ADDRESS";

  /**
   * Copies both maps; null maps become empty.
   */
  public RevokerContext {
    environment = environment == null ? Map.of() : Map.copyOf(environment);
    secrets = secrets == null ? Map.of() : Map.copyOf(secrets);
  }

  /**
   * Environment value.
   *
   * @param key the key
   * @return the value, empty when null or blank
   */
  public Optional<String> env(final String key) {
    return present(environment.get(key));
  }

  /**
   * Secret value.
   *
   * @param key the key
   * @return the value, empty when null or blank
   */
  public Optional<String> secret(final String key) {
    return present(secrets.get(key));
  }

  private static Optional<String> present(final String value) {
    return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
  }

  @Override
  public String toString() {
    return "RevokerContext{environment=" + environment.keySet() + ", secrets=" + secrets.keySet() + "}";
  }
}

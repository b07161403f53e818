package com.codeheadsystems.revoker.client.config;

import java.util.Objects;

/**
 * Static transport configuration shared by every outbound request.
 *
 * @param userAgent  value of the {@code User-Agent} header sent on every request
 * @param apiVersion default Salesforce REST API version, e.g. {@code v61.0}
 */
public record ClientConfig(String userAgent, String apiVersion) {

  /**
   * Default user agent.
   */
  public static final String DEFAULT_USER_AGENT = "permset-revoker/1.0";

  /**
   * Default Salesforce REST API version.
   */
  public static final String DEFAULT_API_VERSION = "v61.0";

  /**
   * Both values are required.
   */
  public ClientConfig {
    Objects.requireNonNull(userAgent, "userAgent");
    Objects.requireNonNull(apiVersion, "apiVersion");
  }

  /**
   * Instantiates a new Client config with the defaults.
   */
  public ClientConfig() {
    this(DEFAULT_USER_AGENT, DEFAULT_API_VERSION);
  }
}

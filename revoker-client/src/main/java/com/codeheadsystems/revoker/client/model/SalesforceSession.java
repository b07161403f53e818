package com.codeheadsystems.revoker.client.model;

/**
 * Everything a Salesforce REST call needs once the target and credentials are resolved.
 *
 * @param address             normalized base URL, no trailing slash
 * @param authorizationHeader full {@code Authorization} header value
 * @param apiVersion          REST API version, e.g. {@code v61.0}
 */
public record SalesforceSession(String address, String authorizationHeader, String apiVersion) {

  @Override
  public String toString() {
    return "SalesforceSession{address=" + address + ", apiVersion=" + apiVersion + "}";
  }
}

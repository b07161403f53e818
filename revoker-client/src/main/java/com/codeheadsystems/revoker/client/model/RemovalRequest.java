package com.codeheadsystems.revoker.client.model;

import com.codeheadsystems.revoker.client.exceptions.InvalidRequestException;

/**
 * Input parameters for one permission set removal.
 *
 * @param username        the Salesforce username to remove from the permission set
 * @param permissionSetId the permission set id
 * @param address         optional base URL override, may be null
 * @param apiVersion      optional REST API version override, may be null
 */
public record RemovalRequest(String username, String permissionSetId, String address, String apiVersion) {

  /**
   * Request without address or version overrides.
   *
   * @param username        the username
   * @param permissionSetId the permission set id
   */
  public RemovalRequest(final String username, final String permissionSetId) {
    this(username, permissionSetId, null, null);
  }

  /**
   * Checks that both required parameters are present.
   *
   * @throws InvalidRequestException if one is missing
   */
  public void validate() {
    if (username == null || username.isBlank()) {
      throw new InvalidRequestException("username is required");
    }
    if (permissionSetId == null || permissionSetId.isBlank()) {
      throw new InvalidRequestException("permissionSetId is required");
    }
  }
}

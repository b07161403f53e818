package com.codeheadsystems.revoker.client.exceptions;

/**
 * No Salesforce user matched the requested username.
 */
public class PrincipalNotFoundException extends RevokerException {

  private final String username;

  /**
   * Instantiates a new Principal not found exception.
   *
   * @param username the username
   */
  public PrincipalNotFoundException(final String username) {
    super("User not found: " + username);
    this.username = username;
  }

  /**
   * Username string.
   *
   * @return the string
   */
  public String username() {
    return username;
  }
}

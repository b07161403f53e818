package com.codeheadsystems.revoker.client.accessor;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Builds the URL-ready {@code q} parameter for the two SOQL lookups.  Words are joined with
 * {@code +}; every interpolated value is SOQL-escaped and then percent-encoded so that quotes or
 * reserved characters in a username cannot change the shape of the query.
 */
public final class SoqlQueries {

  private SoqlQueries() {
  }

  /**
   * Users with the given username, lowest id first.
   *
   * @param username the username
   * @return the encoded query
   */
  public static String userByUsername(final String username) {
    return "SELECT+Id+FROM+User+WHERE+Username='" + literal(username) + "'+ORDER+BY+Id+ASC";
  }

  /**
   * Assignments linking the user to the permission set.
   *
   * @param userId          the user id
   * @param permissionSetId the permission set id
   * @return the encoded query
   */
  public static String permissionSetAssignment(final String userId, final String permissionSetId) {
    return "SELECT+Id+FROM+PermissionSetAssignment+WHERE+AssigneeId='" + literal(userId)
        + "'+AND+PermissionSetId='" + literal(permissionSetId) + "'";
  }

  /**
   * Escapes a value for use inside a single-quoted SOQL string literal, then percent-encodes it.
   *
   * @param value the raw value
   * @return the encoded literal body, without surrounding quotes
   */
  public static String literal(final String value) {
    String escaped = value.replace("\\", "\\\\").replace("'", "\\'");
    return encode(escaped);
  }

  /**
   * Percent-encodes a value, using {@code %20} for spaces.
   *
   * @param value the value
   * @return the encoded value
   */
  public static String encode(final String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
  }
}

package com.codeheadsystems.revoker.client.exceptions;

/**
 * A SOQL query returned a non-2xx status.
 */
public class QueryFailedException extends RevokerException {

  /**
   * Instantiates a new Query failed exception.
   *
   * @param subject    what was being queried, e.g. {@code user}
   * @param status     the status
   * @param statusText the status text
   */
  public QueryFailedException(final String subject, final int status, final String statusText) {
    super("Failed to query " + subject + ": " + status + " " + statusText, status, null);
  }
}

package com.codeheadsystems.revoker.client.exceptions;

/**
 * Deleting the permission set assignment returned a non-2xx status.
 */
public class DeleteFailedException extends RevokerException {

  /**
   * Instantiates a new Delete failed exception.
   *
   * @param status     the status
   * @param statusText the status text
   */
  public DeleteFailedException(final int status, final String statusText) {
    super("Failed to delete permission set assignment: " + status + " " + statusText, status, null);
  }
}

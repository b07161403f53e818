package com.codeheadsystems.revoker.client.exceptions;

import java.util.OptionalInt;

/**
 * Base type for every failure raised by the permission set removal workflow.
 * <p>
 * Subclasses are thrown at the point of detection and propagate unchanged; nothing in the
 * workflow catches one kind and rethrows it as another.  Failures caused by an HTTP response
 * carry the response status so the recovery handler can classify them.
 */
public class RevokerException extends RuntimeException {

  private final Integer status;

  /**
   * Instantiates a new Revoker exception.
   *
   * @param message the message
   */
  public RevokerException(final String message) {
    this(message, null, null);
  }

  /**
   * Instantiates a new Revoker exception.
   *
   * @param message the message
   * @param status  the HTTP status that caused the failure, may be null
   * @param cause   the cause, may be null
   */
  public RevokerException(final String message, final Integer status, final Throwable cause) {
    super(message, cause);
    this.status = status;
  }

  /**
   * The HTTP status associated with this failure, if any.
   *
   * @return the status
   */
  public OptionalInt status() {
    return status == null ? OptionalInt.empty() : OptionalInt.of(status);
  }
}

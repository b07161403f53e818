package com.codeheadsystems.revoker.client.accessor;

import jakarta.ws.rs.core.Response;

/**
 * Reason phrases for HTTP status codes.  {@link java.net.http.HttpResponse} does not expose the
 * server's reason phrase, so the standard one is used.
 */
final class StatusText {

  private StatusText() {
  }

  static String of(final int statusCode) {
    Response.Status status = Response.Status.fromStatusCode(statusCode);
    return status == null ? "" : status.getReasonPhrase();
  }

  static boolean isSuccess(final int statusCode) {
    return statusCode >= 200 && statusCode < 300;
  }
}

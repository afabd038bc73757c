package com.gentoro.gae.exception;

/** A remote API rejected the request (4xx other than auth) or returned an unusable body. */
public class RemoteRequestException extends GaeException {
  private final int statusCode;

  public RemoteRequestException(String message, int statusCode) {
    super(GaeErrorCode.REQUEST_REJECTED, message);
    this.statusCode = statusCode;
  }

  public RemoteRequestException(String message, Throwable cause) {
    super(GaeErrorCode.REQUEST_REJECTED, message, cause);
    this.statusCode = 0;
  }

  public int getStatusCode() {
    return statusCode;
  }
}

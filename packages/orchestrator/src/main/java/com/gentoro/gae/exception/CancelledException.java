package com.gentoro.gae.exception;

/** Raised at a poll or retry boundary once the caller has requested cancellation. */
public class CancelledException extends GaeException {
  public CancelledException(String message) {
    super(GaeErrorCode.CANCELLED, message);
  }

  public CancelledException(String message, Throwable cause) {
    super(GaeErrorCode.CANCELLED, message, cause);
  }
}

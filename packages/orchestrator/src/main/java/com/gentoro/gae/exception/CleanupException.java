package com.gentoro.gae.exception;

/** Engine teardown failed. Surfaced as a warning, never overrides the primary outcome. */
public class CleanupException extends GaeException {
  public CleanupException(String message) {
    super(GaeErrorCode.CLEANUP_ERROR, message);
  }

  public CleanupException(String message, Throwable cause) {
    super(GaeErrorCode.CLEANUP_ERROR, message, cause);
  }
}

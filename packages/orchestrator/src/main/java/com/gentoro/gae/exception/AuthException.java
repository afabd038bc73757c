package com.gentoro.gae.exception;

/** Credential acquisition or refresh failure. Fatal for the calling execution. */
public class AuthException extends GaeException {
  public AuthException(String message) {
    super(GaeErrorCode.AUTH_ERROR, message);
  }

  public AuthException(String message, Throwable cause) {
    super(GaeErrorCode.AUTH_ERROR, message, cause);
  }
}

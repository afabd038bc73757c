package com.gentoro.gae.exception;

/** HTTP 404 from a remote API. */
public class RemoteNotFoundException extends RemoteRequestException {
  public RemoteNotFoundException(String message) {
    super(message, 404);
  }
}

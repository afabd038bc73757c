package com.gentoro.gae.exception;

/** An operation was called on a component in the wrong lifecycle state. */
public class StateException extends GaeException {
  public StateException(String message) {
    super(GaeErrorCode.UNKNOWN, message);
  }
}

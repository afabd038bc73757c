package com.gentoro.gae.exception;

/** Stored results are present but do not look like the output of the requested algorithm. */
public class ResultValidationException extends GaeException {
  public ResultValidationException(String message) {
    super(GaeErrorCode.RESULT_INVALID, message);
  }
}

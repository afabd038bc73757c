package com.gentoro.gae.exception;

/** The engine reported that a submitted job failed. Does not imply the engine itself failed. */
public class JobFailedException extends GaeException {
  public JobFailedException(String message) {
    super(GaeErrorCode.JOB_FAILED, message);
  }

  public JobFailedException(String message, Throwable cause) {
    super(GaeErrorCode.JOB_FAILED, message, cause);
  }
}

package com.gentoro.gae.exception;

import java.time.Duration;

/** A job did not reach a terminal status within its wait budget. Treated as a job failure. */
public class TimeoutExceededException extends GaeException {
  private final Duration budget;

  public TimeoutExceededException(String message, Duration budget) {
    super(GaeErrorCode.TIMEOUT_EXCEEDED, message);
    this.budget = budget;
  }

  public Duration getBudget() {
    return budget;
  }
}

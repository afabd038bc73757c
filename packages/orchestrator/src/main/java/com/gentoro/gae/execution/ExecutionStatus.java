package com.gentoro.gae.execution;

public enum ExecutionStatus {
  COMPLETED,
  /** Jobs completed but no written documents could be observed in the target collection. */
  PARTIAL,
  FAILED,
  CANCELLED,
  /** Never started because an earlier batch request failed or the batch ran out of time. */
  SKIPPED;

  public boolean isFailure() {
    return this == FAILED || this == CANCELLED;
  }

  public String id() {
    return name().toLowerCase();
  }
}

package com.gentoro.gae.engine;

import java.util.Locale;

/** Canonical job lifecycle, whatever vocabulary the backend answered with. */
public enum JobStatus {
  /** Job accepted but not yet executing. */
  PENDING,
  /** Job is executing. */
  RUNNING,
  /** Job finished successfully. */
  COMPLETED,
  /** Job failed permanently. */
  FAILED,
  /** Job was cancelled on the engine. */
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }

  /**
   * Map a remote state string. Unrecognized non-blank values count as {@link #RUNNING} so the
   * poller keeps waiting within its budget.
   */
  public static JobStatus fromRemoteState(String state) {
    if (state == null || state.isBlank()) return PENDING;
    return switch (state.trim().toLowerCase(Locale.ROOT)) {
      case "done", "finished", "completed", "complete", "succeeded", "success" -> COMPLETED;
      case "failed", "error", "errored" -> FAILED;
      case "queued", "pending", "created", "submitted" -> PENDING;
      case "cancelled", "canceled", "aborted" -> CANCELLED;
      default -> RUNNING;
    };
  }
}

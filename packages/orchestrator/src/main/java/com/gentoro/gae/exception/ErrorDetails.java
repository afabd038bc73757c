package com.gentoro.gae.exception;

import java.time.Instant;
import java.util.Map;

/** Structured, serializable view of a failure. */
public record ErrorDetails(
    String type, String message, GaeErrorCode code, Map<String, Object> context, Instant at) {

  /** Single-line classified form, e.g. {@code JOB_FAILED: pagerank job 42 failed: OOM}. */
  public String toDisplayString() {
    return code.name() + ": " + (message == null || message.isBlank() ? type : message);
  }
}

package com.gentoro.gae.engine;

import java.util.Objects;

/**
 * Status snapshot of one job on an engine. Polling replaces the whole snapshot.
 *
 * @param resultCount documents or rows reported by the engine, {@code null} when not reported
 * @param error remote error text for failed jobs
 */
public record JobHandle(
    String id, JobStatus status, String graphId, Long resultCount, String error) {

  public JobHandle {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(status, "status");
  }

  public static JobHandle submitted(String id, String graphId) {
    return new JobHandle(id, JobStatus.PENDING, graphId, null, null);
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }
}

package com.gentoro.gae.batch;

import com.gentoro.gae.execution.ExecutionResult;
import com.gentoro.gae.execution.ExecutionStatus;
import java.time.Duration;
import java.util.List;

/** Aggregate view of one batch run. */
public record BatchSummary(
    int total,
    int completed,
    int partial,
    int failed,
    int cancelled,
    int skipped,
    int cleanupWarnings,
    Duration elapsed,
    double totalCost) {

  public static BatchSummary of(List<ExecutionResult> results, Duration elapsed) {
    int completed = 0;
    int partial = 0;
    int failed = 0;
    int cancelled = 0;
    int skipped = 0;
    int warnings = 0;
    double cost = 0.0;
    for (ExecutionResult r : results) {
      switch (r.status()) {
        case COMPLETED -> completed++;
        case PARTIAL -> partial++;
        case FAILED -> failed++;
        case CANCELLED -> cancelled++;
        case SKIPPED -> skipped++;
      }
      if (r.hasCleanupWarning()) warnings++;
      cost += r.estimatedCost();
    }
    return new BatchSummary(
        results.size(), completed, partial, failed, cancelled, skipped, warnings, elapsed, cost);
  }

  public boolean allSucceeded() {
    return completed + partial == total;
  }

  public int count(ExecutionStatus status) {
    return switch (status) {
      case COMPLETED -> completed;
      case PARTIAL -> partial;
      case FAILED -> failed;
      case CANCELLED -> cancelled;
      case SKIPPED -> skipped;
    };
  }

  @Override
  public String toString() {
    return ("%d analyses: %d completed, %d partial, %d failed, %d cancelled, %d skipped"
            + " in %ds, estimated cost $%.2f")
        .formatted(
            total, completed, partial, failed, cancelled, skipped, elapsed.toSeconds(), totalCost);
  }
}

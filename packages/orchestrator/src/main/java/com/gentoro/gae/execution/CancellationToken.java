package com.gentoro.gae.execution;

import com.gentoro.gae.exception.CancelledException;
import com.gentoro.gae.exception.TimeoutExceededException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Cooperative cancellation, checked at every poll iteration and retry boundary. A token may be
 * linked to a parent (cancelling the parent cancels the child) and may carry a deadline.
 */
public final class CancellationToken {
  private final CancellationToken parent;
  private final Instant deadline;
  private final Clock clock;
  private volatile boolean cancelled;
  private volatile String reason;

  private CancellationToken(CancellationToken parent, Instant deadline, Clock clock) {
    this.parent = parent;
    this.deadline = deadline;
    this.clock = clock;
  }

  public static CancellationToken create() {
    return new CancellationToken(null, null, null);
  }

  /** Child of {@code parent} that additionally expires at {@code deadline} (may be null). */
  public static CancellationToken linked(CancellationToken parent, Instant deadline, Clock clock) {
    return new CancellationToken(parent, deadline, clock);
  }

  public void cancel(String why) {
    this.reason = why;
    this.cancelled = true;
  }

  public boolean isCancelled() {
    return cancelled
        || (parent != null && parent.isCancelled())
        || Thread.currentThread().isInterrupted();
  }

  public boolean isExpired() {
    return deadline != null && !clock.instant().isBefore(deadline);
  }

  /** Time left before the deadline, {@code null} when there is none. */
  public Duration remaining() {
    if (deadline == null) return null;
    Duration left = Duration.between(clock.instant(), deadline);
    return left.isNegative() ? Duration.ZERO : left;
  }

  /**
   * @throws CancelledException once cancelled
   * @throws TimeoutExceededException once the deadline has passed
   */
  public void throwIfCancelled(String where) {
    if (isCancelled()) {
      String why = reason != null ? reason : parent != null ? parent.reason : null;
      throw new CancelledException(
          "Cancelled during " + where + (why == null ? "" : " (" + why + ")"));
    }
    if (isExpired()) {
      throw new TimeoutExceededException("Batch deadline passed during " + where, null);
    }
  }
}

package com.gentoro.gae.execution;

import com.gentoro.gae.engine.JobHandle;
import com.gentoro.gae.engine.JobStatus;
import com.gentoro.gae.exception.CancelledException;
import com.gentoro.gae.exception.JobFailedException;
import com.gentoro.gae.exception.TimeoutExceededException;
import com.gentoro.gae.utility.Sleeper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Fixed-interval polling of one job until it completes. The wait is bounded by a budget and,
 * when present, by the cancellation token's deadline.
 */
public class JobPoller {
  private static final org.slf4j.Logger log =
      com.gentoro.gae.logging.LoggingService.getLogger(JobPoller.class);

  private final Duration interval;
  private final Clock clock;
  private final Sleeper sleeper;

  public JobPoller(Duration interval, Clock clock, Sleeper sleeper) {
    this.interval = interval;
    this.clock = clock;
    this.sleeper = sleeper;
  }

  public Duration interval() {
    return interval;
  }

  /**
   * @param fetch one status snapshot; retries, if any, are the supplier's business
   * @return the completed snapshot
   * @throws JobFailedException when the engine reports the job failed or cancelled
   * @throws TimeoutExceededException when the budget runs out first
   */
  public JobHandle await(
      String description,
      Duration budget,
      Supplier<JobHandle> fetch,
      CancellationToken cancellation) {
    Instant deadline = clock.instant().plus(budget);
    JobStatus last = null;
    int polls = 0;
    while (true) {
      cancellation.throwIfCancelled(description);
      JobHandle job = fetch.get();
      polls++;
      if (job.status() != last) {
        log.debug("{} is {} (poll {})", description, job.status(), polls);
        last = job.status();
      }
      switch (job.status()) {
        case COMPLETED -> {
          return job;
        }
        case FAILED -> throw new JobFailedException(
            description + " failed: " + (job.error() == null ? "no error reported" : job.error()));
        case CANCELLED -> throw new JobFailedException(
            description + " was cancelled on the engine");
        default -> {}
      }
      Duration left = Duration.between(clock.instant(), deadline);
      if (left.isNegative() || left.isZero()) {
        throw new TimeoutExceededException(
            "%s did not finish within %ds (last status %s)"
                .formatted(description, budget.toSeconds(), job.status()),
            budget);
      }
      Duration pause = left.compareTo(interval) < 0 ? left : interval;
      Duration batchLeft = cancellation.remaining();
      if (batchLeft != null && batchLeft.compareTo(pause) < 0) {
        pause = batchLeft;
      }
      try {
        sleeper.sleep(pause);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new CancelledException("Interrupted while waiting for " + description, e);
      }
    }
  }
}

package com.gentoro.gae.execution;

import com.gentoro.gae.config.OrchestratorSettings;
import com.gentoro.gae.exception.CancelledException;
import com.gentoro.gae.exception.ConfigException;
import com.gentoro.gae.exception.GaeException;
import com.gentoro.gae.exception.TransientNetworkException;
import com.gentoro.gae.utility.Sleeper;
import java.time.Duration;
import java.util.function.IntConsumer;
import java.util.function.Supplier;

/**
 * Bounded retry with capped exponential backoff. Only retryable {@link GaeException}s are retried;
 * everything else propagates on the first failure.
 */
public class RetryPolicy {
  private static final org.slf4j.Logger log =
      com.gentoro.gae.logging.LoggingService.getLogger(RetryPolicy.class);

  private final int maxAttempts;
  private final Duration initialBackoff;
  private final Duration maxBackoff;
  private final double multiplier;
  private final Sleeper sleeper;

  public RetryPolicy(
      int maxAttempts,
      Duration initialBackoff,
      Duration maxBackoff,
      double multiplier,
      Sleeper sleeper) {
    if (maxAttempts < 1) {
      throw new ConfigException("maxAttempts must be at least 1, got " + maxAttempts);
    }
    this.maxAttempts = maxAttempts;
    this.initialBackoff = initialBackoff;
    this.maxBackoff = maxBackoff;
    this.multiplier = multiplier;
    this.sleeper = sleeper;
  }

  public static RetryPolicy from(OrchestratorSettings settings, Sleeper sleeper) {
    return new RetryPolicy(
        settings.retryMaxAttempts(),
        settings.retryInitialBackoff(),
        settings.retryMaxBackoff(),
        settings.retryMultiplier(),
        sleeper);
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  /** Delay before attempt {@code failedAttempt + 1}. */
  Duration backoff(int failedAttempt) {
    double millis = initialBackoff.toMillis() * Math.pow(multiplier, failedAttempt - 1);
    long capped = (long) Math.min(millis, (double) maxBackoff.toMillis());
    return Duration.ofMillis(Math.max(0L, capped));
  }

  public <T> T execute(String operation, Supplier<T> call) {
    return execute(operation, call, CancellationToken.create(), attempt -> {});
  }

  /**
   * Run {@code call}, attempting it at most {@link #maxAttempts()} times.
   *
   * @param onRetry invoked with the failed attempt number before each retry
   * @throws TransientNetworkException an exhausted, non-retryable copy once attempts run out
   */
  public <T> T execute(
      String operation, Supplier<T> call, CancellationToken cancellation, IntConsumer onRetry) {
    for (int attempt = 1; ; attempt++) {
      cancellation.throwIfCancelled(operation);
      try {
        return call.get();
      } catch (GaeException e) {
        if (!e.isRetryable()) {
          throw e;
        }
        if (attempt >= maxAttempts) {
          if (e instanceof TransientNetworkException transientError) {
            throw TransientNetworkException.exhausted(operation, attempt, transientError);
          }
          throw e;
        }
        Duration delay = backoff(attempt);
        log.warn(
            "{} failed (attempt {}/{}): {}; retrying in {} ms",
            operation,
            attempt,
            maxAttempts,
            e.getMessage(),
            delay.toMillis());
        onRetry.accept(attempt);
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new CancelledException("Interrupted while retrying " + operation, ie);
        }
      }
    }
  }
}

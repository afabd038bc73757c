package com.gentoro.gae.batch;

import com.gentoro.gae.execution.CancellationToken;
import java.time.Duration;

/**
 * How a batch runs.
 *
 * @param continueOnError keep going after a failed request; otherwise the rest are skipped
 * @param parallelism number of requests executing at once; above 1 requires {@code
 *     continueOnError}
 * @param batchTimeout optional bound on the whole batch, {@code null} for none
 * @param cancellation cancels every running and pending request of the batch
 */
public record BatchOptions(
    boolean continueOnError,
    int parallelism,
    Duration batchTimeout,
    CancellationToken cancellation) {

  public BatchOptions {
    if (cancellation == null) cancellation = CancellationToken.create();
  }

  public static BatchOptions sequential(boolean continueOnError) {
    return new BatchOptions(continueOnError, 1, null, null);
  }

  public static BatchOptions parallel(int parallelism) {
    return new BatchOptions(true, parallelism, null, null);
  }

  public BatchOptions withBatchTimeout(Duration timeout) {
    return new BatchOptions(continueOnError, parallelism, timeout, cancellation);
  }

  public BatchOptions withCancellation(CancellationToken token) {
    return new BatchOptions(continueOnError, parallelism, batchTimeout, token);
  }
}

package com.gentoro.gae.batch;

import com.gentoro.gae.analysis.AnalysisRequest;
import com.gentoro.gae.exception.ConfigException;
import com.gentoro.gae.execution.AnalysisExecutor;
import com.gentoro.gae.execution.CancellationToken;
import com.gentoro.gae.execution.ExecutionResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a list of analysis requests, each with its own engine lifecycle. Individual failures end
 * up in the returned results; only malformed batch input raises.
 */
public class BatchRunner {
  private static final org.slf4j.Logger log =
      com.gentoro.gae.logging.LoggingService.getLogger(BatchRunner.class);

  private final AnalysisExecutor executor;
  private final Clock clock;

  public BatchRunner(AnalysisExecutor executor, Clock clock) {
    this.executor = executor;
    this.clock = clock;
  }

  /**
   * @return one result per request, in request order
   * @throws ConfigException for an empty batch, an invalid option combination or a malformed
   *     request; nothing remote has happened at that point
   */
  public List<ExecutionResult> run(List<AnalysisRequest> requests, BatchOptions options) {
    validate(requests, options);
    Instant started = clock.instant();
    Instant deadline = options.batchTimeout() == null ? null : started.plus(options.batchTimeout());
    log.info(
        "Running batch of {} analyses (parallelism {}, continueOnError {})",
        requests.size(),
        options.parallelism(),
        options.continueOnError());

    List<ExecutionResult> results =
        options.parallelism() == 1
            ? runSequential(requests, options, deadline)
            : runParallel(requests, options, deadline);

    BatchSummary summary = BatchSummary.of(results, Duration.between(started, clock.instant()));
    if (summary.allSucceeded()) {
      log.info("Batch finished: {}", summary);
    } else {
      log.warn("Batch finished: {}", summary);
    }
    if (summary.cleanupWarnings() > 0) {
      log.error(
          "{} engine(s) could not be torn down and need manual cleanup",
          summary.cleanupWarnings());
    }
    return results;
  }

  /** Run and summarize in one call. */
  public BatchSummary runAndSummarize(List<AnalysisRequest> requests, BatchOptions options) {
    Instant started = clock.instant();
    List<ExecutionResult> results = run(requests, options);
    return BatchSummary.of(results, Duration.between(started, clock.instant()));
  }

  private void validate(List<AnalysisRequest> requests, BatchOptions options) {
    if (requests == null || requests.isEmpty()) {
      throw new ConfigException("A batch needs at least one analysis request");
    }
    if (options == null) {
      throw new ConfigException("Batch options are required");
    }
    if (options.parallelism() < 1) {
      throw new ConfigException("parallelism must be at least 1, got " + options.parallelism());
    }
    if (options.parallelism() > 1 && !options.continueOnError()) {
      throw new ConfigException(
          "parallel batches cannot stop on the first failure; set continueOnError");
    }
    if (options.batchTimeout() != null
        && (options.batchTimeout().isNegative() || options.batchTimeout().isZero())) {
      throw new ConfigException("batch timeout must be positive");
    }
    for (AnalysisRequest request : requests) {
      if (request == null) {
        throw new ConfigException("A batch must not contain null requests");
      }
      request.validate();
    }
  }

  private List<ExecutionResult> runSequential(
      List<AnalysisRequest> requests, BatchOptions options, Instant deadline) {
    List<ExecutionResult> results = new ArrayList<>(requests.size());
    String stopReason = null;
    for (AnalysisRequest request : requests) {
      String skip = stopReason != null ? stopReason : skipReason(options, deadline);
      if (skip != null) {
        log.info("Skipping analysis {}: {}", request.name(), skip);
        results.add(ExecutionResult.skipped(request, skip, clock.instant()));
        continue;
      }
      ExecutionResult result = execute(request, options, deadline);
      results.add(result);
      if (!options.continueOnError() && result.status().isFailure()) {
        stopReason = "analysis " + request.name() + " failed";
      }
    }
    return results;
  }

  private List<ExecutionResult> runParallel(
      List<AnalysisRequest> requests, BatchOptions options, Instant deadline) {
    AtomicInteger threadIndex = new AtomicInteger();
    ExecutorService pool =
        Executors.newFixedThreadPool(
            Math.min(options.parallelism(), requests.size()),
            r -> new Thread(r, "gae-batch-" + threadIndex.incrementAndGet()));
    List<Future<ExecutionResult>> futures = new ArrayList<>(requests.size());
    try {
      for (AnalysisRequest request : requests) {
        futures.add(
            pool.submit(
                () -> {
                  String skip = skipReason(options, deadline);
                  if (skip != null) {
                    log.info("Skipping analysis {}: {}", request.name(), skip);
                    return ExecutionResult.skipped(request, skip, clock.instant());
                  }
                  return execute(request, options, deadline);
                }));
      }
      List<ExecutionResult> results = new ArrayList<>(requests.size());
      boolean interrupted = false;
      for (int i = 0; i < futures.size(); i++) {
        AnalysisRequest request = requests.get(i);
        while (true) {
          try {
            results.add(futures.get(i).get());
            break;
          } catch (InterruptedException e) {
            // running executions still tear their engines down; wait for them
            interrupted = true;
            options.cancellation().cancel("batch interrupted");
          } catch (ExecutionException e) {
            log.error("Analysis {} escaped its execution", request.name(), e.getCause());
            results.add(ExecutionResult.failed(request, e.getCause(), clock.instant()));
            break;
          }
        }
      }
      if (interrupted) Thread.currentThread().interrupt();
      return results;
    } finally {
      pool.shutdown();
    }
  }

  private ExecutionResult execute(AnalysisRequest request, BatchOptions options, Instant deadline) {
    CancellationToken token = CancellationToken.linked(options.cancellation(), deadline, clock);
    return executor.execute(request, token);
  }

  private String skipReason(BatchOptions options, Instant deadline) {
    if (options.cancellation().isCancelled()) return "batch cancelled";
    if (deadline != null && !clock.instant().isBefore(deadline)) return "batch timeout expired";
    return null;
  }
}

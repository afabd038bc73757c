package com.gentoro.gae.execution;

import com.gentoro.gae.analysis.AnalysisRequest;
import com.gentoro.gae.catalog.ExecutionRecord;
import com.gentoro.gae.engine.EngineConnection;
import com.gentoro.gae.engine.EngineHandle;
import com.gentoro.gae.engine.JobHandle;
import com.gentoro.gae.exception.CancelledException;
import com.gentoro.gae.exception.CleanupException;
import com.gentoro.gae.exception.ErrorDetails;
import com.gentoro.gae.exception.ExceptionUtil;
import com.gentoro.gae.exception.GaeException;
import com.gentoro.gae.exception.ProvisioningException;
import com.gentoro.gae.store.DocumentStore;
import com.gentoro.gae.utility.CollectionUtility;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;

/**
 * One run of the analysis state machine: credential, engine, load, algorithm, store, cleanup.
 *
 * <p>Engine acquisition is the acquired resource: once a handle exists, {@link
 * EngineConnection#teardown} runs exactly once on every exit path, including cancellation and
 * unexpected exceptions. Errors never escape {@link #run()}; they end up classified on the
 * {@link ExecutionResult}. Instances are single use.
 */
final class AnalysisExecution {
  private static final org.slf4j.Logger log =
      com.gentoro.gae.logging.LoggingService.getLogger(AnalysisExecution.class);
  static final String MDC_KEY = "analysis";

  private final AnalysisExecutor deps;
  private final AnalysisRequest request;
  private final CancellationToken cancellation;
  private final EngineConnection connection;
  private final DocumentStore store;
  private final Clock clock;
  private final String executionId = UUID.randomUUID().toString();

  private final List<JobHandle> jobs = new ArrayList<>();
  private final Map<ExecutionPhase, Duration> timings = new EnumMap<>(ExecutionPhase.class);
  private ExecutionPhase phase = ExecutionPhase.INIT;
  private ExecutionPhase lastPhase = ExecutionPhase.INIT;
  private EngineHandle engine;
  private String graphId;
  private long vertexCount = -1;
  private long edgeCount = -1;
  private long documentsWritten;
  private int retries;
  private boolean started;

  AnalysisExecution(
      AnalysisExecutor deps, AnalysisRequest request, CancellationToken cancellation) {
    this.deps = deps;
    this.request = request;
    this.cancellation = cancellation == null ? CancellationToken.create() : cancellation;
    this.connection = deps.connection();
    this.store = deps.documentStore();
    this.clock = deps.clock();
  }

  ExecutionResult run() {
    if (started) {
      throw new IllegalStateException("Execution " + executionId + " has already run");
    }
    started = true;
    MDC.put(MDC_KEY, request.name());
    try {
      Instant startedAt = clock.instant();
      log.info("Starting analysis {} [{}]", request, executionId);
      ExecutionStatus status;
      GaeException failure = null;
      ErrorDetails cleanupWarning;
      try {
        status = proceed();
      } catch (GaeException e) {
        failure = e;
        status =
            e instanceof CancelledException ? ExecutionStatus.CANCELLED : ExecutionStatus.FAILED;
        log.error("Analysis {} aborted in phase {}: {}", request.name(), phase, e.getMessage());
      } catch (RuntimeException e) {
        failure =
            new GaeException(ExceptionUtil.classify(e), ExceptionUtil.extractErrorMessage(e), e);
        status = ExecutionStatus.FAILED;
        log.error("Analysis {} failed unexpectedly in phase {}", request.name(), phase, e);
      } finally {
        cleanupWarning = cleanUp();
      }
      Instant finishedAt = clock.instant();

      Duration uptime = Duration.ZERO;
      double cost = 0.0;
      if (engine != null) {
        uptime = Duration.between(engine.createdAt(), finishedAt);
        if (uptime.isNegative()) uptime = Duration.ZERO;
        cost = deps.costEstimator().estimate(engine.size(), uptime, connection.isMetered());
      }

      ExecutionResult result =
          ExecutionResult.builder()
              .executionId(executionId)
              .request(request)
              .status(status)
              .lastPhase(lastPhase)
              .jobs(jobs)
              .documentsWritten(documentsWritten)
              .elapsed(Duration.between(startedAt, finishedAt))
              .engineUptime(uptime)
              .estimatedCost(cost)
              .error(failure == null ? null : ExceptionUtil.toErrorDetails(failure))
              .cleanupWarning(cleanupWarning)
              .phaseTimings(timings)
              .retryCount(retries)
              .engine(engine == null ? null : engine.id(), engine == null ? null : engine.size())
              .graph(graphId, vertexCount, edgeCount)
              .startedAt(startedAt)
              .finishedAt(finishedAt)
              .build();
      log.info("Analysis {} finished: {}", request.name(), result);
      deps.catalog().publish(toRecord(result));
      return result;
    } finally {
      MDC.remove(MDC_KEY);
    }
  }

  private ExecutionStatus proceed() {
    request.validate();
    cancellation.throwIfCancelled("credential acquisition");
    deps.credentials().getCredential();
    advance(ExecutionPhase.CREDENTIAL_READY);

    Duration budget =
        request.waitTimeout() != null ? request.waitTimeout() : deps.settings().jobTimeout();
    String size =
        request.engineSize() != null ? request.engineSize() : deps.settings().defaultEngineSize();

    Instant mark = clock.instant();
    try {
      engine =
          retry(
              "engine provisioning",
              () -> connection.discoverOrProvision(size, request.exclusiveEngine()));
    } catch (ProvisioningException e) {
      engine = e.getOrphan().orElse(null);
      throw e;
    }
    log.info("Using engine {}", engine);
    advance(ExecutionPhase.ENGINE_READY);
    mark = recordTiming(ExecutionPhase.ENGINE_READY, mark);

    JobHandle load = retry("graph load", () -> connection.loadGraph(engine, request));
    JobHandle loaded = await("graph load job " + load.id(), load, budget);
    graphId = StringUtils.firstNonBlank(loaded.graphId(), load.graphId(), load.id());
    readGraphDetails();
    advance(ExecutionPhase.GRAPH_LOADED);
    mark = recordTiming(ExecutionPhase.GRAPH_LOADED, mark);

    String algorithm = request.algorithm().id();
    JobHandle submitted =
        retry(algorithm + " submission", () -> connection.runAlgorithm(engine, request, graphId));
    advance(ExecutionPhase.ALGORITHM_RUNNING);
    JobHandle computed = await(algorithm + " job " + submitted.id(), submitted, budget);
    mark = recordTiming(ExecutionPhase.ALGORITHM_RUNNING, mark);

    String database = database();
    prepareTarget(database);
    JobHandle storing =
        retry(
            "result storage",
            () -> connection.storeResults(engine, request, List.of(computed.id())));
    JobHandle stored = await("store job " + storing.id(), storing, budget);
    ExecutionStatus outcome = verifyWrites(database, stored);
    advance(ExecutionPhase.RESULTS_STORED);
    recordTiming(ExecutionPhase.RESULTS_STORED, mark);
    if (outcome == ExecutionStatus.COMPLETED) {
      validateResults(database);
    }
    return outcome;
  }

  private <T> T retry(String operation, Supplier<T> call) {
    return deps.retryPolicy().execute(operation, call, cancellation, attempt -> retries++);
  }

  private JobHandle await(String description, JobHandle submitted, Duration budget) {
    track(submitted);
    Supplier<JobHandle> fetch =
        () ->
            track(
                retry("status of " + description, () -> connection.getJob(engine, submitted.id())));
    return deps.jobPoller().await(description, budget, fetch, cancellation);
  }

  /** Keep the latest snapshot of every job this execution submitted. */
  private JobHandle track(JobHandle job) {
    for (int i = 0; i < jobs.size(); i++) {
      if (jobs.get(i).id().equals(job.id())) {
        jobs.set(i, job);
        return job;
      }
    }
    jobs.add(job);
    return job;
  }

  private void readGraphDetails() {
    try {
      connection
          .getGraph(engine, graphId)
          .ifPresent(
              graph -> {
                vertexCount = graph.vertexCount();
                edgeCount = graph.edgeCount();
              });
      log.info("Graph {} loaded: {} vertices, {} edges", graphId, vertexCount, edgeCount);
    } catch (GaeException e) {
      log.debug("Details of graph {} unavailable: {}", graphId, e.getMessage());
    }
  }

  private void prepareTarget(String database) {
    if (store == null) return;
    try {
      store.ensureCollection(database, request.targetCollection());
    } catch (GaeException e) {
      log.warn(
          "Could not prepare target collection {}: {}; continuing with the store job",
          request.targetCollection(),
          e.getMessage());
    }
  }

  /** Wait until written documents are visible in the target collection. */
  private ExecutionStatus verifyWrites(String database, JobHandle stored) {
    if (store == null) {
      documentsWritten = stored.resultCount() == null ? 0 : stored.resultCount();
      return ExecutionStatus.COMPLETED;
    }
    String target = request.targetCollection();
    Instant deadline = clock.instant().plus(deps.settings().storageVerifyTimeout());
    while (true) {
      cancellation.throwIfCancelled("result verification");
      try {
        long count = store.count(database, target);
        if (count > 0) {
          documentsWritten = count;
          log.info("{} documents present in {}", count, target);
          return ExecutionStatus.COMPLETED;
        }
      } catch (GaeException e) {
        log.warn("Could not count documents in {}: {}", target, e.getMessage());
      }
      Duration left = Duration.between(clock.instant(), deadline);
      if (left.isNegative() || left.isZero()) break;
      Duration interval = deps.jobPoller().interval();
      try {
        deps.sleeper().sleep(left.compareTo(interval) < 0 ? left : interval);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new CancelledException("Interrupted while verifying results in " + target, e);
      }
    }
    log.warn(
        "Store job {} completed but no documents appeared in {} within {}s",
        stored.id(),
        target,
        deps.settings().storageVerifyTimeout().toSeconds());
    documentsWritten = 0;
    return ExecutionStatus.PARTIAL;
  }

  /** Check a sample of the stored documents; unreadable samples skip the check. */
  private void validateResults(String database) {
    if (store == null || documentsWritten == 0) return;
    String target = request.targetCollection();
    List<Map<String, Object>> samples;
    try {
      samples = store.sample(database, target, ResultValidator.SAMPLE_SIZE);
    } catch (GaeException e) {
      log.warn("Could not sample results in {}, skipping validation: {}", target, e.getMessage());
      return;
    }
    deps.resultValidator().validate(request, samples);
    log.info("Results in {} passed validation", target);
  }

  /** Tear the engine down, if one was acquired. Returns a warning instead of throwing. */
  private ErrorDetails cleanUp() {
    lastPhase = phase;
    // a cancelled thread still has to be able to issue the teardown call
    boolean interrupted = Thread.interrupted();
    Instant mark = clock.instant();
    try {
      if (engine == null) return null;
      try {
        connection.teardown(engine);
        log.info("Engine {} torn down", engine.id());
        return null;
      } catch (CleanupException e) {
        log.error(
            "Engine {} could not be torn down, manual cleanup required: {}",
            engine.id(),
            e.getMessage());
        return ExceptionUtil.toErrorDetails(e);
      } catch (RuntimeException e) {
        engine.markError();
        CleanupException wrapped =
            new CleanupException(
                "Teardown of engine " + engine.id() + " failed: " + e.getMessage(), e);
        log.error("Engine {} could not be torn down, manual cleanup required", engine.id(), e);
        return ExceptionUtil.toErrorDetails(wrapped);
      }
    } finally {
      timings.put(ExecutionPhase.CLEANED, Duration.between(mark, clock.instant()));
      advance(ExecutionPhase.CLEANED);
      if (interrupted) Thread.currentThread().interrupt();
    }
  }

  private void advance(ExecutionPhase next) {
    if (!phase.canAdvanceTo(next)) {
      throw new IllegalStateException("Illegal phase transition " + phase + " -> " + next);
    }
    log.debug("{} -> {}", phase, next);
    phase = next;
  }

  private Instant recordTiming(ExecutionPhase reached, Instant since) {
    Instant now = clock.instant();
    timings.put(reached, Duration.between(since, now));
    return now;
  }

  private String database() {
    return StringUtils.isNotBlank(request.database())
        ? request.database()
        : deps.settings().database();
  }

  private ExecutionRecord toRecord(ExecutionResult result) {
    Map<String, Object> parameters =
        request.algorithm() == null
            ? request.params()
            : CollectionUtility.mergeMaps(request.algorithm().defaults(), request.params());
    return new ExecutionRecord(
        executionId,
        request.name(),
        result.algorithm(),
        request.algorithm() == null ? null : request.algorithm().version(),
        parameters,
        request.graphSource().describe(),
        database(),
        request.targetCollection(),
        result.documentsWritten(),
        result.elapsed().toMillis(),
        result.estimatedCost(),
        result.status().id(),
        result.errorMessage(),
        result.engineId(),
        result.engineSize(),
        connection.mode().id(),
        result.retryCount(),
        result.vertexCount(),
        result.edgeCount(),
        result.startedAt().toString(),
        result.finishedAt().toString());
  }
}

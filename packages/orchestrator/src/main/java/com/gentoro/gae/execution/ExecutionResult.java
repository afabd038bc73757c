package com.gentoro.gae.execution;

import com.gentoro.gae.analysis.AnalysisRequest;
import com.gentoro.gae.engine.JobHandle;
import com.gentoro.gae.exception.CancelledException;
import com.gentoro.gae.exception.ErrorDetails;
import com.gentoro.gae.exception.ExceptionUtil;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Terminal outcome of one analysis execution. */
public final class ExecutionResult {
  private final String executionId;
  private final String requestName;
  private final String algorithm;
  private final ExecutionStatus status;
  private final ExecutionPhase lastPhase;
  private final List<JobHandle> jobs;
  private final long documentsWritten;
  private final Duration elapsed;
  private final Duration engineUptime;
  private final double estimatedCost;
  private final ErrorDetails error;
  private final ErrorDetails cleanupWarning;
  private final Map<ExecutionPhase, Duration> phaseTimings;
  private final int retryCount;
  private final String engineId;
  private final String engineSize;
  private final String graphId;
  private final long vertexCount;
  private final long edgeCount;
  private final Instant startedAt;
  private final Instant finishedAt;

  private ExecutionResult(Builder b) {
    this.executionId = b.executionId;
    this.requestName = b.requestName;
    this.algorithm = b.algorithm;
    this.status = b.status;
    this.lastPhase = b.lastPhase;
    this.jobs = List.copyOf(b.jobs);
    this.documentsWritten = b.documentsWritten;
    this.elapsed = b.elapsed == null ? Duration.ZERO : b.elapsed;
    this.engineUptime = b.engineUptime == null ? Duration.ZERO : b.engineUptime;
    this.estimatedCost = b.estimatedCost;
    this.error = b.error;
    this.cleanupWarning = b.cleanupWarning;
    this.phaseTimings = Collections.unmodifiableMap(new EnumMap<>(b.phaseTimings));
    this.retryCount = b.retryCount;
    this.engineId = b.engineId;
    this.engineSize = b.engineSize;
    this.graphId = b.graphId;
    this.vertexCount = b.vertexCount;
    this.edgeCount = b.edgeCount;
    this.startedAt = b.startedAt;
    this.finishedAt = b.finishedAt;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Result for a batch request that was never started. */
  public static ExecutionResult skipped(AnalysisRequest request, String reason, Instant at) {
    return builder()
        .request(request)
        .status(ExecutionStatus.SKIPPED)
        .error(ExceptionUtil.toErrorDetails(new CancelledException("Skipped: " + reason)))
        .startedAt(at)
        .finishedAt(at)
        .build();
  }

  /** Result for an execution that escaped with an unexpected throwable. */
  public static ExecutionResult failed(AnalysisRequest request, Throwable cause, Instant at) {
    return builder()
        .request(request)
        .status(ExecutionStatus.FAILED)
        .error(ExceptionUtil.toErrorDetails(cause))
        .startedAt(at)
        .finishedAt(at)
        .build();
  }

  public String executionId() {
    return executionId;
  }

  public String requestName() {
    return requestName;
  }

  public String algorithm() {
    return algorithm;
  }

  public ExecutionStatus status() {
    return status;
  }

  /** Last phase reached before cleanup. */
  public ExecutionPhase lastPhase() {
    return lastPhase;
  }

  public List<JobHandle> jobs() {
    return jobs;
  }

  public long documentsWritten() {
    return documentsWritten;
  }

  public Duration elapsed() {
    return elapsed;
  }

  public Duration engineUptime() {
    return engineUptime;
  }

  /** USD, zero on unmetered backends. */
  public double estimatedCost() {
    return estimatedCost;
  }

  public ErrorDetails error() {
    return error;
  }

  /** Set when teardown failed; the engine may still be running. */
  public ErrorDetails cleanupWarning() {
    return cleanupWarning;
  }

  public boolean hasCleanupWarning() {
    return cleanupWarning != null;
  }

  public Map<ExecutionPhase, Duration> phaseTimings() {
    return phaseTimings;
  }

  public int retryCount() {
    return retryCount;
  }

  public String engineId() {
    return engineId;
  }

  public String engineSize() {
    return engineSize;
  }

  public String graphId() {
    return graphId;
  }

  /** {@code -1} when unknown. */
  public long vertexCount() {
    return vertexCount;
  }

  /** {@code -1} when unknown. */
  public long edgeCount() {
    return edgeCount;
  }

  public Instant startedAt() {
    return startedAt;
  }

  public Instant finishedAt() {
    return finishedAt;
  }

  public boolean isSuccess() {
    return status == ExecutionStatus.COMPLETED || status == ExecutionStatus.PARTIAL;
  }

  /** Classified, single-line error text, or {@code null} when there was no error. */
  public String errorMessage() {
    return error == null ? null : error.toDisplayString();
  }

  @Override
  public String toString() {
    return "ExecutionResult{name=%s, status=%s, documents=%d, elapsed=%dms, cost=$%.4f%s}"
        .formatted(
            requestName,
            status.id(),
            documentsWritten,
            elapsed.toMillis(),
            estimatedCost,
            error == null ? "" : ", error=" + error.toDisplayString());
  }

  public static final class Builder {
    private String executionId;
    private String requestName;
    private String algorithm;
    private ExecutionStatus status = ExecutionStatus.FAILED;
    private ExecutionPhase lastPhase = ExecutionPhase.INIT;
    private final List<JobHandle> jobs = new ArrayList<>();
    private long documentsWritten;
    private Duration elapsed;
    private Duration engineUptime;
    private double estimatedCost;
    private ErrorDetails error;
    private ErrorDetails cleanupWarning;
    private final Map<ExecutionPhase, Duration> phaseTimings = new EnumMap<>(ExecutionPhase.class);
    private int retryCount;
    private String engineId;
    private String engineSize;
    private String graphId;
    private long vertexCount = -1;
    private long edgeCount = -1;
    private Instant startedAt;
    private Instant finishedAt;

    private Builder() {}

    public Builder executionId(String executionId) {
      this.executionId = executionId;
      return this;
    }

    public Builder request(AnalysisRequest request) {
      this.requestName = request.name();
      this.algorithm = request.algorithm() == null ? null : request.algorithm().id();
      return this;
    }

    public Builder status(ExecutionStatus status) {
      this.status = status;
      return this;
    }

    public Builder lastPhase(ExecutionPhase lastPhase) {
      this.lastPhase = lastPhase;
      return this;
    }

    public Builder jobs(List<JobHandle> jobs) {
      this.jobs.addAll(jobs);
      return this;
    }

    public Builder documentsWritten(long documentsWritten) {
      this.documentsWritten = documentsWritten;
      return this;
    }

    public Builder elapsed(Duration elapsed) {
      this.elapsed = elapsed;
      return this;
    }

    public Builder engineUptime(Duration engineUptime) {
      this.engineUptime = engineUptime;
      return this;
    }

    public Builder estimatedCost(double estimatedCost) {
      this.estimatedCost = estimatedCost;
      return this;
    }

    public Builder error(ErrorDetails error) {
      this.error = error;
      return this;
    }

    public Builder cleanupWarning(ErrorDetails cleanupWarning) {
      this.cleanupWarning = cleanupWarning;
      return this;
    }

    public Builder phaseTimings(Map<ExecutionPhase, Duration> timings) {
      this.phaseTimings.putAll(timings);
      return this;
    }

    public Builder retryCount(int retryCount) {
      this.retryCount = retryCount;
      return this;
    }

    public Builder engine(String id, String size) {
      this.engineId = id;
      this.engineSize = size;
      return this;
    }

    public Builder graph(String graphId, long vertexCount, long edgeCount) {
      this.graphId = graphId;
      this.vertexCount = vertexCount;
      this.edgeCount = edgeCount;
      return this;
    }

    public Builder startedAt(Instant startedAt) {
      this.startedAt = startedAt;
      return this;
    }

    public Builder finishedAt(Instant finishedAt) {
      this.finishedAt = finishedAt;
      return this;
    }

    public ExecutionResult build() {
      return new ExecutionResult(this);
    }
  }
}

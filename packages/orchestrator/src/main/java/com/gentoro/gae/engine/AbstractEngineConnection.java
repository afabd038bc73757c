package com.gentoro.gae.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.gae.analysis.AnalysisRequest;
import com.gentoro.gae.analysis.GraphSource;
import com.gentoro.gae.config.OrchestratorSettings;
import com.gentoro.gae.exception.CancelledException;
import com.gentoro.gae.exception.CleanupException;
import com.gentoro.gae.exception.GaeException;
import com.gentoro.gae.exception.RemoteNotFoundException;
import com.gentoro.gae.exception.RemoteRequestException;
import com.gentoro.gae.exception.TimeoutExceededException;
import com.gentoro.gae.exception.TransientNetworkException;
import com.gentoro.gae.http.EngineHttpClient;
import com.gentoro.gae.utility.Sleeper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import org.apache.commons.lang3.StringUtils;

/**
 * Engine API calls shared by both backends. Every job-producing call goes through {@link
 * #submitJob}; each backend supplies its own response normalization in {@link #normalizeJob}.
 */
public abstract class AbstractEngineConnection implements EngineConnection {
  private static final org.slf4j.Logger log =
      com.gentoro.gae.logging.LoggingService.getLogger(AbstractEngineConnection.class);

  protected final EngineHttpClient http;
  protected final OrchestratorSettings settings;
  protected final Clock clock;
  protected final Sleeper sleeper;

  protected AbstractEngineConnection(
      EngineHttpClient http, OrchestratorSettings settings, Clock clock, Sleeper sleeper) {
    this.http = http;
    this.settings = settings;
    this.clock = clock == null ? Clock.systemUTC() : clock;
    this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
  }

  /** Canonical job snapshot from a backend response. */
  protected abstract JobHandle normalizeJob(JsonNode body, String knownJobId);

  /** Remove the engine through the backend's management API. */
  protected abstract void deleteEngine(EngineHandle engine);

  /** Graph source as the backend's load call accepts it. */
  protected GraphSource graphSourceFor(AnalysisRequest request, String database) {
    return request.graphSource();
  }

  protected String databaseFor(AnalysisRequest request) {
    return StringUtils.isNotBlank(request.database()) ? request.database() : settings.database();
  }

  @Override
  public JobHandle loadGraph(EngineHandle engine, AnalysisRequest request) {
    String database = databaseFor(request);
    GraphSource source = graphSourceFor(request, database);
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("database", database);
    if (source.hasNamedGraph()) {
      payload.put("graph_name", source.namedGraph());
    } else {
      payload.put("vertex_collections", source.vertexCollections());
      payload.put("edge_collections", source.edgeCollections());
    }
    if (!request.vertexAttributes().isEmpty()) {
      payload.put("vertex_attributes", request.vertexAttributes());
    }
    log.debug(
        "Loading {} from database '{}' into engine {}", source.describe(), database, engine.id());
    return submitJob(engine, "v1/loaddata", payload);
  }

  @Override
  public JobHandle runAlgorithm(EngineHandle engine, AnalysisRequest request, String graphId) {
    Algorithm algorithm = request.algorithm();
    return submitJob(engine, algorithm.endpoint(), algorithm.payload(graphId, request.params()));
  }

  @Override
  public JobHandle storeResults(EngineHandle engine, AnalysisRequest request, List<String> jobIds) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("database", databaseFor(request));
    payload.put("target_collection", request.targetCollection());
    payload.put("job_ids", jobIds);
    payload.put("attribute_names", Collections.nCopies(jobIds.size(), request.resultField()));
    payload.put("parallelism", request.storeParallelism());
    payload.put("batch_size", request.storeBatchSize());
    return submitJob(engine, "v1/storeresults", payload);
  }

  @Override
  public JobHandle getJob(EngineHandle engine, String jobId) {
    return normalizeJob(http.get(url(engine, "v1/jobs/" + jobId)), jobId);
  }

  @Override
  public List<JobHandle> listJobs(EngineHandle engine) {
    JsonNode body = http.get(url(engine, "v1/jobs"));
    List<JobHandle> jobs = new ArrayList<>();
    for (JsonNode node : items(body, "jobs")) {
      jobs.add(normalizeJob(node, null));
    }
    return jobs;
  }

  @Override
  public void deleteJob(EngineHandle engine, String jobId) {
    try {
      http.delete(url(engine, "v1/jobs/" + jobId));
    } catch (RemoteNotFoundException e) {
      log.debug("Job {} already gone on engine {}", jobId, engine.id());
    }
  }

  @Override
  public List<GraphInfo> listGraphs(EngineHandle engine) {
    JsonNode body = http.get(url(engine, "v1/graphs"));
    List<GraphInfo> graphs = new ArrayList<>();
    for (JsonNode node : items(body, "graphs")) {
      graphs.add(toGraphInfo(node, null));
    }
    return graphs;
  }

  @Override
  public Optional<GraphInfo> getGraph(EngineHandle engine, String graphId) {
    try {
      return Optional.of(toGraphInfo(http.get(url(engine, "v1/graphs/" + graphId)), graphId));
    } catch (RemoteNotFoundException e) {
      return Optional.empty();
    }
  }

  @Override
  public void deleteGraph(EngineHandle engine, String graphId) {
    try {
      http.delete(url(engine, "v1/graphs/" + graphId));
    } catch (RemoteNotFoundException e) {
      log.debug("Graph {} already gone on engine {}", graphId, engine.id());
    }
  }

  @Override
  public void teardown(EngineHandle engine) {
    if (engine.status() == EngineStatus.STOPPED) {
      log.debug("Engine {} already stopped", engine.id());
      return;
    }
    try {
      deleteEngine(engine);
      log.info("Engine {} deleted", engine.id());
    } catch (RemoteNotFoundException e) {
      log.info("Engine {} was already gone", engine.id());
    } catch (GaeException e) {
      engine.markError();
      throw new CleanupException(
          "Failed to delete engine " + engine.id() + ": " + e.getMessage(), e);
    }
    engine.markStopped();
  }

  /** The one submission primitive: POST a payload, normalize the job envelope. */
  protected JobHandle submitJob(EngineHandle engine, String endpoint, Map<String, Object> payload) {
    JsonNode body = http.post(url(engine, endpoint), payload);
    JobHandle job = normalizeJob(body, null);
    log.debug("Submitted {} on engine {} as job {}", endpoint, engine.id(), job.id());
    return job;
  }

  protected String url(EngineHandle engine, String path) {
    if (engine.engineUrl() == null) {
      throw new IllegalStateException("Engine " + engine.id() + " has no engine URL yet");
    }
    return StringUtils.removeEnd(engine.engineUrl(), "/") + "/" + path;
  }

  /** Whether the engine API at {@code engineUrl} answers its version endpoint. */
  protected boolean probeVersion(String engineUrl) {
    try {
      http.get(StringUtils.removeEnd(engineUrl, "/") + "/v1/version");
      return true;
    } catch (TransientNetworkException | RemoteRequestException e) {
      log.debug("Engine API at {} not answering yet: {}", engineUrl, e.getMessage());
      return false;
    }
  }

  /**
   * Poll {@code condition} until it holds, bounded by the configured readiness timeout.
   *
   * @throws TimeoutExceededException if the condition never held
   */
  protected void awaitCondition(String what, BooleanSupplier condition) {
    Duration timeout = settings.engineReadyTimeout();
    Instant deadline = clock.instant().plus(timeout);
    while (!condition.getAsBoolean()) {
      if (!clock.instant().isBefore(deadline)) {
        throw new TimeoutExceededException(what + " not reached within " + timeout, timeout);
      }
      try {
        sleeper.sleep(settings.engineReadyPollInterval());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new CancelledException("Interrupted while waiting for " + what, e);
      }
    }
  }

  /** Elements of a bare array, or of the array under {@code field} (or {@code items}). */
  protected static List<JsonNode> items(JsonNode body, String field) {
    JsonNode array = body;
    if (body != null && body.isObject()) {
      array = body.has(field) ? body.get(field) : body.get("items");
    }
    List<JsonNode> out = new ArrayList<>();
    if (array != null && array.isArray()) {
      array.forEach(out::add);
    }
    return out;
  }

  /** First non-blank textual value among {@code fields}. */
  protected static String text(JsonNode node, String... fields) {
    if (node == null) return null;
    for (String f : fields) {
      JsonNode v = node.get(f);
      if (v != null && (v.isTextual() || v.isNumber()) && StringUtils.isNotBlank(v.asText())) {
        return v.asText();
      }
    }
    return null;
  }

  protected static Long longValue(JsonNode node, String... fields) {
    if (node == null) return null;
    for (String f : fields) {
      JsonNode v = node.get(f);
      if (v != null && v.canConvertToLong()) return v.asLong();
    }
    return null;
  }

  /** Job id from the envelope, falling back to the id the caller asked for. */
  protected static String jobId(JsonNode body, String knownJobId) {
    String id = text(body, "job_id", "jobId", "id");
    if (id == null) id = knownJobId;
    if (id == null) {
      throw new RemoteRequestException("Engine response carries no job id: " + body, 0);
    }
    return id;
  }

  /**
   * Progress-style envelope ({@code progress}, {@code total}, {@code error}), or {@code null} when
   * the body uses a state field instead.
   */
  protected static JobHandle fromProgress(JsonNode body, String id, String graphId) {
    if (body == null || !body.has("progress") || !body.has("total")) return null;
    long progress = body.path("progress").asLong(0);
    long total = body.path("total").asLong(0);
    Long count = longValue(body, "result_count");
    if (body.path("error").asBoolean(false)) {
      String message = text(body, "error_message", "errorMessage");
      return new JobHandle(
          id, JobStatus.FAILED, graphId, count, message == null ? "Unknown error" : message);
    }
    JobStatus status = total > 0 && progress >= total ? JobStatus.COMPLETED : JobStatus.RUNNING;
    return new JobHandle(id, status, graphId, count, null);
  }

  protected static GraphInfo toGraphInfo(JsonNode node, String knownId) {
    String id = text(node, "graph_id", "id");
    if (id == null) id = knownId;
    Long vertices = longValue(node, "vertex_count");
    Long edges = longValue(node, "edge_count");
    return new GraphInfo(id, vertices == null ? -1 : vertices, edges == null ? -1 : edges);
  }
}

package com.gentoro.gae.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.gentoro.gae.analysis.AnalysisRequest;
import com.gentoro.gae.analysis.GraphSource;
import com.gentoro.gae.config.DeploymentMode;
import com.gentoro.gae.config.OrchestratorSettings;
import com.gentoro.gae.exception.ConfigException;
import com.gentoro.gae.exception.GaeException;
import com.gentoro.gae.exception.ProvisioningException;
import com.gentoro.gae.exception.RemoteRequestException;
import com.gentoro.gae.exception.TransientNetworkException;
import com.gentoro.gae.http.EngineHttpClient;
import com.gentoro.gae.store.DocumentStore;
import com.gentoro.gae.store.NamedGraph;
import com.gentoro.gae.utility.Sleeper;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Managed cloud backend. Engines are created and deleted through the graph-analytics management
 * API at {@code <deployment-url>:<port>/graph-analytics/api/graphanalytics/v1}; each engine then
 * serves its own engine API at the endpoint reported in its status.
 */
public class ManagedEngineConnection extends AbstractEngineConnection {
  private static final org.slf4j.Logger log =
      com.gentoro.gae.logging.LoggingService.getLogger(ManagedEngineConnection.class);

  static final String MANAGEMENT_PATH = "/graph-analytics/api/graphanalytics/v1";
  static final String ENGINE_TYPE = "gral";

  private final String managementUrl;
  private final DocumentStore documentStore;

  /**
   * @param documentStore resolves named graphs into collections; may be {@code null} when every
   *     request names its collections explicitly
   */
  public ManagedEngineConnection(
      EngineHttpClient http,
      OrchestratorSettings settings,
      DocumentStore documentStore,
      Clock clock,
      Sleeper sleeper) {
    super(http, settings, clock, sleeper);
    this.managementUrl =
        settings.managedDeploymentUrl() + ":" + settings.managedPort() + MANAGEMENT_PATH;
    this.documentStore = documentStore;
  }

  @Override
  public DeploymentMode mode() {
    return DeploymentMode.MANAGED;
  }

  @Override
  public boolean isMetered() {
    return true;
  }

  @Override
  public EngineHandle discoverOrProvision(String size, boolean exclusive) {
    if (!exclusive) {
      for (EngineHandle existing : listEngines()) {
        if (existing.status() == EngineStatus.READY && probeVersion(existing.engineUrl())) {
          log.warn(
              "Reusing running engine {} instead of deploying a new one; a graph loaded by an"
                  + " earlier request may still be in its memory",
              existing.id());
          return existing;
        }
      }
    }

    String sizeId = EngineSizes.normalize(size);
    JsonNode created =
        http.post(managementUrl + "/engines", Map.of("type_id", ENGINE_TYPE, "size_id", sizeId));
    String id = text(created, "id");
    if (id == null) {
      throw new RemoteRequestException("Engine deployment response carries no id: " + created, 0);
    }
    EngineHandle pending =
        new EngineHandle(id, sizeId, clock.instant(), null, false, EngineStatus.PROVISIONING);
    log.info("Deployed {} engine {} (size {}), waiting for it to start", ENGINE_TYPE, id, sizeId);

    try {
      AtomicReference<String> endpoint = new AtomicReference<>();
      awaitCondition(
          "engine " + id + " started",
          () -> {
            JsonNode status = getEngine(id).path("status");
            if (status.path("is_started").asBoolean(false)
                && status.path("succeeded").asBoolean(false)) {
              endpoint.set(text(status, "endpoint"));
              return endpoint.get() != null;
            }
            return false;
          });
      EngineHandle engine = pending.withEngineUrl(endpoint.get());
      awaitCondition("engine " + id + " API ready", () -> probeVersion(engine.engineUrl()));
      engine.markReady();
      log.info("Engine {} ready at {}", id, engine.engineUrl());
      return engine;
    } catch (GaeException e) {
      pending.markError();
      throw new ProvisioningException("Engine " + id + " did not become ready", pending, e);
    }
  }

  /** Engine details; transient failures read as "not started yet". */
  private JsonNode getEngine(String id) {
    try {
      return http.get(managementUrl + "/engines/" + id);
    } catch (TransientNetworkException e) {
      log.debug("Status of engine {} unavailable: {}", id, e.getMessage());
      return MissingNode.getInstance();
    }
  }

  @Override
  public List<EngineHandle> listEngines() {
    JsonNode body = http.get(managementUrl + "/engines");
    List<EngineHandle> engines = new ArrayList<>();
    for (JsonNode node : items(body, "items")) {
      String id = text(node, "id");
      if (id == null) continue;
      JsonNode status = node.path("status");
      boolean ready =
          status.path("is_started").asBoolean(false) && status.path("succeeded").asBoolean(false);
      String endpoint = text(status, "endpoint");
      engines.add(
          new EngineHandle(
              id,
              text(node, "size_id"),
              clock.instant(),
              endpoint,
              true,
              ready && endpoint != null ? EngineStatus.READY : EngineStatus.PROVISIONING));
    }
    return engines;
  }

  @Override
  protected void deleteEngine(EngineHandle engine) {
    http.delete(managementUrl + "/engines/" + engine.id());
  }

  /** Managed engines only load explicit collection lists. */
  @Override
  protected GraphSource graphSourceFor(AnalysisRequest request, String database) {
    GraphSource source = request.graphSource();
    if (!source.hasNamedGraph()) return source;
    if (documentStore == null) {
      throw new ConfigException(
          "Named graph '%s' needs a document store to resolve its collections"
              .formatted(source.namedGraph()));
    }
    NamedGraph graph = documentStore.namedGraphCollections(database, source.namedGraph());
    if (graph.vertexCollections().isEmpty() || graph.edgeCollections().isEmpty()) {
      throw new ConfigException(
          "Named graph '%s' has no vertex or no edge collections".formatted(graph.name()));
    }
    log.debug(
        "Resolved named graph '{}' to {} vertex and {} edge collections",
        graph.name(),
        graph.vertexCollections().size(),
        graph.edgeCollections().size());
    return GraphSource.collections(graph.vertexCollections(), graph.edgeCollections());
  }

  /** Nested {@code status.state}, a bare status string, a flat {@code state}, or progress. */
  @Override
  protected JobHandle normalizeJob(JsonNode body, String knownJobId) {
    String id = jobId(body, knownJobId);
    String graphId = text(body, "graph_id", "graphId");
    JobHandle progress = fromProgress(body, id, graphId);
    if (progress != null) return progress;

    JsonNode status = body.get("status");
    String state;
    String error;
    if (status != null && status.isObject()) {
      state = text(status, "state");
      error = text(status, "error", "error_message");
      if (error == null) error = text(body, "error", "error_message");
    } else if (status != null && status.isTextual()) {
      state = status.asText();
      error = text(body, "error", "error_message");
    } else {
      state = text(body, "state");
      error = text(body, "error", "error_message");
    }
    JobStatus js = JobStatus.fromRemoteState(state);
    if (js == JobStatus.FAILED && error == null) error = "Unknown error";
    return new JobHandle(
        id, js, graphId, longValue(body, "result_count"), js == JobStatus.FAILED ? error : null);
  }
}

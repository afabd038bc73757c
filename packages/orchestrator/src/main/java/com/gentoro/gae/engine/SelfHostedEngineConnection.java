package com.gentoro.gae.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.gae.config.DeploymentMode;
import com.gentoro.gae.config.OrchestratorSettings;
import com.gentoro.gae.exception.GaeException;
import com.gentoro.gae.exception.ProvisioningException;
import com.gentoro.gae.exception.RemoteRequestException;
import com.gentoro.gae.http.EngineHttpClient;
import com.gentoro.gae.utility.Sleeper;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Self-hosted platform backend. Engines are platform services started and stopped under {@code
 * /gen-ai/v1}; a service {@code arangodb-gral-<short>} serves its engine API at {@code
 * <endpoint>/gral/<short>}. Engine size is not configurable and usage is not metered.
 */
public class SelfHostedEngineConnection extends AbstractEngineConnection {
  private static final org.slf4j.Logger log =
      com.gentoro.gae.logging.LoggingService.getLogger(SelfHostedEngineConnection.class);

  static final String SERVICE_PREFIX = "arangodb-gral-";
  static final String DEPLOYED = "DEPLOYED";

  private final String endpoint;

  public SelfHostedEngineConnection(
      EngineHttpClient http, OrchestratorSettings settings, Clock clock, Sleeper sleeper) {
    super(http, settings, clock, sleeper);
    this.endpoint = settings.selfHostedEndpoint();
  }

  @Override
  public DeploymentMode mode() {
    return DeploymentMode.SELF_HOSTED;
  }

  @Override
  public boolean isMetered() {
    return false;
  }

  /** Engine API base for a service id. */
  String engineUrl(String serviceId) {
    String shortId = serviceId.substring(serviceId.lastIndexOf('-') + 1);
    return endpoint + "/gral/" + shortId;
  }

  @Override
  public EngineHandle discoverOrProvision(String size, boolean exclusive) {
    if (size != null) {
      log.debug("Engine size '{}' ignored: self-hosted services have a fixed size", size);
    }
    if (!exclusive) {
      for (EngineHandle existing : listEngines()) {
        if (probeVersion(existing.engineUrl())) {
          existing.markReady();
          log.warn(
              "Reusing deployed service {} instead of starting a new one; a graph loaded by an"
                  + " earlier request may still be in its memory",
              existing.id());
          return existing;
        }
        log.debug("Deployed service {} does not answer, skipping", existing.id());
      }
    }

    JsonNode started = http.post(endpoint + "/gen-ai/v1/graphanalytics", Map.of());
    String serviceId = text(started.path("serviceInfo"), "serviceId");
    if (serviceId == null || "null".equals(serviceId)) {
      throw new RemoteRequestException("Service start response carries no service id", 0);
    }
    EngineHandle engine =
        new EngineHandle(
            serviceId,
            null,
            clock.instant(),
            engineUrl(serviceId),
            false,
            EngineStatus.PROVISIONING);
    log.info("Started service {}, waiting for its engine API", serviceId);
    try {
      awaitCondition("service " + serviceId + " API ready", () -> probeVersion(engine.engineUrl()));
    } catch (GaeException e) {
      engine.markError();
      throw new ProvisioningException("Service " + serviceId + " did not become ready", engine, e);
    }
    engine.markReady();
    log.info("Service {} ready at {}", serviceId, engine.engineUrl());
    return engine;
  }

  /** Deployed analytics services. Some deployments omit {@code type}, so the id prefix counts. */
  @Override
  public List<EngineHandle> listEngines() {
    JsonNode body = http.post(endpoint + "/gen-ai/v1/list_services", null);
    List<EngineHandle> engines = new ArrayList<>();
    for (JsonNode service : items(body, "services")) {
      String id = text(service, "serviceId");
      if (id == null || !DEPLOYED.equals(text(service, "status"))) continue;
      if (!"gral".equals(text(service, "type")) && !id.startsWith(SERVICE_PREFIX)) continue;
      engines.add(
          new EngineHandle(id, null, clock.instant(), engineUrl(id), true, EngineStatus.READY));
    }
    return engines;
  }

  @Override
  protected void deleteEngine(EngineHandle engine) {
    http.delete(endpoint + "/gen-ai/v1/service/" + engine.id());
  }

  /** Flat {@code state}, a bare status string, nested {@code status.state}, or progress. */
  @Override
  protected JobHandle normalizeJob(JsonNode body, String knownJobId) {
    String id = jobId(body, knownJobId);
    String graphId = text(body, "graph_id", "graphId");
    JobHandle progress = fromProgress(body, id, graphId);
    if (progress != null) return progress;

    String state = text(body, "state");
    if (state == null) {
      JsonNode status = body.get("status");
      if (status != null && status.isTextual()) {
        state = status.asText();
      } else if (status != null && status.isObject()) {
        state = text(status, "state");
      }
    }
    JobStatus js = JobStatus.fromRemoteState(state);
    String error = null;
    if (js == JobStatus.FAILED) {
      error = text(body, "error", "error_message", "errorMessage");
      if (error == null) error = text(body.path("status"), "error");
      if (error == null) error = "Unknown error";
    }
    return new JobHandle(id, js, graphId, longValue(body, "result_count"), error);
  }
}

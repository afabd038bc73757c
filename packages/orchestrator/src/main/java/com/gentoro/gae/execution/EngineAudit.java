package com.gentoro.gae.execution;

import com.gentoro.gae.engine.EngineConnection;
import com.gentoro.gae.engine.EngineHandle;
import com.gentoro.gae.engine.GraphInfo;
import com.gentoro.gae.engine.JobHandle;
import com.gentoro.gae.exception.GaeException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Enumerates running engines and stops them on demand. */
public class EngineAudit {
  private static final org.slf4j.Logger log =
      com.gentoro.gae.logging.LoggingService.getLogger(EngineAudit.class);

  private final EngineConnection connection;

  public EngineAudit(EngineConnection connection) {
    this.connection = connection;
  }

  /** An engine with the graphs and jobs it currently holds. Lists are empty when unreadable. */
  public record EngineInventory(
      EngineHandle engine, List<GraphInfo> graphs, List<JobHandle> jobs) {}

  /**
   * @param stopped ids of engines torn down
   * @param failures engine id to failure message, for engines needing manual cleanup
   */
  public record StopReport(List<String> stopped, Map<String, String> failures) {
    public boolean isClean() {
      return failures.isEmpty();
    }
  }

  public List<EngineHandle> runningEngines() {
    return connection.listEngines();
  }

  public List<EngineInventory> inventory() {
    List<EngineInventory> result = new ArrayList<>();
    for (EngineHandle engine : connection.listEngines()) {
      List<GraphInfo> graphs = List.of();
      List<JobHandle> jobs = List.of();
      if (engine.engineUrl() != null) {
        try {
          graphs = connection.listGraphs(engine);
          jobs = connection.listJobs(engine);
        } catch (GaeException e) {
          log.warn("Could not inspect engine {}: {}", engine.id(), e.getMessage());
        }
      }
      result.add(new EngineInventory(engine, graphs, jobs));
    }
    return result;
  }

  /** Tear down every listed engine. Individual failures are collected, not thrown. */
  public StopReport stopAll() {
    List<EngineHandle> engines = connection.listEngines();
    log.info("Stopping {} engine(s)", engines.size());
    List<String> stopped = new ArrayList<>();
    Map<String, String> failures = new LinkedHashMap<>();
    for (EngineHandle engine : engines) {
      try {
        connection.teardown(engine);
        stopped.add(engine.id());
      } catch (GaeException e) {
        log.error("Engine {} could not be stopped: {}", engine.id(), e.getMessage());
        failures.put(engine.id(), e.getMessage());
      }
    }
    return new StopReport(List.copyOf(stopped), Collections.unmodifiableMap(failures));
  }
}

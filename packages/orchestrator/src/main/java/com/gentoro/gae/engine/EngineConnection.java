package com.gentoro.gae.engine;

import com.gentoro.gae.analysis.AnalysisRequest;
import com.gentoro.gae.config.DeploymentMode;
import java.util.List;
import java.util.Optional;

/**
 * Capability interface over one deployment backend. Remote failures surface as {@link
 * com.gentoro.gae.exception.GaeException} subclasses; retrying is left to the caller.
 */
public interface EngineConnection {

  DeploymentMode mode();

  /** Whether engine time is billed. Unmetered backends report zero cost. */
  boolean isMetered();

  /**
   * Return a ready engine. An existing ready engine is reused (with a warning) unless {@code
   * exclusive} is set.
   *
   * @param size requested size; ignored by backends without configurable sizes
   * @throws com.gentoro.gae.exception.ProvisioningException if an engine was created but did not
   *     become ready; the exception carries its handle for teardown
   */
  EngineHandle discoverOrProvision(String size, boolean exclusive);

  /** Submit the load job for the request's graph source. */
  JobHandle loadGraph(EngineHandle engine, AnalysisRequest request);

  /** Submit the request's algorithm against a graph loaded earlier. */
  JobHandle runAlgorithm(EngineHandle engine, AnalysisRequest request, String graphId);

  /** Current status snapshot of a job. Idempotent. */
  JobHandle getJob(EngineHandle engine, String jobId);

  /** Submit the job writing algorithm results to the request's target collection. */
  JobHandle storeResults(EngineHandle engine, AnalysisRequest request, List<String> jobIds);

  /**
   * Stop and delete the engine. An engine that is already gone counts as torn down.
   *
   * @throws com.gentoro.gae.exception.CleanupException if the engine could not be removed
   */
  void teardown(EngineHandle engine);

  List<EngineHandle> listEngines();

  List<GraphInfo> listGraphs(EngineHandle engine);

  Optional<GraphInfo> getGraph(EngineHandle engine, String graphId);

  void deleteGraph(EngineHandle engine, String graphId);

  List<JobHandle> listJobs(EngineHandle engine);

  void deleteJob(EngineHandle engine, String jobId);
}

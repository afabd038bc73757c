package com.gentoro.gae.engine;

import static com.gentoro.gae.support.ScriptedInterceptor.*;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.gae.analysis.AnalysisRequest;
import com.gentoro.gae.exception.CleanupException;
import com.gentoro.gae.exception.ConfigException;
import com.gentoro.gae.exception.GaeErrorCode;
import com.gentoro.gae.exception.ProvisioningException;
import com.gentoro.gae.exception.RemoteNotFoundException;
import com.gentoro.gae.http.EngineHttpClient;
import com.gentoro.gae.store.InMemoryDocumentStore;
import com.gentoro.gae.support.MutableClock;
import com.gentoro.gae.support.RecordingSleeper;
import com.gentoro.gae.support.ScriptedInterceptor;
import com.gentoro.gae.support.TestSettings;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ManagedEngineConnectionTest {
  private static final String ENGINES = ManagedEngineConnection.MANAGEMENT_PATH + "/engines";
  private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");
  private static final String ENGINE_URL = "https://engine-1.example.com";
  private static final String STARTED =
      "{\"id\":\"e-1\",\"size_id\":\"e16\",\"status\":{\"is_started\":true,\"succeeded\":true,"
          + "\"endpoint\":\""
          + ENGINE_URL
          + "\"}}";

  private MutableClock clock;
  private RecordingSleeper sleeper;
  private ScriptedInterceptor http;
  private InMemoryDocumentStore store;
  private ManagedEngineConnection connection;

  @BeforeEach
  void setUp() {
    clock = new MutableClock();
    sleeper = new RecordingSleeper(clock);
    http = new ScriptedInterceptor();
    store = new InMemoryDocumentStore();
    connection =
        new ManagedEngineConnection(
            new EngineHttpClient(http.client()), TestSettings.managed(), store, clock, sleeper);
  }

  private static EngineHandle ready() {
    return new EngineHandle("e-1", "e16", T0, ENGINE_URL, false, EngineStatus.READY);
  }

  @Test
  @DisplayName("deploys an engine and waits until it is started and answering")
  void provision() {
    http.on("GET", ENGINES, ok("{\"items\":[]}"))
        .on("POST", ENGINES, ok("{\"id\":\"e-1\"}"))
        .on("GET", ENGINES + "/e-1", ok("{\"status\":{\"is_started\":false}}"), ok(STARTED))
        .on("GET", "/v1/version", ok("{\"version\":\"1.0\"}"));

    EngineHandle engine = connection.discoverOrProvision("small", false);

    assertEquals("e-1", engine.id());
    assertEquals("e8", engine.size());
    assertEquals(ENGINE_URL, engine.engineUrl());
    assertEquals(EngineStatus.READY, engine.status());
    assertFalse(engine.isReused());
    assertEquals(clock.instant().minusSeconds(1), engine.createdAt());
    assertTrue(http.lastBody("POST", ENGINES).contains("\"size_id\":\"e8\""));
    assertTrue(http.lastBody("POST", ENGINES).contains("\"type_id\":\"gral\""));
    assertEquals(List.of(Duration.ofSeconds(1)), sleeper.sleeps());
  }

  @Test
  @DisplayName("repeated discovery reuses the ready engine without provisioning")
  void reuse() {
    http.on("GET", ENGINES, ok("{\"items\":[" + STARTED + "]}"))
        .on("GET", "/v1/version", ok("{}"));

    EngineHandle first = connection.discoverOrProvision("e16", false);
    EngineHandle second = connection.discoverOrProvision("e16", false);

    assertTrue(first.isReused());
    assertTrue(second.isReused());
    assertEquals("e-1", first.id());
    assertEquals(first.id(), second.id());
    assertEquals(2, http.count("GET", ENGINES));
    assertEquals(0, http.count("POST", ENGINES));
  }

  @Test
  @DisplayName("exclusive requests never look at running engines")
  void exclusive() {
    http.on("POST", ENGINES, ok("{\"id\":\"e-2\"}"))
        .on("GET", ENGINES + "/e-2", ok(STARTED))
        .on("GET", "/v1/version", ok("{}"));

    EngineHandle engine = connection.discoverOrProvision(null, true);

    assertEquals("e-2", engine.id());
    assertEquals(EngineSizes.DEFAULT_SIZE, engine.size());
    assertEquals(0, http.count("GET", ENGINES));
  }

  @Test
  @DisplayName("an engine that never starts is returned as an orphan for teardown")
  void provisionTimeout() {
    http.on("GET", ENGINES, ok("{\"items\":[]}"))
        .on("POST", ENGINES, ok("{\"id\":\"e-3\"}"))
        .on("GET", ENGINES + "/e-3", ok("{\"status\":{\"is_started\":false}}"));

    ProvisioningException e =
        assertThrows(
            ProvisioningException.class, () -> connection.discoverOrProvision("e16", false));

    assertEquals(GaeErrorCode.TIMEOUT_EXCEEDED, e.getCode());
    assertFalse(e.isRetryable());
    EngineHandle orphan = e.getOrphan().orElseThrow();
    assertEquals("e-3", orphan.id());
    assertEquals(EngineStatus.ERROR, orphan.status());
    assertEquals(Duration.ofSeconds(10), sleeper.total());
  }

  @Test
  @DisplayName("teardown deletes the engine; an engine already gone counts as deleted")
  void teardown() {
    http.on("DELETE", ENGINES + "/e-1", ok("{}"));
    EngineHandle engine = ready();
    connection.teardown(engine);
    assertEquals(EngineStatus.STOPPED, engine.status());

    // a second teardown is a no-op
    connection.teardown(engine);
    assertEquals(1, http.count("DELETE", ENGINES + "/e-1"));

    http.on("DELETE", ENGINES + "/e-9", json(404, "{}"));
    EngineHandle gone = new EngineHandle("e-9", "e16", T0, null, false, null);
    connection.teardown(gone);
    assertEquals(EngineStatus.STOPPED, gone.status());
  }

  @Test
  @DisplayName("failed deletion raises a cleanup error and marks the engine")
  void teardownFailure() {
    http.on("DELETE", ENGINES + "/e-1", json(500, "oops"));
    EngineHandle engine = ready();

    assertThrows(CleanupException.class, () -> connection.teardown(engine));
    assertEquals(EngineStatus.ERROR, engine.status());
  }

  @Test
  @DisplayName("named graphs are resolved into collections before loading")
  void loadResolvesNamedGraph() {
    store.defineGraph("_system", "social", List.of("users"), List.of("follows"));
    http.on("POST", "/v1/loaddata", ok("{\"job_id\":\"11\",\"graph_id\":\"5\"}"));

    JobHandle job =
        connection.loadGraph(
            ready(),
            AnalysisRequest.builder()
                .algorithm("pagerank")
                .namedGraph("social")
                .vertexAttributes(List.of("age"))
                .targetCollection("out")
                .build());

    assertEquals("11", job.id());
    assertEquals("5", job.graphId());
    assertEquals(JobStatus.PENDING, job.status());
    String body = http.lastBody("POST", "/v1/loaddata");
    assertTrue(body.contains("\"vertex_collections\":[\"users\"]"));
    assertTrue(body.contains("\"edge_collections\":[\"follows\"]"));
    assertTrue(body.contains("\"vertex_attributes\":[\"age\"]"));
    assertFalse(body.contains("graph_name"));
  }

  @Test
  @DisplayName("unknown named graphs fail before anything is submitted")
  void unknownNamedGraph() {
    AnalysisRequest request =
        AnalysisRequest.builder()
            .algorithm("wcc")
            .namedGraph("missing")
            .targetCollection("out")
            .build();

    assertThrows(RemoteNotFoundException.class, () -> connection.loadGraph(ready(), request));
    assertTrue(http.exchanges().isEmpty());

    ManagedEngineConnection storeless =
        new ManagedEngineConnection(
            new EngineHttpClient(http.client()), TestSettings.managed(), null, clock, sleeper);
    assertThrows(ConfigException.class, () -> storeless.loadGraph(ready(), request));
  }

  @Test
  @DisplayName("algorithm and store submissions carry the expected payloads")
  void submissions() {
    http.on("POST", "/v1/pagerank", ok("{\"job_id\":12}"))
        .on("POST", "/v1/storeresults", ok("{\"job_id\":13}"));
    AnalysisRequest request =
        AnalysisRequest.builder()
            .algorithm("pagerank")
            .param("damping_factor", 0.9)
            .collections(List.of("users"), List.of("follows"))
            .targetCollection("out")
            .build();

    JobHandle algo = connection.runAlgorithm(ready(), request, "5");
    JobHandle store = connection.storeResults(ready(), request, List.of(algo.id()));

    assertEquals("12", algo.id());
    assertEquals("13", store.id());
    String algoBody = http.lastBody("POST", "/v1/pagerank");
    assertTrue(algoBody.contains("\"damping_factor\":0.9"));
    assertTrue(algoBody.contains("\"maximum_supersteps\":100"));
    assertTrue(algoBody.contains("\"graph_id\":\"5\""));
    String storeBody = http.lastBody("POST", "/v1/storeresults");
    assertTrue(storeBody.contains("\"job_ids\":[\"12\"]"));
    assertTrue(storeBody.contains("\"attribute_names\":[\"rank\"]"));
    assertTrue(storeBody.contains("\"target_collection\":\"out\""));
    assertTrue(storeBody.contains("\"parallelism\":8"));
    assertTrue(storeBody.contains("\"batch_size\":10000"));
  }

  @Test
  @DisplayName("job envelopes in every known shape are normalized")
  void normalizeJobs() {
    http.on(
        "GET",
        "/v1/jobs/1",
        ok("{\"job_id\":\"1\",\"status\":{\"state\":\"done\"},\"result_count\":100}"),
        ok("{\"job_id\":\"1\",\"status\":\"failed\",\"error\":\"OOM\"}"),
        ok("{\"job_id\":1,\"progress\":5,\"total\":10}"),
        ok("{\"job_id\":1,\"progress\":10,\"total\":10}"),
        ok("{\"job_id\":1,\"progress\":1,\"total\":1,\"error\":true,\"error_message\":\"x\"}"),
        ok("{\"state\":\"warming up\"}"));

    JobHandle done = connection.getJob(ready(), "1");
    assertEquals(JobStatus.COMPLETED, done.status());
    assertEquals(100L, done.resultCount());

    JobHandle failed = connection.getJob(ready(), "1");
    assertEquals(JobStatus.FAILED, failed.status());
    assertEquals("OOM", failed.error());

    assertEquals(JobStatus.RUNNING, connection.getJob(ready(), "1").status());
    assertEquals(JobStatus.COMPLETED, connection.getJob(ready(), "1").status());
    assertEquals("x", connection.getJob(ready(), "1").error());

    JobHandle unknown = connection.getJob(ready(), "1");
    assertEquals("1", unknown.id());
    assertEquals(JobStatus.RUNNING, unknown.status());
  }

  @Test
  @DisplayName("graph details come from the engine, missing graphs are empty")
  void graphs() {
    http.on("GET", "/v1/graphs/5", ok("{\"graph_id\":\"5\",\"vertex_count\":3,\"edge_count\":2}"))
        .on("GET", "/v1/graphs/6", json(404, "{}"))
        .on("GET", "/v1/graphs", ok("[{\"graph_id\":\"5\"}]"));

    GraphInfo graph = connection.getGraph(ready(), "5").orElseThrow();
    assertEquals(new GraphInfo("5", 3, 2), graph);
    assertTrue(connection.getGraph(ready(), "6").isEmpty());
    assertEquals(List.of(new GraphInfo("5", -1, -1)), connection.listGraphs(ready()));
  }

  @Test
  @DisplayName("listed engines are marked reused and ready only once started")
  void listEngines() {
    http.on(
        "GET",
        ENGINES,
        ok("{\"items\":[" + STARTED + ",{\"id\":\"e-2\",\"status\":{\"is_started\":false}}]}"));

    List<EngineHandle> engines = connection.listEngines();

    assertEquals(2, engines.size());
    assertEquals(EngineStatus.READY, engines.get(0).status());
    assertEquals(EngineStatus.PROVISIONING, engines.get(1).status());
    assertTrue(engines.stream().allMatch(EngineHandle::isReused));
    assertTrue(connection.isMetered());
  }
}

package com.gentoro.gae.support;

import com.gentoro.gae.analysis.AnalysisRequest;
import com.gentoro.gae.config.DeploymentMode;
import com.gentoro.gae.engine.EngineConnection;
import com.gentoro.gae.engine.EngineHandle;
import com.gentoro.gae.engine.EngineStatus;
import com.gentoro.gae.engine.GraphInfo;
import com.gentoro.gae.engine.JobHandle;
import com.gentoro.gae.engine.JobStatus;
import com.gentoro.gae.exception.RemoteRequestException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Scriptable in-process backend. Jobs are named {@code <kind>-<n>} ({@code load}, {@code algo},
 * {@code store}); each reports RUNNING for {@link #pollsBeforeCompletion} polls, then its
 * scripted terminal status. Errors queued per call site are thrown before the call's effect.
 */
public final class FakeEngineConnection implements EngineConnection {
  private final Clock clock;
  public volatile boolean metered = true;
  public volatile int pollsBeforeCompletion = 1;
  public volatile Long storeResultCount = 42L;
  public volatile GraphInfo graphInfo = new GraphInfo("graph-1", 10, 20);
  public volatile RuntimeException teardownError;
  public volatile Consumer<String> onPoll = id -> {};
  public volatile Consumer<AnalysisRequest> onStore = r -> {};

  public final Deque<RuntimeException> provisionErrors = new ConcurrentLinkedDeque<>();
  public final Deque<RuntimeException> loadErrors = new ConcurrentLinkedDeque<>();
  public final Deque<RuntimeException> algorithmErrors = new ConcurrentLinkedDeque<>();
  public final Deque<RuntimeException> storeErrors = new ConcurrentLinkedDeque<>();
  public final Deque<RuntimeException> pollErrors = new ConcurrentLinkedDeque<>();
  /** Terminal status per job kind; COMPLETED when absent. */
  public final Map<String, JobStatus> terminalStatus = new ConcurrentHashMap<>();
  /** Job kinds that never leave RUNNING. */
  public final Set<String> hangingKinds = ConcurrentHashMap.newKeySet();
  /** Request names whose load call is rejected. */
  public final Set<String> rejectedRequests = ConcurrentHashMap.newKeySet();

  public final AtomicInteger provisions = new AtomicInteger();
  public final AtomicInteger teardowns = new AtomicInteger();
  public final AtomicInteger loadCalls = new AtomicInteger();
  public final AtomicInteger algorithmCalls = new AtomicInteger();
  public final List<String> calls = Collections.synchronizedList(new ArrayList<>());
  public final List<EngineHandle> engines = Collections.synchronizedList(new ArrayList<>());

  private final AtomicInteger jobSeq = new AtomicInteger();
  private final Map<String, AtomicInteger> polls = new ConcurrentHashMap<>();

  public FakeEngineConnection(Clock clock) {
    this.clock = clock;
  }

  @Override
  public DeploymentMode mode() {
    return DeploymentMode.MANAGED;
  }

  @Override
  public boolean isMetered() {
    return metered;
  }

  @Override
  public EngineHandle discoverOrProvision(String size, boolean exclusive) {
    calls.add("provision");
    throwNext(provisionErrors);
    int n = provisions.incrementAndGet();
    EngineHandle engine =
        new EngineHandle(
            "engine-" + n, size, clock.instant(), "http://engine-" + n, false, EngineStatus.READY);
    engines.add(engine);
    return engine;
  }

  /** An engine handle as a backend would attach it to a provisioning failure. */
  public EngineHandle orphan() {
    int n = provisions.incrementAndGet();
    EngineHandle engine =
        new EngineHandle(
            "engine-" + n, "e16", clock.instant(), null, false, EngineStatus.ERROR);
    engines.add(engine);
    return engine;
  }

  @Override
  public JobHandle loadGraph(EngineHandle engine, AnalysisRequest request) {
    calls.add("load");
    loadCalls.incrementAndGet();
    if (rejectedRequests.contains(request.name())) {
      throw new RemoteRequestException("load rejected for " + request.name(), 400);
    }
    throwNext(loadErrors);
    return JobHandle.submitted(nextJob("load"), "graph-1");
  }

  @Override
  public JobHandle runAlgorithm(EngineHandle engine, AnalysisRequest request, String graphId) {
    calls.add("algorithm:" + graphId);
    algorithmCalls.incrementAndGet();
    throwNext(algorithmErrors);
    return JobHandle.submitted(nextJob("algo"), graphId);
  }

  @Override
  public JobHandle getJob(EngineHandle engine, String jobId) {
    calls.add("poll:" + jobId);
    onPoll.accept(jobId);
    throwNext(pollErrors);
    int n = polls.computeIfAbsent(jobId, k -> new AtomicInteger()).incrementAndGet();
    String kind = jobId.substring(0, jobId.indexOf('-'));
    if (hangingKinds.contains(kind) || n <= pollsBeforeCompletion) {
      return new JobHandle(jobId, JobStatus.RUNNING, null, null, null);
    }
    JobStatus status = terminalStatus.getOrDefault(kind, JobStatus.COMPLETED);
    String error = status == JobStatus.FAILED ? "engine ran out of memory" : null;
    Long count = "store".equals(kind) ? storeResultCount : null;
    return new JobHandle(jobId, status, "load".equals(kind) ? "graph-1" : null, count, error);
  }

  @Override
  public JobHandle storeResults(EngineHandle engine, AnalysisRequest request, List<String> jobIds) {
    calls.add("store:" + String.join(",", jobIds));
    throwNext(storeErrors);
    onStore.accept(request);
    return JobHandle.submitted(nextJob("store"), null);
  }

  @Override
  public void teardown(EngineHandle engine) {
    calls.add("teardown:" + engine.id());
    teardowns.incrementAndGet();
    if (teardownError != null) {
      engine.markError();
      throw teardownError;
    }
    engine.markStopped();
  }

  @Override
  public List<EngineHandle> listEngines() {
    synchronized (engines) {
      List<EngineHandle> running = new ArrayList<>();
      for (EngineHandle e : engines) {
        if (e.status() != EngineStatus.STOPPED) running.add(e);
      }
      return running;
    }
  }

  @Override
  public List<GraphInfo> listGraphs(EngineHandle engine) {
    return graphInfo == null ? List.of() : List.of(graphInfo);
  }

  @Override
  public Optional<GraphInfo> getGraph(EngineHandle engine, String graphId) {
    return Optional.ofNullable(graphInfo);
  }

  @Override
  public void deleteGraph(EngineHandle engine, String graphId) {
    calls.add("deleteGraph:" + graphId);
  }

  @Override
  public List<JobHandle> listJobs(EngineHandle engine) {
    return List.of();
  }

  @Override
  public void deleteJob(EngineHandle engine, String jobId) {
    calls.add("deleteJob:" + jobId);
  }

  /** Calls made, in order, without job polls. */
  public List<String> callsWithoutPolls() {
    synchronized (calls) {
      List<String> out = new ArrayList<>();
      for (String c : calls) {
        if (!c.startsWith("poll:")) out.add(c);
      }
      return out;
    }
  }

  public Set<String> kindsPolled() {
    Set<String> kinds = new HashSet<>();
    polls.keySet().forEach(id -> kinds.add(id.substring(0, id.indexOf('-'))));
    return kinds;
  }

  private String nextJob(String kind) {
    return kind + "-" + jobSeq.incrementAndGet();
  }

  private static void throwNext(Deque<RuntimeException> errors) {
    RuntimeException next = errors.poll();
    if (next != null) throw next;
  }
}

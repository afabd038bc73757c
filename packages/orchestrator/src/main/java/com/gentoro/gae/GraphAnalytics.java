package com.gentoro.gae;

import com.gentoro.gae.analysis.AnalysisRequest;
import com.gentoro.gae.analysis.AnalysisRequestLoader;
import com.gentoro.gae.auth.CredentialManager;
import com.gentoro.gae.batch.BatchOptions;
import com.gentoro.gae.batch.BatchRunner;
import com.gentoro.gae.catalog.ArangoExecutionCatalog;
import com.gentoro.gae.catalog.CatalogPublisher;
import com.gentoro.gae.catalog.InMemoryExecutionCatalog;
import com.gentoro.gae.config.ConfigurationProvider;
import com.gentoro.gae.config.OrchestratorSettings;
import com.gentoro.gae.cost.CostEstimator;
import com.gentoro.gae.engine.EngineConnection;
import com.gentoro.gae.engine.EngineConnectionFactory;
import com.gentoro.gae.engine.EngineHandle;
import com.gentoro.gae.exception.StateException;
import com.gentoro.gae.execution.AnalysisExecutor;
import com.gentoro.gae.execution.CancellationToken;
import com.gentoro.gae.execution.EngineAudit;
import com.gentoro.gae.execution.ExecutionResult;
import com.gentoro.gae.http.OkHttpFactory;
import com.gentoro.gae.logging.LoggingService;
import com.gentoro.gae.store.ArangoDocumentStore;
import com.gentoro.gae.store.DocumentStore;
import com.gentoro.gae.store.InMemoryDocumentStore;
import com.gentoro.gae.utility.Sleeper;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;

/**
 * Entry point: wires configuration, credentials, the engine backend, the document store and the
 * execution catalog, then runs analyses.
 *
 * <pre>{@code
 * try (GraphAnalytics gae = new GraphAnalytics(Path.of("gae.yaml")).initialize()) {
 *   ExecutionResult result = gae.runAnalysis(request);
 * }
 * }</pre>
 */
public class GraphAnalytics implements AutoCloseable {
  private static final org.slf4j.Logger log = LoggingService.getLogger(GraphAnalytics.class);

  private final Path configFile;
  private final Configuration explicitConfiguration;
  private final UnaryOperator<String> environment;
  private final Clock clock;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

  private Configuration configuration;
  private OrchestratorSettings settings;
  private OkHttpClient httpClient;
  private CredentialManager credentials;
  private DocumentStore documentStore;
  private EngineConnection connection;
  private CatalogPublisher catalog;
  private CostEstimator costEstimator;
  private AnalysisExecutor executor;
  private BatchRunner batchRunner;
  private EngineAudit audit;

  /** @param configFile YAML configuration, or {@code null} for the classpath default */
  public GraphAnalytics(Path configFile) {
    this(configFile, null, System::getenv, Clock.systemUTC());
  }

  public GraphAnalytics(Configuration configuration, UnaryOperator<String> environment) {
    this(null, configuration, environment, Clock.systemUTC());
  }

  private GraphAnalytics(
      Path configFile,
      Configuration configuration,
      UnaryOperator<String> environment,
      Clock clock) {
    this.configFile = configFile;
    this.explicitConfiguration = configuration;
    this.environment = environment;
    this.clock = clock;
  }

  public GraphAnalytics initialize() {
    if (executor != null) {
      throw new StateException("GraphAnalytics is already initialized");
    }
    this.configuration =
        explicitConfiguration != null
            ? explicitConfiguration
            : new ConfigurationProvider(configFile).config();
    // levels first, so the remaining setup logs at the configured verbosity
    LoggingService.applyConfiguration(configuration);
    this.settings = OrchestratorSettings.from(configuration, environment);

    this.httpClient = OkHttpFactory.create(settings);
    this.credentials =
        new CredentialManager(
            EngineConnectionFactory.credentialSource(settings, httpClient, clock),
            settings.credentialRefreshMargin(),
            clock);
    this.documentStore = createDocumentStore();
    this.connection =
        EngineConnectionFactory.create(
            settings,
            OkHttpFactory.authenticated(httpClient, credentials),
            documentStore,
            clock,
            Sleeper.SYSTEM);
    this.catalog = createCatalog();
    this.costEstimator = new CostEstimator(settings.hourlyRates());
    this.executor =
        AnalysisExecutor.builder()
            .settings(settings)
            .credentials(credentials)
            .connection(connection)
            .documentStore(documentStore)
            .catalog(catalog)
            .costEstimator(costEstimator)
            .clock(clock)
            .sleeper(Sleeper.SYSTEM)
            .build();
    this.batchRunner = new BatchRunner(executor, clock);
    this.audit = new EngineAudit(connection);
    log.info(
        "Graph analytics orchestrator ready ({} mode, database {}, store {}, catalog {})",
        settings.mode().id(),
        settings.database(),
        documentStore == null ? "none" : settings.storeType(),
        catalog.isEnabled() ? "on" : "off");
    return this;
  }

  private DocumentStore createDocumentStore() {
    if (OrchestratorSettings.STORE_IN_MEMORY.equals(settings.storeType())) {
      log.info("Using the in-memory document store");
      return new InMemoryDocumentStore();
    }
    if (StringUtils.isBlank(settings.storeEndpoint())) {
      log.warn("No document store endpoint configured; result verification is disabled");
      return null;
    }
    return new ArangoDocumentStore(
        ArangoDocumentStore.connect(
            settings.storeEndpoint(), settings.storeUser(), settings.storePassword()));
  }

  private CatalogPublisher createCatalog() {
    if (!settings.catalogEnabled()) {
      return CatalogPublisher.disabled();
    }
    if (documentStore instanceof ArangoDocumentStore arangoStore) {
      return new CatalogPublisher(
          new ArangoExecutionCatalog(
              arangoStore.arango(), settings.database(), settings.catalogCollection()));
    }
    return new CatalogPublisher(new InMemoryExecutionCatalog());
  }

  public ExecutionResult runAnalysis(AnalysisRequest request) {
    return executor().execute(request);
  }

  public ExecutionResult runAnalysis(AnalysisRequest request, CancellationToken cancellation) {
    return executor().execute(request, cancellation);
  }

  public List<ExecutionResult> runBatch(List<AnalysisRequest> requests, BatchOptions options) {
    requireInitialized();
    return batchRunner.run(requests, options);
  }

  public List<AnalysisRequest> loadRequests(Path file) {
    return AnalysisRequestLoader.load(file);
  }

  /** Expected cost of keeping an engine of {@code size} up for {@code runtime}, in USD. */
  public double estimateCost(String size, Duration runtime) {
    requireInitialized();
    return connection.isMetered() ? costEstimator.forecast(size, runtime) : 0.0;
  }

  public List<EngineHandle> runningEngines() {
    return engineAudit().runningEngines();
  }

  public EngineAudit.StopReport stopAllEngines() {
    return engineAudit().stopAll();
  }

  public Configuration configuration() {
    requireInitialized();
    return configuration;
  }

  public OrchestratorSettings settings() {
    requireInitialized();
    return settings;
  }

  public CredentialManager credentials() {
    requireInitialized();
    return credentials;
  }

  public EngineConnection connection() {
    requireInitialized();
    return connection;
  }

  public DocumentStore documentStore() {
    requireInitialized();
    return documentStore;
  }

  public AnalysisExecutor executor() {
    requireInitialized();
    return executor;
  }

  public EngineAudit engineAudit() {
    requireInitialized();
    return audit;
  }

  private void requireInitialized() {
    if (executor == null) {
      throw new StateException("GraphAnalytics not initialized. Call initialize() first.");
    }
    if (shuttingDown.get()) {
      throw new StateException("GraphAnalytics has been shut down");
    }
  }

  /** Release the store connection and HTTP resources. Safe to call more than once. */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) return;
    if (documentStore != null) {
      try {
        documentStore.close();
      } catch (RuntimeException e) {
        log.warn("Closing the document store failed: {}", e.getMessage());
      }
    }
    if (httpClient != null) {
      httpClient.dispatcher().executorService().shutdown();
      httpClient.connectionPool().evictAll();
    }
    log.info("Graph analytics orchestrator shut down");
  }

  @Override
  public void close() {
    shutdown();
  }
}

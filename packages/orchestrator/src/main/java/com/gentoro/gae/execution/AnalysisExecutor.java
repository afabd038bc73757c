package com.gentoro.gae.execution;

import com.gentoro.gae.analysis.AnalysisRequest;
import com.gentoro.gae.auth.CredentialManager;
import com.gentoro.gae.catalog.CatalogPublisher;
import com.gentoro.gae.config.OrchestratorSettings;
import com.gentoro.gae.cost.CostEstimator;
import com.gentoro.gae.engine.EngineConnection;
import com.gentoro.gae.store.DocumentStore;
import com.gentoro.gae.utility.Sleeper;
import java.time.Clock;
import java.util.Objects;

/**
 * Shared collaborators for analysis executions. Each {@link #execute} call runs a fresh {@link
 * AnalysisExecution}; nothing but the credential manager is shared between concurrent calls.
 */
public class AnalysisExecutor {
  private final OrchestratorSettings settings;
  private final CredentialManager credentials;
  private final EngineConnection connection;
  private final DocumentStore documentStore;
  private final CatalogPublisher catalog;
  private final CostEstimator costEstimator;
  private final RetryPolicy retryPolicy;
  private final JobPoller jobPoller;
  private final ResultValidator resultValidator = new ResultValidator();
  private final Clock clock;
  private final Sleeper sleeper;

  private AnalysisExecutor(Builder b) {
    this.settings = Objects.requireNonNull(b.settings, "settings");
    this.credentials = Objects.requireNonNull(b.credentials, "credentials");
    this.connection = Objects.requireNonNull(b.connection, "connection");
    this.documentStore = b.documentStore;
    this.clock = b.clock == null ? Clock.systemUTC() : b.clock;
    this.sleeper = b.sleeper == null ? Sleeper.SYSTEM : b.sleeper;
    this.catalog = b.catalog == null ? CatalogPublisher.disabled() : b.catalog;
    this.costEstimator =
        b.costEstimator == null ? new CostEstimator(settings.hourlyRates()) : b.costEstimator;
    this.retryPolicy =
        b.retryPolicy == null ? RetryPolicy.from(settings, sleeper) : b.retryPolicy;
    this.jobPoller =
        b.jobPoller == null
            ? new JobPoller(settings.jobPollInterval(), clock, sleeper)
            : b.jobPoller;
  }

  public static Builder builder() {
    return new Builder();
  }

  public ExecutionResult execute(AnalysisRequest request) {
    return execute(request, CancellationToken.create());
  }

  public ExecutionResult execute(AnalysisRequest request, CancellationToken cancellation) {
    return new AnalysisExecution(this, request, cancellation).run();
  }

  OrchestratorSettings settings() {
    return settings;
  }

  CredentialManager credentials() {
    return credentials;
  }

  EngineConnection connection() {
    return connection;
  }

  DocumentStore documentStore() {
    return documentStore;
  }

  CatalogPublisher catalog() {
    return catalog;
  }

  CostEstimator costEstimator() {
    return costEstimator;
  }

  RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  ResultValidator resultValidator() {
    return resultValidator;
  }

  JobPoller jobPoller() {
    return jobPoller;
  }

  Clock clock() {
    return clock;
  }

  Sleeper sleeper() {
    return sleeper;
  }

  public static final class Builder {
    private OrchestratorSettings settings;
    private CredentialManager credentials;
    private EngineConnection connection;
    private DocumentStore documentStore;
    private CatalogPublisher catalog;
    private CostEstimator costEstimator;
    private RetryPolicy retryPolicy;
    private JobPoller jobPoller;
    private Clock clock;
    private Sleeper sleeper;

    private Builder() {}

    public Builder settings(OrchestratorSettings settings) {
      this.settings = settings;
      return this;
    }

    public Builder credentials(CredentialManager credentials) {
      this.credentials = credentials;
      return this;
    }

    public Builder connection(EngineConnection connection) {
      this.connection = connection;
      return this;
    }

    /** Optional: without a store, target collections are neither created nor verified. */
    public Builder documentStore(DocumentStore documentStore) {
      this.documentStore = documentStore;
      return this;
    }

    public Builder catalog(CatalogPublisher catalog) {
      this.catalog = catalog;
      return this;
    }

    public Builder costEstimator(CostEstimator costEstimator) {
      this.costEstimator = costEstimator;
      return this;
    }

    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder jobPoller(JobPoller jobPoller) {
      this.jobPoller = jobPoller;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    public AnalysisExecutor build() {
      return new AnalysisExecutor(this);
    }
  }
}

package com.gentoro.gae.config;

import com.gentoro.gae.exception.ConfigException;
import java.time.Duration;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;

/**
 * Typed, immutable view over the {@code gae.*} configuration keys.
 *
 * <p>Secrets and endpoints fall back to the environment variables the analytics platform tooling
 * conventionally uses ({@code ARANGO_ENDPOINT}, {@code ARANGO_GRAPH_TOKEN}, ...). A configured
 * value always wins over the environment.
 */
public final class OrchestratorSettings {
  public static final String STORE_ARANGODB = "arangodb";
  public static final String STORE_IN_MEMORY = "in-memory";
  public static final Map<String, Double> DEFAULT_HOURLY_RATES;

  static {
    Map<String, Double> rates = new LinkedHashMap<>();
    rates.put("e4", 0.20);
    rates.put("e8", 0.30);
    rates.put("e16", 0.40);
    rates.put("e32", 0.80);
    rates.put("e64", 1.60);
    rates.put("e128", 3.20);
    DEFAULT_HOURLY_RATES = Collections.unmodifiableMap(rates);
  }

  private final DeploymentMode mode;
  private final String database;
  private final String defaultEngineSize;
  private final Duration engineReadyTimeout;
  private final Duration engineReadyPollInterval;
  private final Duration jobPollInterval;
  private final Duration jobTimeout;
  private final int retryMaxAttempts;
  private final Duration retryInitialBackoff;
  private final Duration retryMaxBackoff;
  private final double retryMultiplier;
  private final Duration httpConnectTimeout;
  private final Duration httpReadTimeout;
  private final Duration credentialValidity;
  private final Duration credentialRefreshMargin;
  private final String managedDeploymentUrl;
  private final int managedPort;
  private final String managedApiKeyId;
  private final String managedApiKeySecret;
  private final String managedAccessToken;
  private final String managedLoginCommand;
  private final String selfHostedEndpoint;
  private final String selfHostedUser;
  private final String selfHostedPassword;
  private final Duration storageVerifyTimeout;
  private final boolean catalogEnabled;
  private final String catalogCollection;
  private final Map<String, Double> hourlyRates;
  private final String storeType;
  private final String storeEndpoint;
  private final String storeUser;
  private final String storePassword;

  private OrchestratorSettings(Configuration cfg, UnaryOperator<String> env) {
    this.mode =
        DeploymentMode.fromId(
            value(
                cfg, env, "gae.deployment-mode", "GAE_DEPLOYMENT_MODE",
                DeploymentMode.SELF_HOSTED.id()));
    this.database = value(cfg, env, "gae.database", "ARANGO_DATABASE", "_system");
    this.defaultEngineSize = cfg.getString("gae.engine.default-size", "e16");
    this.engineReadyTimeout =
        Duration.ofSeconds(positiveLong(cfg, "gae.engine.ready-timeout", 300));
    this.engineReadyPollInterval =
        Duration.ofMillis(positiveLong(cfg, "gae.engine.ready-poll-interval", 2000));
    this.jobPollInterval = Duration.ofMillis(positiveLong(cfg, "gae.job.poll-interval", 2000));
    this.jobTimeout = Duration.ofSeconds(positiveLong(cfg, "gae.job.timeout", 3600));
    this.retryMaxAttempts = (int) positiveLong(cfg, "gae.retry.max-attempts", 3);
    this.retryInitialBackoff =
        Duration.ofMillis(nonNegativeLong(cfg, "gae.retry.initial-backoff", 1000));
    this.retryMaxBackoff = Duration.ofMillis(nonNegativeLong(cfg, "gae.retry.max-backoff", 30000));
    this.retryMultiplier = cfg.getDouble("gae.retry.multiplier", 2.0);
    if (retryMultiplier < 1.0) {
      throw new ConfigException("gae.retry.multiplier must be >= 1.0, got " + retryMultiplier);
    }
    this.httpConnectTimeout =
        Duration.ofSeconds(positiveLong(cfg, "gae.http.connect-timeout", 10));
    this.httpReadTimeout = Duration.ofSeconds(positiveLong(cfg, "gae.http.read-timeout", 60));
    this.credentialValidity = Duration.ofHours(positiveLong(cfg, "gae.credential.validity", 24));
    this.credentialRefreshMargin =
        Duration.ofHours(nonNegativeLong(cfg, "gae.credential.refresh-margin", 1));
    if (credentialRefreshMargin.compareTo(credentialValidity) >= 0) {
      throw new ConfigException("gae.credential.refresh-margin must be shorter than the validity");
    }

    this.managedDeploymentUrl =
        StringUtils.removeEnd(
            value(cfg, env, "gae.managed.deployment-url", "ARANGO_GRAPH_URL", null), "/");
    this.managedPort = port(value(cfg, env, "gae.managed.port", "ARANGO_GAE_PORT", "8829"));
    this.managedApiKeyId =
        value(cfg, env, "gae.managed.api-key-id", "ARANGO_GRAPH_API_KEY_ID", null);
    this.managedApiKeySecret =
        value(cfg, env, "gae.managed.api-key-secret", "ARANGO_GRAPH_API_KEY_SECRET", null);
    this.managedAccessToken =
        value(cfg, env, "gae.managed.access-token", "ARANGO_GRAPH_TOKEN", null);
    this.managedLoginCommand = cfg.getString("gae.managed.login-command", "oasisctl");

    this.selfHostedEndpoint =
        StringUtils.removeEnd(
            value(cfg, env, "gae.self-hosted.endpoint", "ARANGO_ENDPOINT", null), "/");
    this.selfHostedUser = value(cfg, env, "gae.self-hosted.user", "ARANGO_USER", "root");
    this.selfHostedPassword =
        value(cfg, env, "gae.self-hosted.password", "ARANGO_PASSWORD", "");

    this.storageVerifyTimeout =
        Duration.ofSeconds(nonNegativeLong(cfg, "gae.storage.verify-timeout", 60));
    this.catalogEnabled = cfg.getBoolean("gae.catalog.enabled", true);
    this.catalogCollection = cfg.getString("gae.catalog.collection", "analysis_executions");
    this.hourlyRates = readRates(cfg);

    this.storeType = cfg.getString("gae.store.type", STORE_ARANGODB).trim().toLowerCase();
    if (!STORE_ARANGODB.equals(storeType) && !STORE_IN_MEMORY.equals(storeType)) {
      throw new ConfigException(
          "gae.store.type must be '" + STORE_ARANGODB + "' or '" + STORE_IN_MEMORY + "', got "
              + storeType);
    }
    this.storeEndpoint =
        StringUtils.removeEnd(
            value(cfg, env, "gae.store.endpoint", "ARANGO_ENDPOINT", selfHostedEndpoint), "/");
    this.storeUser = value(cfg, env, "gae.store.user", "ARANGO_USER", selfHostedUser);
    this.storePassword =
        value(cfg, env, "gae.store.password", "ARANGO_PASSWORD", selfHostedPassword);

    validateForMode();
  }

  /** Settings backed by the process environment. */
  public static OrchestratorSettings from(Configuration configuration) {
    return from(configuration, System::getenv);
  }

  /** Settings with an explicit environment lookup, used by tests. */
  public static OrchestratorSettings from(Configuration configuration, UnaryOperator<String> env) {
    if (configuration == null) {
      throw new ConfigException("Configuration is required");
    }
    return new OrchestratorSettings(configuration, env == null ? k -> null : env);
  }

  private void validateForMode() {
    switch (mode) {
      case MANAGED -> {
        if (StringUtils.isBlank(managedDeploymentUrl)) {
          throw new ConfigException(
              "Managed mode requires gae.managed.deployment-url (or ARANGO_GRAPH_URL)");
        }
        boolean hasKeys =
            StringUtils.isNotBlank(managedApiKeyId) && StringUtils.isNotBlank(managedApiKeySecret);
        if (!hasKeys && StringUtils.isBlank(managedAccessToken)) {
          throw new ConfigException(
              "Managed mode requires either an access token or an API key id and secret");
        }
        if (STORE_ARANGODB.equals(storeType) && StringUtils.isBlank(storeEndpoint)) {
          throw new ConfigException(
              "Managed mode with the arangodb store requires gae.store.endpoint"
                  + " (or ARANGO_ENDPOINT)");
        }
      }
      case SELF_HOSTED -> {
        if (StringUtils.isBlank(selfHostedEndpoint)) {
          throw new ConfigException(
              "Self-hosted mode requires gae.self-hosted.endpoint (or ARANGO_ENDPOINT)");
        }
      }
    }
  }

  private static String value(
      Configuration cfg, UnaryOperator<String> env, String key, String envName, String def) {
    String configured = cfg.getString(key, null);
    if (StringUtils.isNotBlank(configured)) return configured.trim();
    if (envName != null) {
      String fromEnv = env.apply(envName);
      if (StringUtils.isNotBlank(fromEnv)) return fromEnv.trim();
    }
    return def;
  }

  private static long positiveLong(Configuration cfg, String key, long def) {
    long v = readLong(cfg, key, def);
    if (v <= 0) {
      throw new ConfigException(key + " must be positive, got " + v);
    }
    return v;
  }

  private static long nonNegativeLong(Configuration cfg, String key, long def) {
    long v = readLong(cfg, key, def);
    if (v < 0) {
      throw new ConfigException(key + " must not be negative, got " + v);
    }
    return v;
  }

  private static long readLong(Configuration cfg, String key, long def) {
    try {
      return cfg.getLong(key, def);
    } catch (RuntimeException e) {
      throw new ConfigException("Invalid numeric value for " + key, e);
    }
  }

  private static int port(String raw) {
    try {
      int p = Integer.parseInt(raw);
      if (p <= 0 || p > 65535) throw new NumberFormatException("out of range");
      return p;
    } catch (NumberFormatException e) {
      throw new ConfigException("Invalid gae.managed.port: " + raw, e);
    }
  }

  private static Map<String, Double> readRates(Configuration cfg) {
    Map<String, Double> rates = new LinkedHashMap<>(DEFAULT_HOURLY_RATES);
    Configuration sub = cfg.subset("gae.cost.rates");
    Iterator<String> keys = sub.getKeys();
    while (keys.hasNext()) {
      String size = keys.next();
      try {
        rates.put(size, sub.getDouble(size));
      } catch (RuntimeException e) {
        throw new ConfigException("Invalid hourly rate for engine size " + size, e);
      }
    }
    return Collections.unmodifiableMap(rates);
  }

  public DeploymentMode mode() {
    return mode;
  }

  public String database() {
    return database;
  }

  public String defaultEngineSize() {
    return defaultEngineSize;
  }

  public Duration engineReadyTimeout() {
    return engineReadyTimeout;
  }

  public Duration engineReadyPollInterval() {
    return engineReadyPollInterval;
  }

  public Duration jobPollInterval() {
    return jobPollInterval;
  }

  public Duration jobTimeout() {
    return jobTimeout;
  }

  public int retryMaxAttempts() {
    return retryMaxAttempts;
  }

  public Duration retryInitialBackoff() {
    return retryInitialBackoff;
  }

  public Duration retryMaxBackoff() {
    return retryMaxBackoff;
  }

  public double retryMultiplier() {
    return retryMultiplier;
  }

  public Duration httpConnectTimeout() {
    return httpConnectTimeout;
  }

  public Duration httpReadTimeout() {
    return httpReadTimeout;
  }

  public Duration credentialValidity() {
    return credentialValidity;
  }

  public Duration credentialRefreshMargin() {
    return credentialRefreshMargin;
  }

  public String managedDeploymentUrl() {
    return managedDeploymentUrl;
  }

  public int managedPort() {
    return managedPort;
  }

  public String managedApiKeyId() {
    return managedApiKeyId;
  }

  public String managedApiKeySecret() {
    return managedApiKeySecret;
  }

  public String managedAccessToken() {
    return managedAccessToken;
  }

  public String managedLoginCommand() {
    return managedLoginCommand;
  }

  public String selfHostedEndpoint() {
    return selfHostedEndpoint;
  }

  public String selfHostedUser() {
    return selfHostedUser;
  }

  public String selfHostedPassword() {
    return selfHostedPassword;
  }

  public Duration storageVerifyTimeout() {
    return storageVerifyTimeout;
  }

  public boolean catalogEnabled() {
    return catalogEnabled;
  }

  public String catalogCollection() {
    return catalogCollection;
  }

  /** USD per engine-hour, keyed by managed engine size id. */
  public Map<String, Double> hourlyRates() {
    return hourlyRates;
  }

  /** {@link #STORE_ARANGODB} or {@link #STORE_IN_MEMORY}. */
  public String storeType() {
    return storeType;
  }

  public String storeEndpoint() {
    return storeEndpoint;
  }

  public String storeUser() {
    return storeUser;
  }

  public String storePassword() {
    return storePassword;
  }
}

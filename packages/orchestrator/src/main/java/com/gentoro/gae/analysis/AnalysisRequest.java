package com.gentoro.gae.analysis;

import com.gentoro.gae.engine.Algorithm;
import com.gentoro.gae.exception.ConfigException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of one unit of work. Unset optional values ({@code database}, {@code
 * engineSize}, {@code waitTimeout}) are filled from configuration by the executor.
 */
public final class AnalysisRequest {
  public static final int DEFAULT_STORE_PARALLELISM = 8;
  public static final int DEFAULT_STORE_BATCH_SIZE = 10_000;

  private final String name;
  private final Algorithm algorithm;
  private final Map<String, Object> params;
  private final GraphSource graphSource;
  private final List<String> vertexAttributes;
  private final String database;
  private final String targetCollection;
  private final String resultField;
  private final String engineSize;
  private final Duration waitTimeout;
  private final boolean exclusiveEngine;
  private final int storeParallelism;
  private final int storeBatchSize;

  private AnalysisRequest(Builder b) {
    this.algorithm = b.algorithm;
    this.name =
        b.name != null && !b.name.isBlank()
            ? b.name.trim()
            : (algorithm == null ? "analysis" : algorithm.id());
    this.params = Collections.unmodifiableMap(new LinkedHashMap<>(b.params));
    this.graphSource = b.graphSource == null ? new GraphSource(null, null, null) : b.graphSource;
    this.vertexAttributes = List.copyOf(b.vertexAttributes);
    this.database = b.database;
    this.targetCollection = b.targetCollection;
    this.resultField = b.resultField;
    this.engineSize = b.engineSize;
    this.waitTimeout = b.waitTimeout;
    this.exclusiveEngine = b.exclusiveEngine;
    this.storeParallelism = b.storeParallelism;
    this.storeBatchSize = b.storeBatchSize;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reject malformed requests before anything remote happens.
   *
   * @throws ConfigException naming every problem found
   */
  public AnalysisRequest validate() {
    List<String> problems = new ArrayList<>();
    if (algorithm == null) {
      problems.add("algorithm is required");
    }
    boolean named = graphSource.hasNamedGraph();
    boolean collections = graphSource.hasCollections();
    if (named && collections) {
      problems.add("set either a named graph or vertex/edge collections, not both");
    } else if (!named && !collections) {
      problems.add("a named graph or vertex/edge collections are required");
    } else if (collections
        && (graphSource.vertexCollections().isEmpty() || graphSource.edgeCollections().isEmpty())) {
      problems.add("explicit graph sources need both vertex and edge collections");
    }
    if (targetCollection == null || targetCollection.isBlank()) {
      problems.add("target collection is required");
    }
    if (waitTimeout != null && (waitTimeout.isNegative() || waitTimeout.isZero())) {
      problems.add("wait timeout must be positive");
    }
    if (storeParallelism <= 0 || storeBatchSize <= 0) {
      problems.add("store parallelism and batch size must be positive");
    }
    if (!problems.isEmpty()) {
      throw new ConfigException("Invalid analysis request '" + name + "': " + problems);
    }
    return this;
  }

  public String name() {
    return name;
  }

  public Algorithm algorithm() {
    return algorithm;
  }

  public Map<String, Object> params() {
    return params;
  }

  public GraphSource graphSource() {
    return graphSource;
  }

  public List<String> vertexAttributes() {
    return vertexAttributes;
  }

  public String database() {
    return database;
  }

  public String targetCollection() {
    return targetCollection;
  }

  /** Explicit result attribute, or the algorithm's standard one. */
  public String resultField() {
    if (resultField != null && !resultField.isBlank()) return resultField;
    return algorithm == null ? null : algorithm.resultField();
  }

  public String engineSize() {
    return engineSize;
  }

  public Duration waitTimeout() {
    return waitTimeout;
  }

  public boolean exclusiveEngine() {
    return exclusiveEngine;
  }

  public int storeParallelism() {
    return storeParallelism;
  }

  public int storeBatchSize() {
    return storeBatchSize;
  }

  @Override
  public String toString() {
    return "AnalysisRequest{name=%s, algorithm=%s, source=%s, target=%s}"
        .formatted(
            name,
            algorithm == null ? null : algorithm.id(),
            graphSource.describe(),
            targetCollection);
  }

  public static final class Builder {
    private String name;
    private Algorithm algorithm;
    private final Map<String, Object> params = new LinkedHashMap<>();
    private GraphSource graphSource;
    private final List<String> vertexAttributes = new ArrayList<>();
    private String database;
    private String targetCollection;
    private String resultField;
    private String engineSize;
    private Duration waitTimeout;
    private boolean exclusiveEngine;
    private int storeParallelism = DEFAULT_STORE_PARALLELISM;
    private int storeBatchSize = DEFAULT_STORE_BATCH_SIZE;

    private Builder() {}

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder algorithm(Algorithm algorithm) {
      this.algorithm = algorithm;
      return this;
    }

    /** Accepts algorithm ids and aliases, e.g. {@code rank-propagation}. */
    public Builder algorithm(String algorithm) {
      this.algorithm = Algorithm.fromId(algorithm);
      return this;
    }

    public Builder param(String key, Object value) {
      this.params.put(Objects.requireNonNull(key, "key"), value);
      return this;
    }

    public Builder params(Map<String, Object> params) {
      if (params != null) this.params.putAll(params);
      return this;
    }

    public Builder graphSource(GraphSource graphSource) {
      this.graphSource = graphSource;
      return this;
    }

    public Builder namedGraph(String graphName) {
      return graphSource(GraphSource.named(graphName));
    }

    public Builder collections(List<String> vertices, List<String> edges) {
      return graphSource(GraphSource.collections(vertices, edges));
    }

    public Builder vertexAttributes(List<String> attributes) {
      if (attributes != null) this.vertexAttributes.addAll(attributes);
      return this;
    }

    public Builder database(String database) {
      this.database = database;
      return this;
    }

    public Builder targetCollection(String targetCollection) {
      this.targetCollection = targetCollection;
      return this;
    }

    public Builder resultField(String resultField) {
      this.resultField = resultField;
      return this;
    }

    public Builder engineSize(String engineSize) {
      this.engineSize = engineSize;
      return this;
    }

    public Builder waitTimeout(Duration waitTimeout) {
      this.waitTimeout = waitTimeout;
      return this;
    }

    public Builder exclusiveEngine(boolean exclusiveEngine) {
      this.exclusiveEngine = exclusiveEngine;
      return this;
    }

    public Builder storeParallelism(int storeParallelism) {
      this.storeParallelism = storeParallelism;
      return this;
    }

    public Builder storeBatchSize(int storeBatchSize) {
      this.storeBatchSize = storeBatchSize;
      return this;
    }

    /** Builds without validating; see {@link AnalysisRequest#validate()}. */
    public AnalysisRequest build() {
      return new AnalysisRequest(this);
    }
  }
}

package com.gentoro.gae.engine;

import com.gentoro.gae.exception.ConfigException;
import com.gentoro.gae.utility.CollectionUtility;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Algorithms the engine runs. All of them are submitted through the same job primitive; they
 * differ only in endpoint, default parameters and the attribute their result is written to.
 */
public enum Algorithm {
  PAGERANK(
      "pagerank",
      "v1/pagerank",
      "rank",
      defaults("damping_factor", 0.85, "maximum_supersteps", 100),
      "rank-propagation",
      "page_rank"),
  WCC("wcc", "v1/wcc", "component", Map.of(), "weakly_connected_components"),
  SCC("scc", "v1/scc", "component", Map.of(), "strongly_connected_components"),
  LABEL_PROPAGATION(
      "label_propagation",
      "v1/labelpropagation",
      "community",
      defaults(
          "start_label_attribute",
          "_key",
          "synchronous",
          false,
          "random_tiebreak",
          false,
          "maximum_supersteps",
          100),
      "labelpropagation",
      "label-propagation"),
  BETWEENNESS(
      "betweenness",
      "v1/betweenness",
      "centrality",
      defaults("maximum_supersteps", 100),
      "betweenness_centrality");

  public static final String VERSION = "1.0";

  private final String id;
  private final String endpoint;
  private final String resultField;
  private final Map<String, Object> defaults;
  private final List<String> aliases;

  Algorithm(
      String id,
      String endpoint,
      String resultField,
      Map<String, Object> defaults,
      String... aliases) {
    this.id = id;
    this.endpoint = endpoint;
    this.resultField = resultField;
    this.defaults = defaults;
    this.aliases = List.of(aliases);
  }

  private static Map<String, Object> defaults(Object... keyValues) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      map.put((String) keyValues[i], keyValues[i + 1]);
    }
    return Map.copyOf(map);
  }

  public String id() {
    return id;
  }

  /** Engine API path relative to the engine URL. */
  public String endpoint() {
    return endpoint;
  }

  /** Attribute the result is stored under when the request names none. */
  public String resultField() {
    return resultField;
  }

  public Map<String, Object> defaults() {
    return defaults;
  }

  public String version() {
    return VERSION;
  }

  /** Request body: defaults, overridden by caller parameters, plus the graph id. */
  public Map<String, Object> payload(String graphId, Map<String, Object> params) {
    Map<String, Object> body = CollectionUtility.mergeMaps(defaults, params);
    body.put("graph_id", graphId);
    return body;
  }

  public static Algorithm fromId(String value) {
    if (value == null || value.isBlank()) {
      throw new ConfigException("Algorithm is required");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (Algorithm a : values()) {
      if (a.id.equals(normalized) || a.aliases.contains(normalized)) {
        return a;
      }
    }
    throw new ConfigException(
        "Unsupported algorithm '%s', expected one of %s"
            .formatted(value, Arrays.stream(values()).map(Algorithm::id).toList()));
  }
}

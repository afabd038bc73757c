package com.gentoro.gae.execution;

import com.gentoro.gae.analysis.AnalysisRequest;
import com.gentoro.gae.engine.Algorithm;
import com.gentoro.gae.exception.ResultValidationException;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Sanity checks on a sample of stored result documents:
 *
 * <ul>
 *   <li>at least one document carries the request's result attribute;
 *   <li>component algorithms did not put every sampled vertex into its own component;
 *   <li>when explicit vertex collections were requested, no result refers to a vertex outside
 *       them.
 * </ul>
 *
 * Vertex references are read from the {@code id} or {@code vertex_id} attribute the engine
 * writes ({@code collection/key}).
 */
public class ResultValidator {
  private static final org.slf4j.Logger log =
      com.gentoro.gae.logging.LoggingService.getLogger(ResultValidator.class);

  public static final int SAMPLE_SIZE = 100;
  private static final double WEAK_CLUSTERING_RATIO = 0.9;

  /**
   * @throws ResultValidationException describing the first failed check
   */
  public void validate(AnalysisRequest request, List<Map<String, Object>> samples) {
    if (samples == null || samples.isEmpty()) {
      log.debug("No result documents sampled for {}, skipping validation", request.name());
      return;
    }
    String field = request.resultField();
    checkResultField(field, samples);
    if (request.algorithm() == Algorithm.WCC || request.algorithm() == Algorithm.SCC) {
      checkComponents(request, field, samples);
    }
    checkVertexCollections(request.graphSource().vertexCollections(), samples);
    log.debug("{} sampled results of {} passed validation", samples.size(), request.name());
  }

  private static void checkResultField(String field, List<Map<String, Object>> samples) {
    if (field == null) return;
    for (Map<String, Object> doc : samples) {
      if (doc.containsKey(field)) return;
    }
    Set<String> found = new TreeSet<>();
    samples.forEach(doc -> found.addAll(doc.keySet()));
    throw new ResultValidationException(
        "Results are missing the expected attribute '%s'; found %s".formatted(field, found));
  }

  private static void checkComponents(
      AnalysisRequest request, String field, List<Map<String, Object>> samples) {
    Set<String> vertices = new LinkedHashSet<>();
    Set<Object> components = new LinkedHashSet<>();
    for (Map<String, Object> doc : samples) {
      String vertex = vertexRef(doc);
      if (vertex != null) vertices.add(vertex);
      Object component = doc.get(field);
      if (component != null) components.add(component);
    }
    // a single sampled vertex is trivially its own component
    if (vertices.size() > 1 && components.size() == vertices.size()) {
      throw new ResultValidationException(
          ("%s results put every vertex in its own component (%d components for %d vertices); "
                  + "the algorithm did not run on the loaded edges or '%s' is the wrong attribute")
              .formatted(request.algorithm().id(), components.size(), vertices.size(), field));
    }
    if (vertices.size() > 10 && components.size() > vertices.size() * WEAK_CLUSTERING_RATIO) {
      log.warn(
          "{} produced {} components for {} sampled vertices; clustering is weak",
          request.name(),
          components.size(),
          vertices.size());
    }
  }

  private static void checkVertexCollections(
      Collection<String> allowed, List<Map<String, Object>> samples) {
    if (allowed == null || allowed.isEmpty()) return;
    Set<String> foreign = new TreeSet<>();
    for (Map<String, Object> doc : samples) {
      String vertex = vertexRef(doc);
      int slash = vertex == null ? -1 : vertex.indexOf('/');
      if (slash > 0 && !allowed.contains(vertex.substring(0, slash))) {
        foreign.add(vertex.substring(0, slash));
      }
    }
    if (!foreign.isEmpty()) {
      throw new ResultValidationException(
          "Results contain vertices from collections %s outside the requested %s"
              .formatted(foreign, allowed));
    }
  }

  private static String vertexRef(Map<String, Object> doc) {
    Object id = doc.get("id");
    if (id == null) id = doc.get("vertex_id");
    if (id == null) return null;
    String ref = id.toString();
    return ref.isBlank() ? null : ref;
  }
}

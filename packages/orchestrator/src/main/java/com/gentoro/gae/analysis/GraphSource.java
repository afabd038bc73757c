package com.gentoro.gae.analysis;

import java.util.List;

/**
 * Where the engine loads the graph from: a named graph, or explicit vertex and edge collection
 * lists. Exactly one of the two forms is valid, see {@link AnalysisRequest#validate()}.
 */
public record GraphSource(
    String namedGraph, List<String> vertexCollections, List<String> edgeCollections) {

  public GraphSource {
    vertexCollections = vertexCollections == null ? List.of() : List.copyOf(vertexCollections);
    edgeCollections = edgeCollections == null ? List.of() : List.copyOf(edgeCollections);
  }

  public static GraphSource named(String graphName) {
    return new GraphSource(graphName, List.of(), List.of());
  }

  public static GraphSource collections(List<String> vertices, List<String> edges) {
    return new GraphSource(null, vertices, edges);
  }

  public boolean hasNamedGraph() {
    return namedGraph != null && !namedGraph.isBlank();
  }

  public boolean hasCollections() {
    return !vertexCollections.isEmpty() || !edgeCollections.isEmpty();
  }

  /** Short form for logs and catalog records. */
  public String describe() {
    if (hasNamedGraph()) return "graph:" + namedGraph;
    return "collections:" + vertexCollections + "/" + edgeCollections;
  }
}

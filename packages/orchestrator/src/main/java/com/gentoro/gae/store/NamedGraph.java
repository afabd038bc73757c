package com.gentoro.gae.store;

import java.util.List;

/** Vertex and edge collection membership of a named graph. */
public record NamedGraph(
    String name, List<String> vertexCollections, List<String> edgeCollections) {

  public NamedGraph {
    vertexCollections = List.copyOf(vertexCollections);
    edgeCollections = List.copyOf(edgeCollections);
  }
}

package com.gentoro.gae.store;

import com.gentoro.gae.exception.RemoteNotFoundException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Map-backed store for tests and dry runs. Thread-safe. */
public class InMemoryDocumentStore implements DocumentStore {
  private final Map<String, Map<String, Map<String, Object>>> collections =
      new ConcurrentHashMap<>();
  private final Map<String, NamedGraph> graphs = new ConcurrentHashMap<>();

  private static String qualified(String database, String name) {
    return database + "/" + name;
  }

  /** Register a named graph and create its collections. */
  public InMemoryDocumentStore defineGraph(
      String database, String graphName, List<String> vertices, List<String> edges) {
    graphs.put(qualified(database, graphName), new NamedGraph(graphName, vertices, edges));
    vertices.forEach(c -> ensureCollection(database, c));
    edges.forEach(c -> ensureCollection(database, c));
    return this;
  }

  @Override
  public long count(String database, String collection) {
    Map<String, Map<String, Object>> docs = collections.get(qualified(database, collection));
    return docs == null ? 0 : docs.size();
  }

  @Override
  public boolean hasCollection(String database, String collection) {
    return collections.containsKey(qualified(database, collection));
  }

  @Override
  public void ensureCollection(String database, String collection) {
    collections.computeIfAbsent(qualified(database, collection), k -> new ConcurrentHashMap<>());
  }

  @Override
  public int writeAttributes(
      String database, String collection, Map<String, Map<String, Object>> documents) {
    if (documents == null || documents.isEmpty()) return 0;
    ensureCollection(database, collection);
    Map<String, Map<String, Object>> docs = collections.get(qualified(database, collection));
    documents.forEach(
        (key, attrs) ->
            docs.merge(
                key,
                withKey(key, attrs),
                (existing, update) -> {
                  Map<String, Object> merged = new LinkedHashMap<>(existing);
                  merged.putAll(update);
                  return merged;
                }));
    return documents.size();
  }

  private static Map<String, Object> withKey(String key, Map<String, Object> attrs) {
    Map<String, Object> doc = new LinkedHashMap<>();
    if (attrs != null) doc.putAll(attrs);
    doc.put("_key", key);
    return doc;
  }

  @Override
  public List<Map<String, Object>> sample(String database, String collection, int limit) {
    Map<String, Map<String, Object>> docs = collections.get(qualified(database, collection));
    if (docs == null || limit <= 0) return List.of();
    List<Map<String, Object>> sample = new ArrayList<>();
    for (Map<String, Object> doc : docs.values()) {
      if (sample.size() >= limit) break;
      sample.add(new LinkedHashMap<>(doc));
    }
    return sample;
  }

  /** Copy of one document, or {@code null}. */
  public Map<String, Object> document(String database, String collection, String key) {
    Map<String, Map<String, Object>> docs = collections.get(qualified(database, collection));
    Map<String, Object> doc = docs == null ? null : docs.get(key);
    return doc == null ? null : new LinkedHashMap<>(doc);
  }

  @Override
  public NamedGraph namedGraphCollections(String database, String graphName) {
    NamedGraph graph = graphs.get(qualified(database, graphName));
    if (graph == null) {
      throw new RemoteNotFoundException(
          "Named graph '%s' not found in database '%s'".formatted(graphName, database));
    }
    return graph;
  }
}

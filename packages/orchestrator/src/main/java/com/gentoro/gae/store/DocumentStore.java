package com.gentoro.gae.store;

import java.util.List;
import java.util.Map;

/**
 * The document database the engine reads graphs from and writes results to, reduced to what the
 * orchestrator needs.
 */
public interface DocumentStore extends AutoCloseable {

  /** Number of documents in the collection, {@code 0} when it does not exist. */
  long count(String database, String collection);

  boolean hasCollection(String database, String collection);

  /** Create a document collection unless it exists. */
  void ensureCollection(String database, String collection);

  /**
   * Upsert documents by key, merging the given attributes into existing documents.
   *
   * @param documents document key to attributes
   * @return number of documents written
   */
  int writeAttributes(
      String database, String collection, Map<String, Map<String, Object>> documents);

  /**
   * Up to {@code limit} documents of a collection, in no particular order.
   *
   * @return copies of the documents, empty when the collection does not exist
   */
  List<Map<String, Object>> sample(String database, String collection, int limit);

  /**
   * Collection membership of a named graph.
   *
   * @throws com.gentoro.gae.exception.RemoteNotFoundException if the graph does not exist
   */
  NamedGraph namedGraphCollections(String database, String graphName);

  @Override
  default void close() {}
}

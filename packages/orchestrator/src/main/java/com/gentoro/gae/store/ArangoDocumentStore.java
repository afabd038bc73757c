package com.gentoro.gae.store;

import com.arangodb.ArangoCursor;
import com.arangodb.ArangoDB;
import com.arangodb.ArangoDBException;
import com.arangodb.ArangoDatabase;
import com.arangodb.ArangoGraph;
import com.arangodb.entity.EdgeDefinition;
import com.arangodb.entity.GraphEntity;
import com.arangodb.model.AqlQueryOptions;
import com.gentoro.gae.exception.ConfigException;
import com.gentoro.gae.exception.GaeException;
import com.gentoro.gae.exception.RemoteNotFoundException;
import com.gentoro.gae.exception.RemoteRequestException;
import com.gentoro.gae.exception.TransientNetworkException;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** ArangoDB-backed {@link DocumentStore} using the Java driver. */
public class ArangoDocumentStore implements DocumentStore {
  private static final org.slf4j.Logger log =
      com.gentoro.gae.logging.LoggingService.getLogger(ArangoDocumentStore.class);

  private static final int ERROR_DUPLICATE_NAME = 1207;
  private static final String SAMPLE_AQL = "FOR doc IN @@collection LIMIT @limit RETURN doc";
  private static final String UPSERT_AQL =
      "FOR doc IN @docs UPSERT { _key: doc._key } INSERT doc UPDATE doc IN @@collection";

  private final ArangoDB arango;

  public ArangoDocumentStore(ArangoDB arango) {
    this.arango = Objects.requireNonNull(arango, "arango");
  }

  /**
   * Connect to the database behind an endpoint URL such as {@code https://host:8529}.
   *
   * @throws ConfigException if the endpoint cannot be parsed
   */
  public static ArangoDB connect(String endpoint, String user, String password) {
    if (endpoint == null || endpoint.isBlank()) {
      throw new ConfigException("Database endpoint is required for the ArangoDB document store");
    }
    URI uri;
    try {
      uri = URI.create(endpoint.trim());
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Invalid database endpoint: " + endpoint, e);
    }
    if (uri.getHost() == null) {
      throw new ConfigException("Invalid database endpoint: " + endpoint);
    }
    boolean ssl = "https".equalsIgnoreCase(uri.getScheme());
    int port = uri.getPort() > 0 ? uri.getPort() : 8529;
    log.debug("Connecting document store to {}:{} (ssl={})", uri.getHost(), port, ssl);
    return new ArangoDB.Builder()
        .host(uri.getHost(), port)
        .useSsl(ssl)
        .user(user)
        .password(password == null ? "" : password)
        .build();
  }

  /** The underlying driver, shared with the execution catalog. */
  public ArangoDB arango() {
    return arango;
  }

  @Override
  public long count(String database, String collection) {
    try {
      ArangoDatabase db = arango.db(database);
      if (!db.collection(collection).exists()) return 0;
      Long count = db.collection(collection).count().getCount();
      return count == null ? 0 : count;
    } catch (ArangoDBException e) {
      throw translate("count " + database + "/" + collection, e);
    }
  }

  @Override
  public boolean hasCollection(String database, String collection) {
    try {
      return arango.db(database).collection(collection).exists();
    } catch (ArangoDBException e) {
      throw translate("check collection " + database + "/" + collection, e);
    }
  }

  @Override
  public void ensureCollection(String database, String collection) {
    try {
      ArangoDatabase db = arango.db(database);
      if (db.collection(collection).exists()) return;
      db.createCollection(collection);
      log.info("Created collection '{}' in database '{}'", collection, database);
    } catch (ArangoDBException e) {
      if (Objects.equals(e.getErrorNum(), ERROR_DUPLICATE_NAME)) {
        // created concurrently
        return;
      }
      throw translate("create collection " + database + "/" + collection, e);
    }
  }

  @Override
  public int writeAttributes(
      String database, String collection, Map<String, Map<String, Object>> documents) {
    if (documents == null || documents.isEmpty()) return 0;
    List<Map<String, Object>> docs = new ArrayList<>(documents.size());
    documents.forEach(
        (key, attrs) -> {
          Map<String, Object> doc = new LinkedHashMap<>();
          if (attrs != null) doc.putAll(attrs);
          doc.put("_key", key);
          docs.add(doc);
        });
    Map<String, Object> bind = new LinkedHashMap<>();
    bind.put("docs", docs);
    bind.put("@collection", collection);
    try {
      arango.db(database).query(UPSERT_AQL, Map.class, bind, new AqlQueryOptions());
      return docs.size();
    } catch (ArangoDBException e) {
      throw translate("write " + docs.size() + " documents to " + collection, e);
    }
  }

  @Override
  @SuppressWarnings({"rawtypes", "unchecked"})
  public List<Map<String, Object>> sample(String database, String collection, int limit) {
    if (limit <= 0) return List.of();
    Map<String, Object> bind = new LinkedHashMap<>();
    bind.put("@collection", collection);
    bind.put("limit", limit);
    try {
      ArangoDatabase db = arango.db(database);
      if (!db.collection(collection).exists()) return List.of();
      List<Map<String, Object>> docs = new ArrayList<>();
      ArangoCursor<Map> cursor = db.query(SAMPLE_AQL, Map.class, bind, new AqlQueryOptions());
      for (Map doc : cursor.asListRemaining()) {
        docs.add(new LinkedHashMap<String, Object>(doc));
      }
      return docs;
    } catch (ArangoDBException e) {
      throw translate("sample " + database + "/" + collection, e);
    }
  }

  @Override
  public NamedGraph namedGraphCollections(String database, String graphName) {
    try {
      ArangoGraph graph = arango.db(database).graph(graphName);
      if (!graph.exists()) {
        throw new RemoteNotFoundException(
            "Named graph '%s' not found in database '%s'".formatted(graphName, database));
      }
      GraphEntity info = graph.getInfo();
      Set<String> vertices = new LinkedHashSet<>();
      Set<String> edges = new LinkedHashSet<>();
      if (info.getEdgeDefinitions() != null) {
        for (EdgeDefinition def : info.getEdgeDefinitions()) {
          edges.add(def.getCollection());
          vertices.addAll(def.getFrom());
          vertices.addAll(def.getTo());
        }
      }
      if (info.getOrphanCollections() != null) {
        vertices.addAll(info.getOrphanCollections());
      }
      log.debug(
          "Named graph '{}' resolves to vertices {} and edges {}", graphName, vertices, edges);
      return new NamedGraph(graphName, new ArrayList<>(vertices), new ArrayList<>(edges));
    } catch (ArangoDBException e) {
      throw translate("read named graph " + graphName, e);
    }
  }

  @Override
  public void close() {
    arango.shutdown();
  }

  static GaeException translate(String operation, ArangoDBException e) {
    Integer status = e.getResponseCode();
    String detail = e.getErrorMessage() != null ? e.getErrorMessage() : e.getMessage();
    String message = "Document store failed to " + operation + ": " + detail;
    if (status == null || status >= 500 || status == 408 || status == 429) {
      return new TransientNetworkException(message, e);
    }
    if (status == 404) {
      return new RemoteNotFoundException(message);
    }
    return new RemoteRequestException(message, status);
  }
}

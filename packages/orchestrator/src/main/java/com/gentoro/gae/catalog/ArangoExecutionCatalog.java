package com.gentoro.gae.catalog;

import com.arangodb.ArangoCollection;
import com.arangodb.ArangoDB;
import com.fasterxml.jackson.core.type.TypeReference;
import com.gentoro.gae.utility.JacksonUtility;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/** Stores one document per execution in an ArangoDB collection, created on first use. */
public class ArangoExecutionCatalog implements ExecutionCatalog {
  private static final org.slf4j.Logger log =
      com.gentoro.gae.logging.LoggingService.getLogger(ArangoExecutionCatalog.class);

  private final ArangoDB arango;
  private final String database;
  private final String collection;
  private final AtomicBoolean collectionReady = new AtomicBoolean(false);

  public ArangoExecutionCatalog(ArangoDB arango, String database, String collection) {
    this.arango = arango;
    this.database = database;
    this.collection = collection;
  }

  @Override
  public void record(ExecutionRecord record) {
    ArangoCollection target = arango.db(database).collection(collection);
    if (!collectionReady.get()) {
      if (!target.exists()) {
        arango.db(database).createCollection(collection);
        log.info("Created execution catalog collection '{}' in '{}'", collection, database);
      }
      collectionReady.set(true);
    }
    Map<String, Object> doc =
        JacksonUtility.getJsonMapper().convertValue(record, new TypeReference<>() {});
    doc.put("_key", record.executionId());
    target.insertDocument(doc);
  }
}

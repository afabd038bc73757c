package com.gentoro.gae.store;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.gae.exception.RemoteNotFoundException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InMemoryDocumentStoreTest {
  private final InMemoryDocumentStore store = new InMemoryDocumentStore();

  @Test
  @DisplayName("writes merge attributes into existing documents")
  void upsertMerges() {
    store.writeAttributes("db", "users", Map.of("u1", Map.of("name", "ann")));
    int written = store.writeAttributes("db", "users", Map.of("u1", Map.of("rank", 0.4)));

    assertEquals(1, written);
    assertEquals(1, store.count("db", "users"));
    Map<String, Object> doc = store.document("db", "users", "u1");
    assertEquals("ann", doc.get("name"));
    assertEquals(0.4, doc.get("rank"));
    assertEquals("u1", doc.get("_key"));
  }

  @Test
  @DisplayName("collections are scoped by database")
  void scopedByDatabase() {
    store.ensureCollection("a", "users");

    assertTrue(store.hasCollection("a", "users"));
    assertFalse(store.hasCollection("b", "users"));
    assertEquals(0, store.count("b", "users"));
    assertNull(store.document("b", "users", "u1"));
  }

  @Test
  @DisplayName("empty writes are no-ops")
  void emptyWrite() {
    assertEquals(0, store.writeAttributes("db", "users", Map.of()));
    assertFalse(store.hasCollection("db", "users"));
  }

  @Test
  @DisplayName("named graphs resolve to their collections")
  void namedGraphs() {
    store.defineGraph("db", "social", List.of("users"), List.of("follows"));

    NamedGraph graph = store.namedGraphCollections("db", "social");
    assertEquals(List.of("users"), graph.vertexCollections());
    assertEquals(List.of("follows"), graph.edgeCollections());
    assertTrue(store.hasCollection("db", "follows"));
    assertThrows(
        RemoteNotFoundException.class, () -> store.namedGraphCollections("other", "social"));
  }

  @Test
  @DisplayName("samples are bounded copies")
  void sample() {
    store.writeAttributes(
        "db", "users", Map.of("u1", Map.of("rank", 0.1), "u2", Map.of("rank", 0.2)));

    List<Map<String, Object>> sample = store.sample("db", "users", 1);
    assertEquals(1, sample.size());
    sample.get(0).put("rank", 9.9);

    assertEquals(2, store.sample("db", "users", 10).size());
    assertFalse(store.sample("db", "users", 10).stream().anyMatch(d -> d.get("rank").equals(9.9)));
    assertTrue(store.sample("db", "missing", 10).isEmpty());
  }
}

package com.gentoro.gae.catalog;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.gae.utility.JacksonUtility;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CatalogPublisherTest {

  private static ExecutionRecord record(String id) {
    return new ExecutionRecord(
        id,
        "influencers",
        "pagerank",
        "1.0",
        Map.of("damping_factor", 0.85),
        "graph:social",
        "_system",
        "users",
        42,
        3_000,
        0.25,
        "COMPLETED",
        null,
        "engine-1",
        "e8",
        "managed",
        1,
        10,
        20,
        "2025-01-01T00:00:00Z",
        "2025-01-01T00:00:03Z");
  }

  @Test
  @DisplayName("records reach the catalog")
  void publishes() {
    InMemoryExecutionCatalog catalog = new InMemoryExecutionCatalog();
    CatalogPublisher publisher = new CatalogPublisher(catalog);

    assertTrue(publisher.isEnabled());
    assertTrue(publisher.publish(record("x-1")));
    assertEquals(1, catalog.records().size());
    assertEquals("x-1", catalog.records().get(0).executionId());
  }

  @Test
  @DisplayName("catalog failures are contained")
  void failureContained() {
    ExecutionCatalog broken = mock(ExecutionCatalog.class);
    doThrow(new IllegalStateException("catalog offline")).when(broken).record(any());

    assertFalse(new CatalogPublisher(broken).publish(record("x-2")));
    verify(broken).record(any());
  }

  @Test
  @DisplayName("a disabled publisher drops records")
  void disabled() {
    CatalogPublisher publisher = CatalogPublisher.disabled();
    assertFalse(publisher.isEnabled());
    assertFalse(publisher.publish(record("x-3")));
  }

  @Test
  @DisplayName("records serialize with snake_case attributes")
  void snakeCase() {
    JsonNode json = JacksonUtility.getJsonMapper().valueToTree(record("x-4"));

    assertEquals("x-4", json.get("execution_id").asText());
    assertEquals(42, json.get("result_count").asLong());
    assertEquals(0.25, json.get("estimated_cost_usd").asDouble(), 1e-9);
    assertEquals("graph:social", json.get("graph_reference").asText());
    assertFalse(json.has("executionId"));
  }
}

package com.gentoro.gae.execution;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.gae.analysis.AnalysisRequest;
import com.gentoro.gae.exception.GaeErrorCode;
import com.gentoro.gae.exception.ResultValidationException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ResultValidatorTest {
  private final ResultValidator validator = new ResultValidator();

  private static AnalysisRequest wcc() {
    return AnalysisRequest.builder()
        .algorithm("wcc")
        .collections(List.of("users"), List.of("follows"))
        .targetCollection("components")
        .build();
  }

  private static Map<String, Object> doc(String id, Object component) {
    return Map.of("id", id, "component", component);
  }

  @Test
  @DisplayName("clustered results from the requested collections pass")
  void validResults() {
    assertDoesNotThrow(
        () ->
            validator.validate(
                wcc(),
                List.of(doc("users/1", "c1"), doc("users/2", "c1"), doc("users/3", "c2"))));
  }

  @Test
  @DisplayName("a missing result attribute is reported with the attributes found")
  void missingResultField() {
    AnalysisRequest pagerank =
        AnalysisRequest.builder()
            .algorithm("pagerank")
            .namedGraph("social")
            .targetCollection("users")
            .build();

    ResultValidationException e =
        assertThrows(
            ResultValidationException.class,
            () -> validator.validate(pagerank, List.of(Map.of("_key", "1", "score", 0.1))));

    assertEquals(GaeErrorCode.RESULT_INVALID, e.getCode());
    assertTrue(e.getMessage().contains("'rank'"));
    assertTrue(e.getMessage().contains("[_key, score]"));
  }

  @Test
  @DisplayName("one component per vertex means the components were not computed")
  void singletonComponents() {
    ResultValidationException e =
        assertThrows(
            ResultValidationException.class,
            () ->
                validator.validate(
                    wcc(),
                    List.of(doc("users/1", "c1"), doc("users/2", "c2"), doc("users/3", "c3"))));

    assertTrue(e.getMessage().contains("3 components for 3 vertices"));
  }

  @Test
  @DisplayName("a single sampled vertex is not judged")
  void singleVertex() {
    assertDoesNotThrow(() -> validator.validate(wcc(), List.of(doc("users/1", "c1"))));
  }

  @Test
  @DisplayName("results from collections outside the request are rejected")
  void foreignCollections() {
    ResultValidationException e =
        assertThrows(
            ResultValidationException.class,
            () ->
                validator.validate(
                    wcc(),
                    List.of(
                        doc("users/1", "c1"),
                        Map.of("vertex_id", "products/9", "component", "c1"))));

    assertTrue(e.getMessage().contains("[products]"));
  }

  @Test
  @DisplayName("named graph requests skip the collection check")
  void namedGraphSkipsCollectionCheck() {
    AnalysisRequest named =
        AnalysisRequest.builder()
            .algorithm("scc")
            .namedGraph("social")
            .targetCollection("components")
            .build();

    assertDoesNotThrow(
        () ->
            validator.validate(
                named, List.of(doc("users/1", "c1"), doc("products/2", "c1"))));
  }

  @Test
  @DisplayName("an empty sample is not validated")
  void emptySample() {
    assertDoesNotThrow(() -> validator.validate(wcc(), List.of()));
  }
}

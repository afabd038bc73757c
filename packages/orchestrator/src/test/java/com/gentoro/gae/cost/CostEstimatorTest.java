package com.gentoro.gae.cost;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CostEstimatorTest {
  private final CostEstimator estimator =
      new CostEstimator(Map.of("e8", 0.30, "e16", 0.60, "e64", 2.40));

  @Test
  @DisplayName("cost is uptime times the hourly rate")
  void uptimeTimesRate() {
    assertEquals(0.45, estimator.estimate("e8", Duration.ofMinutes(90), true), 1e-9);
    assertEquals(1.2, estimator.estimate("e16", Duration.ofHours(2), true), 1e-9);
  }

  @Test
  @DisplayName("size aliases resolve to their engine type")
  void aliases() {
    assertEquals(0.30, estimator.hourlyRate("small"), 1e-9);
    assertEquals(0.60, estimator.hourlyRate("medium"), 1e-9);
  }

  @Test
  @DisplayName("unmetered backends and empty uptimes cost nothing")
  void zeroCases() {
    assertEquals(0.0, estimator.estimate("e8", Duration.ofHours(5), false));
    assertEquals(0.0, estimator.estimate("e8", Duration.ZERO, true));
    assertEquals(0.0, estimator.estimate("e8", Duration.ofMinutes(-3), true));
    assertEquals(0.0, estimator.estimate("e8", null, true));
  }

  @Test
  @DisplayName("a size without a rate is free")
  void unknownRate() {
    CostEstimator sparse = new CostEstimator(Map.of("e8", 0.30));
    assertEquals(0.0, sparse.estimate("e64", Duration.ofHours(1), true));
  }

  @Test
  @DisplayName("forecasts assume a metered backend")
  void forecast() {
    assertEquals(4.8, estimator.forecast("e64", Duration.ofHours(2)), 1e-9);
  }
}

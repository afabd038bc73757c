package com.gentoro.gae.cost;

import com.gentoro.gae.engine.EngineSizes;
import java.time.Duration;
import java.util.Map;

/** Engine cost as uptime times the hourly rate of the engine size, in USD. */
public class CostEstimator {
  private static final double MILLIS_PER_HOUR = 3_600_000d;

  private final Map<String, Double> hourlyRates;

  public CostEstimator(Map<String, Double> hourlyRates) {
    this.hourlyRates = Map.copyOf(hourlyRates);
  }

  /** Rate for a size; unknown sizes have no rate and cost nothing. */
  public double hourlyRate(String size) {
    return hourlyRates.getOrDefault(EngineSizes.normalize(size), 0.0);
  }

  /**
   * @param metered {@code false} for backends that do not bill engine time
   */
  public double estimate(String size, Duration uptime, boolean metered) {
    if (!metered || uptime == null || uptime.isNegative() || uptime.isZero()) {
      return 0.0;
    }
    return uptime.toMillis() / MILLIS_PER_HOUR * hourlyRate(size);
  }

  /** Up-front estimate for an expected runtime on a metered backend. */
  public double forecast(String size, Duration expectedRuntime) {
    return estimate(size, expectedRuntime, true);
  }
}

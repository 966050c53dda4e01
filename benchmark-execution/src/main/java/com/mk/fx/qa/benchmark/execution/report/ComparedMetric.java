package com.mk.fx.qa.benchmark.execution.report;

import java.util.function.ToDoubleFunction;

/** Metrics on which two systems are ranked against each other. */
public enum ComparedMetric {
  THROUGHPUT("throughput", "req/s", true, AverageMetrics::requestsPerSecond),
  RESPONSE_TIME("response time", "ms", false, AverageMetrics::averageResponseTimeMs),
  P95_RESPONSE_TIME("P95 response time", "ms", false, AverageMetrics::p95ResponseTimeMs),
  P99_RESPONSE_TIME("P99 response time", "ms", false, AverageMetrics::p99ResponseTimeMs);

  private final String displayName;
  private final String unit;
  private final boolean higherIsBetter;
  private final ToDoubleFunction<AverageMetrics> extractor;

  ComparedMetric(
      String displayName,
      String unit,
      boolean higherIsBetter,
      ToDoubleFunction<AverageMetrics> extractor) {
    this.displayName = displayName;
    this.unit = unit;
    this.higherIsBetter = higherIsBetter;
    this.extractor = extractor;
  }

  public String displayName() {
    return displayName;
  }

  public String unit() {
    return unit;
  }

  public boolean higherIsBetter() {
    return higherIsBetter;
  }

  double valueOf(AverageMetrics averages) {
    return extractor.applyAsDouble(averages);
  }
}

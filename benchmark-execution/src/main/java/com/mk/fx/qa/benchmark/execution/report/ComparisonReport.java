package com.mk.fx.qa.benchmark.execution.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mk.fx.qa.benchmark.execution.dto.BenchmarkResult;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Comparison of two systems built from their benchmark results. Averages are {@code null} for a
 * system without results, and winners are only determined when both systems have results.
 */
public record ComparisonReport(
    @JsonProperty("generated_at") Instant generatedAt,
    @JsonProperty("label_a") String labelA,
    @JsonProperty("results_a") List<BenchmarkResult> resultsA,
    @JsonProperty("average_a") AverageMetrics averageA,
    @JsonProperty("label_b") String labelB,
    @JsonProperty("results_b") List<BenchmarkResult> resultsB,
    @JsonProperty("average_b") AverageMetrics averageB,
    @JsonProperty("winners") List<MetricWinner> winners) {

  public ComparisonReport {
    resultsA = resultsA == null ? List.of() : List.copyOf(resultsA);
    resultsB = resultsB == null ? List.of() : List.copyOf(resultsB);
    winners = winners == null ? List.of() : List.copyOf(winners);
  }

  public Optional<MetricWinner> winnerFor(ComparedMetric metric) {
    return winners.stream().filter(w -> w.metric() == metric).findFirst();
  }

  public Optional<MetricWinner> throughputWinner() {
    return winnerFor(ComparedMetric.THROUGHPUT);
  }

  public Optional<MetricWinner> responseTimeWinner() {
    return winnerFor(ComparedMetric.RESPONSE_TIME);
  }
}

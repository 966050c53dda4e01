package com.mk.fx.qa.benchmark.execution.report;

import com.mk.fx.qa.benchmark.execution.dto.BenchmarkResult;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Compares two systems from their benchmark results and renders the comparison. Works on
 * {@link BenchmarkResult} values only; no measurement happens here.
 */
@Slf4j
public class ComparisonReporter {

  private final Clock clock;
  private final Map<ReportFormat, ReportRenderer> renderers;

  public ComparisonReporter(Clock clock, List<ReportRenderer> renderers) {
    this.clock = Objects.requireNonNull(clock, "clock");
    Map<ReportFormat, ReportRenderer> map = new EnumMap<>(ReportFormat.class);
    for (ReportRenderer renderer : renderers) {
      var existing = map.putIfAbsent(renderer.format(), renderer);
      if (existing != null) {
        throw new IllegalStateException("Multiple renderers registered for " + renderer.format());
      }
    }
    this.renderers = Map.copyOf(map);
  }

  /**
   * Builds the comparison. Per system, every numeric metric is averaged over its results. Higher
   * mean throughput wins; lower mean, P95 and P99 response time win. On an exact tie the second
   * system is named the winner.
   */
  public ComparisonReport compare(
      String labelA,
      List<BenchmarkResult> resultsA,
      String labelB,
      List<BenchmarkResult> resultsB) {
    Objects.requireNonNull(labelA, "labelA");
    Objects.requireNonNull(labelB, "labelB");
    var averageA = average(resultsA).orElse(null);
    var averageB = average(resultsB).orElse(null);

    List<MetricWinner> winners = new ArrayList<>();
    if (averageA != null && averageB != null) {
      for (ComparedMetric metric : ComparedMetric.values()) {
        winners.add(decide(metric, labelA, averageA, labelB, averageB));
      }
    } else {
      log.debug("Skipping winner analysis, results missing for {} or {}", labelA, labelB);
    }

    return new ComparisonReport(
        clock.instant(), labelA, resultsA, averageA, labelB, resultsB, averageB, winners);
  }

  /** Renders a comparison in the requested format. */
  public String render(ComparisonReport report, ReportFormat format) {
    var renderer = renderers.get(format);
    if (renderer == null) {
      throw new IllegalArgumentException("No renderer available for format " + format);
    }
    return renderer.render(report);
  }

  /** Arithmetic mean of every numeric metric, empty when there are no results. */
  public static Optional<AverageMetrics> average(List<BenchmarkResult> results) {
    if (results == null || results.isEmpty()) {
      return Optional.empty();
    }
    double rps = 0, avg = 0, p95 = 0, p99 = 0, memory = 0, cpu = 0;
    for (BenchmarkResult result : results) {
      rps += result.requestsPerSecond();
      avg += result.averageResponseTimeMs();
      p95 += result.p95ResponseTimeMs();
      p99 += result.p99ResponseTimeMs();
      memory += result.memoryUsageMb();
      cpu += result.cpuUsagePercent();
    }
    int n = results.size();
    return Optional.of(
        new AverageMetrics(n, rps / n, avg / n, p95 / n, p99 / n, memory / n, cpu / n));
  }

  private static MetricWinner decide(
      ComparedMetric metric,
      String labelA,
      AverageMetrics averageA,
      String labelB,
      AverageMetrics averageB) {
    var a = metric.valueOf(averageA);
    var b = metric.valueOf(averageB);
    var aWins = metric.higherIsBetter() ? a > b : a < b;
    return aWins
        ? new MetricWinner(metric, labelA, labelB, a, b, differencePercent(a, b))
        : new MetricWinner(metric, labelB, labelA, b, a, differencePercent(b, a));
  }

  static double differencePercent(double winnerValue, double loserValue) {
    if (loserValue == 0) {
      return 0.0;
    }
    return Math.abs(winnerValue - loserValue) / loserValue * 100.0;
  }
}

package com.mk.fx.qa.benchmark.execution.metrics;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MetricsAggregateTest {

  private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

  private static MetricsAggregate aggregate() {
    return new MetricsAggregate("AXUM", Clock.fixed(START, ZoneOffset.UTC));
  }

  private static RequestSample ok(String endpoint, double millis, long bytes) {
    return RequestSample.response(0L, (long) (millis * 1_000_000), 200, bytes, endpoint);
  }

  private static RequestSample status(int code, double millis) {
    return RequestSample.response(0L, (long) (millis * 1_000_000), code, 0, "/x");
  }

  @Test
  void emptyAggregate_reportsZerosInsteadOfFailing() {
    var aggregate = aggregate();
    aggregate.finish(START.plusSeconds(2));

    assertEquals(0, aggregate.getTotalRequests());
    assertEquals(0.0, aggregate.requestsPerSecond());
    assertEquals(0.0, aggregate.averageResponseTimeMs());
    assertEquals(0.0, aggregate.percentileResponseTimeMs(95));
    assertEquals(0.0, aggregate.successRate());
    assertEquals(0.0, aggregate.throughputMbPerSecond());
    assertEquals(0.0, aggregate.minResponseTimeMs());
    assertEquals(0.0, aggregate.maxResponseTimeMs());
  }

  @Test
  void zeroDuration_reportsZeroRates() {
    var aggregate = aggregate();
    aggregate.addSample(ok("/a", 5, 100));
    aggregate.finish(START);

    assertEquals(0.0, aggregate.durationSeconds());
    assertEquals(0.0, aggregate.requestsPerSecond());
    assertEquals(0.0, aggregate.throughputMbPerSecond());
    assertEquals(5.0, aggregate.averageResponseTimeMs(), 1e-9);
  }

  @Test
  void derivedStatistics_areConsistentWithSamples() {
    var aggregate = aggregate();
    aggregate.addSample(ok("/a", 10, 1024 * 1024));
    aggregate.addSample(ok("/a", 20, 1024 * 1024));
    aggregate.addSample(status(500, 30));
    aggregate.addSample(RequestSample.transportFailure(0L, 40_000_000L, "/b", "CONNECTION_REFUSED"));
    aggregate.finish(START.plusSeconds(2));

    assertEquals(2.0, aggregate.durationSeconds(), 1e-9);
    assertEquals(4, aggregate.getTotalRequests());
    assertEquals(2, aggregate.getSuccessfulRequests());
    assertEquals(2, aggregate.getFailedRequests());
    assertEquals(2.0, aggregate.requestsPerSecond(), 1e-9);
    assertEquals(25.0, aggregate.averageResponseTimeMs(), 1e-9);
    assertEquals(50.0, aggregate.successRate(), 1e-9);
    assertEquals(1.0, aggregate.throughputMbPerSecond(), 1e-9);
    assertEquals(Map.of("HTTP_500", 1L, "HTTP_0", 1L), aggregate.getErrorCounts());
    assertEquals(Map.of("CONNECTION_REFUSED", 1L), aggregate.getTransportErrorCounts());
  }

  @Test
  void percentile_usesNearestRankWithClamping() {
    var aggregate = aggregate();
    for (int i = 1; i <= 100; i++) {
      aggregate.addSample(ok("/a", i, 0));
    }
    aggregate.finish(START.plusSeconds(1));

    assertEquals(1.0, aggregate.percentileResponseTimeMs(0), 1e-9);
    assertEquals(51.0, aggregate.percentileResponseTimeMs(50), 1e-9);
    assertEquals(96.0, aggregate.percentileResponseTimeMs(95), 1e-9);
    assertEquals(100.0, aggregate.percentileResponseTimeMs(99), 1e-9);
    assertEquals(100.0, aggregate.percentileResponseTimeMs(100), 1e-9);
  }

  @Test
  void percentileBounds_matchMinAndMaxRegardlessOfInsertionOrder() {
    var aggregate = aggregate();
    for (double millis : new double[] {7.5, 0.25, 42.0, 3.0, 19.0}) {
      aggregate.addSample(ok("/a", millis, 0));
    }
    aggregate.finish(START.plusSeconds(1));

    assertEquals(aggregate.minResponseTimeMs(), aggregate.percentileResponseTimeMs(0), 1e-9);
    assertEquals(aggregate.maxResponseTimeMs(), aggregate.percentileResponseTimeMs(100), 1e-9);
    assertEquals(0.25, aggregate.minResponseTimeMs(), 1e-9);
    assertEquals(42.0, aggregate.maxResponseTimeMs(), 1e-9);
  }

  @Test
  void merge_totalsEqualSumOfWorkerSequences() {
    var aggregate = aggregate();
    int[] lengths = {3, 0, 7, 5};
    int expected = 0;
    for (int worker = 0; worker < lengths.length; worker++) {
      List<RequestSample> samples = new ArrayList<>();
      for (int i = 0; i < lengths[worker]; i++) {
        samples.add(i % 2 == 0 ? ok("/w" + worker, 1, 10) : status(503, 1));
      }
      aggregate.addSamples(samples);
      expected += lengths[worker];
    }
    aggregate.finish(START.plusSeconds(1));

    assertEquals(expected, aggregate.getTotalRequests());
    assertEquals(
        aggregate.getTotalRequests(),
        aggregate.getSuccessfulRequests() + aggregate.getFailedRequests());
    assertEquals(aggregate.getFailedRequests(), aggregate.getErrorCounts().get("HTTP_503"));
  }

  @Test
  void finishedAggregate_rejectsNewSamples() {
    var aggregate = aggregate();
    aggregate.finish(START.plusSeconds(1));

    assertTrue(aggregate.isFinished());
    assertThrows(IllegalStateException.class, () -> aggregate.addSample(ok("/a", 1, 0)));
  }

  @Test
  void finish_keepsFirstEndTimestamp() {
    var aggregate = aggregate();
    aggregate.finish(START.plusSeconds(3));
    aggregate.finish(START.plusSeconds(10));

    assertEquals(START.plusSeconds(3), aggregate.getEndedAt());
  }

  @Test
  void endpointBreakdown_groupsByPathInFirstSeenOrder() {
    var aggregate = aggregate();
    aggregate.addSample(ok("/b", 10, 0));
    aggregate.addSample(ok("/a", 4, 0));
    aggregate.addSample(RequestSample.response(0L, 20_000_000L, 404, 0, "/b"));
    aggregate.finish(START.plusSeconds(1));

    var breakdown = aggregate.endpointBreakdown();

    assertEquals(List.of("/b", "/a"), List.copyOf(breakdown.keySet()));
    var b = breakdown.get("/b");
    assertEquals(2, b.totalRequests());
    assertEquals(1, b.successfulRequests());
    assertEquals(1, b.failedRequests());
    assertEquals(15.0, b.averageResponseTimeMs(), 1e-9);
  }

  @Test
  void toBenchmarkResult_snapshotsDerivedStatisticsWithPlaceholders() {
    var aggregate = aggregate();
    aggregate.addSample(ok("/a", 10, 0));
    aggregate.addSample(ok("/a", 30, 0));
    aggregate.finish(START.plusSeconds(4));

    var result = aggregate.toBenchmarkResult("Health Check");

    assertEquals("AXUM", result.framework());
    assertEquals("Health Check", result.testName());
    assertEquals(0.5, result.requestsPerSecond(), 1e-9);
    assertEquals(20.0, result.averageResponseTimeMs(), 1e-9);
    assertEquals(30.0, result.p95ResponseTimeMs(), 1e-9);
    assertEquals(30.0, result.p99ResponseTimeMs(), 1e-9);
    assertEquals(0.0, result.memoryUsageMb());
    assertEquals(0.0, result.cpuUsagePercent());
    assertEquals(2, result.totalRequests());
    assertEquals(100.0, result.successRate(), 1e-9);
  }

  @Test
  void requestSample_successOnlyFor2xx() {
    assertTrue(RequestSample.response(0, 1, 200, 0, "/").success());
    assertTrue(RequestSample.response(0, 1, 299, 0, "/").success());
    assertFalse(RequestSample.response(0, 1, 199, 0, "/").success());
    assertFalse(RequestSample.response(0, 1, 302, 0, "/").success());
    assertFalse(RequestSample.transportFailure(0, 1, "/", "HTTP_TIMEOUT").success());
    assertEquals(1.5, RequestSample.response(0, 1_500_000, 200, 0, "/").durationMs(), 1e-9);
  }
}

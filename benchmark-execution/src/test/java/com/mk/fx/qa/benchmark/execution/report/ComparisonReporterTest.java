package com.mk.fx.qa.benchmark.execution.report;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.benchmark.execution.cfg.ObjectMapperConfig;
import com.mk.fx.qa.benchmark.execution.dto.BenchmarkResult;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class ComparisonReporterTest {

  static final Instant GENERATED = Instant.parse("2024-05-01T12:30:45Z");

  static BenchmarkResult result(
      String framework, String test, double rps, double avg, double p95, double p99) {
    return new BenchmarkResult(
        framework, test, rps, avg, p95, p99, 0.0, 0.0, GENERATED, 1000, 99.5, 1.25);
  }

  static ComparisonReporter reporter() {
    return new ComparisonReporter(
        Clock.fixed(GENERATED, ZoneOffset.UTC),
        List.of(
            new MarkdownReportRenderer(),
            new HtmlReportRenderer(),
            new JsonReportRenderer(ObjectMapperConfig.create())));
  }

  @Test
  void compare_higherThroughputWins_withDifferenceRelativeToLoser() {
    var report =
        reporter()
            .compare(
                "AXUM",
                List.of(result("AXUM", "REST API", 15420.5, 6.2, 10.0, 20.0)),
                "ACTIX",
                List.of(result("ACTIX", "REST API", 14850.2, 6.7, 11.0, 19.0)));

    var throughput = report.throughputWinner().orElseThrow();
    assertEquals("AXUM", throughput.winner());
    assertEquals("ACTIX", throughput.loser());
    assertEquals(3.84, throughput.differencePercent(), 0.01);

    var responseTime = report.responseTimeWinner().orElseThrow();
    assertEquals("AXUM", responseTime.winner());
    assertEquals(7.46, responseTime.differencePercent(), 0.01);

    assertEquals("ACTIX", report.winnerFor(ComparedMetric.P99_RESPONSE_TIME).orElseThrow().winner());
    assertEquals(4, report.winners().size());
    assertEquals(GENERATED, report.generatedAt());
  }

  @Test
  void compare_averagesEveryMetricOverAllScenarios() {
    var report =
        reporter()
            .compare(
                "A",
                List.of(
                    result("A", "Health Check", 100, 2, 4, 6),
                    result("A", "REST API", 300, 4, 8, 10)),
                "B",
                List.of(result("B", "Health Check", 150, 3, 5, 7)));

    var averageA = report.averageA();
    assertEquals(2, averageA.scenarioCount());
    assertEquals(200.0, averageA.requestsPerSecond(), 1e-9);
    assertEquals(3.0, averageA.averageResponseTimeMs(), 1e-9);
    assertEquals(6.0, averageA.p95ResponseTimeMs(), 1e-9);
    assertEquals(8.0, averageA.p99ResponseTimeMs(), 1e-9);
    assertEquals(1, report.averageB().scenarioCount());
  }

  @Test
  void compare_exactTie_favoursSecondSystem() {
    var report =
        reporter()
            .compare(
                "A",
                List.of(result("A", "t", 500, 5, 5, 5)),
                "B",
                List.of(result("B", "t", 500, 5, 5, 5)));

    for (MetricWinner winner : report.winners()) {
      assertEquals("B", winner.winner());
      assertEquals(0.0, winner.differencePercent());
    }
  }

  @Test
  void compare_missingResults_skipsWinnerAnalysis() {
    var report =
        reporter().compare("A", List.of(), "B", List.of(result("B", "t", 500, 5, 5, 5)));

    assertNull(report.averageA());
    assertNotNull(report.averageB());
    assertTrue(report.winners().isEmpty());
    assertTrue(report.throughputWinner().isEmpty());
  }

  @Test
  void differencePercent_zeroLoserValue_isZero() {
    assertEquals(0.0, ComparisonReporter.differencePercent(12.0, 0.0));
    assertEquals(50.0, ComparisonReporter.differencePercent(15.0, 10.0), 1e-9);
    assertEquals(25.0, ComparisonReporter.differencePercent(6.0, 8.0), 1e-9);
  }

  @Test
  void average_emptyOrNull_isEmpty() {
    assertTrue(ComparisonReporter.average(List.of()).isEmpty());
    assertTrue(ComparisonReporter.average(null).isEmpty());
  }

  @Test
  void render_dispatchesOnFormat() {
    var reporter = reporter();
    var report =
        reporter.compare(
            "A", List.of(result("A", "t", 1, 1, 1, 1)), "B", List.of(result("B", "t", 2, 1, 1, 1)));

    assertTrue(reporter.render(report, ReportFormat.MARKDOWN).startsWith("# A vs B"));
    assertTrue(reporter.render(report, ReportFormat.HTML).startsWith("<!DOCTYPE html>"));
    assertTrue(reporter.render(report, ReportFormat.JSON).trim().startsWith("{"));
  }

  @Test
  void constructor_rejectsDuplicateRenderers() {
    var clock = Clock.systemUTC();
    assertThrows(
        IllegalStateException.class,
        () ->
            new ComparisonReporter(
                clock, List.of(new MarkdownReportRenderer(), new MarkdownReportRenderer())));
  }

  @Test
  void render_unregisteredFormat_isRejected() {
    var reporter = new ComparisonReporter(Clock.systemUTC(), List.of(new MarkdownReportRenderer()));
    var report = reporter.compare("A", List.of(), "B", List.of());

    assertThrows(IllegalArgumentException.class, () -> reporter.render(report, ReportFormat.HTML));
  }

  @Test
  void reportFormat_resolvesNamesAndExtensions() {
    assertEquals(ReportFormat.MARKDOWN, ReportFormat.fromValue(null));
    assertEquals(ReportFormat.MARKDOWN, ReportFormat.fromValue(" "));
    assertEquals(ReportFormat.MARKDOWN, ReportFormat.fromValue("md"));
    assertEquals(ReportFormat.MARKDOWN, ReportFormat.fromValue("Markdown"));
    assertEquals(ReportFormat.HTML, ReportFormat.fromValue("HTML"));
    assertEquals(ReportFormat.JSON, ReportFormat.fromValue("json"));
    assertThrows(IllegalArgumentException.class, () -> ReportFormat.fromValue("pdf"));
  }
}

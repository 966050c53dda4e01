package com.mk.fx.qa.benchmark.execution.report;

import static com.mk.fx.qa.benchmark.execution.report.ComparisonReporterTest.result;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class MarkdownReportRendererTest {

  private final MarkdownReportRenderer renderer = new MarkdownReportRenderer();

  private static ComparisonReport sampleReport() {
    return ComparisonReporterTest.reporter()
        .compare(
            "AXUM",
            List.of(result("AXUM", "REST API", 15420.5, 6.2, 10.0, 20.0)),
            "ACTIX",
            List.of(result("ACTIX", "REST API", 14850.2, 6.7, 11.0, 19.0)));
  }

  @Test
  void render_containsHeaderSummaryDetailsAndAnalysis() {
    var markdown = renderer.render(sampleReport());

    assertTrue(markdown.startsWith("# AXUM vs ACTIX Performance Comparison Report\n\n"));
    assertTrue(markdown.contains("Generated at: 2024-05-01 12:30:45 UTC"));
    assertTrue(
        markdown.contains("| Framework | Avg RPS | Avg Response Time (ms) | P95 (ms) | P99 (ms) |"));
    assertTrue(markdown.contains("| AXUM | 15420.50 | 6.20 | 10.00 | 20.00 |"));
    assertTrue(markdown.contains("| ACTIX | 14850.20 | 6.70 | 11.00 | 19.00 |"));
    assertTrue(markdown.contains("### AXUM Framework Results"));
    assertTrue(markdown.contains("**REST API**\n- Requests/sec: 15420.50\n"));
    assertTrue(markdown.contains("- Total requests: 1000\n- Success rate: 99.5%\n"));
    assertTrue(
        markdown.contains(
            "🏆 **AXUM wins in throughput** by 3.8% (15420.50 vs 14850.20 req/s)"));
    assertTrue(markdown.contains("⚡ **AXUM wins in response time** by 7.5% (6.20ms vs 6.70ms)"));
    assertTrue(markdown.contains("📊 **ACTIX wins in P99 response time**"));
  }

  @Test
  void render_sectionsAppearInOrder() {
    var markdown = renderer.render(sampleReport());

    var summary = markdown.indexOf("## Summary");
    var details = markdown.indexOf("## Detailed Results");
    var axum = markdown.indexOf("### AXUM Framework Results");
    var actix = markdown.indexOf("### ACTIX Framework Results");
    var analysis = markdown.indexOf("## Analysis");
    assertTrue(summary > 0);
    assertTrue(summary < details);
    assertTrue(details < axum);
    assertTrue(axum < actix);
    assertTrue(actix < analysis);
  }

  @Test
  void render_oneSideEmpty_omitsItsRowsAndAnalysis() {
    var report =
        ComparisonReporterTest.reporter()
            .compare("A", List.of(result("A", "Health Check", 10, 1, 1, 1)), "B", List.of());

    var markdown = renderer.render(report);

    assertTrue(markdown.contains("| A | 10.00 |"));
    assertFalse(markdown.contains("| B |"));
    assertFalse(markdown.contains("### B Framework Results"));
    assertFalse(markdown.contains("wins in"));
  }
}

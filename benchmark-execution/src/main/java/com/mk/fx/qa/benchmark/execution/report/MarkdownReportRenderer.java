package com.mk.fx.qa.benchmark.execution.report;

import com.mk.fx.qa.benchmark.execution.dto.BenchmarkResult;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/** Markdown comparison: summary table, per-scenario details for each system, winner analysis. */
public class MarkdownReportRenderer implements ReportRenderer {

  static final DateTimeFormatter GENERATED_AT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

  @Override
  public ReportFormat format() {
    return ReportFormat.MARKDOWN;
  }

  @Override
  public String render(ComparisonReport report) {
    var md = new StringBuilder();
    md.append("# ")
        .append(report.labelA())
        .append(" vs ")
        .append(report.labelB())
        .append(" Performance Comparison Report\n\n");
    md.append("Generated at: ").append(GENERATED_AT.format(report.generatedAt())).append("\n\n");

    md.append("## Summary\n\n");
    md.append("| Framework | Avg RPS | Avg Response Time (ms) | P95 (ms) | P99 (ms) |\n");
    md.append("|-----------|---------|------------------------|----------|----------|\n");
    appendSummaryRow(md, report.labelA(), report.averageA());
    appendSummaryRow(md, report.labelB(), report.averageB());

    md.append("\n## Detailed Results\n\n");
    appendDetails(md, report.labelA(), report.resultsA());
    appendDetails(md, report.labelB(), report.resultsB());

    md.append("## Analysis\n\n");
    for (MetricWinner winner : report.winners()) {
      md.append(analysisSentence(winner)).append("\n\n");
    }
    return md.toString();
  }

  private void appendSummaryRow(StringBuilder md, String label, AverageMetrics average) {
    if (average == null) {
      return;
    }
    md.append(
        fmt(
            "| %s | %.2f | %.2f | %.2f | %.2f |\n",
            label,
            average.requestsPerSecond(),
            average.averageResponseTimeMs(),
            average.p95ResponseTimeMs(),
            average.p99ResponseTimeMs()));
  }

  private void appendDetails(StringBuilder md, String label, List<BenchmarkResult> results) {
    if (results.isEmpty()) {
      return;
    }
    md.append("### ").append(label).append(" Framework Results\n\n");
    for (BenchmarkResult result : results) {
      md.append("**").append(result.testName()).append("**\n");
      md.append(fmt("- Requests/sec: %.2f\n", result.requestsPerSecond()));
      md.append(fmt("- Avg response time: %.2fms\n", result.averageResponseTimeMs()));
      md.append(fmt("- P95 response time: %.2fms\n", result.p95ResponseTimeMs()));
      md.append(fmt("- P99 response time: %.2fms\n", result.p99ResponseTimeMs()));
      if (result.totalRequests() > 0) {
        md.append(fmt("- Total requests: %d\n", result.totalRequests()));
        md.append(fmt("- Success rate: %.1f%%\n", result.successRate()));
      }
      md.append("\n");
    }
  }

  static String analysisSentence(MetricWinner winner) {
    var metric = winner.metric();
    var icon =
        switch (metric) {
          case THROUGHPUT -> "🏆";
          case RESPONSE_TIME -> "⚡";
          case P95_RESPONSE_TIME, P99_RESPONSE_TIME -> "📊";
        };
    var values =
        metric == ComparedMetric.THROUGHPUT
            ? fmt("%.2f vs %.2f req/s", winner.winnerValue(), winner.loserValue())
            : fmt("%.2fms vs %.2fms", winner.winnerValue(), winner.loserValue());
    return fmt(
        "%s **%s wins in %s** by %.1f%% (%s)",
        icon, winner.winner(), metric.displayName(), winner.differencePercent(), values);
  }

  private static String fmt(String pattern, Object... args) {
    return String.format(Locale.ROOT, pattern, args);
  }
}

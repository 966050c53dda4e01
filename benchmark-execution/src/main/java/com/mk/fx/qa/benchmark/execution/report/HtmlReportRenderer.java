package com.mk.fx.qa.benchmark.execution.report;

import com.google.common.html.HtmlEscapers;
import com.mk.fx.qa.benchmark.execution.dto.BenchmarkResult;
import java.util.List;
import java.util.Locale;

/** Standalone HTML page with the same content as the markdown report. */
public class HtmlReportRenderer implements ReportRenderer {

  private static final String STYLE =
      "body{font-family:sans-serif;margin:2em;color:#222}"
          + "table{border-collapse:collapse;margin-bottom:1.5em}"
          + "th,td{border:1px solid #ccc;padding:6px 10px;text-align:right}"
          + "th:first-child,td:first-child{text-align:left}"
          + "th{background:#f0f0f0}"
          + "tr.winner td{background:#e6f4ea;font-weight:bold}"
          + ".analysis li{margin-bottom:.4em}";

  @Override
  public ReportFormat format() {
    return ReportFormat.HTML;
  }

  @Override
  public String render(ComparisonReport report) {
    var title = report.labelA() + " vs " + report.labelB() + " Performance Comparison Report";
    var throughputWinner =
        report.throughputWinner().map(MetricWinner::winner).orElse(null);

    var html = new StringBuilder();
    html.append("<!DOCTYPE html>\n<html lang=\"en\">\n<head>\n<meta charset=\"UTF-8\">\n");
    html.append("<title>").append(escape(title)).append("</title>\n");
    html.append("<style>").append(STYLE).append("</style>\n</head>\n<body>\n");
    html.append("<h1>").append(escape(title)).append("</h1>\n");
    html.append("<p>Generated at: ")
        .append(MarkdownReportRenderer.GENERATED_AT.format(report.generatedAt()))
        .append("</p>\n");

    html.append("<h2>Summary</h2>\n<table>\n");
    html.append(
        "<tr><th>Framework</th><th>Avg RPS</th><th>Avg Response Time (ms)</th>"
            + "<th>P95 (ms)</th><th>P99 (ms)</th></tr>\n");
    appendSummaryRow(html, report.labelA(), report.averageA(), throughputWinner);
    appendSummaryRow(html, report.labelB(), report.averageB(), throughputWinner);
    html.append("</table>\n");

    html.append("<h2>Detailed Results</h2>\n");
    appendDetails(html, report.labelA(), report.resultsA());
    appendDetails(html, report.labelB(), report.resultsB());

    html.append("<h2>Analysis</h2>\n<ul class=\"analysis\">\n");
    for (MetricWinner winner : report.winners()) {
      html.append("<li>")
          .append(escape(MarkdownReportRenderer.analysisSentence(winner)).replace("**", ""))
          .append("</li>\n");
    }
    html.append("</ul>\n</body>\n</html>\n");
    return html.toString();
  }

  private void appendSummaryRow(
      StringBuilder html, String label, AverageMetrics average, String throughputWinner) {
    if (average == null) {
      return;
    }
    html.append(label.equals(throughputWinner) ? "<tr class=\"winner\">" : "<tr>")
        .append("<td>")
        .append(escape(label))
        .append("</td>")
        .append(cell(average.requestsPerSecond()))
        .append(cell(average.averageResponseTimeMs()))
        .append(cell(average.p95ResponseTimeMs()))
        .append(cell(average.p99ResponseTimeMs()))
        .append("</tr>\n");
  }

  private void appendDetails(StringBuilder html, String label, List<BenchmarkResult> results) {
    if (results.isEmpty()) {
      return;
    }
    html.append("<h3>").append(escape(label)).append(" Framework Results</h3>\n<table>\n");
    html.append(
        "<tr><th>Test</th><th>Requests/sec</th><th>Avg (ms)</th><th>P95 (ms)</th>"
            + "<th>P99 (ms)</th><th>Success rate (%)</th></tr>\n");
    for (BenchmarkResult result : results) {
      html.append("<tr><td>")
          .append(escape(result.testName()))
          .append("</td>")
          .append(cell(result.requestsPerSecond()))
          .append(cell(result.averageResponseTimeMs()))
          .append(cell(result.p95ResponseTimeMs()))
          .append(cell(result.p99ResponseTimeMs()))
          .append(cell(result.successRate()))
          .append("</tr>\n");
    }
    html.append("</table>\n");
  }

  private static String cell(double value) {
    return String.format(Locale.ROOT, "<td>%.2f</td>", value);
  }

  private static String escape(String value) {
    return value == null ? "" : HtmlEscapers.htmlEscaper().escape(value);
  }
}

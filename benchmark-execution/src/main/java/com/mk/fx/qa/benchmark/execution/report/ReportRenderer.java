package com.mk.fx.qa.benchmark.execution.report;

/** Turns a comparison into a document of one format. */
public interface ReportRenderer {

  ReportFormat format();

  String render(ComparisonReport report);
}

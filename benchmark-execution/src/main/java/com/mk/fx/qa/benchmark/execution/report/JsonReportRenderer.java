package com.mk.fx.qa.benchmark.execution.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Objects;

/** Serialises the whole comparison, results and averages included, with the given mapper. */
public class JsonReportRenderer implements ReportRenderer {

  private final ObjectMapper objectMapper;

  public JsonReportRenderer(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  @Override
  public ReportFormat format() {
    return ReportFormat.JSON;
  }

  @Override
  public String render(ComparisonReport report) {
    try {
      return objectMapper.writeValueAsString(report);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialise comparison report", e);
    }
  }
}

package com.mk.fx.qa.benchmark.execution.report;

import java.util.Arrays;
import java.util.Locale;

public enum ReportFormat {
  MARKDOWN("md", "text/markdown"),
  HTML("html", "text/html"),
  JSON("json", "application/json");

  private final String fileExtension;
  private final String mediaType;

  ReportFormat(String fileExtension, String mediaType) {
    this.fileExtension = fileExtension;
    this.mediaType = mediaType;
  }

  public String fileExtension() {
    return fileExtension;
  }

  public String mediaType() {
    return mediaType;
  }

  /**
   * Resolves a format from its name or file extension, case-insensitively. {@code null} or blank
   * resolves to {@link #MARKDOWN}.
   *
   * @throws IllegalArgumentException for unknown formats
   */
  public static ReportFormat fromValue(String value) {
    if (value == null || value.isBlank()) {
      return MARKDOWN;
    }
    var normalized = value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(
            f -> f.name().toLowerCase(Locale.ROOT).equals(normalized)
                || f.fileExtension.equals(normalized))
        .findFirst()
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "Unsupported report format: " + value + ". Allowed: markdown, md, html, json"));
  }
}

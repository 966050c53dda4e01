package com.mk.fx.qa.benchmark.execution.dto.controllerresponse;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mk.fx.qa.benchmark.execution.dto.BenchmarkResult;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.Data;

/** Two labelled result sets to compare without running anything. */
@Data
public class ComparisonReportRequest {

  @NotBlank
  @JsonProperty("labelA")
  private String labelA;

  @NotNull
  @JsonProperty("resultsA")
  private List<BenchmarkResult> resultsA;

  @NotBlank
  @JsonProperty("labelB")
  private String labelB;

  @NotNull
  @JsonProperty("resultsB")
  private List<BenchmarkResult> resultsB;
}

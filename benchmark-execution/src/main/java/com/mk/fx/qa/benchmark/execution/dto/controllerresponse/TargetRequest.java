package com.mk.fx.qa.benchmark.execution.dto.controllerresponse;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/** A system to benchmark, as submitted over the API. */
@Data
public class TargetRequest {

  @NotBlank
  @JsonProperty("label")
  private String label;

  @NotBlank
  @JsonProperty("baseUrl")
  private String baseUrl;
}

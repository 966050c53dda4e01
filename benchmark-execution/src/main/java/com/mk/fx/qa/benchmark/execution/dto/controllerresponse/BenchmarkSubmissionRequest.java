package com.mk.fx.qa.benchmark.execution.dto.controllerresponse;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mk.fx.qa.benchmark.execution.config.BenchmarkConfigValidator;
import com.mk.fx.qa.benchmark.execution.dto.EndpointDefinition;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import lombok.Data;

/**
 * Represents a request to start a benchmark run. Omitted load settings fall back to the configured
 * defaults; when {@code endpoints} is given it replaces the named scenarios with a single custom
 * scenario, and when neither is given every built-in scenario runs.
 */
@Data
public class BenchmarkSubmissionRequest {

  /** SINGLE or COMPARE, COMPARE when omitted. */
  @JsonProperty("mode")
  private String mode;

  @Valid
  @NotEmpty
  @JsonProperty("targets")
  private List<TargetRequest> targets;

  @Positive
  @Max(BenchmarkConfigValidator.MAX_CONCURRENT_USERS)
  @JsonProperty("users")
  private Integer users;

  @Positive
  @JsonProperty("durationSeconds")
  private Integer durationSeconds;

  @PositiveOrZero
  @JsonProperty("rampUpSeconds")
  private Integer rampUpSeconds;

  @JsonProperty("scenarios")
  private List<String> scenarios;

  @JsonProperty("endpoints")
  private List<EndpointDefinition> endpoints;
}

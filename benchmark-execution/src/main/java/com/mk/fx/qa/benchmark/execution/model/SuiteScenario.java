package com.mk.fx.qa.benchmark.execution.model;

import com.mk.fx.qa.benchmark.execution.dto.BenchmarkConfig;
import com.mk.fx.qa.benchmark.execution.dto.EndpointDefinition;
import com.mk.fx.qa.benchmark.execution.scenarios.BenchmarkScenario;
import java.util.List;

/** A named endpoint mix run as one step of a suite. */
public record SuiteScenario(String name, List<EndpointDefinition> endpoints) {

  public static final String CUSTOM = "Custom";

  public SuiteScenario {
    endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
  }

  public static SuiteScenario of(BenchmarkScenario scenario) {
    return new SuiteScenario(scenario.displayName(), scenario.endpoints());
  }

  public static SuiteScenario custom(List<EndpointDefinition> endpoints) {
    return new SuiteScenario(CUSTOM, endpoints);
  }

  /** Builds the configuration for one target; the profile must be complete. */
  public BenchmarkConfig toConfig(BenchmarkTarget target, LoadProfile profile) {
    return new BenchmarkConfig(
        target.baseUrl(),
        profile.users(),
        profile.durationSeconds(),
        profile.rampUpSeconds(),
        endpoints);
  }
}

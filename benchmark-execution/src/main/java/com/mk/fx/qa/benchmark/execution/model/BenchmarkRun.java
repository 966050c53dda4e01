package com.mk.fx.qa.benchmark.execution.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A submitted benchmark run: the targets, the scenarios to run against each of them and the load
 * profile shared by every scenario.
 */
public record BenchmarkRun(
    UUID id,
    RunMode mode,
    List<BenchmarkTarget> targets,
    LoadProfile profile,
    List<SuiteScenario> scenarios,
    Instant createdAt) {

  public BenchmarkRun {
    targets = targets == null ? List.of() : List.copyOf(targets);
    scenarios = scenarios == null ? List.of() : List.copyOf(scenarios);
  }

  public BenchmarkRun withProfile(LoadProfile resolved) {
    return new BenchmarkRun(id, mode, targets, resolved, scenarios, createdAt);
  }

  public List<String> targetLabels() {
    return targets.stream().map(BenchmarkTarget::label).toList();
  }

  public List<String> scenarioNames() {
    return scenarios.stream().map(SuiteScenario::name).toList();
  }
}

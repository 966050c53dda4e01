package com.mk.fx.qa.benchmark.execution.service;

import static com.mk.fx.qa.benchmark.execution.utils.TimingUtils.shouldStop;
import static com.mk.fx.qa.benchmark.execution.utils.TimingUtils.sleepWithCancellation;

import com.mk.fx.qa.benchmark.execution.dto.BenchmarkResult;
import com.mk.fx.qa.benchmark.execution.executors.LoadTester;
import com.mk.fx.qa.benchmark.execution.metrics.MetricsAggregate;
import com.mk.fx.qa.benchmark.execution.model.BenchmarkTarget;
import com.mk.fx.qa.benchmark.execution.model.LoadProfile;
import com.mk.fx.qa.benchmark.execution.model.SuiteScenario;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a list of scenarios against one or more targets, one benchmark at a time, and turns every
 * finished benchmark into a {@link BenchmarkResult}. Pauses between scenarios and between targets
 * let the system under test settle.
 */
@Slf4j
public class BenchmarkSuiteRunner {

  private final LoadTester loadTester;
  private final Duration scenarioPause;
  private final Duration targetPause;

  public BenchmarkSuiteRunner(LoadTester loadTester, Duration scenarioPause, Duration targetPause) {
    this.loadTester = Objects.requireNonNull(loadTester, "loadTester");
    this.scenarioPause = Objects.requireNonNull(scenarioPause, "scenarioPause");
    this.targetPause = Objects.requireNonNull(targetPause, "targetPause");
  }

  /**
   * Runs every scenario against every target, targets in order.
   *
   * @return results per target label, in target order
   * @throws SuiteCancelledException if cancellation is requested; it carries the results so far
   */
  public Map<String, List<BenchmarkResult>> runTargets(
      List<BenchmarkTarget> targets,
      LoadProfile profile,
      List<SuiteScenario> scenarios,
      BooleanSupplier cancellationRequested)
      throws SuiteCancelledException {
    Map<String, List<BenchmarkResult>> results = new LinkedHashMap<>();
    for (int i = 0; i < targets.size(); i++) {
      var target = targets.get(i);
      var targetResults = new ArrayList<BenchmarkResult>();
      results.put(target.label(), targetResults);
      runScenarios(target, profile, scenarios, cancellationRequested, targetResults, results);

      if (i < targets.size() - 1) {
        log.info("Waiting {} before benchmarking the next target", targetPause);
        pause(targetPause, cancellationRequested, results);
      }
    }
    return results;
  }

  /** Runs every scenario against a single target. */
  public List<BenchmarkResult> runSuite(
      BenchmarkTarget target,
      LoadProfile profile,
      List<SuiteScenario> scenarios,
      BooleanSupplier cancellationRequested)
      throws SuiteCancelledException {
    return runTargets(List.of(target), profile, scenarios, cancellationRequested)
        .get(target.label());
  }

  private void runScenarios(
      BenchmarkTarget target,
      LoadProfile profile,
      List<SuiteScenario> scenarios,
      BooleanSupplier cancellationRequested,
      List<BenchmarkResult> targetResults,
      Map<String, List<BenchmarkResult>> allResults)
      throws SuiteCancelledException {
    log.info(
        "Benchmarking {} at {} with {} scenarios", target.label(), target.baseUrl(), scenarios.size());

    for (int i = 0; i < scenarios.size(); i++) {
      var scenario = scenarios.get(i);
      if (shouldStop(cancellationRequested)) {
        throw cancelled(allResults);
      }

      log.info("Running {} benchmark for {}", scenario.name(), target.label());
      MetricsAggregate aggregate = null;
      try {
        aggregate =
            loadTester.runBenchmark(
                scenario.toConfig(target, profile), target.label(), cancellationRequested);
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        throw cancelled(allResults);
      } catch (RuntimeException ex) {
        log.warn(
            "{} benchmark for {} failed, skipping: {}", scenario.name(), target.label(), ex.getMessage());
      }

      // a benchmark cut short by cancellation is not a representative result
      if (shouldStop(cancellationRequested)) {
        throw cancelled(allResults);
      }
      if (aggregate != null) {
        targetResults.add(aggregate.toBenchmarkResult(scenario.name()));
      }

      if (i < scenarios.size() - 1) {
        pause(scenarioPause, cancellationRequested, allResults);
      }
    }
  }

  private void pause(
      Duration duration,
      BooleanSupplier cancellationRequested,
      Map<String, List<BenchmarkResult>> results)
      throws SuiteCancelledException {
    try {
      sleepWithCancellation(duration, cancellationRequested);
    } catch (InterruptedException interrupted) {
      // a cancellation request surfaces as InterruptedException too; only a real interrupt is restored
      if (!cancellationRequested.getAsBoolean()) {
        Thread.currentThread().interrupt();
      }
      throw cancelled(results);
    }
  }

  private static SuiteCancelledException cancelled(Map<String, List<BenchmarkResult>> results) {
    return new SuiteCancelledException("Benchmark suite cancelled", results);
  }
}

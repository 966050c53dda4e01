package com.mk.fx.qa.benchmark.execution.executors;

import static com.mk.fx.qa.benchmark.execution.utils.TimingUtils.shouldStop;
import static com.mk.fx.qa.benchmark.execution.utils.TimingUtils.sleepWithCancellation;

import com.mk.fx.qa.benchmark.execution.dto.BenchmarkConfig;
import com.mk.fx.qa.benchmark.execution.metrics.RequestSample;
import com.mk.fx.qa.benchmark.execution.selector.WeightedEndpointSelector;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * One virtual user. Waits for its ramp-up slot, then keeps selecting and executing requests until
 * its duration has elapsed, pausing briefly between requests. The request in flight when the
 * duration runs out is always allowed to finish.
 *
 * <p>Samples are kept in a list private to the worker; nothing is shared with other workers.
 * An unexpected error ends only this user and the samples collected so far are still returned.
 */
@Slf4j
public class VirtualUserWorker implements Callable<VirtualUserResult> {

  public static final Duration DEFAULT_INTER_REQUEST_PAUSE = Duration.ofMillis(10);

  private final String label;
  private final int userIndex;
  private final BenchmarkConfig config;
  private final WeightedEndpointSelector selector;
  private final RequestExecutor requestExecutor;
  private final BooleanSupplier cancellationRequested;
  private final Duration interRequestPause;

  public VirtualUserWorker(
      String label,
      int userIndex,
      BenchmarkConfig config,
      WeightedEndpointSelector selector,
      RequestExecutor requestExecutor,
      BooleanSupplier cancellationRequested,
      Duration interRequestPause) {
    this.label = label;
    this.userIndex = userIndex;
    this.config = Objects.requireNonNull(config, "config");
    this.selector = Objects.requireNonNull(selector, "selector");
    this.requestExecutor = Objects.requireNonNull(requestExecutor, "requestExecutor");
    this.cancellationRequested =
        Objects.requireNonNull(cancellationRequested, "cancellationRequested");
    this.interRequestPause = Objects.requireNonNull(interRequestPause, "interRequestPause");
  }

  /**
   * Start offset of a user inside the ramp-up window, {@code (rampUp * 1000 / users) * index}
   * milliseconds in integer arithmetic.
   */
  public static long startDelayMillis(int rampUpSeconds, int concurrentUsers, int userIndex) {
    if (rampUpSeconds <= 0 || concurrentUsers <= 0) {
      return 0;
    }
    return (rampUpSeconds * 1000L / concurrentUsers) * userIndex;
  }

  @Override
  public VirtualUserResult call() {
    List<RequestSample> samples = new ArrayList<>();
    try {
      var delay = startDelayMillis(config.rampUpSeconds(), config.concurrentUsers(), userIndex);
      if (delay > 0) {
        log.debug("Benchmark {} virtual user {} waiting {} ms before start", label, userIndex, delay);
        sleepWithCancellation(Duration.ofMillis(delay), cancellationRequested);
      }

      var deadline = System.nanoTime() + Duration.ofSeconds(config.durationSeconds()).toNanos();
      log.debug("Benchmark {} virtual user {} started", label, userIndex);

      while (System.nanoTime() < deadline) {
        if (shouldStop(cancellationRequested)) {
          log.debug(
              "Benchmark {} virtual user {} stopping due to cancellation after {} requests",
              label,
              userIndex,
              samples.size());
          return new VirtualUserResult(userIndex, samples, true, null);
        }

        var endpoint = selector.select(config.endpoints());
        samples.add(requestExecutor.execute(config.targetUrl(), endpoint));

        sleepWithCancellation(interRequestPause, cancellationRequested);
      }

      log.debug(
          "Benchmark {} virtual user {} completed with {} requests", label, userIndex, samples.size());
      return new VirtualUserResult(userIndex, samples, false, null);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      log.debug(
          "Benchmark {} virtual user {} interrupted after {} requests",
          label,
          userIndex,
          samples.size());
      return new VirtualUserResult(userIndex, samples, true, null);
    } catch (Exception ex) {
      log.error(
          "Benchmark {} virtual user {} failed: {} - stopping this user ({} requests recorded)",
          label,
          userIndex,
          ex.getMessage(),
          samples.size(),
          ex);
      // Stop this virtual user but let others continue
      return new VirtualUserResult(
          userIndex, samples, false, ex.getMessage() != null ? ex.getMessage() : ex.toString());
    }
  }
}

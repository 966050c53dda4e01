package com.mk.fx.qa.benchmark.execution.executors;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.mk.fx.qa.benchmark.execution.config.BenchmarkConfigValidator;
import com.mk.fx.qa.benchmark.execution.dto.BenchmarkConfig;
import com.mk.fx.qa.benchmark.execution.metrics.MetricsAggregate;
import com.mk.fx.qa.benchmark.execution.selector.WeightedEndpointSelector;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one benchmark: validates the configuration, starts one {@link VirtualUserWorker} per
 * configured user, waits for all of them and merges their samples into a single {@link
 * MetricsAggregate}.
 *
 * <p>Threading: Creates a fixed thread pool sized to the number of users for every run and shuts
 * it down afterwards. Workers share nothing but the selector and the request executor, both of
 * which are safe for concurrent use. The aggregate is only touched by the calling thread, after
 * every worker has terminated.
 */
@Slf4j
public class LoadTester {

  private final RequestExecutor requestExecutor;
  private final WeightedEndpointSelector selector;
  private final Duration interRequestPause;

  public LoadTester(RequestExecutor requestExecutor, WeightedEndpointSelector selector) {
    this(requestExecutor, selector, VirtualUserWorker.DEFAULT_INTER_REQUEST_PAUSE);
  }

  public LoadTester(
      RequestExecutor requestExecutor,
      WeightedEndpointSelector selector,
      Duration interRequestPause) {
    this.requestExecutor = Objects.requireNonNull(requestExecutor, "requestExecutor");
    this.selector = Objects.requireNonNull(selector, "selector");
    this.interRequestPause = Objects.requireNonNull(interRequestPause, "interRequestPause");
  }

  /** Runs a benchmark that cannot be cancelled externally. */
  public MetricsAggregate runBenchmark(BenchmarkConfig config, String label)
      throws InterruptedException {
    return runBenchmark(config, label, () -> false);
  }

  /**
   * Runs a benchmark to completion or until cancellation is requested.
   *
   * @param config benchmark configuration, validated before any user starts
   * @param label name of the system under test, carried into the aggregate
   * @param cancellationRequested supplier every user checks between requests and while sleeping
   * @return the finished aggregate, usable even when every request failed
   * @throws com.mk.fx.qa.benchmark.execution.config.InvalidBenchmarkConfigException if the
   *     configuration is rejected
   * @throws InterruptedException if the calling thread is interrupted while waiting for users
   */
  public MetricsAggregate runBenchmark(
      BenchmarkConfig config, String label, BooleanSupplier cancellationRequested)
      throws InterruptedException {
    BenchmarkConfigValidator.validate(config);
    Objects.requireNonNull(label, "label");
    Objects.requireNonNull(cancellationRequested, "cancellationRequested");

    var users = config.concurrentUsers();
    log.info(
        "Benchmark {} starting against {} with {} users for {}s (ramp-up {}s, {} endpoints)",
        label,
        config.targetUrl(),
        users,
        config.durationSeconds(),
        config.rampUpSeconds(),
        config.endpoints().size());

    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("benchmark-" + label + "-" + thread.getId());
          thread.setDaemon(true);
          return thread;
        };

    var aggregate = new MetricsAggregate(label);
    var executor = newFixedThreadPool(users, threadFactory);
    List<Future<VirtualUserResult>> futures = new ArrayList<>(users);
    List<VirtualUserResult> results = new ArrayList<>(users);

    try {
      for (int userIndex = 0; userIndex < users; userIndex++) {
        futures.add(
            executor.submit(
                new VirtualUserWorker(
                    label,
                    userIndex,
                    config,
                    selector,
                    requestExecutor,
                    cancellationRequested,
                    interRequestPause)));
      }
      results.addAll(waitForUsers(futures, label));
    } finally {
      executor.shutdownNow();
      try {
        executor.awaitTermination(30, TimeUnit.SECONDS);
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        throw interrupted;
      }
    }

    var failedUsers = 0;
    var cancelledUsers = 0;
    for (VirtualUserResult result : results) {
      aggregate.addSamples(result.samples());
      if (result.failed()) {
        failedUsers++;
      } else if (result.cancelled()) {
        cancelledUsers++;
      }
    }
    aggregate.finish();

    log.info(
        "Benchmark {} completed: {} requests, {} req/s, {} ms avg response time, {}% success rate"
            + " ({} users failed, {} cancelled)",
        label,
        aggregate.getTotalRequests(),
        String.format("%.2f", aggregate.requestsPerSecond()),
        String.format("%.2f", aggregate.averageResponseTimeMs()),
        String.format("%.1f", aggregate.successRate()),
        failedUsers,
        cancelledUsers);
    return aggregate;
  }

  /** Joins every user. A user whose future fails is logged and contributes no samples. */
  private List<VirtualUserResult> waitForUsers(
      List<Future<VirtualUserResult>> futures, String label) throws InterruptedException {
    List<VirtualUserResult> results = new ArrayList<>(futures.size());
    for (int i = 0; i < futures.size(); i++) {
      try {
        results.add(futures.get(i).get());
      } catch (ExecutionException ex) {
        log.error(
            "Benchmark {} virtual user {} terminated abnormally", label, i, ex.getCause());
      } catch (CancellationException ignored) {
        log.debug("Benchmark {} virtual user {} future cancelled", label, i);
      }
    }
    return results;
  }
}

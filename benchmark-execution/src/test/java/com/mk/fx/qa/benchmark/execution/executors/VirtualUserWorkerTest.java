package com.mk.fx.qa.benchmark.execution.executors;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.benchmark.execution.dto.BenchmarkConfig;
import com.mk.fx.qa.benchmark.execution.dto.EndpointDefinition;
import com.mk.fx.qa.benchmark.execution.metrics.RequestSample;
import com.mk.fx.qa.benchmark.execution.selector.WeightedEndpointSelector;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class VirtualUserWorkerTest {

  private static final List<EndpointDefinition> ENDPOINTS =
      List.of(EndpointDefinition.get("/a", 0.5), EndpointDefinition.get("/b", 0.5));

  private ExecutorService pool;

  @BeforeEach
  void setUp() {
    pool = Executors.newSingleThreadExecutor();
  }

  @AfterEach
  void tearDown() throws Exception {
    pool.shutdownNow();
    pool.awaitTermination(5, TimeUnit.SECONDS);
  }

  private static BenchmarkConfig config(int users, int durationSeconds, int rampUpSeconds) {
    return new BenchmarkConfig("http://localhost:1", users, durationSeconds, rampUpSeconds, ENDPOINTS);
  }

  private static RequestExecutor okExecutor() {
    return (baseUrl, endpoint) -> {
      var start = System.nanoTime();
      return RequestSample.response(start, System.nanoTime(), 200, 10, endpoint.path());
    };
  }

  private VirtualUserResult run(
      BenchmarkConfig config, int userIndex, RequestExecutor executor, BooleanSupplier cancel)
      throws Exception {
    var worker =
        new VirtualUserWorker(
            "TEST",
            userIndex,
            config,
            new WeightedEndpointSelector(),
            executor,
            cancel,
            Duration.ofMillis(5));
    return pool.submit(worker).get(20, TimeUnit.SECONDS);
  }

  @Test
  void startDelay_spreadsUsersEvenlyAcrossRampUp() {
    assertEquals(500, VirtualUserWorker.startDelayMillis(10, 100, 5));
    assertEquals(0, VirtualUserWorker.startDelayMillis(10, 100, 0));
    assertEquals(666, VirtualUserWorker.startDelayMillis(1, 3, 2));
    assertEquals(0, VirtualUserWorker.startDelayMillis(0, 5, 4));
  }

  @Test
  void call_runsUntilDurationElapsed_withChronologicalSamples() throws Exception {
    var started = System.nanoTime();

    var result = run(config(1, 1, 0), 0, okExecutor(), () -> false);

    var elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
    assertFalse(result.cancelled());
    assertFalse(result.failed());
    assertEquals(0, result.userIndex());
    assertTrue(result.samples().size() > 1);
    assertTrue(elapsedMillis >= 1000, "Worker stopped early after " + elapsedMillis + " ms");
    for (int i = 1; i < result.samples().size(); i++) {
      assertTrue(result.samples().get(i).startNanos() >= result.samples().get(i - 1).endNanos());
    }
  }

  @Test
  void call_waitsForRampUpSlotBeforeFirstRequest() throws Exception {
    var firstRequestAt = new AtomicLong();
    var started = System.nanoTime();
    RequestExecutor executor =
        (baseUrl, endpoint) -> {
          firstRequestAt.compareAndSet(0, System.nanoTime());
          return okExecutor().execute(baseUrl, endpoint);
        };

    // 2 users over a 1s ramp: user 1 starts 500 ms in
    run(config(2, 1, 1), 1, executor, () -> false);

    var delayMillis = TimeUnit.NANOSECONDS.toMillis(firstRequestAt.get() - started);
    assertTrue(delayMillis >= 500, "First request after " + delayMillis + " ms");
  }

  @Test
  void call_unexpectedError_stopsOnlyThisUserAndKeepsPartialSamples() throws Exception {
    var calls = new AtomicInteger();
    RequestExecutor executor =
        (baseUrl, endpoint) -> {
          if (calls.incrementAndGet() == 3) {
            throw new IllegalStateException("boom");
          }
          return okExecutor().execute(baseUrl, endpoint);
        };

    var result = run(config(1, 10, 0), 0, executor, () -> false);

    assertTrue(result.failed());
    assertFalse(result.cancelled());
    assertEquals("boom", result.failureMessage());
    assertEquals(2, result.samples().size());
  }

  @Test
  void call_cancellation_stopsPromptlyAndReturnsSamplesSoFar() throws Exception {
    var cancel = new AtomicBoolean(false);
    var calls = new AtomicInteger();
    RequestExecutor executor =
        (baseUrl, endpoint) -> {
          if (calls.incrementAndGet() == 3) {
            cancel.set(true);
          }
          return okExecutor().execute(baseUrl, endpoint);
        };
    var started = System.nanoTime();

    var result = run(config(1, 10, 0), 0, executor, cancel::get);

    assertTrue(result.cancelled());
    assertFalse(result.failed());
    assertEquals(3, result.samples().size());
    assertTrue(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - started) < 5);
  }

  @Test
  void call_cancelledDuringRampUp_sendsNothing() throws Exception {
    var calls = new AtomicInteger();
    RequestExecutor executor =
        (baseUrl, endpoint) -> {
          calls.incrementAndGet();
          return okExecutor().execute(baseUrl, endpoint);
        };

    var result = run(config(2, 5, 10), 1, executor, () -> true);

    assertTrue(result.cancelled());
    assertTrue(result.samples().isEmpty());
    assertEquals(0, calls.get());
  }
}

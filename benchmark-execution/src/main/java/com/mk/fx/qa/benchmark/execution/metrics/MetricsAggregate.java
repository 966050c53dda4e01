package com.mk.fx.qa.benchmark.execution.metrics;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.benchmark.execution.dto.BenchmarkResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Accumulates the samples of one benchmark run and derives its statistics.
 *
 * <p>The aggregate has a single owner: the orchestrator folds worker samples in after every worker
 * has stopped, then calls {@link #finish()}. Once finished it rejects further samples, and every
 * derived statistic becomes stable. Derived values are always computed from the sample list and
 * the counters that are updated together with it, never cached.
 *
 * <p>Empty aggregates and zero-length runs report 0 for every rate and latency.
 */
public class MetricsAggregate {

  private static final double BYTES_PER_MB = 1024.0 * 1024.0;

  private final String label;
  private final Clock clock;
  private final Instant startedAt;
  private final List<RequestSample> samples = new ArrayList<>();
  private final ErrorTracker errorTracker = new ErrorTracker();
  private Instant endedAt;
  private long successfulRequests;
  private long totalBytes;

  public MetricsAggregate(String label) {
    this(label, Clock.systemUTC());
  }

  @VisibleForTesting
  MetricsAggregate(String label, Clock clock) {
    this.label = Objects.requireNonNull(label, "label");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.startedAt = clock.instant();
  }

  /**
   * Folds one sample into the aggregate.
   *
   * @throws IllegalStateException if the aggregate is already finished
   */
  public void addSample(RequestSample sample) {
    Objects.requireNonNull(sample, "sample");
    if (isFinished()) {
      throw new IllegalStateException("Aggregate " + label + " is finished");
    }
    samples.add(sample);
    totalBytes += sample.responseBytes();
    if (sample.success()) {
      successfulRequests++;
    } else {
      errorTracker.recordFailure(sample);
    }
  }

  public void addSamples(Collection<RequestSample> batch) {
    for (RequestSample sample : batch) {
      addSample(sample);
    }
  }

  /** Sets the end timestamp. Subsequent calls keep the first end timestamp. */
  public void finish() {
    if (endedAt == null) {
      endedAt = clock.instant();
    }
  }

  @VisibleForTesting
  void finish(Instant end) {
    if (endedAt == null) {
      endedAt = end.isBefore(startedAt) ? startedAt : end;
    }
  }

  public boolean isFinished() {
    return endedAt != null;
  }

  public String getLabel() {
    return label;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  /** End timestamp, or {@code null} while the aggregate is still open. */
  public Instant getEndedAt() {
    return endedAt;
  }

  public List<RequestSample> getSamples() {
    return Collections.unmodifiableList(samples);
  }

  public long getTotalRequests() {
    return samples.size();
  }

  public long getSuccessfulRequests() {
    return successfulRequests;
  }

  public long getFailedRequests() {
    return errorTracker.totalErrors();
  }

  public long getTotalBytes() {
    return totalBytes;
  }

  /** Failure counts keyed by {@code HTTP_<status>}; transport failures count under HTTP_0. */
  public Map<String, Long> getErrorCounts() {
    return errorTracker.statusSnapshot();
  }

  /** Transport failure counts keyed by classified cause, e.g. CONNECTION_REFUSED. */
  public Map<String, Long> getTransportErrorCounts() {
    return errorTracker.transportSnapshot();
  }

  /** Wall-clock length of the run; measured up to now while the aggregate is still open. */
  public double durationSeconds() {
    var end = endedAt != null ? endedAt : clock.instant();
    var millis = Duration.between(startedAt, end).toMillis();
    return Math.max(0, millis) / 1000.0;
  }

  public double requestsPerSecond() {
    var duration = durationSeconds();
    return duration > 0 ? samples.size() / duration : 0.0;
  }

  public double averageResponseTimeMs() {
    if (samples.isEmpty()) {
      return 0.0;
    }
    double sum = 0;
    for (RequestSample sample : samples) {
      sum += sample.durationMs();
    }
    return sum / samples.size();
  }

  /**
   * Nearest-rank percentile: durations sorted ascending, index {@code floor(p / 100 * count)}
   * clamped to the valid range. No interpolation.
   *
   * @param percentile value in {@code [0, 100]}
   * @return the duration in milliseconds at the computed rank, 0 when there are no samples
   */
  public double percentileResponseTimeMs(double percentile) {
    if (samples.isEmpty()) {
      return 0.0;
    }
    var sorted = sortedDurations();
    var index = (int) Math.floor(percentile / 100.0 * sorted.length);
    index = Math.max(0, Math.min(sorted.length - 1, index));
    return sorted[index];
  }

  public double minResponseTimeMs() {
    return samples.isEmpty() ? 0.0 : sortedDurations()[0];
  }

  public double maxResponseTimeMs() {
    if (samples.isEmpty()) {
      return 0.0;
    }
    var sorted = sortedDurations();
    return sorted[sorted.length - 1];
  }

  /** Percentage of 2xx responses among all attempts, in {@code [0, 100]}. */
  public double successRate() {
    return samples.isEmpty() ? 0.0 : successfulRequests * 100.0 / samples.size();
  }

  public double throughputMbPerSecond() {
    var duration = durationSeconds();
    return duration > 0 ? totalBytes / BYTES_PER_MB / duration : 0.0;
  }

  /** Per endpoint path statistics in order of first appearance. */
  public Map<String, EndpointStats> endpointBreakdown() {
    Map<String, long[]> counts = new LinkedHashMap<>();
    Map<String, Double> latencySums = new LinkedHashMap<>();
    for (RequestSample sample : samples) {
      var c = counts.computeIfAbsent(sample.endpoint(), k -> new long[2]);
      c[0]++;
      if (sample.success()) {
        c[1]++;
      }
      latencySums.merge(sample.endpoint(), sample.durationMs(), Double::sum);
    }
    Map<String, EndpointStats> breakdown = new LinkedHashMap<>();
    counts.forEach(
        (endpoint, c) ->
            breakdown.put(
                endpoint,
                new EndpointStats(
                    endpoint, c[0], c[1], c[0] - c[1], latencySums.get(endpoint) / c[0])));
    return breakdown;
  }

  /**
   * Snapshots the aggregate as a result for the named scenario. Memory and CPU are reported as 0.
   *
   * @param testName scenario name
   */
  public BenchmarkResult toBenchmarkResult(String testName) {
    return new BenchmarkResult(
        label,
        testName,
        requestsPerSecond(),
        averageResponseTimeMs(),
        percentileResponseTimeMs(95),
        percentileResponseTimeMs(99),
        0.0,
        0.0,
        clock.instant(),
        getTotalRequests(),
        successRate(),
        throughputMbPerSecond());
  }

  private double[] sortedDurations() {
    var durations = new double[samples.size()];
    for (int i = 0; i < durations.length; i++) {
      durations[i] = samples.get(i).durationMs();
    }
    Arrays.sort(durations);
    return durations;
  }
}

package com.mk.fx.qa.benchmark.execution.model;

import com.mk.fx.qa.benchmark.execution.dto.BenchmarkResult;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable lifecycle state of one run. Written by the worker executing the run and by cancellation
 * requests; read by status queries, hence the volatile fields.
 */
public class RunRecord {

  private final BenchmarkRun run;
  private final Instant submittedAt;
  private final AtomicBoolean cancellationRequested = new AtomicBoolean(false);
  private volatile RunStatus status = RunStatus.QUEUED;
  private volatile Instant startedAt;
  private volatile Instant completedAt;
  private volatile String errorMessage;
  private volatile String reportFile;
  private volatile Map<String, List<BenchmarkResult>> results = Map.of();

  public RunRecord(BenchmarkRun run, Instant submittedAt) {
    this.run = run;
    this.submittedAt = submittedAt;
  }

  public synchronized void markProcessing(Instant at) {
    status = RunStatus.PROCESSING;
    startedAt = at;
  }

  public synchronized void markCompleted(Instant at, Map<String, List<BenchmarkResult>> runResults) {
    results = copy(runResults);
    status = RunStatus.COMPLETED;
    completedAt = at;
  }

  public synchronized void markErrored(Instant at, String message) {
    status = RunStatus.ERROR;
    completedAt = at;
    errorMessage = message;
  }

  /** Marks the run cancelled, keeping whatever results were produced before cancellation. */
  public synchronized void markCancelled(Instant at, Map<String, List<BenchmarkResult>> partial) {
    if (partial != null) {
      results = copy(partial);
    }
    status = RunStatus.CANCELLED;
    completedAt = at;
  }

  public void requestCancellation() {
    cancellationRequested.set(true);
  }

  public boolean isCancellationRequested() {
    return cancellationRequested.get();
  }

  public void setReportFile(String reportFile) {
    this.reportFile = reportFile;
  }

  public UUID getRunId() {
    return run.id();
  }

  public BenchmarkRun getRun() {
    return run;
  }

  public RunStatus getStatus() {
    return status;
  }

  public Instant getSubmittedAt() {
    return submittedAt;
  }

  public Optional<Instant> getStartedAt() {
    return Optional.ofNullable(startedAt);
  }

  public Optional<Instant> getCompletedAt() {
    return Optional.ofNullable(completedAt);
  }

  public Optional<String> getErrorMessage() {
    return Optional.ofNullable(errorMessage);
  }

  public Optional<String> getReportFile() {
    return Optional.ofNullable(reportFile);
  }

  public Map<String, List<BenchmarkResult>> getResults() {
    return results;
  }

  /** Milliseconds between start and completion, or up to now while the run is processing. */
  public long getProcessingDurationMillis() {
    var start = startedAt;
    if (start == null) {
      return 0L;
    }
    var end = completedAt != null ? completedAt : Instant.now();
    return Math.max(0L, Duration.between(start, end).toMillis());
  }

  private static Map<String, List<BenchmarkResult>> copy(Map<String, List<BenchmarkResult>> source) {
    Map<String, List<BenchmarkResult>> copy = new LinkedHashMap<>();
    source.forEach((label, list) -> copy.put(label, List.copyOf(list)));
    return Collections.unmodifiableMap(copy);
  }
}

package com.mk.fx.qa.benchmark.execution.service;

import com.mk.fx.qa.benchmark.execution.cfg.BenchmarkProperties;
import com.mk.fx.qa.benchmark.execution.config.BenchmarkConfigValidator;
import com.mk.fx.qa.benchmark.execution.dto.BenchmarkResult;
import com.mk.fx.qa.benchmark.execution.dto.controllerresponse.BenchmarkHistoryEntry;
import com.mk.fx.qa.benchmark.execution.dto.controllerresponse.BenchmarkStatusResponse;
import com.mk.fx.qa.benchmark.execution.dto.controllerresponse.RunSubmissionOutcome;
import com.mk.fx.qa.benchmark.execution.model.BenchmarkRun;
import com.mk.fx.qa.benchmark.execution.model.BenchmarkTarget;
import com.mk.fx.qa.benchmark.execution.model.LoadProfile;
import com.mk.fx.qa.benchmark.execution.model.RunMode;
import com.mk.fx.qa.benchmark.execution.model.RunRecord;
import com.mk.fx.qa.benchmark.execution.model.RunStatus;
import com.mk.fx.qa.benchmark.execution.model.SuiteScenario;
import com.mk.fx.qa.benchmark.execution.report.ComparisonReport;
import com.mk.fx.qa.benchmark.execution.report.ComparisonReporter;
import com.mk.fx.qa.benchmark.execution.report.ReportFormat;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Accepts benchmark runs, executes them asynchronously on a bounded worker pool and keeps their
 * status, results and a bounded history.
 *
 * <p>Lifecycle of a run: QUEUED → PROCESSING → COMPLETED/ERROR/CANCELLED. A completed COMPARE run
 * also has its markdown report written to the configured report directory.
 *
 * <p>Thread-safety: Runs are tracked in concurrent collections and each {@link RunRecord} guards
 * its own transitions, so status queries never block running benchmarks.
 */
@Slf4j
@Service
public class BenchmarkRunService {

  static final DateTimeFormatter REPORT_FILE_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

  private final BenchmarkProperties properties;
  private final BenchmarkSuiteRunner suiteRunner;
  private final ComparisonReporter reporter;
  private final Clock clock;
  private final ThreadPoolExecutor executor;
  private final Map<UUID, RunRecord> runRecords = new ConcurrentHashMap<>();
  private final Map<UUID, Future<?>> activeRuns = new ConcurrentHashMap<>();
  private final Deque<RunRecord> runHistory = new ConcurrentLinkedDeque<>();
  private final AtomicBoolean acceptingRuns = new AtomicBoolean(true);

  public BenchmarkRunService(
      BenchmarkProperties properties,
      BenchmarkSuiteRunner suiteRunner,
      ComparisonReporter reporter,
      Clock clock) {
    this.properties = properties;
    this.suiteRunner = suiteRunner;
    this.reporter = reporter;
    this.clock = clock;
    this.executor = createExecutor(properties.getConcurrency(), properties.getQueueCapacity());
  }

  @PostConstruct
  void logConfiguration() {
    log.info(
        "BenchmarkRunService initialised with concurrency={} historySize={} reportDirectory={}",
        properties.getConcurrency(),
        properties.getHistorySize(),
        properties.getReportDirectory());
  }

  private ThreadPoolExecutor createExecutor(int concurrency, int queueCapacity) {
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("benchmark-run-worker-" + thread.getId());
          thread.setDaemon(true);
          return thread;
        };

    return new ThreadPoolExecutor(
        concurrency,
        concurrency,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(queueCapacity),
        threadFactory,
        (runnable, exec) -> {
          throw new RejectedExecutionException("Run queue is full");
        });
  }

  /**
   * Validates and queues a run. Load settings missing from the run are filled from the configured
   * defaults, and every scenario configuration is validated against every target before anything
   * is queued.
   *
   * @param run run to execute
   * @return empty if the service no longer accepts runs, otherwise the submission outcome
   * @throws IllegalArgumentException if the run is invalid (wrong target count, bad configuration)
   */
  public Optional<RunSubmissionOutcome> submitRun(BenchmarkRun run) {
    if (!acceptingRuns.get()) {
      return Optional.empty();
    }

    var resolved = resolve(run);
    var record = new RunRecord(resolved, clock.instant());
    var previous = runRecords.putIfAbsent(resolved.id(), record);
    if (previous != null) {
      return Optional.of(
          new RunSubmissionOutcome(resolved.id(), RunStatus.ERROR, "Run ID already exists"));
    }

    try {
      Future<?> future = executor.submit(() -> executeRun(record));
      activeRuns.put(resolved.id(), future);
      log.info(
          "Run {} submitted (mode={}, targets={}, scenarios={})",
          resolved.id(),
          resolved.mode(),
          resolved.targetLabels(),
          resolved.scenarioNames());
      return Optional.of(new RunSubmissionOutcome(resolved.id(), record.getStatus(), "Run queued"));
    } catch (RejectedExecutionException ex) {
      log.warn("Run {} rejected: {}", resolved.id(), ex.getMessage());
      runRecords.remove(resolved.id());
      return Optional.of(
          new RunSubmissionOutcome(resolved.id(), RunStatus.ERROR, "Run queue is full"));
    }
  }

  private BenchmarkRun resolve(BenchmarkRun run) {
    if (run.mode() == null) {
      throw new IllegalArgumentException("Run mode is required");
    }
    if (run.targets().size() != run.mode().requiredTargets()) {
      throw new IllegalArgumentException(
          run.mode()
              + " runs need exactly "
              + run.mode().requiredTargets()
              + " target(s) but got "
              + run.targets().size());
    }
    var labels = new HashSet<String>();
    for (BenchmarkTarget target : run.targets()) {
      if (target.label() == null || target.label().isBlank()) {
        throw new IllegalArgumentException("Every target needs a label");
      }
      if (!labels.add(target.label())) {
        throw new IllegalArgumentException("Duplicate target label " + target.label());
      }
    }
    if (run.scenarios().isEmpty()) {
      throw new IllegalArgumentException("At least one scenario is required");
    }

    var requested = run.profile() != null ? run.profile() : new LoadProfile(null, null, null);
    var profile =
        requested
            .withDefaults(
                properties.getDefaultUsers(),
                properties.getDefaultDurationSeconds(),
                properties.getDefaultRampUpSeconds());
    for (BenchmarkTarget target : run.targets()) {
      for (SuiteScenario scenario : run.scenarios()) {
        BenchmarkConfigValidator.validate(scenario.toConfig(target, profile));
      }
    }
    return run.withProfile(profile);
  }

  private void executeRun(RunRecord record) {
    var runId = record.getRunId();
    var run = record.getRun();
    try {
      if (Thread.currentThread().isInterrupted() || record.isCancellationRequested()) {
        record.markCancelled(clock.instant(), null);
        log.info("Run {} cancelled before start", runId);
        return;
      }

      record.markProcessing(clock.instant());
      log.info("Run {} started", runId);

      var results =
          suiteRunner.runTargets(
              run.targets(), run.profile(), run.scenarios(), record::isCancellationRequested);

      if (run.mode() == RunMode.COMPARE) {
        writeReport(record, results);
      }
      record.markCompleted(clock.instant(), results);
      log.info("Run {} completed in {} ms", runId, record.getProcessingDurationMillis());
    } catch (SuiteCancelledException cancelled) {
      record.markCancelled(clock.instant(), cancelled.getPartialResults());
      log.info("Run {} cancelled", runId);
    } catch (Exception ex) {
      record.markErrored(clock.instant(), ex.getMessage());
      log.error("Run {} failed: {}", runId, ex.getMessage(), ex);
    } finally {
      activeRuns.remove(runId);
      addToHistory(record);
    }
  }

  private void writeReport(RunRecord record, Map<String, List<BenchmarkResult>> results) {
    var report = compare(record.getRun(), results);
    var markdown = reporter.render(report, ReportFormat.MARKDOWN);
    var fileName = "benchmark_report_" + REPORT_FILE_TIMESTAMP.format(clock.instant()) + ".md";
    var path = Path.of(properties.getReportDirectory()).resolve(fileName);
    try {
      Files.createDirectories(path.getParent());
      Files.writeString(path, markdown, StandardCharsets.UTF_8);
      record.setReportFile(path.toString());
      log.info("Run {} report saved to {}", record.getRunId(), path);
    } catch (IOException e) {
      log.warn("Run {} report could not be written to {}: {}", record.getRunId(), path, e.getMessage());
    }
  }

  private ComparisonReport compare(BenchmarkRun run, Map<String, List<BenchmarkResult>> results) {
    var first = run.targets().get(0).label();
    var second = run.targets().get(1).label();
    return reporter.compare(
        first, results.getOrDefault(first, List.of()), second, results.getOrDefault(second, List.of()));
  }

  private void addToHistory(RunRecord record) {
    if (runHistory.contains(record)) {
      return;
    }
    runHistory.addFirst(record);
    while (runHistory.size() > properties.getHistorySize()) {
      runHistory.pollLast();
    }
  }

  /** Returns the current status for a given run id, if present. */
  public Optional<BenchmarkStatusResponse> getRunStatus(UUID runId) {
    return Optional.ofNullable(runRecords.get(runId)).map(this::toStatusResponse);
  }

  /** Returns every known run, most recently submitted first. */
  public Collection<BenchmarkStatusResponse> getAllRuns() {
    List<BenchmarkStatusResponse> responses = new ArrayList<>();
    runRecords.values().stream()
        .sorted(Comparator.comparing(RunRecord::getSubmittedAt).reversed())
        .forEach(record -> responses.add(toStatusResponse(record)));
    return responses;
  }

  /** Returns a snapshot of the most recently finished runs up to the configured history size. */
  public List<BenchmarkHistoryEntry> getRunHistory() {
    List<BenchmarkHistoryEntry> snapshot = new ArrayList<>();
    for (RunRecord record : runHistory) {
      snapshot.add(
          new BenchmarkHistoryEntry(
              record.getRunId(),
              record.getRun().mode(),
              record.getRun().targetLabels(),
              record.getStatus(),
              record.getStartedAt().orElse(null),
              record.getCompletedAt().orElse(null),
              record.getProcessingDurationMillis(),
              record.getErrorMessage().orElse(null)));
    }
    return snapshot;
  }

  /**
   * Results per target label. Runs that have not finished yet, or failed, return an empty map;
   * cancelled runs return the scenarios finished before cancellation.
   */
  public Optional<Map<String, List<BenchmarkResult>>> getResults(UUID runId) {
    return Optional.ofNullable(runRecords.get(runId)).map(RunRecord::getResults);
  }

  /**
   * Renders the comparison report of a completed COMPARE run.
   *
   * @return empty if the run is unknown
   * @throws IllegalStateException if the run is not a completed comparison
   */
  public Optional<String> renderReport(UUID runId, ReportFormat format) {
    var record = runRecords.get(runId);
    if (record == null) {
      return Optional.empty();
    }
    if (record.getRun().mode() != RunMode.COMPARE) {
      throw new IllegalStateException("Run " + runId + " is not a comparison run");
    }
    if (record.getStatus() != RunStatus.COMPLETED) {
      throw new IllegalStateException(
          "Run " + runId + " has no report in status " + record.getStatus());
    }
    return Optional.of(reporter.render(compare(record.getRun(), record.getResults()), format));
  }

  /** Compares two posted result sets and renders the comparison. */
  public String renderReport(
      String labelA,
      List<BenchmarkResult> resultsA,
      String labelB,
      List<BenchmarkResult> resultsB,
      ReportFormat format) {
    return reporter.render(reporter.compare(labelA, resultsA, labelB, resultsB), format);
  }

  /**
   * Attempts to cancel the specified run.
   *
   * <p>A queued run is cancelled immediately. A running run gets a cooperative cancellation
   * request: virtual users stop at their next request boundary and the run ends up CANCELLED with
   * the results of the scenarios already finished.
   *
   * @param runId id of the run to cancel
   * @return result describing the cancellation outcome and current run status
   */
  public CancellationResult cancelRun(UUID runId) {
    var record = runRecords.get(runId);
    if (record == null) {
      return CancellationResult.notFound();
    }

    var status = record.getStatus();
    if (status.isTerminal()) {
      return CancellationResult.notCancellable(status);
    }

    record.requestCancellation();
    Future<?> future = activeRuns.get(runId);
    if (status == RunStatus.QUEUED) {
      if (future != null && future.cancel(false)) {
        record.markCancelled(clock.instant(), null);
        activeRuns.remove(runId);
        addToHistory(record);
        log.info("Run {} cancelled while queued", runId);
        return CancellationResult.cancelled(record.getStatus());
      }
    }

    log.info("Run {} cancellation requested", runId);
    return CancellationResult.cancellationRequested(record.getStatus());
  }

  /**
   * Initiates a graceful shutdown: flips acceptance flag, asks running benchmarks to stop and shuts
   * down the executor.
   */
  public void shutdown() {
    if (acceptingRuns.compareAndSet(true, false)) {
      runRecords.values().stream()
          .filter(record -> !record.getStatus().isTerminal())
          .forEach(RunRecord::requestCancellation);
      executor.shutdown();
    }
  }

  @PreDestroy
  void onShutdown() {
    shutdown();
  }

  /** Simple health indicator for external liveness checks. */
  public boolean isHealthy() {
    return acceptingRuns.get() && !executor.isShutdown();
  }

  private BenchmarkStatusResponse toStatusResponse(RunRecord record) {
    var run = record.getRun();
    return new BenchmarkStatusResponse(
        record.getRunId(),
        run.mode(),
        run.targetLabels(),
        run.scenarioNames(),
        record.getStatus(),
        record.getSubmittedAt(),
        record.getStartedAt().orElse(null),
        record.getCompletedAt().orElse(null),
        record.getProcessingDurationMillis(),
        record.getReportFile().orElse(null),
        record.getErrorMessage().orElse(null));
  }

  /** Describes the outcome of a cancellation attempt for a run. */
  @Getter
  public static class CancellationResult {
    public enum CancellationState {
      CANCELLED,
      CANCELLATION_REQUESTED,
      NOT_FOUND,
      NOT_CANCELLABLE
    }

    private final CancellationState state;
    private final RunStatus runStatus;

    private CancellationResult(CancellationState state, RunStatus runStatus) {
      this.state = state;
      this.runStatus = runStatus;
    }

    public static CancellationResult cancelled(RunStatus status) {
      return new CancellationResult(CancellationState.CANCELLED, status);
    }

    public static CancellationResult cancellationRequested(RunStatus status) {
      return new CancellationResult(CancellationState.CANCELLATION_REQUESTED, status);
    }

    public static CancellationResult notFound() {
      return new CancellationResult(CancellationState.NOT_FOUND, null);
    }

    public static CancellationResult notCancellable(RunStatus status) {
      return new CancellationResult(CancellationState.NOT_CANCELLABLE, status);
    }
  }
}

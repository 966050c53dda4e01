package com.mk.fx.qa.benchmark.execution.resource;

import static com.mk.fx.qa.benchmark.execution.model.RunStatus.*;

import com.mk.fx.qa.benchmark.execution.dto.controllerresponse.*;
import com.mk.fx.qa.benchmark.execution.model.BenchmarkRun;
import com.mk.fx.qa.benchmark.execution.model.RunStatus;
import com.mk.fx.qa.benchmark.execution.report.ReportFormat;
import com.mk.fx.qa.benchmark.execution.scenarios.BenchmarkScenario;
import com.mk.fx.qa.benchmark.execution.service.BenchmarkRunService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.*;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Slf4j
@Tag(
    name = "Benchmarks",
    description = "Endpoints for running, monitoring and comparing HTTP load benchmarks")
@RestController
@RequestMapping("/api/benchmarks")
@Validated
@RequiredArgsConstructor
public class BenchmarkController {

  private final BenchmarkRunService runService;
  private final BenchmarkRunMapper runMapper;
  private final ApiResponseFactory responseFactory;

  // -----------------------------------------------------
  // Run submission
  // -----------------------------------------------------
  @Operation(
      summary = "Submit a benchmark run",
      description =
          "Queues a benchmark of one target (SINGLE) or a comparison of two targets (COMPARE).")
  @PostMapping
  public ResponseEntity<BenchmarkSubmissionResponse> submitRun(
      @Valid @RequestBody BenchmarkSubmissionRequest request) {
    log.info(
        "Received benchmark submission mode={} targets={}",
        request.getMode(),
        request.getTargets().size());
    BenchmarkRun run = runMapper.toDomain(request);
    Optional<RunSubmissionOutcome> outcomeOpt = runService.submitRun(run);

    if (outcomeOpt.isEmpty()) {
      return responseFactory.unavailable(
          new BenchmarkSubmissionResponse(null, CANCELLED, "Service not accepting new runs"));
    }

    RunSubmissionOutcome outcome = outcomeOpt.get();
    log.info("Run {} submitted with status {}", outcome.runId(), outcome.status());
    return ResponseEntity.status(mapStatus(outcome.status()))
        .body(
            new BenchmarkSubmissionResponse(outcome.runId(), outcome.status(), outcome.message()));
  }

  // -----------------------------------------------------
  // Run status and control
  // -----------------------------------------------------
  @Operation(summary = "Get run status", description = "Returns current status of a run.")
  @GetMapping("/{runId}")
  public ResponseEntity<BenchmarkStatusResponse> getRunStatus(@PathVariable UUID runId) {
    return runService
        .getRunStatus(runId)
        .map(ResponseEntity::ok)
        .orElseGet(
            () -> {
              log.warn("Run {} not found", runId);
              return ResponseEntity.notFound().build();
            });
  }

  @Operation(summary = "Cancel run", description = "Attempts to cancel a queued or running run.")
  @DeleteMapping("/{runId}")
  public ResponseEntity<?> cancelRun(@PathVariable UUID runId) {
    var result = runService.cancelRun(runId);
    log.info("Cancellation requested for {} -> {}", runId, result.getState());
    return switch (result.getState()) {
      case NOT_FOUND -> responseFactory.notFound("Run not found");
      case NOT_CANCELLABLE -> responseFactory.error(
          HttpStatus.CONFLICT, "Conflict", "Run cannot be cancelled in its current state");
      case CANCELLED -> ResponseEntity.ok(
          new BenchmarkCancellationResponse(runId, CANCELLED, "Run cancelled"));
      case CANCELLATION_REQUESTED -> ResponseEntity.ok(
          new BenchmarkCancellationResponse(
              runId,
              Optional.ofNullable(result.getRunStatus()).orElse(PROCESSING),
              "Cancellation requested"));
    };
  }

  // -----------------------------------------------------
  // Listings and history
  // -----------------------------------------------------
  @Operation(summary = "List runs", description = "Lists all known runs, newest first.")
  @GetMapping
  public ResponseEntity<Collection<BenchmarkStatusResponse>> getRuns() {
    return ResponseEntity.ok(runService.getAllRuns());
  }

  @Operation(summary = "Run history", description = "Returns recently finished runs.")
  @GetMapping("/history")
  public ResponseEntity<List<BenchmarkHistoryEntry>> getRunHistory() {
    return ResponseEntity.ok(runService.getRunHistory());
  }

  // -----------------------------------------------------
  // Results and reports
  // -----------------------------------------------------
  @Operation(
      summary = "Run results",
      description = "Returns the benchmark results of a run, grouped by target label.")
  @GetMapping("/{runId}/results")
  public ResponseEntity<?> getResults(@PathVariable UUID runId) {
    return runService
        .getResults(runId)
        .<ResponseEntity<?>>map(ResponseEntity::ok)
        .orElseGet(
            () -> {
              log.warn("Results not found for run {}", runId);
              return responseFactory.notFound("Run not found: " + runId);
            });
  }

  @Operation(
      summary = "Run report",
      description = "Renders the comparison report of a completed COMPARE run.")
  @GetMapping("/{runId}/report")
  public ResponseEntity<?> getReport(
      @PathVariable UUID runId, @RequestParam(defaultValue = "markdown") String format) {
    var reportFormat = ReportFormat.fromValue(format);
    return runService
        .renderReport(runId, reportFormat)
        .<ResponseEntity<?>>map(body -> responseFactory.document(body, reportFormat.mediaType()))
        .orElseGet(
            () -> {
              log.warn("Report not found for run {}", runId);
              return responseFactory.notFound("Run not found: " + runId);
            });
  }

  @Operation(
      summary = "Compare results",
      description = "Renders a comparison report from two posted sets of benchmark results.")
  @PostMapping("/report")
  public ResponseEntity<String> compareResults(
      @Valid @RequestBody ComparisonReportRequest request,
      @RequestParam(defaultValue = "markdown") String format) {
    var reportFormat = ReportFormat.fromValue(format);
    var body =
        runService.renderReport(
            request.getLabelA(),
            request.getResultsA(),
            request.getLabelB(),
            request.getResultsB(),
            reportFormat);
    return responseFactory.document(body, reportFormat.mediaType());
  }

  // -----------------------------------------------------
  // Misc endpoints
  // -----------------------------------------------------
  @Operation(summary = "Built-in scenarios", description = "Lists the built-in endpoint mixes.")
  @GetMapping("/scenarios")
  public ResponseEntity<List<ScenarioResponse>> getScenarios() {
    return ResponseEntity.ok(
        Arrays.stream(BenchmarkScenario.values())
            .map(s -> new ScenarioResponse(s.name(), s.displayName(), s.endpoints()))
            .toList());
  }

  @Operation(summary = "Health check", description = "Verifies service health.")
  @GetMapping("/health")
  public ResponseEntity<HealthResponse> health() {
    boolean healthy = runService.isHealthy();
    log.debug("Health check: {}", healthy ? "UP" : "DOWN");
    return ResponseEntity.ok(new HealthResponse(healthy ? "UP" : "DOWN"));
  }

  // -----------------------------------------------------
  // Helpers
  // -----------------------------------------------------
  private HttpStatus mapStatus(RunStatus status) {
    return switch (status) {
      case COMPLETED -> HttpStatus.OK;
      case PROCESSING, QUEUED -> HttpStatus.ACCEPTED;
      case ERROR -> HttpStatus.BAD_REQUEST;
      case CANCELLED -> HttpStatus.SERVICE_UNAVAILABLE;
    };
  }
}

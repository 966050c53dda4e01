package com.mk.fx.qa.benchmark.execution.dto.controllerresponse;

import com.mk.fx.qa.benchmark.execution.model.RunMode;
import com.mk.fx.qa.benchmark.execution.model.RunStatus;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Current state of a benchmark run, including timestamps, processing time, the report file once
 * written and the error message if the run failed.
 */
public record BenchmarkStatusResponse(
    UUID runId,
    RunMode mode,
    List<String> targets,
    List<String> scenarios,
    RunStatus status,
    Instant submittedAt,
    Instant startedAt,
    Instant completedAt,
    Long processingTimeMillis,
    String reportFile,
    String errorMessage) {}

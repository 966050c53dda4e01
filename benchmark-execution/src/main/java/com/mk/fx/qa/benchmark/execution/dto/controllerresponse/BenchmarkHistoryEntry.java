package com.mk.fx.qa.benchmark.execution.dto.controllerresponse;

import com.mk.fx.qa.benchmark.execution.model.RunMode;
import com.mk.fx.qa.benchmark.execution.model.RunStatus;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record BenchmarkHistoryEntry(
    UUID runId,
    RunMode mode,
    List<String> targets,
    RunStatus status,
    Instant startedAt,
    Instant completedAt,
    long processingTimeMillis,
    String errorMessage) {}

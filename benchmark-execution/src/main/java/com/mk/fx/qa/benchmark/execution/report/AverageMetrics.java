package com.mk.fx.qa.benchmark.execution.report;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Arithmetic means of the numeric metrics over all results of one system. */
public record AverageMetrics(
    @JsonProperty("scenario_count") int scenarioCount,
    @JsonProperty("requests_per_second") double requestsPerSecond,
    @JsonProperty("average_response_time_ms") double averageResponseTimeMs,
    @JsonProperty("p95_response_time_ms") double p95ResponseTimeMs,
    @JsonProperty("p99_response_time_ms") double p99ResponseTimeMs,
    @JsonProperty("memory_usage_mb") double memoryUsageMb,
    @JsonProperty("cpu_usage_percent") double cpuUsagePercent) {}

package com.mk.fx.qa.benchmark.execution.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Snapshot of one finished benchmark scenario for one system. Memory and CPU figures are
 * placeholders and always 0 for locally produced results; imported results may carry real values.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BenchmarkResult(
    @JsonProperty("framework") String framework,
    @JsonProperty("test_name") String testName,
    @JsonProperty("requests_per_second") double requestsPerSecond,
    @JsonProperty("average_response_time_ms") double averageResponseTimeMs,
    @JsonProperty("p95_response_time_ms") double p95ResponseTimeMs,
    @JsonProperty("p99_response_time_ms") double p99ResponseTimeMs,
    @JsonProperty("memory_usage_mb") double memoryUsageMb,
    @JsonProperty("cpu_usage_percent") double cpuUsagePercent,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("total_requests") long totalRequests,
    @JsonProperty("success_rate") double successRate,
    @JsonProperty("throughput_mb_per_second") double throughputMbPerSecond) {}

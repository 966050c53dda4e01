package com.mk.fx.qa.benchmark.execution.metrics;

/** Per endpoint path request counts and mean latency within one aggregate. */
public record EndpointStats(
    String endpoint, long totalRequests, long successfulRequests, long failedRequests,
    double averageResponseTimeMs) {}

package com.mk.fx.qa.benchmark.execution.dto;

import java.util.List;
import java.util.Map;

/**
 * Everything a single benchmark run needs: where to send traffic, how many virtual users, for how
 * long, how fast to ramp them up and which weighted endpoint mix to draw from.
 */
public record BenchmarkConfig(
    String targetUrl,
    int concurrentUsers,
    int durationSeconds,
    int rampUpSeconds,
    List<EndpointDefinition> endpoints) {

  public static final int DEFAULT_USERS = 100;
  public static final int DEFAULT_DURATION_SECONDS = 60;
  public static final int DEFAULT_RAMP_UP_SECONDS = 10;

  public BenchmarkConfig {
    endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
  }

  /** Default mix: health, product listing, authenticated profile and a GraphQL health query. */
  public static BenchmarkConfig defaults(String targetUrl) {
    return new BenchmarkConfig(
        targetUrl,
        DEFAULT_USERS,
        DEFAULT_DURATION_SECONDS,
        DEFAULT_RAMP_UP_SECONDS,
        List.of(
            EndpointDefinition.get("/health", 0.3),
            EndpointDefinition.get("/api/products", 0.4),
            new EndpointDefinition(
                "/api/users/me", "GET", Map.of("Authorization", "Bearer demo-token"), null, 0.2),
            EndpointDefinition.postJson("/graphql", "{\"query\":\"query { health }\"}", 0.1)));
  }

  public BenchmarkConfig withTargetUrl(String url) {
    return new BenchmarkConfig(url, concurrentUsers, durationSeconds, rampUpSeconds, endpoints);
  }
}

package com.mk.fx.qa.benchmark.execution.scenarios;

import static com.mk.fx.qa.benchmark.execution.dto.EndpointDefinition.get;
import static com.mk.fx.qa.benchmark.execution.dto.EndpointDefinition.postJson;

import com.mk.fx.qa.benchmark.execution.dto.BenchmarkConfig;
import com.mk.fx.qa.benchmark.execution.dto.EndpointDefinition;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/** Built-in endpoint mixes, run in declaration order by a suite. */
public enum BenchmarkScenario {
  HEALTH_CHECK("Health Check", List.of(get("/health", 1.0))),

  REST_API(
      "REST API",
      List.of(
          get("/api/products", 0.6),
          postJson(
              "/api/products",
              "{\"name\":\"Benchmark Product\",\"description\":\"Created during benchmark\","
                  + "\"price\":99.99}",
              0.2),
          postJson(
              "/api/auth/login",
              "{\"email\":\"benchmark@example.com\",\"password\":\"BenchmarkPass123!\"}",
              0.2))),

  GRAPHQL(
      "GraphQL",
      List.of(
          postJson("/graphql", "{\"query\":\"query { health }\"}", 0.3),
          postJson("/graphql", "{\"query\":\"query { products { id name price } }\"}", 0.4),
          postJson("/graphql", "{\"query\":\"query { users { id email name } }\"}", 0.3))),

  MIXED_LOAD(
      "Mixed Load",
      List.of(
          get("/health", 0.2),
          get("/api/products", 0.3),
          postJson("/graphql", "{\"query\":\"query { products { id name } }\"}", 0.3),
          get("/metrics", 0.2)));

  private final String displayName;
  private final List<EndpointDefinition> endpoints;

  BenchmarkScenario(String displayName, List<EndpointDefinition> endpoints) {
    this.displayName = displayName;
    this.endpoints = endpoints;
  }

  public String displayName() {
    return displayName;
  }

  public List<EndpointDefinition> endpoints() {
    return endpoints;
  }

  public BenchmarkConfig toConfig(String baseUrl, int users, int durationSeconds, int rampUpSeconds) {
    return new BenchmarkConfig(baseUrl, users, durationSeconds, rampUpSeconds, endpoints);
  }

  /**
   * Resolves a scenario by enum name or display name, ignoring case, spaces, dashes and
   * underscores, so {@code "rest-api"}, {@code "REST API"} and {@code "REST_API"} all match.
   *
   * @throws IllegalArgumentException for unknown scenarios
   */
  public static BenchmarkScenario fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Scenario name is required");
    }
    var key = normalize(value);
    return Arrays.stream(values())
        .filter(s -> normalize(s.name()).equals(key) || normalize(s.displayName).equals(key))
        .findFirst()
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "Unknown scenario: " + value + ". Allowed: " + Arrays.toString(values())));
  }

  private static String normalize(String value) {
    return value.replaceAll("[\\s_-]", "").toLowerCase(Locale.ROOT);
  }
}

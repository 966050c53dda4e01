package com.mk.fx.qa.benchmark.execution.config;

import com.mk.fx.qa.benchmark.execution.dto.BenchmarkConfig;
import com.mk.fx.qa.benchmark.execution.dto.EndpointDefinition;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;

/**
 * Rejects configurations that cannot produce a meaningful run. All checks happen up front so that
 * a bad configuration never surfaces halfway through a benchmark.
 */
public final class BenchmarkConfigValidator {

  /** Upper bound on virtual users; each one holds a platform thread for the whole run. */
  public static final int MAX_CONCURRENT_USERS = 5_000;

  private BenchmarkConfigValidator() {
    throw new UnsupportedOperationException("BenchmarkConfigValidator cannot be instantiated");
  }

  /**
   * Validates the configuration.
   *
   * @param config configuration to check
   * @throws InvalidBenchmarkConfigException describing the first problem found
   */
  public static void validate(BenchmarkConfig config) {
    if (config == null) {
      throw new InvalidBenchmarkConfigException("Benchmark configuration is required");
    }
    validateTargetUrl(config.targetUrl());
    if (config.concurrentUsers() < 1) {
      throw new InvalidBenchmarkConfigException(
          "concurrentUsers must be at least 1 but was " + config.concurrentUsers());
    }
    if (config.concurrentUsers() > MAX_CONCURRENT_USERS) {
      throw new InvalidBenchmarkConfigException(
          "concurrentUsers must be at most "
              + MAX_CONCURRENT_USERS
              + " but was "
              + config.concurrentUsers());
    }
    if (config.durationSeconds() < 1) {
      throw new InvalidBenchmarkConfigException(
          "durationSeconds must be at least 1 but was " + config.durationSeconds());
    }
    if (config.rampUpSeconds() < 0) {
      throw new InvalidBenchmarkConfigException(
          "rampUpSeconds must not be negative but was " + config.rampUpSeconds());
    }
    validateEndpoints(config.endpoints());
  }

  /**
   * Validates an endpoint mix on its own. A single endpoint may carry weight 0; with more than one
   * endpoint the total weight must be positive.
   */
  public static void validateEndpoints(List<EndpointDefinition> endpoints) {
    if (endpoints == null || endpoints.isEmpty()) {
      throw new InvalidBenchmarkConfigException("At least one endpoint must be configured");
    }
    double totalWeight = 0;
    for (int i = 0; i < endpoints.size(); i++) {
      var endpoint = endpoints.get(i);
      if (endpoint == null) {
        throw new InvalidBenchmarkConfigException("Endpoint " + i + " is null");
      }
      if (endpoint.path() == null || endpoint.path().isBlank()) {
        throw new InvalidBenchmarkConfigException("Endpoint " + i + " has no path");
      }
      if (!Double.isFinite(endpoint.weight()) || endpoint.weight() < 0) {
        throw new InvalidBenchmarkConfigException(
            "Endpoint " + endpoint.path() + " has invalid weight " + endpoint.weight());
      }
      totalWeight += endpoint.weight();
    }
    if (endpoints.size() > 1 && totalWeight <= 0) {
      throw new InvalidBenchmarkConfigException(
          "Total endpoint weight must be positive when more than one endpoint is configured");
    }
  }

  private static void validateTargetUrl(String targetUrl) {
    if (targetUrl == null || targetUrl.isBlank()) {
      throw new InvalidBenchmarkConfigException("targetUrl is required");
    }
    try {
      var uri = new URI(targetUrl.trim());
      var scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
      if (!scheme.equals("http") && !scheme.equals("https")) {
        throw new InvalidBenchmarkConfigException(
            "targetUrl must use http or https but was " + targetUrl);
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new InvalidBenchmarkConfigException("targetUrl has no host: " + targetUrl);
      }
    } catch (URISyntaxException e) {
      throw new InvalidBenchmarkConfigException(
          "targetUrl is not a valid URI: " + targetUrl + " (" + e.getMessage() + ")");
    }
  }
}

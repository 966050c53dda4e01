package com.mk.fx.qa.benchmark.execution.dto;

import java.util.Map;

/**
 * A weighted request template. The method is kept as configured; names other than
 * GET/POST/PUT/DELETE are sent as GET.
 *
 * @param path path appended to the target base URL, e.g. {@code /api/products}
 * @param method HTTP method name
 * @param headers headers attached to every request for this endpoint
 * @param body optional payload, sent whatever the method
 * @param weight relative selection weight; weights need not sum to 1
 */
public record EndpointDefinition(
    String path, String method, Map<String, String> headers, String body, double weight) {

  private static final Map<String, String> JSON_CONTENT = Map.of("Content-Type", "application/json");

  public EndpointDefinition {
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }

  public static EndpointDefinition get(String path, double weight) {
    return new EndpointDefinition(path, "GET", Map.of(), null, weight);
  }

  public static EndpointDefinition postJson(String path, String json, double weight) {
    return new EndpointDefinition(path, "POST", JSON_CONTENT, json, weight);
  }
}

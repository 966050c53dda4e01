package com.mk.fx.qa.benchmark.execution.executors;

import com.mk.fx.qa.benchmark.execution.dto.EndpointDefinition;
import com.mk.fx.qa.benchmark.execution.metrics.ErrorTracker;
import com.mk.fx.qa.benchmark.execution.metrics.RequestSample;
import com.mk.fx.qa.benchmark.rest.HttpMethod;
import com.mk.fx.qa.benchmark.rest.HttpTransportException;
import com.mk.fx.qa.benchmark.rest.LoadHttpClient;
import com.mk.fx.qa.benchmark.rest.Request;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/** {@link RequestExecutor} backed by the shared {@link LoadHttpClient}. */
@Slf4j
public class HttpRequestExecutor implements RequestExecutor {

  private final LoadHttpClient httpClient;

  public HttpRequestExecutor(LoadHttpClient httpClient) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
  }

  /**
   * Sends the endpoint's request. A 2xx status counts as success; the declared Content-Length is
   * used as the response size. Connection, DNS and timeout failures yield a status 0 sample whose
   * failure reason names the root cause.
   *
   * @throws IllegalArgumentException if the request cannot be built from the endpoint definition
   */
  @Override
  public RequestSample execute(String baseUrl, EndpointDefinition endpoint) {
    var request = toRequest(endpoint);
    try {
      var response = httpClient.execute(baseUrl, request);
      return RequestSample.response(
          response.getStartNanos(),
          response.getEndNanos(),
          response.getStatusCode(),
          response.getContentLength(),
          endpoint.path());
    } catch (HttpTransportException e) {
      var reason = ErrorTracker.classify(e);
      log.debug("{} {} failed with {}: {}", request.getMethod(), endpoint.path(), reason, e.getMessage());
      return RequestSample.transportFailure(
          e.getStartNanos(), e.getEndNanos(), endpoint.path(), reason);
    }
  }

  private Request toRequest(EndpointDefinition endpoint) {
    var request = new Request();
    request.setMethod(HttpMethod.resolve(endpoint.method()));
    request.setPath(endpoint.path());
    request.setHeaders(endpoint.headers());
    request.setBody(endpoint.body());
    return request;
  }
}

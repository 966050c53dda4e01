package com.mk.fx.qa.benchmark.execution.executors;

import com.mk.fx.qa.benchmark.execution.dto.EndpointDefinition;
import com.mk.fx.qa.benchmark.execution.metrics.RequestSample;

/**
 * Issues one request for an endpoint and reports the outcome as a sample. Implementations must be
 * safe to call from many virtual users at once and must report transport failures as samples
 * rather than throw them.
 */
@FunctionalInterface
public interface RequestExecutor {

  RequestSample execute(String baseUrl, EndpointDefinition endpoint);
}

package com.mk.fx.qa.benchmark.execution.dto.controllerresponse;

/** Response object for health check endpoint. Contains the status of the service. */
public record HealthResponse(String status) {}

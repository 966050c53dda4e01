package com.mk.fx.qa.benchmark.execution.config;

/** Raised when a benchmark configuration is rejected before any virtual user starts. */
public class InvalidBenchmarkConfigException extends IllegalArgumentException {

  public InvalidBenchmarkConfigException(String message) {
    super(message);
  }
}

package com.mk.fx.qa.benchmark.execution.service;

import com.mk.fx.qa.benchmark.execution.dto.BenchmarkResult;
import java.util.List;
import java.util.Map;

/** Signals that a suite stopped on cancellation; carries the results finished before that. */
public class SuiteCancelledException extends InterruptedException {

  private final transient Map<String, List<BenchmarkResult>> partialResults;

  public SuiteCancelledException(String message, Map<String, List<BenchmarkResult>> partialResults) {
    super(message);
    this.partialResults = partialResults;
  }

  public Map<String, List<BenchmarkResult>> getPartialResults() {
    return partialResults;
  }
}

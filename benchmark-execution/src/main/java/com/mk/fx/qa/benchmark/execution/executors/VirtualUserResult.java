package com.mk.fx.qa.benchmark.execution.executors;

import com.mk.fx.qa.benchmark.execution.metrics.RequestSample;
import java.util.List;

/**
 * Samples produced by one virtual user, in request order, and how the user stopped.
 *
 * @param userIndex zero-based user index
 * @param samples samples in chronological order, possibly partial
 * @param cancelled whether the user stopped because cancellation was requested
 * @param failureMessage message of the unexpected error that ended the user, {@code null} otherwise
 */
public record VirtualUserResult(
    int userIndex, List<RequestSample> samples, boolean cancelled, String failureMessage) {

  public VirtualUserResult {
    samples = List.copyOf(samples);
  }

  public boolean failed() {
    return failureMessage != null;
  }
}

package com.mk.fx.qa.benchmark.execution.metrics;

/**
 * Outcome of one request attempt. Timestamps come from {@link System#nanoTime()} so durations are
 * immune to wall-clock adjustments.
 *
 * @param startNanos monotonic time just before dispatch
 * @param endNanos monotonic time once the response headers, or the failure, were observed
 * @param statusCode HTTP status, or 0 when no response was received
 * @param responseBytes declared response size, 0 when unknown
 * @param endpoint endpoint path the request was sent to
 * @param success whether a 2xx response was received
 * @param failureReason classified transport failure, {@code null} when a response arrived
 */
public record RequestSample(
    long startNanos,
    long endNanos,
    int statusCode,
    long responseBytes,
    String endpoint,
    boolean success,
    String failureReason) {

  public static RequestSample response(
      long startNanos, long endNanos, int statusCode, long responseBytes, String endpoint) {
    return new RequestSample(
        startNanos,
        endNanos,
        statusCode,
        Math.max(0, responseBytes),
        endpoint,
        statusCode >= 200 && statusCode < 300,
        null);
  }

  public static RequestSample transportFailure(
      long startNanos, long endNanos, String endpoint, String failureReason) {
    return new RequestSample(startNanos, endNanos, 0, 0, endpoint, false, failureReason);
  }

  /** Elapsed time of the attempt in fractional milliseconds. */
  public double durationMs() {
    return Math.max(0L, endNanos - startNanos) / 1_000_000.0;
  }
}

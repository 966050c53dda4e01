package com.mk.fx.qa.benchmark.rest;

import lombok.Getter;

/**
 * Raised when no HTTP response could be obtained: connection refused, DNS failure, timeout or
 * interruption while waiting. Carries the monotonic timestamps of the failed attempt so callers
 * can still account for the time spent.
 */
@Getter
public class HttpTransportException extends RuntimeException {

    private final long startNanos;
    private final long endNanos;

    public HttpTransportException(String message, Throwable cause, long startNanos, long endNanos) {
        super(message, cause);
        this.startNanos = startNanos;
        this.endNanos = endNanos;
    }
}

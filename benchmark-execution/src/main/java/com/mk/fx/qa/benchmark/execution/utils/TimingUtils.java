package com.mk.fx.qa.benchmark.execution.utils;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/** Sleeping helpers that stay responsive to cooperative cancellation. */
public final class TimingUtils {

    static final long SLEEP_CHUNK_MILLIS = 100L;

    private TimingUtils() {
        // Utility class, no instantiation
    }

    /** Returns true if the current thread is interrupted or external cancellation is signalled. */
    public static boolean shouldStop(BooleanSupplier cancellationRequested) {
        return Thread.currentThread().isInterrupted() || cancellationRequested.getAsBoolean();
    }

    /**
     * Sleeps for the requested duration in chunks, checking for cancellation between chunks.
     *
     * @param duration how long to sleep; zero or negative returns immediately
     * @param cancellationRequested supplier checked before every chunk
     * @throws InterruptedException if cancellation is observed or the thread is interrupted
     */
    public static void sleepWithCancellation(Duration duration, BooleanSupplier cancellationRequested)
            throws InterruptedException {
        long remaining = duration == null ? 0 : duration.toMillis();
        while (remaining > 0) {
            if (shouldStop(cancellationRequested)) {
                throw new InterruptedException("Cancelled during sleep");
            }
            var chunk = Math.min(SLEEP_CHUNK_MILLIS, remaining);
            TimeUnit.MILLISECONDS.sleep(chunk);
            remaining -= chunk;
        }
    }
}

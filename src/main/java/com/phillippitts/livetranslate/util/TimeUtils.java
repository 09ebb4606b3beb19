package com.phillippitts.livetranslate.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Utility methods for latency measurement and threshold arithmetic.
 *
 * <p>Latency is measured with {@link System#nanoTime()}; session thresholds are
 * evaluated against wall-clock {@link Instant}s supplied by an injected clock.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts nanoseconds to milliseconds.
     *
     * @param nanos time in nanoseconds
     * @return time in milliseconds (truncated)
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Returns the instant {@code millis} before {@code now}; the cutoff used by
     * "older than" comparisons.
     */
    public static Instant cutoff(Instant now, long millis) {
        return now.minus(Duration.ofMillis(millis));
    }

    /**
     * True when {@code instant} is strictly before {@code now - millis}.
     * A null instant is never considered older.
     */
    public static boolean isOlderThan(Instant instant, Instant now, long millis) {
        return instant != null && instant.isBefore(cutoff(now, millis));
    }
}

package com.phillippitts.ctcdecode.util;

/**
 * Elapsed-time helpers for load and build timing logs.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Milliseconds elapsed since a {@link System#nanoTime()} reading, truncated.
     *
     * @param startNanos earlier {@code System.nanoTime()} value
     * @return elapsed milliseconds
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }
}

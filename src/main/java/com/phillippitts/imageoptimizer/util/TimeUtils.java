package com.phillippitts.imageoptimizer.util;

/**
 * Conversions for {@link System#nanoTime()} based timing.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts nanoseconds to milliseconds (truncated).
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Milliseconds elapsed since a {@link System#nanoTime()} timestamp.
     *
     * <pre>
     * long start = System.nanoTime();
     * runBatch();
     * long elapsedMs = TimeUtils.elapsedMillis(start);
     * </pre>
     */
    public static long elapsedMillis(long startNanos) {
        return nanosToMillis(System.nanoTime() - startNanos);
    }
}

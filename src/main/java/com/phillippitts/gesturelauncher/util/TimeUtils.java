package com.phillippitts.gesturelauncher.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Utility methods for time conversions used by the tick loop and cooldown gate.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private TimeUtils() {
        // Utility class - prevent instantiation
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
     * Converts fractional seconds (as written in configuration or a tracker feed) to a Duration,
     * rounded to the nearest nanosecond.
     *
     * @param seconds non-negative, finite number of seconds
     * @return equivalent duration
     * @throws IllegalArgumentException if seconds is negative, NaN or infinite
     */
    public static Duration secondsToDuration(double seconds) {
        if (!Double.isFinite(seconds) || seconds < 0) {
            throw new IllegalArgumentException("seconds must be finite and >= 0, got: " + seconds);
        }
        return Duration.ofNanos(Math.round(seconds * NANOS_PER_SECOND));
    }

    /**
     * Converts a tracker timestamp in fractional seconds since an arbitrary origin to an Instant
     * relative to the epoch.
     */
    public static Instant secondsToInstant(double seconds) {
        if (!Double.isFinite(seconds)) {
            throw new IllegalArgumentException("seconds must be finite, got: " + seconds);
        }
        long nanos = Math.round(seconds * NANOS_PER_SECOND);
        return Instant.EPOCH.plusNanos(nanos);
    }

    /**
     * Converts a duration to fractional seconds for display.
     */
    public static double toSeconds(Duration duration) {
        return duration.toNanos() / NANOS_PER_SECOND;
    }
}

package com.phillippitts.livescribe.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Elapsed-time helpers for connect latency, drain waits and session lifetimes.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
    }

    /**
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed nanoseconds since startNanos
     */
    public static long elapsedNanos(long startNanos) {
        return System.nanoTime() - startNanos;
    }

    public static long elapsedMillis(long startNanos) {
        return elapsedNanos(startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Wall-clock lifetime between two instants, clamped at zero when the clock stepped back.
     *
     * @return lifetime in nanoseconds
     */
    public static long lifetimeNanos(Instant createdAt, Instant closedAt) {
        long nanos = Duration.between(createdAt, closedAt).toNanos();
        return Math.max(0L, nanos);
    }
}

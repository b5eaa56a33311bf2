package com.phillippitts.livescribe.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void elapsedTimeCountsFromStart() {
        long start = System.nanoTime() - 5 * TimeUtils.NANOS_PER_MILLI;

        assertThat(TimeUtils.elapsedNanos(start)).isGreaterThanOrEqualTo(5 * TimeUtils.NANOS_PER_MILLI);
        assertThat(TimeUtils.elapsedMillis(start)).isGreaterThanOrEqualTo(5L);
    }

    @Test
    void lifetimeIsMeasuredBetweenInstants() {
        Instant created = Instant.parse("2026-03-01T10:00:00Z");

        assertThat(TimeUtils.lifetimeNanos(created, created.plusMillis(1500))).isEqualTo(1_500_000_000L);
    }

    @Test
    void lifetimeNeverNegativeWhenClockStepsBack() {
        Instant created = Instant.parse("2026-03-01T10:00:00Z");

        assertThat(TimeUtils.lifetimeNanos(created, created.minusSeconds(2))).isZero();
    }
}

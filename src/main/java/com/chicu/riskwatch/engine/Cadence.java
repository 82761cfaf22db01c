package com.chicu.riskwatch.engine;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * When a recurring task is next due, given the current instant.
 */
@FunctionalInterface
public interface Cadence {

    /** Strictly after {@code now}. */
    Instant nextAfter(Instant now);

    static Cadence every(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0, got " + interval);
        }
        return now -> now.plus(interval);
    }

    /** Every day at {@code at} local time in {@code zone}. */
    static Cadence daily(LocalTime at, ZoneId zone) {
        return now -> {
            ZonedDateTime local = now.atZone(zone);
            ZonedDateTime candidate = local.toLocalDate().atTime(at).atZone(zone);
            if (!candidate.toInstant().isAfter(now)) {
                candidate = local.toLocalDate().plusDays(1).atTime(at).atZone(zone);
            }
            return candidate.toInstant();
        };
    }
}

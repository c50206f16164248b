/* (C)2026 */
package com.ammann.traffic.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Closed time range used to scope store reads.
 *
 * @param from lower bound (inclusive), {@code null} for an unbounded (all-time) range
 * @param to   upper bound (inclusive)
 */
public record TimeRange(Instant from, Instant to) {

    public TimeRange {
        if (to == null) {
            throw new IllegalArgumentException("Upper bound is required");
        }
        if (from != null && from.isAfter(to)) {
            throw new IllegalArgumentException("Range start " + from + " is after end " + to);
        }
    }

    /**
     * Range covering everything up to and including {@code asOf}.
     */
    public static TimeRange allUntil(Instant asOf) {
        return new TimeRange(null, asOf);
    }

    /**
     * Range {@code [asOf - lookback, asOf]}, or all-time when {@code lookback} is {@code null}.
     */
    public static TimeRange trailing(Instant asOf, Duration lookback) {
        return lookback == null ? allUntil(asOf) : new TimeRange(asOf.minus(lookback), asOf);
    }

    public boolean isUnbounded() {
        return from == null;
    }

    public boolean contains(Instant instant) {
        return (from == null || !instant.isBefore(from)) && !instant.isAfter(to);
    }

    /**
     * Widens the lower bound by {@code warmUp} so trailing windows starting at
     * {@link #from()} see their full history.
     */
    public TimeRange extendedBack(Duration warmUp) {
        return from == null ? this : new TimeRange(from.minus(warmUp), to);
    }
}

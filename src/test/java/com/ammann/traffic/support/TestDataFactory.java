/* (C)2026 */
package com.ammann.traffic.support;

import com.ammann.traffic.model.AlertEvent;
import com.ammann.traffic.model.IntervalStat;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

public final class TestDataFactory {

    /** Reference instant used as "now" by unit tests. */
    public static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private TestDataFactory() {}

    public static Clock fixedClock() {
        return fixedClock(NOW);
    }

    public static Clock fixedClock(Instant now) {
        return Clock.fixed(now, ZoneOffset.UTC);
    }

    public static AlertEvent alert(Instant timestamp, String type, String src) {
        return AlertEvent.of(timestamp, type, src, "10.0.0.1", type + " from " + src);
    }

    public static AlertEvent alert(Instant timestamp, String type, String src, String dst, String details) {
        return AlertEvent.of(timestamp, type, src, dst, details);
    }

    /**
     * Alert {@code secondsBeforeNow} seconds before {@link #NOW}.
     */
    public static AlertEvent alertAgo(long secondsBeforeNow, String type, String src) {
        return alert(NOW.minusSeconds(secondsBeforeNow), type, src);
    }

    /**
     * One-minute bucket ending at {@code end} with only total packets and bytes set.
     */
    public static IntervalStat traffic(String host, Instant end, long packets, long bytes) {
        return stat(host, end.minus(Duration.ofMinutes(1)), end, packets, 0, 0, 0, 0, bytes);
    }

    /**
     * One-minute bucket ending at {@code end} with directional packet counts.
     */
    public static IntervalStat directional(String host, Instant end, long incoming, long outgoing) {
        return stat(host, end.minus(Duration.ofMinutes(1)), end, incoming + outgoing, incoming, outgoing,
                0, 0, 0);
    }

    /**
     * One-minute bucket ending at {@code end} with distinct source and port counts.
     */
    public static IntervalStat fanout(String host, Instant end, long uniqueSources, long uniquePorts) {
        return stat(host, end.minus(Duration.ofMinutes(1)), end, 100, 50, 50, uniqueSources, uniquePorts,
                6_400);
    }

    public static IntervalStat stat(String host,
                                    Instant start,
                                    Instant end,
                                    long total,
                                    long incoming,
                                    long outgoing,
                                    long uniqueSources,
                                    long uniquePorts,
                                    long bytes) {
        return new IntervalStat(null, start, end, host, total, incoming, outgoing, uniqueSources,
                uniquePorts, bytes);
    }
}

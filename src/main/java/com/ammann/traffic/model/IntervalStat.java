/* (C)2026 */
package com.ammann.traffic.model;

import com.ammann.traffic.exception.ValidationException;
import java.time.Instant;
import java.util.Comparator;

/**
 * Pre-aggregated traffic statistics for one host over one fixed-width interval bucket.
 *
 * <p>Buckets for the same host are contiguous and never overlap. The record is immutable
 * once written by the capture pipeline.
 *
 * @param id                 store-assigned identifier, {@code null} until appended
 * @param intervalStart      bucket start (inclusive)
 * @param intervalEnd        bucket end, strictly after {@code intervalStart}
 * @param hostKey            host the statistics describe
 * @param totalPackets       packets involving the host
 * @param incomingPackets    packets where the host is the destination
 * @param outgoingPackets    packets where the host is the source
 * @param uniqueSrcCount     distinct source addresses seen towards the host
 * @param uniqueDstPortCount distinct destination ports targeted
 * @param totalBytes         summed packet sizes in bytes
 */
public record IntervalStat(
        Long id,
        Instant intervalStart,
        Instant intervalEnd,
        String hostKey,
        long totalPackets,
        long incomingPackets,
        long outgoingPackets,
        long uniqueSrcCount,
        long uniqueDstPortCount,
        long totalBytes
) {
    /** Per-host order by bucket start. */
    public static final Comparator<IntervalStat> BY_HOST_THEN_START =
            Comparator.comparing(IntervalStat::hostKey)
                    .thenComparing(IntervalStat::intervalStart)
                    .thenComparing(IntervalStat::id, Comparator.nullsLast(Comparator.naturalOrder()));

    public IntervalStat {
        if (intervalStart == null || intervalEnd == null) {
            throw ValidationException.rejectedRecord("interval stat", "interval bounds are required");
        }
        if (!intervalStart.isBefore(intervalEnd)) {
            throw ValidationException.rejectedRecord("interval stat",
                    "interval_start " + intervalStart + " must be before interval_end " + intervalEnd);
        }
        if (hostKey == null || hostKey.isBlank()) {
            throw ValidationException.rejectedRecord("interval stat", "host key is required");
        }
        if (totalPackets < 0 || incomingPackets < 0 || outgoingPackets < 0
                || uniqueSrcCount < 0 || uniqueDstPortCount < 0 || totalBytes < 0) {
            throw ValidationException.rejectedRecord("interval stat",
                    "counters must be non-negative for host " + hostKey);
        }
    }

    public IntervalStat withId(long assignedId) {
        return new IntervalStat(assignedId, intervalStart, intervalEnd, hostKey, totalPackets,
                incomingPackets, outgoingPackets, uniqueSrcCount, uniqueDstPortCount, totalBytes);
    }

    /**
     * Whether this bucket shares any instant with {@code other} for the same host.
     * Touching buckets (one ends where the next starts) do not overlap.
     */
    public boolean overlaps(IntervalStat other) {
        return hostKey.equals(other.hostKey)
                && intervalStart.isBefore(other.intervalEnd)
                && other.intervalStart.isBefore(intervalEnd);
    }
}

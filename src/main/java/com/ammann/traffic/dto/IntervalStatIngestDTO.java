/* (C)2026 */
package com.ammann.traffic.dto;

import com.ammann.traffic.model.IntervalStat;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Per-host traffic bucket as posted by the capture pipeline. Omitted counters default to zero.
 */
@Schema(description = "Host interval statistics to append")
public record IntervalStatIngestDTO(
        @Schema(description = "Bucket start (inclusive)", required = true) Instant intervalStart,
        @Schema(description = "Bucket end (exclusive)", required = true) Instant intervalEnd,
        @Schema(description = "Host key", required = true) String hostKey,
        @Schema(description = "Packets involving the host") long totalPackets,
        @Schema(description = "Packets with the host as destination") long incomingPackets,
        @Schema(description = "Packets with the host as source") long outgoingPackets,
        @Schema(description = "Distinct source addresses seen") long uniqueSrcCount,
        @Schema(description = "Distinct destination ports seen") long uniqueDstPortCount,
        @Schema(description = "Bytes involving the host") long totalBytes
) {
    public IntervalStat toStat() {
        return new IntervalStat(null, intervalStart, intervalEnd, hostKey, totalPackets,
                incomingPackets, outgoingPackets, uniqueSrcCount, uniqueDstPortCount, totalBytes);
    }
}

/* (C)2026 */
package com.ammann.traffic.enumeration;

import com.ammann.traffic.model.IntervalStat;
import java.util.function.ToLongFunction;

/**
 * Numeric fields of an {@link IntervalStat} that detectors and aggregators can select.
 */
public enum IntervalMetric
{
    TOTAL_PACKETS(IntervalStat::totalPackets),
    INCOMING_PACKETS(IntervalStat::incomingPackets),
    OUTGOING_PACKETS(IntervalStat::outgoingPackets),
    UNIQUE_SOURCES(IntervalStat::uniqueSrcCount),
    UNIQUE_DST_PORTS(IntervalStat::uniqueDstPortCount),
    TOTAL_BYTES(IntervalStat::totalBytes);

    private final ToLongFunction<IntervalStat> extractor;

    IntervalMetric(ToLongFunction<IntervalStat> extractor)
    {
        this.extractor = extractor;
    }

    public long valueOf(IntervalStat stat)
    {
        return extractor.applyAsLong(stat);
    }

    public ToLongFunction<IntervalStat> extractor()
    {
        return extractor;
    }
}

/* (C)2026 */
package com.ammann.traffic.model;

import io.quarkus.hibernate.orm.panache.PanacheEntity;
import io.quarkus.hibernate.orm.panache.PanacheQuery;
import io.quarkus.panache.common.Sort;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

@Entity
@Table(name = HostStatEntity.TABLE_NAME, indexes = {
        @Index(name = "idx_host_stats_host_start", columnList = "host_key, interval_start"),
        @Index(name = "idx_host_stats_interval_end", columnList = "interval_end")
})
public class HostStatEntity extends PanacheEntity
{
    public static final String TABLE_NAME = "host_stats";

    public static final Sort BY_HOST_THEN_START = Sort.by("hostKey").and("intervalStart").and("id");

    @Column(name = "interval_start", nullable = false)
    @NotNull
    public Instant intervalStart;

    @Column(name = "interval_end", nullable = false)
    @NotNull
    public Instant intervalEnd;

    /**
     * Host the bucket describes. Could be an internal host or an external peer.
     */
    @Column(name = "host_key", nullable = false, length = 64)
    @NotNull
    public String hostKey;

    @Column(name = "total_packets", nullable = false)
    @Min(0)
    public long totalPackets;

    /**
     * Packets where this host is the destination.
     */
    @Column(name = "incoming_packets", nullable = false)
    @Min(0)
    public long incomingPackets;

    /**
     * Packets where this host is the source.
     */
    @Column(name = "outgoing_packets", nullable = false)
    @Min(0)
    public long outgoingPackets;

    @Column(name = "unique_src_count", nullable = false)
    @Min(0)
    public long uniqueSrcCount;

    /**
     * Distinct destination ports targeted, useful for scan detection.
     */
    @Column(name = "unique_dst_port_count", nullable = false)
    @Min(0)
    public long uniqueDstPortCount;

    @Column(name = "total_bytes", nullable = false)
    @Min(0)
    public long totalBytes;

    public HostStatEntity()
    {
    }

    public static HostStatEntity from(IntervalStat stat)
    {
        HostStatEntity entity = new HostStatEntity();
        entity.intervalStart = stat.intervalStart();
        entity.intervalEnd = stat.intervalEnd();
        entity.hostKey = stat.hostKey();
        entity.totalPackets = stat.totalPackets();
        entity.incomingPackets = stat.incomingPackets();
        entity.outgoingPackets = stat.outgoingPackets();
        entity.uniqueSrcCount = stat.uniqueSrcCount();
        entity.uniqueDstPortCount = stat.uniqueDstPortCount();
        entity.totalBytes = stat.totalBytes();
        return entity;
    }

    public IntervalStat toStat()
    {
        return new IntervalStat(id, intervalStart, intervalEnd, hostKey, totalPackets,
                incomingPackets, outgoingPackets, uniqueSrcCount, uniqueDstPortCount, totalBytes);
    }

    /**
     * Buckets whose end falls inside the range, grouped by host and ordered by start.
     */
    public static PanacheQuery<HostStatEntity> findEndingInRange(TimeRange range)
    {
        if (range.isUnbounded()) {
            return find("intervalEnd <= ?1", BY_HOST_THEN_START, range.to());
        }
        return find("intervalEnd >= ?1 AND intervalEnd <= ?2", BY_HOST_THEN_START, range.from(), range.to());
    }

    /**
     * Number of stored buckets for the host sharing any instant with {@code [start, end)}.
     */
    public static long countOverlapping(String hostKey, Instant start, Instant end)
    {
        return count("hostKey = ?1 AND intervalStart < ?2 AND intervalEnd > ?3", hostKey, end, start);
    }
}

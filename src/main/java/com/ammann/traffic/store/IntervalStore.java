/* (C)2026 */
package com.ammann.traffic.store;

import com.ammann.traffic.model.IntervalStat;
import com.ammann.traffic.model.TimeRange;
import java.util.List;

/**
 * Append-only access to per-host interval statistics.
 *
 * <p>Appending a bucket that overlaps an existing bucket of the same host is rejected.
 */
public interface IntervalStore {

    /**
     * Appends a bucket and returns it with its assigned id.
     *
     * @throws com.ammann.traffic.exception.ValidationException if the bucket overlaps a stored one
     */
    IntervalStat append(IntervalStat stat);

    /**
     * Buckets whose {@code interval_end} lies inside {@code range}, ordered by host then start.
     */
    List<IntervalStat> findEndingInRange(TimeRange range);

    long count();
}

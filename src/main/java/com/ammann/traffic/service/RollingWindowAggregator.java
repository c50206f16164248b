/* (C)2026 */
package com.ammann.traffic.service;

import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.ToLongFunction;
import org.jboss.logging.Logger;

/**
 * Trailing-window sums and counts over time-ordered records.
 *
 * <p>For every record at time {@code t} the aggregate covers all records with timestamp in
 * {@code [t - W, t]}. The lower bound is inclusive, and records sharing the timestamp
 * {@code t} are all part of the window, whatever their position in the sequence. The scan
 * keeps two monotonic cursors (a head that admits records up to {@code t} and a tail that
 * evicts records older than {@code t - W}) so a full materialization costs O(n) per key.
 */
@ApplicationScoped
public class RollingWindowAggregator
{
    private static final Logger LOG = Logger.getLogger(RollingWindowAggregator.class);

    /**
     * A record paired with the aggregate of the window ending at it.
     */
    public record WindowedValue<T>(T record, long value) {}

    /**
     * Rolling sum over a single time-ordered sequence.
     *
     * @param ordered      records in non-decreasing time order
     * @param timeOf       timestamp of a record
     * @param contribution amount a record adds to every window containing it
     * @param window       trailing window length, positive
     * @return one value per input record, in input order
     * @throws IllegalArgumentException if the records are not time-ordered
     */
    public <T> List<WindowedValue<T>> rollingSum(List<T> ordered,
                                                 Function<T, Instant> timeOf,
                                                 ToLongFunction<T> contribution,
                                                 Duration window)
    {
        ParameterChecks.requirePositive("window", window);

        int n = ordered.size();
        List<WindowedValue<T>> result = new ArrayList<>(n);
        long running = 0;
        int head = 0;
        int tail = 0;
        Instant previous = null;

        for (int i = 0; i < n; i++) {
            if ((i & QueryDeadline.CHECK_INTERVAL_MASK) == 0) {
                QueryDeadline.check();
            }

            T current = ordered.get(i);
            Instant t = timeOf.apply(current);
            if (previous != null && t.isBefore(previous)) {
                throw new IllegalArgumentException(
                        "Records must be in time order: " + t + " follows " + previous);
            }
            previous = t;

            while (head < n && !timeOf.apply(ordered.get(head)).isAfter(t)) {
                running += contribution.applyAsLong(ordered.get(head));
                head++;
            }

            Instant cutoff = t.minus(window);
            while (tail < head && timeOf.apply(ordered.get(tail)).isBefore(cutoff)) {
                running -= contribution.applyAsLong(ordered.get(tail));
                tail++;
            }

            result.add(new WindowedValue<>(current, running));
        }

        return result;
    }

    /**
     * Rolling count of records matching {@code qualifies}, evaluated at every record.
     */
    public <T> List<WindowedValue<T>> rollingCount(List<T> ordered,
                                                   Function<T, Instant> timeOf,
                                                   Predicate<T> qualifies,
                                                   Duration window)
    {
        return rollingSum(ordered, timeOf, record -> qualifies.test(record) ? 1L : 0L, window);
    }

    /**
     * Rolling sum computed independently for every key.
     *
     * @param records unordered records
     * @param keyOf   partition key, never {@code null}
     * @param order   time order within a key, including any tie-break
     * @return per-key results, keys ascending, each list in time order
     */
    public <T, K extends Comparable<? super K>> Map<K, List<WindowedValue<T>>> rollingSumByKey(
            Collection<T> records,
            Function<T, K> keyOf,
            Function<T, Instant> timeOf,
            Comparator<? super T> order,
            ToLongFunction<T> contribution,
            Duration window)
    {
        ParameterChecks.requirePositive("window", window);

        Map<K, List<T>> partitions = new TreeMap<>();
        for (T record : records) {
            K key = Objects.requireNonNull(keyOf.apply(record), "partition key");
            partitions.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
        }

        Map<K, List<WindowedValue<T>>> result = new LinkedHashMap<>();
        partitions.forEach((key, partition) -> {
            partition.sort(order);
            result.put(key, rollingSum(partition, timeOf, contribution, window));
        });

        LOG.debugf("Rolling window of %s over %d records in %d partitions",
                window, records.size(), partitions.size());
        return result;
    }
}

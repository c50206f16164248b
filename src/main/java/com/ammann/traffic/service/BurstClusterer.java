/* (C)2026 */
package com.ammann.traffic.service;

import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;
import org.jboss.logging.Logger;

/**
 * Groups per-key event sequences into bursts.
 *
 * <p>A burst is a maximal run of events from the same key in which no two consecutive
 * events are more than {@code gap} apart. A gap of exactly {@code gap} keeps the run open.
 * Only bursts with at least {@code minSize} events are reported, so an isolated event is
 * never a burst.
 */
@ApplicationScoped
public class BurstClusterer
{
    private static final Logger LOG = Logger.getLogger(BurstClusterer.class);

    /** Smallest meaningful burst. */
    public static final int MIN_BURST_SIZE = 2;

    /**
     * One qualifying burst.
     *
     * @param key   key every event of the burst shares
     * @param start timestamp of the first event
     * @param end   timestamp of the last event
     * @param count number of events
     */
    public record Burst<K>(K key, Instant start, Instant end, int count)
    {
        public Duration span()
        {
            return Duration.between(start, end);
        }
    }

    /**
     * Clusters events into bursts.
     *
     * @param events  events in any order
     * @param keyOf   partition key, never {@code null}
     * @param timeOf  event timestamp
     * @param order   time order within a key, including any tie-break
     * @param gap     largest allowed distance between consecutive events of a burst
     * @param minSize smallest reported burst, at least {@value #MIN_BURST_SIZE}
     * @return bursts ordered by start, then key
     */
    public <T, K extends Comparable<? super K>> List<Burst<K>> cluster(Collection<T> events,
                                                                       Function<T, K> keyOf,
                                                                       Function<T, Instant> timeOf,
                                                                       Comparator<? super T> order,
                                                                       Duration gap,
                                                                       int minSize)
    {
        ParameterChecks.requirePositive("gap", gap);
        ParameterChecks.requireBetween("minSize", minSize, MIN_BURST_SIZE, Integer.MAX_VALUE);

        Map<K, List<T>> partitions = new TreeMap<>();
        for (T event : events) {
            K key = Objects.requireNonNull(keyOf.apply(event), "partition key");
            partitions.computeIfAbsent(key, k -> new ArrayList<>()).add(event);
        }

        List<Burst<K>> bursts = new ArrayList<>();
        for (Map.Entry<K, List<T>> partition : partitions.entrySet()) {
            List<T> sequence = partition.getValue();
            sequence.sort(order);
            scanPartition(partition.getKey(), sequence, timeOf, gap, minSize, bursts);
        }

        bursts.sort(Comparator.comparing((Burst<K> b) -> b.start())
                .thenComparing(Burst::key));

        LOG.debugf("Clustered %d events from %d keys into %d bursts (gap=%s, minSize=%d)",
                events.size(), partitions.size(), bursts.size(), gap, minSize);
        return bursts;
    }

    private <T, K> void scanPartition(K key,
                                      List<T> sequence,
                                      Function<T, Instant> timeOf,
                                      Duration gap,
                                      int minSize,
                                      List<Burst<K>> sink)
    {
        Instant start = null;
        Instant last = null;
        int count = 0;

        for (int i = 0; i < sequence.size(); i++) {
            if ((i & QueryDeadline.CHECK_INTERVAL_MASK) == 0) {
                QueryDeadline.check();
            }

            Instant t = timeOf.apply(sequence.get(i));
            if (last == null || Duration.between(last, t).compareTo(gap) > 0) {
                emitIfQualifies(key, start, last, count, minSize, sink);
                start = t;
                count = 0;
            }
            last = t;
            count++;
        }

        emitIfQualifies(key, start, last, count, minSize, sink);
    }

    private <K> void emitIfQualifies(K key, Instant start, Instant end, int count, int minSize,
                                     List<Burst<K>> sink)
    {
        if (start != null && count >= minSize) {
            sink.add(new Burst<>(key, start, end, count));
        }
    }
}

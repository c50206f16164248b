/* (C)2026 */
package com.ammann.traffic.service;

import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Bounded top-K selection.
 *
 * <p>Keeps at most {@code k} candidates in a heap whose head is the weakest kept candidate,
 * so ranking {@code n} items costs O(n log k). Orders passed in must be total; every
 * convenience method here breaks value ties by key ascending so re-runs over identical
 * input return identical leaderboards.
 */
@ApplicationScoped
public class TopKRanker
{
    /**
     * One leaderboard row.
     *
     * @param rank  1-based position
     * @param key   ranked key
     * @param value aggregate the key was ranked by
     */
    public record Ranked<K>(int rank, K key, long value) {}

    /**
     * The best {@code k} items under {@code order}, best first.
     *
     * @param items candidates
     * @param order best-first total order
     * @param k     maximum number of results, positive
     */
    public <T> List<T> top(Collection<T> items, Comparator<? super T> order, int k)
    {
        ParameterChecks.requireBetween("limit", k, 1, Integer.MAX_VALUE);

        PriorityQueue<T> heap = new PriorityQueue<>(Math.min(k, Math.max(1, items.size())),
                order.reversed());
        int seen = 0;
        for (T item : items) {
            if ((seen++ & QueryDeadline.CHECK_INTERVAL_MASK) == 0) {
                QueryDeadline.check();
            }
            if (heap.size() < k) {
                heap.add(item);
            } else if (order.compare(item, heap.peek()) < 0) {
                heap.poll();
                heap.add(item);
            }
        }

        List<T> result = new ArrayList<>(heap);
        result.sort(order);
        return result;
    }

    /**
     * The {@code k} keys with the largest aggregate, value descending then key ascending.
     */
    public <K extends Comparable<? super K>> List<Ranked<K>> rankByValue(Map<K, Long> aggregates, int k)
    {
        Comparator<Map.Entry<K, Long>> order = Map.Entry.<K, Long>comparingByValue().reversed()
                .thenComparing(Map.Entry.<K, Long>comparingByKey());

        List<Map.Entry<K, Long>> winners = top(aggregates.entrySet(), order, k);

        List<Ranked<K>> ranked = new ArrayList<>(winners.size());
        for (int i = 0; i < winners.size(); i++) {
            Map.Entry<K, Long> entry = winners.get(i);
            ranked.add(new Ranked<>(i + 1, entry.getKey(), entry.getValue()));
        }
        return ranked;
    }
}

/* (C)2026 */
package com.ammann.traffic.service;

import com.ammann.traffic.enumeration.IntervalMetric;
import com.ammann.traffic.model.IntervalStat;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Flags step changes of a metric between consecutive intervals of the same host.
 *
 * <p>Each interval is compared with the host's immediately preceding interval by
 * {@code interval_start}. A host's first interval has nothing to compare to and is never
 * reported; it is not treated as a jump from zero.
 */
@ApplicationScoped
public class SpikeDetector
{
    private static final Logger LOG = Logger.getLogger(SpikeDetector.class);

    /**
     * A flagged pair of consecutive intervals.
     *
     * @param hostKey       host both intervals belong to
     * @param previous      earlier interval
     * @param current       later interval
     * @param previousValue metric value of {@code previous}
     * @param currentValue  metric value of {@code current}
     * @param delta         {@code currentValue - previousValue}
     */
    public record Spike(String hostKey,
                        IntervalStat previous,
                        IntervalStat current,
                        long previousValue,
                        long currentValue,
                        long delta) {}

    static final Comparator<Spike> LARGEST_FIRST =
            Comparator.comparingLong(Spike::delta).reversed()
                    .thenComparing(Spike::hostKey)
                    .thenComparing(spike -> spike.current().intervalStart());

    /**
     * Detects spikes.
     *
     * @param stats     interval statistics of any number of hosts, in any order
     * @param metric    field compared between consecutive intervals
     * @param threshold smallest reported delta, positive
     * @return spikes ordered by delta descending, then host, then interval start
     */
    public List<Spike> detect(Collection<IntervalStat> stats, IntervalMetric metric, long threshold)
    {
        ParameterChecks.requirePositive("threshold", threshold);

        List<IntervalStat> ordered = new ArrayList<>(stats);
        ordered.sort(IntervalStat.BY_HOST_THEN_START);

        List<Spike> spikes = new ArrayList<>();
        IntervalStat previous = null;

        for (int i = 0; i < ordered.size(); i++) {
            if ((i & QueryDeadline.CHECK_INTERVAL_MASK) == 0) {
                QueryDeadline.check();
            }

            IntervalStat current = ordered.get(i);
            if (previous != null && previous.hostKey().equals(current.hostKey())) {
                long previousValue = metric.valueOf(previous);
                long currentValue = metric.valueOf(current);
                long delta = currentValue - previousValue;
                if (delta >= threshold) {
                    spikes.add(new Spike(current.hostKey(), previous, current,
                            previousValue, currentValue, delta));
                }
            }
            previous = current;
        }

        spikes.sort(LARGEST_FIRST);

        LOG.debugf("Detected %d %s spikes >= %d across %d intervals",
                spikes.size(), metric, threshold, ordered.size());
        return spikes;
    }
}

/* (C)2026 */
package com.ammann.traffic.service;

import com.ammann.traffic.model.IntervalStat;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.jboss.logging.Logger;

/**
 * Outgoing/incoming packet ratio per host.
 *
 * <p>A host is flagged when {@code outgoing >= k * incoming}. A host with no incoming
 * traffic but some outgoing traffic has an undefined ratio, reported as
 * {@link #UNDEFINED_RATIO}, and is flagged for every {@code k}. Hosts with no traffic in
 * either direction are left out entirely.
 */
@ApplicationScoped
public class RatioDetector
{
    private static final Logger LOG = Logger.getLogger(RatioDetector.class);

    /** Sentinel ratio for hosts with outgoing but no incoming traffic. */
    public static final double UNDEFINED_RATIO = Double.POSITIVE_INFINITY;

    /**
     * Summed directional traffic of one host.
     */
    public record HostRatio(String hostKey, long incoming, long outgoing, double ratio, boolean flagged)
    {
        public boolean ratioUndefined()
        {
            return incoming == 0;
        }
    }

    static final Comparator<HostRatio> HIGHEST_FIRST =
            Comparator.comparingDouble(HostRatio::ratio).reversed()
                    .thenComparing(HostRatio::hostKey);

    /**
     * Ratios of every active host.
     *
     * @param stats      interval statistics already restricted to the window of interest
     * @param multiplier {@code k}, positive and finite
     * @return ratios ordered highest first (undefined ratios lead), ties by host key
     */
    public List<HostRatio> computeRatios(Collection<IntervalStat> stats, double multiplier)
    {
        ParameterChecks.requirePositiveFinite("multiplier", multiplier);

        Map<String, long[]> totals = new TreeMap<>();
        int seen = 0;
        for (IntervalStat stat : stats) {
            if ((seen++ & QueryDeadline.CHECK_INTERVAL_MASK) == 0) {
                QueryDeadline.check();
            }
            long[] sums = totals.computeIfAbsent(stat.hostKey(), k -> new long[2]);
            sums[0] += stat.incomingPackets();
            sums[1] += stat.outgoingPackets();
        }

        List<HostRatio> ratios = new ArrayList<>();
        totals.forEach((host, sums) -> {
            long incoming = sums[0];
            long outgoing = sums[1];
            if (incoming == 0 && outgoing == 0) {
                return;
            }
            double ratio = incoming == 0 ? UNDEFINED_RATIO : (double) outgoing / incoming;
            boolean flagged = (double) outgoing >= multiplier * incoming;
            ratios.add(new HostRatio(host, incoming, outgoing, ratio, flagged));
        });

        ratios.sort(HIGHEST_FIRST);
        return ratios;
    }

    /**
     * Only the hosts at or above {@code multiplier}.
     */
    public List<HostRatio> flagged(Collection<IntervalStat> stats, double multiplier)
    {
        List<HostRatio> flagged = computeRatios(stats, multiplier).stream()
                .filter(HostRatio::flagged)
                .toList();

        LOG.debugf("%d hosts with outgoing >= %.2f x incoming", Integer.valueOf(flagged.size()), Double.valueOf(multiplier));
        return flagged;
    }
}

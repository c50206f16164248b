/* (C)2026 */
package com.ammann.traffic.service;

import com.ammann.traffic.dto.AlertBucketCountDTO;
import com.ammann.traffic.dto.AlertGapStatsDTO;
import com.ammann.traffic.dto.AlertPairDTO;
import com.ammann.traffic.dto.AlertSummaryDTO;
import com.ammann.traffic.dto.AlertWindowCountsDTO;
import com.ammann.traffic.dto.AvgPacketSizeDTO;
import com.ammann.traffic.dto.BandwidthLeaderDTO;
import com.ammann.traffic.dto.FloodAlertDTO;
import com.ammann.traffic.dto.HeavyOutgoingHostDTO;
import com.ammann.traffic.dto.PortFanoutDTO;
import com.ammann.traffic.dto.QuietPeriodDTO;
import com.ammann.traffic.dto.RollingAlertCountDTO;
import com.ammann.traffic.dto.RollingPacketTotalDTO;
import com.ammann.traffic.dto.RollingTotalPointDTO;
import com.ammann.traffic.dto.ScanBurstDTO;
import com.ammann.traffic.dto.SourceAlertSummaryDTO;
import com.ammann.traffic.dto.SourceSpikeDTO;
import com.ammann.traffic.dto.TargetHitsDTO;
import com.ammann.traffic.dto.TrafficHeatmapCellDTO;
import com.ammann.traffic.enumeration.IntervalMetric;
import com.ammann.traffic.exception.ValidationException;
import com.ammann.traffic.model.AlertEvent;
import com.ammann.traffic.model.IntervalStat;
import com.ammann.traffic.model.TimeRange;
import com.ammann.traffic.service.BurstClusterer.Burst;
import com.ammann.traffic.service.RatioDetector.HostRatio;
import com.ammann.traffic.service.RollingWindowAggregator.WindowedValue;
import com.ammann.traffic.service.SpikeDetector.Spike;
import com.ammann.traffic.service.TopKRanker.Ranked;
import com.ammann.traffic.store.AlertStore;
import com.ammann.traffic.store.IntervalStore;
import io.quarkus.cache.CacheResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jboss.logging.Logger;

/**
 * Named analytics views over the alert and interval stores.
 *
 * <p>Every view validates its parameters before touching a store, fixes its reference
 * instant once from the injected {@link Clock}, reads the rows it needs and delegates the
 * windowing, clustering, detection and ranking to the shared components. Views never write,
 * so concurrent calls do not interfere and a failed call leaves nothing behind.
 *
 * <p>Where a view evaluates trailing windows inside a lookback period, rows from
 * {@code lookbackStart - window} onward are loaded so the first emitted windows are complete,
 * but only rows inside the lookback are returned.
 */
@ApplicationScoped
public class AnalyticsService
{
    private static final Logger LOG = Logger.getLogger(AnalyticsService.class);

    /** Key substituted for alerts without a source or destination. */
    public static final String UNKNOWN_KEY = "unknown";

    public static final String PORT_SCAN = "Port Scan";
    public static final String DDOS = "DDoS";

    public static final int MAX_RECENT_ALERTS = 1000;

    public static final int MAX_WINDOW_LOOKBACKS = 8;

    private static final Pattern FLOOD_PACKETS = Pattern.compile("(\\d+) packets");

    AlertStore alertStore;
    IntervalStore intervalStore;
    RollingWindowAggregator aggregator;
    BurstClusterer burstClusterer;
    SpikeDetector spikeDetector;
    RatioDetector ratioDetector;
    TopKRanker ranker;
    Clock clock;

    @Inject
    public AnalyticsService(AlertStore alertStore,
                            IntervalStore intervalStore,
                            RollingWindowAggregator aggregator,
                            BurstClusterer burstClusterer,
                            SpikeDetector spikeDetector,
                            RatioDetector ratioDetector,
                            TopKRanker ranker,
                            Clock clock)
    {
        this.alertStore = alertStore;
        this.intervalStore = intervalStore;
        this.aggregator = aggregator;
        this.burstClusterer = burstClusterer;
        this.spikeDetector = spikeDetector;
        this.ratioDetector = ratioDetector;
        this.ranker = ranker;
        this.clock = clock;
    }

    // ---------------------------------------------------------------- alert views

    /**
     * Alert counts per hour and type.
     *
     * @param lookback trailing period, {@code null} for all-time
     */
    public List<AlertBucketCountDTO> alertsByHour(Duration lookback)
    {
        return alertHistogram(Duration.ofHours(1), lookback);
    }

    /**
     * Alert counts per type in fixed buckets aligned to the epoch.
     *
     * @param bucket   bucket width, at least one millisecond
     * @param lookback trailing period, {@code null} for all-time
     * @return rows ordered by bucket, then type
     */
    public List<AlertBucketCountDTO> alertHistogram(Duration bucket, Duration lookback)
    {
        ParameterChecks.requirePositive("bucket", bucket);
        long bucketMillis = bucketMillis(bucket);
        ParameterChecks.requirePositiveOrAbsent("lookback", lookback);

        Instant asOf = clock.instant();
        LOG.debugf("Alert histogram: bucket=%s, lookback=%s, asOf=%s", bucket, lookback, asOf);

        Map<Instant, Map<String, Long>> counts = new TreeMap<>();
        for (AlertEvent alert : alertStore.findInRange(TimeRange.trailing(asOf, lookback))) {
            Instant start = Instant.ofEpochMilli(
                    Math.floorDiv(alert.timestamp().toEpochMilli(), bucketMillis) * bucketMillis);
            counts.computeIfAbsent(start, k -> new TreeMap<>()).merge(alert.alertType(), 1L, Long::sum);
        }

        List<AlertBucketCountDTO> rows = new ArrayList<>();
        counts.forEach((start, perType) ->
                perType.forEach((type, count) -> rows.add(new AlertBucketCountDTO(start, type, count))));
        return rows;
    }

    /**
     * Sources with the most alerts, with their port scan and DDoS share.
     *
     * @param limit    maximum number of sources
     * @param lookback trailing period, {@code null} for all-time
     */
    public List<SourceAlertSummaryDTO> topSources(int limit, Duration lookback)
    {
        ParameterChecks.requireBetween("limit", limit, 1, Integer.MAX_VALUE);
        ParameterChecks.requirePositiveOrAbsent("lookback", lookback);

        Instant asOf = clock.instant();
        Map<String, Long> totals = new HashMap<>();
        Map<String, long[]> breakdown = new HashMap<>();
        for (AlertEvent alert : alertStore.findInRange(TimeRange.trailing(asOf, lookback))) {
            String src = sourceOf(alert);
            totals.merge(src, 1L, Long::sum);
            long[] split = breakdown.computeIfAbsent(src, k -> new long[2]);
            if (alert.isType(PORT_SCAN)) {
                split[0]++;
            } else if (alert.isType(DDOS)) {
                split[1]++;
            }
        }

        List<SourceAlertSummaryDTO> rows = new ArrayList<>();
        for (Ranked<String> ranked : ranker.rankByValue(totals, limit)) {
            long[] split = breakdown.get(ranked.key());
            rows.add(new SourceAlertSummaryDTO(ranked.rank(), ranked.key(), ranked.value(), split[0], split[1]));
        }
        return rows;
    }

    /**
     * Alerts per type and source counted over each of several trailing periods, all ending at
     * the same instant. A pair is reported when it has at least one alert in the longest period.
     *
     * @param lookbacks distinct positive periods, at most {@value #MAX_WINDOW_LOOKBACKS}
     * @return rows by type, then source, each with one count per lookback in request order
     */
    public List<AlertWindowCountsDTO> alertCountsByWindow(List<Duration> lookbacks)
    {
        if (lookbacks == null || lookbacks.isEmpty() || lookbacks.size() > MAX_WINDOW_LOOKBACKS) {
            throw ValidationException.invalidParameter("lookback", lookbacks,
                    "between 1 and " + MAX_WINDOW_LOOKBACKS + " durations");
        }
        Duration longest = Duration.ZERO;
        for (Duration lookback : lookbacks) {
            ParameterChecks.requirePositive("lookback", lookback);
            if (lookback.compareTo(longest) > 0) {
                longest = lookback;
            }
        }
        if (Set.copyOf(lookbacks).size() != lookbacks.size()) {
            throw ValidationException.invalidParameter("lookback", lookbacks, "distinct durations");
        }

        Instant asOf = clock.instant();
        List<Instant> starts;
        try {
            starts = lookbacks.stream().map(lookback -> asOf.minus(lookback)).toList();
        } catch (DateTimeException e) {
            throw ValidationException.invalidParameter("lookback", longest, "period within the supported time range");
        }

        Map<String, Map<String, long[]>> counts = new TreeMap<>();
        for (AlertEvent alert : alertStore.findInRange(TimeRange.trailing(asOf, longest))) {
            long[] perLookback = counts.computeIfAbsent(alert.alertType(), k -> new TreeMap<>())
                    .computeIfAbsent(sourceOf(alert), k -> new long[lookbacks.size()]);
            for (int i = 0; i < starts.size(); i++) {
                if (!alert.timestamp().isBefore(starts.get(i))) {
                    perLookback[i]++;
                }
            }
        }

        List<AlertWindowCountsDTO> rows = new ArrayList<>();
        counts.forEach((type, perSource) -> perSource.forEach((src, perLookback) -> {
            Map<String, Long> byLookback = new LinkedHashMap<>();
            for (int i = 0; i < perLookback.length; i++) {
                byLookback.put(lookbacks.get(i).toString(), perLookback[i]);
            }
            rows.add(new AlertWindowCountsDTO(type, src, byLookback));
        }));
        return rows;
    }

    /**
     * Trailing-window count of {@code alertType} evaluated at every alert, whatever its type.
     *
     * @param alertType counted type
     * @param window    trailing window, inclusive at both ends
     * @param lookback  period whose alerts are reported
     * @return one row per alert inside the lookback, by time then id
     */
    @CacheResult(cacheName = "rolling-alert-count")
    public List<RollingAlertCountDTO> rollingAlertCount(String alertType, Duration window, Duration lookback)
    {
        ParameterChecks.requireNonBlank("alertType", alertType);
        ParameterChecks.requirePositive("window", window);
        ParameterChecks.requirePositive("lookback", lookback);

        Instant asOf = clock.instant();
        TimeRange range = TimeRange.trailing(asOf, lookback);
        LOG.debugf("Rolling alert count: type=%s, window=%s, range=%s", alertType, window, range);

        List<AlertEvent> alerts = alertStore.findInRange(range.extendedBack(window));

        List<RollingAlertCountDTO> rows = new ArrayList<>();
        for (WindowedValue<AlertEvent> point
                : aggregator.rollingCount(alerts, AlertEvent::timestamp, alert -> alert.isType(alertType), window)) {
            AlertEvent alert = point.record();
            if (range.contains(alert.timestamp())) {
                rows.add(new RollingAlertCountDTO(alert.id(), alert.timestamp(), alert.alertType(), point.value()));
            }
        }
        return rows;
    }

    /**
     * Bursts of {@code alertType} alerts per source.
     *
     * @param gap     largest distance between consecutive alerts of one burst
     * @param minSize smallest reported burst, at least 2
     * @param lookback trailing period, {@code null} for all-time
     * @return bursts by start, then source
     */
    public List<ScanBurstDTO> scanBursts(String alertType, Duration gap, int minSize, Duration lookback)
    {
        ParameterChecks.requireNonBlank("alertType", alertType);
        ParameterChecks.requirePositive("gap", gap);
        ParameterChecks.requireBetween("minSize", minSize, BurstClusterer.MIN_BURST_SIZE, Integer.MAX_VALUE);
        ParameterChecks.requirePositiveOrAbsent("lookback", lookback);

        Instant asOf = clock.instant();
        List<AlertEvent> typed = alertStore.findInRange(TimeRange.trailing(asOf, lookback)).stream()
                .filter(alert -> alert.isType(alertType))
                .toList();

        List<Burst<String>> bursts = burstClusterer.cluster(typed, AnalyticsService::sourceOf,
                AlertEvent::timestamp, AlertEvent.CHRONOLOGICAL, gap, minSize);

        return bursts.stream()
                .map(b -> new ScanBurstDTO(b.key(), b.start(), b.end(), b.count()))
                .toList();
    }

    /**
     * Stretches of at least {@code minSilence} without any alert.
     *
     * @return gaps by length descending, then start
     */
    public List<QuietPeriodDTO> quietPeriods(Duration minSilence, Duration lookback)
    {
        ParameterChecks.requirePositive("minSilence", minSilence);
        ParameterChecks.requirePositiveOrAbsent("lookback", lookback);

        Instant asOf = clock.instant();
        List<AlertEvent> alerts = alertStore.findInRange(TimeRange.trailing(asOf, lookback));

        List<QuietPeriodDTO> rows = new ArrayList<>();
        for (int i = 1; i < alerts.size(); i++) {
            if ((i & QueryDeadline.CHECK_INTERVAL_MASK) == 0) {
                QueryDeadline.check();
            }
            Instant previous = alerts.get(i - 1).timestamp();
            Instant current = alerts.get(i).timestamp();
            Duration silence = Duration.between(previous, current);
            if (silence.compareTo(minSilence) >= 0) {
                rows.add(new QuietPeriodDTO(previous, current, silence.getSeconds()));
            }
        }

        rows.sort(Comparator.comparingLong(QuietPeriodDTO::silenceSeconds).reversed()
                .thenComparing(QuietPeriodDTO::gapStart));
        return rows;
    }

    /**
     * Mean time between consecutive alerts of each type, followed by the mean over the merged
     * stream of all types. Types with a single alert have no gap and are left out.
     */
    public List<AlertGapStatsDTO> alertGapStats(Duration lookback)
    {
        ParameterChecks.requirePositiveOrAbsent("lookback", lookback);

        Instant asOf = clock.instant();
        List<AlertEvent> alerts = alertStore.findInRange(TimeRange.trailing(asOf, lookback));

        Map<String, Instant> lastSeen = new HashMap<>();
        Map<String, long[]> perType = new TreeMap<>();
        long[] overall = new long[2];
        Instant previous = null;

        for (AlertEvent alert : alerts) {
            Instant t = alert.timestamp();
            Instant previousOfType = lastSeen.put(alert.alertType(), t);
            if (previousOfType != null) {
                long[] sums = perType.computeIfAbsent(alert.alertType(), k -> new long[2]);
                sums[0]++;
                sums[1] += Duration.between(previousOfType, t).toMillis();
            }
            if (previous != null) {
                overall[0]++;
                overall[1] += Duration.between(previous, t).toMillis();
            }
            previous = t;
        }

        List<AlertGapStatsDTO> rows = new ArrayList<>();
        perType.forEach((type, sums) -> rows.add(gapStats(type, sums)));
        if (overall[0] > 0) {
            rows.add(gapStats(AlertGapStatsDTO.ALL_TYPES, overall));
        }
        return rows;
    }

    /**
     * Destinations hit most often, per alert type.
     *
     * @return rows by hits descending, then destination, then type
     */
    public List<TargetHitsDTO> topTargets(int limit)
    {
        ParameterChecks.requireBetween("limit", limit, 1, Integer.MAX_VALUE);

        Map<String, Map<String, Long>> hits = new HashMap<>();
        for (AlertEvent alert : alertStore.findInRange(TimeRange.allUntil(clock.instant()))) {
            hits.computeIfAbsent(destinationOf(alert), k -> new HashMap<>())
                    .merge(alert.alertType(), 1L, Long::sum);
        }

        List<TargetHitsDTO> candidates = new ArrayList<>();
        hits.forEach((dst, perType) ->
                perType.forEach((type, count) -> candidates.add(new TargetHitsDTO(dst, type, count))));

        Comparator<TargetHitsDTO> order = Comparator.comparingLong(TargetHitsDTO::hits).reversed()
                .thenComparing(TargetHitsDTO::dstKey)
                .thenComparing(TargetHitsDTO::alertType);
        return ranker.top(candidates, order, limit);
    }

    /**
     * Source/destination pairs with the most alerts and the alert types seen for each.
     */
    public List<AlertPairDTO> topPairs(int limit)
    {
        ParameterChecks.requireBetween("limit", limit, 1, Integer.MAX_VALUE);

        Map<PairKey, PairTally> pairs = new HashMap<>();
        for (AlertEvent alert : alertStore.findInRange(TimeRange.allUntil(clock.instant()))) {
            PairTally tally = pairs.computeIfAbsent(
                    new PairKey(sourceOf(alert), destinationOf(alert)), k -> new PairTally());
            tally.alerts++;
            tally.types.add(alert.alertType());
        }

        List<AlertPairDTO> candidates = new ArrayList<>(pairs.size());
        pairs.forEach((key, tally) -> candidates.add(
                new AlertPairDTO(key.src(), key.dst(), tally.alerts, List.copyOf(tally.types))));

        Comparator<AlertPairDTO> order = Comparator.comparingLong(AlertPairDTO::pairAlerts).reversed()
                .thenComparing(AlertPairDTO::srcKey)
                .thenComparing(AlertPairDTO::dstKey);
        return ranker.top(candidates, order, limit);
    }

    /**
     * Flood alerts with the largest packet count reported in their details. Alerts whose
     * details carry no {@code "<n> packets"} figure are skipped.
     */
    public List<FloodAlertDTO> heaviestFloods(String alertType, int limit)
    {
        ParameterChecks.requireNonBlank("alertType", alertType);
        ParameterChecks.requireBetween("limit", limit, 1, Integer.MAX_VALUE);

        List<FloodAlertDTO> candidates = new ArrayList<>();
        int skipped = 0;
        for (AlertEvent alert : alertStore.findInRange(TimeRange.allUntil(clock.instant()))) {
            if (!alert.isType(alertType)) {
                continue;
            }
            Long packets = packetCountOf(alert.details());
            if (packets == null) {
                skipped++;
                continue;
            }
            candidates.add(new FloodAlertDTO(alert.id(), sourceOf(alert), destinationOf(alert),
                    packets, alert.timestamp()));
        }
        if (skipped > 0) {
            LOG.debugf("Skipped %d %s alerts without a packet count", skipped, alertType);
        }

        Comparator<FloodAlertDTO> order = Comparator.comparingLong(FloodAlertDTO::packetCount).reversed()
                .thenComparing(FloodAlertDTO::alertId, Comparator.nullsLast(Comparator.naturalOrder()));
        return ranker.top(candidates, order, limit);
    }

    /**
     * The newest alerts, newest first.
     */
    public List<AlertSummaryDTO> recentAlerts(int count)
    {
        ParameterChecks.requireBetween("count", count, 1, MAX_RECENT_ALERTS);

        return alertStore.findRecent(count).stream()
                .map(AlertSummaryDTO::from)
                .toList();
    }

    // ---------------------------------------------------------------- host views

    /**
     * Hosts moving the most bytes in the trailing window.
     */
    public List<BandwidthLeaderDTO> topBandwidth(Duration window, int limit)
    {
        ParameterChecks.requirePositive("window", window);
        ParameterChecks.requireBetween("limit", limit, 1, Integer.MAX_VALUE);

        Instant asOf = clock.instant();
        Map<String, Long> bytes = new HashMap<>();
        Map<String, Long> packets = new HashMap<>();
        for (IntervalStat stat : intervalStore.findEndingInRange(TimeRange.trailing(asOf, window))) {
            bytes.merge(stat.hostKey(), stat.totalBytes(), Long::sum);
            packets.merge(stat.hostKey(), stat.totalPackets(), Long::sum);
        }

        return ranker.rankByValue(bytes, limit).stream()
                .map(r -> new BandwidthLeaderDTO(r.rank(), r.key(), r.value(), packets.get(r.key())))
                .toList();
    }

    /**
     * All-time average packet size per host, largest first. Hosts without packets have no
     * average and come last.
     */
    public List<AvgPacketSizeDTO> avgPacketSizePerHost()
    {
        Map<String, long[]> totals = new HashMap<>();
        for (IntervalStat stat : intervalStore.findEndingInRange(TimeRange.allUntil(clock.instant()))) {
            long[] sums = totals.computeIfAbsent(stat.hostKey(), k -> new long[2]);
            sums[0] += stat.totalPackets();
            sums[1] += stat.totalBytes();
        }

        List<AvgPacketSizeDTO> rows = new ArrayList<>(totals.size());
        totals.forEach((host, sums) -> {
            Double average = sums[0] == 0 ? null : round((double) sums[1] / sums[0], 2);
            rows.add(new AvgPacketSizeDTO(host, average, sums[0], sums[1]));
        });

        rows.sort(Comparator.comparing(AvgPacketSizeDTO::avgPacketSizeBytes,
                        Comparator.nullsLast(Comparator.<Double>reverseOrder()))
                .thenComparing(AvgPacketSizeDTO::hostKey));
        return rows;
    }

    /**
     * Hosts whose outgoing packets reach {@code multiplier} times their incoming packets in the
     * trailing window. Hosts that received nothing but sent something are always included.
     */
    public List<HeavyOutgoingHostDTO> heavyOutgoingHosts(Duration window, double multiplier)
    {
        ParameterChecks.requirePositive("window", window);
        ParameterChecks.requirePositiveFinite("multiplier", multiplier);

        Instant asOf = clock.instant();
        List<IntervalStat> stats = intervalStore.findEndingInRange(TimeRange.trailing(asOf, window));

        List<HeavyOutgoingHostDTO> rows = new ArrayList<>();
        for (HostRatio ratio : ratioDetector.flagged(stats, multiplier)) {
            Double wireRatio = ratio.ratioUndefined() ? null : round(ratio.ratio(), 2);
            rows.add(new HeavyOutgoingHostDTO(ratio.hostKey(), ratio.incoming(), ratio.outgoing(),
                    wireRatio, ratio.ratioUndefined()));
        }
        return rows;
    }

    /**
     * Hosts with the widest destination-port fan-out in a single interval.
     *
     * @param minPorts smallest fan-out an interval needs to be considered
     * @return hosts by peak fan-out descending, then host; each row names its peak interval
     */
    public List<PortFanoutDTO> portFanout(long minPorts, Duration window, int limit)
    {
        ParameterChecks.requirePositive("minPorts", minPorts);
        ParameterChecks.requirePositive("window", window);
        ParameterChecks.requireBetween("limit", limit, 1, Integer.MAX_VALUE);

        Instant asOf = clock.instant();
        Map<String, IntervalStat> peaks = new HashMap<>();
        for (IntervalStat stat : intervalStore.findEndingInRange(TimeRange.trailing(asOf, window))) {
            if (stat.uniqueDstPortCount() < minPorts) {
                continue;
            }
            // stats arrive by host then start, so the earliest interval wins a tie
            IntervalStat peak = peaks.get(stat.hostKey());
            if (peak == null || stat.uniqueDstPortCount() > peak.uniqueDstPortCount()) {
                peaks.put(stat.hostKey(), stat);
            }
        }

        Comparator<IntervalStat> order = Comparator.comparingLong(IntervalStat::uniqueDstPortCount).reversed()
                .thenComparing(IntervalStat::hostKey);
        List<IntervalStat> winners = ranker.top(peaks.values(), order, limit);

        List<PortFanoutDTO> rows = new ArrayList<>(winners.size());
        for (int i = 0; i < winners.size(); i++) {
            IntervalStat peak = winners.get(i);
            rows.add(new PortFanoutDTO(i + 1, peak.hostKey(), peak.uniqueDstPortCount(),
                    peak.intervalStart(), peak.intervalEnd()));
        }
        return rows;
    }

    /**
     * Jumps of {@code metric} of at least {@code threshold} between consecutive intervals of a
     * host inside the trailing window.
     *
     * @return spikes by jump descending
     */
    public List<SourceSpikeDTO> newSourceSpikes(Duration window, long threshold, IntervalMetric metric)
    {
        ParameterChecks.requirePositive("window", window);
        ParameterChecks.requirePositive("threshold", threshold);
        if (metric == null) {
            throw ValidationException.invalidParameter("metric", null, "one of " + List.of(IntervalMetric.values()));
        }

        Instant asOf = clock.instant();
        List<IntervalStat> stats = intervalStore.findEndingInRange(TimeRange.trailing(asOf, window));

        List<SourceSpikeDTO> rows = new ArrayList<>();
        for (Spike spike : spikeDetector.detect(stats, metric, threshold)) {
            rows.add(new SourceSpikeDTO(spike.hostKey(), spike.current().intervalStart(),
                    spike.previous().intervalStart(), metric, spike.currentValue(),
                    spike.previousValue(), spike.delta()));
        }
        return rows;
    }

    /**
     * Trailing-window sum of {@code metric} per host, evaluated at every interval end inside
     * the lookback.
     *
     * @return rows by host, then interval end
     */
    @CacheResult(cacheName = "rolling-packet-total")
    public List<RollingPacketTotalDTO> rollingPacketTotal(Duration window, Duration lookback, IntervalMetric metric)
    {
        ParameterChecks.requirePositive("window", window);
        ParameterChecks.requirePositive("lookback", lookback);
        if (metric == null) {
            throw ValidationException.invalidParameter("metric", null, "one of " + List.of(IntervalMetric.values()));
        }

        return computeRollingTotals(clock.instant(), window, lookback, metric);
    }

    /**
     * Per-host rolling packet totals summed over all hosts at each interval end.
     */
    public List<RollingTotalPointDTO> rollingPacketTotalSeries(Duration window, Duration lookback)
    {
        ParameterChecks.requirePositive("window", window);
        ParameterChecks.requirePositive("lookback", lookback);

        Map<Instant, Long> series = new TreeMap<>();
        for (RollingPacketTotalDTO row : computeRollingTotals(clock.instant(), window, lookback, IntervalMetric.TOTAL_PACKETS)) {
            series.merge(row.intervalEnd(), row.windowTotal(), Long::sum);
        }

        List<RollingTotalPointDTO> points = new ArrayList<>(series.size());
        series.forEach((end, total) -> points.add(new RollingTotalPointDTO(end, total)));
        return points;
    }

    /**
     * Packets and bytes per host and hour of interval start.
     *
     * @return cells by hour descending, then packets descending, then host
     */
    public List<TrafficHeatmapCellDTO> trafficHeatmap(Duration lookback)
    {
        ParameterChecks.requirePositiveOrAbsent("lookback", lookback);

        Instant asOf = clock.instant();
        Map<Instant, Map<String, long[]>> cells = new HashMap<>();
        for (IntervalStat stat : intervalStore.findEndingInRange(TimeRange.trailing(asOf, lookback))) {
            long[] sums = cells.computeIfAbsent(stat.intervalStart().truncatedTo(ChronoUnit.HOURS), k -> new HashMap<>())
                    .computeIfAbsent(stat.hostKey(), k -> new long[2]);
            sums[0] += stat.totalPackets();
            sums[1] += stat.totalBytes();
        }

        List<TrafficHeatmapCellDTO> rows = new ArrayList<>();
        cells.forEach((hour, perHost) -> perHost.forEach((host, sums) ->
                rows.add(new TrafficHeatmapCellDTO(hour, host, sums[0], sums[1]))));

        rows.sort(Comparator.comparing(TrafficHeatmapCellDTO::hourBucket).reversed()
                .thenComparing(Comparator.comparingLong(TrafficHeatmapCellDTO::packets).reversed())
                .thenComparing(TrafficHeatmapCellDTO::hostKey));
        return rows;
    }

    // ---------------------------------------------------------------- helpers

    private List<RollingPacketTotalDTO> computeRollingTotals(Instant asOf,
                                                             Duration window,
                                                             Duration lookback,
                                                             IntervalMetric metric)
    {
        TimeRange range = TimeRange.trailing(asOf, lookback);
        LOG.debugf("Rolling %s total: window=%s, range=%s", metric, window, range);

        List<IntervalStat> stats = intervalStore.findEndingInRange(range.extendedBack(window));
        Map<String, List<WindowedValue<IntervalStat>>> perHost = aggregator.rollingSumByKey(stats,
                IntervalStat::hostKey, IntervalStat::intervalEnd, IntervalStat.BY_HOST_THEN_START,
                metric.extractor(), window);

        List<RollingPacketTotalDTO> rows = new ArrayList<>();
        perHost.forEach((host, points) -> {
            for (WindowedValue<IntervalStat> point : points) {
                Instant end = point.record().intervalEnd();
                if (range.contains(end)) {
                    rows.add(new RollingPacketTotalDTO(host, end, point.value()));
                }
            }
        });
        return rows;
    }

    private static AlertGapStatsDTO gapStats(String type, long[] sums)
    {
        return new AlertGapStatsDTO(type, sums[0], round(sums[1] / 1000.0 / sums[0], 1));
    }

    static Long packetCountOf(String details)
    {
        if (details == null) {
            return null;
        }
        Matcher matcher = FLOOD_PACKETS.matcher(details);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Long.parseLong(matcher.group(1));
        } catch (NumberFormatException e) {
            LOG.debugf("Packet count out of range in '%s'", details);
            return null;
        }
    }

    private static long bucketMillis(Duration bucket)
    {
        long millis;
        try {
            millis = bucket.toMillis();
        } catch (ArithmeticException e) {
            throw ValidationException.invalidParameter("bucket", bucket, "duration that fits in epoch milliseconds");
        }
        if (millis < 1) {
            throw ValidationException.invalidParameter("bucket", bucket, "at least 1 millisecond");
        }
        return millis;
    }

    static String sourceOf(AlertEvent alert)
    {
        return Objects.requireNonNullElse(alert.srcKey(), UNKNOWN_KEY);
    }

    static String destinationOf(AlertEvent alert)
    {
        return Objects.requireNonNullElse(alert.dstKey(), UNKNOWN_KEY);
    }

    private static double round(double value, int scale)
    {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    private record PairKey(String src, String dst) {}

    private static final class PairTally
    {
        long alerts;
        final SortedSet<String> types = new TreeSet<>();
    }
}

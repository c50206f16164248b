/* (C)2026 */
package com.ammann.traffic.config;

import com.ammann.traffic.enumeration.IntervalMetric;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Named defaults for every view parameter a caller may omit.
 *
 * <p>Properties live under {@code traffic.analytics.*}. An unset lookback means all-time.
 */
@ApplicationScoped
public class AnalyticsDefaults {

    @ConfigProperty(name = "traffic.analytics.view-timeout", defaultValue = "PT30S")
    Duration viewTimeout;

    @ConfigProperty(name = "traffic.analytics.alerts-by-hour.lookback", defaultValue = "PT24H")
    Duration alertsByHourLookback;

    @ConfigProperty(name = "traffic.analytics.alert-histogram.bucket", defaultValue = "PT1M")
    Duration histogramBucket;

    @ConfigProperty(name = "traffic.analytics.alert-histogram.lookback", defaultValue = "PT24H")
    Duration histogramLookback;

    @ConfigProperty(name = "traffic.analytics.alert-counts-by-window.short-lookback", defaultValue = "PT1H")
    Duration windowCountsShortLookback;

    @ConfigProperty(name = "traffic.analytics.alert-counts-by-window.medium-lookback", defaultValue = "PT12H")
    Duration windowCountsMediumLookback;

    @ConfigProperty(name = "traffic.analytics.alert-counts-by-window.long-lookback", defaultValue = "PT24H")
    Duration windowCountsLongLookback;

    @ConfigProperty(name = "traffic.analytics.top-sources.limit", defaultValue = "5")
    int topSourcesLimit;

    @ConfigProperty(name = "traffic.analytics.top-sources.lookback")
    Optional<Duration> topSourcesLookback;

    @ConfigProperty(name = "traffic.analytics.rolling-alert-count.alert-type", defaultValue = "DDoS")
    String rollingAlertType;

    @ConfigProperty(name = "traffic.analytics.rolling-alert-count.window", defaultValue = "PT10M")
    Duration rollingAlertWindow;

    @ConfigProperty(name = "traffic.analytics.rolling-alert-count.lookback", defaultValue = "PT24H")
    Duration rollingAlertLookback;

    @ConfigProperty(name = "traffic.analytics.scan-bursts.alert-type", defaultValue = "Port Scan")
    String scanBurstAlertType;

    @ConfigProperty(name = "traffic.analytics.scan-bursts.gap", defaultValue = "PT30S")
    Duration scanBurstGap;

    @ConfigProperty(name = "traffic.analytics.scan-bursts.min-size", defaultValue = "3")
    int scanBurstMinSize;

    @ConfigProperty(name = "traffic.analytics.scan-bursts.lookback")
    Optional<Duration> scanBurstLookback;

    @ConfigProperty(name = "traffic.analytics.top-bandwidth.window", defaultValue = "PT10M")
    Duration topBandwidthWindow;

    @ConfigProperty(name = "traffic.analytics.top-bandwidth.limit", defaultValue = "5")
    int topBandwidthLimit;

    @ConfigProperty(name = "traffic.analytics.heavy-outgoing.window", defaultValue = "PT1H")
    Duration heavyOutgoingWindow;

    @ConfigProperty(name = "traffic.analytics.heavy-outgoing.multiplier", defaultValue = "1.0")
    double heavyOutgoingMultiplier;

    @ConfigProperty(name = "traffic.analytics.port-fanout.min-ports", defaultValue = "10")
    long portFanoutMinPorts;

    @ConfigProperty(name = "traffic.analytics.port-fanout.window", defaultValue = "PT2H")
    Duration portFanoutWindow;

    @ConfigProperty(name = "traffic.analytics.port-fanout.limit", defaultValue = "10")
    int portFanoutLimit;

    @ConfigProperty(name = "traffic.analytics.source-spikes.window", defaultValue = "PT12H")
    Duration spikeWindow;

    @ConfigProperty(name = "traffic.analytics.source-spikes.threshold", defaultValue = "10")
    long spikeThreshold;

    @ConfigProperty(name = "traffic.analytics.source-spikes.metric", defaultValue = "UNIQUE_SOURCES")
    IntervalMetric spikeMetric;

    @ConfigProperty(name = "traffic.analytics.rolling-packet-total.window", defaultValue = "PT30M")
    Duration rollingPacketWindow;

    @ConfigProperty(name = "traffic.analytics.rolling-packet-total.lookback", defaultValue = "PT24H")
    Duration rollingPacketLookback;

    @ConfigProperty(name = "traffic.analytics.rolling-packet-total.metric", defaultValue = "TOTAL_PACKETS")
    IntervalMetric rollingPacketMetric;

    @ConfigProperty(name = "traffic.analytics.quiet-periods.min-silence", defaultValue = "PT10M")
    Duration quietMinSilence;

    @ConfigProperty(name = "traffic.analytics.top-targets.limit", defaultValue = "10")
    int topTargetsLimit;

    @ConfigProperty(name = "traffic.analytics.top-pairs.limit", defaultValue = "8")
    int topPairsLimit;

    @ConfigProperty(name = "traffic.analytics.heaviest-floods.alert-type", defaultValue = "DDoS")
    String floodAlertType;

    @ConfigProperty(name = "traffic.analytics.heaviest-floods.limit", defaultValue = "10")
    int floodLimit;

    @ConfigProperty(name = "traffic.analytics.traffic-heatmap.lookback", defaultValue = "PT24H")
    Duration heatmapLookback;

    @ConfigProperty(name = "traffic.analytics.recent-alerts.count", defaultValue = "10")
    int recentAlertsCount;

    public Duration viewTimeout() { return viewTimeout; }
    public Duration alertsByHourLookback() { return alertsByHourLookback; }
    public Duration histogramBucket() { return histogramBucket; }
    public Duration histogramLookback() { return histogramLookback; }

    public List<Duration> windowCountsLookbacks() {
        return List.of(windowCountsShortLookback, windowCountsMediumLookback, windowCountsLongLookback);
    }

    public int topSourcesLimit() { return topSourcesLimit; }
    public Duration topSourcesLookback() { return topSourcesLookback.orElse(null); }
    public String rollingAlertType() { return rollingAlertType; }
    public Duration rollingAlertWindow() { return rollingAlertWindow; }
    public Duration rollingAlertLookback() { return rollingAlertLookback; }
    public String scanBurstAlertType() { return scanBurstAlertType; }
    public Duration scanBurstGap() { return scanBurstGap; }
    public int scanBurstMinSize() { return scanBurstMinSize; }
    public Duration scanBurstLookback() { return scanBurstLookback.orElse(null); }
    public Duration topBandwidthWindow() { return topBandwidthWindow; }
    public int topBandwidthLimit() { return topBandwidthLimit; }
    public Duration heavyOutgoingWindow() { return heavyOutgoingWindow; }
    public double heavyOutgoingMultiplier() { return heavyOutgoingMultiplier; }
    public long portFanoutMinPorts() { return portFanoutMinPorts; }
    public Duration portFanoutWindow() { return portFanoutWindow; }
    public int portFanoutLimit() { return portFanoutLimit; }
    public Duration spikeWindow() { return spikeWindow; }
    public long spikeThreshold() { return spikeThreshold; }
    public IntervalMetric spikeMetric() { return spikeMetric; }
    public Duration rollingPacketWindow() { return rollingPacketWindow; }
    public Duration rollingPacketLookback() { return rollingPacketLookback; }
    public IntervalMetric rollingPacketMetric() { return rollingPacketMetric; }
    public Duration quietMinSilence() { return quietMinSilence; }
    public int topTargetsLimit() { return topTargetsLimit; }
    public int topPairsLimit() { return topPairsLimit; }
    public String floodAlertType() { return floodAlertType; }
    public int floodLimit() { return floodLimit; }
    public Duration heatmapLookback() { return heatmapLookback; }
    public int recentAlertsCount() { return recentAlertsCount; }
}

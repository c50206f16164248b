/* (C)2026 */
package com.ammann.traffic.resource;

import com.ammann.traffic.config.AnalyticsDefaults;
import com.ammann.traffic.dto.AlertBucketCountDTO;
import com.ammann.traffic.dto.AlertGapStatsDTO;
import com.ammann.traffic.dto.AlertPairDTO;
import com.ammann.traffic.dto.AlertWindowCountsDTO;
import com.ammann.traffic.dto.AlertSummaryDTO;
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
import com.ammann.traffic.properties.ApiProperties;
import com.ammann.traffic.service.AnalyticsService;
import com.ammann.traffic.service.ViewExecutionService;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.enums.SchemaType;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource exposing the named analytics views.
 *
 * <p>Durations are ISO-8601 ({@code PT30M}); omitted parameters fall back to the
 * {@code traffic.analytics.*} defaults. Every view runs on the view executor under
 * {@code timeoutMs}, and a view that does not finish in time answers 504.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Analytics API", description = "Windowed alert and host traffic analytics")
@Produces(MediaType.APPLICATION_JSON)
public class AnalyticsResource {

    private static final Logger LOG = Logger.getLogger(AnalyticsResource.class);

    @Inject AnalyticsService analyticsService;

    @Inject ViewExecutionService viewExecutionService;

    @Inject AnalyticsDefaults defaults;

    // ---------------------------------------------------------------- alerts

    @GET
    @Path(ApiProperties.Alerts.BY_HOUR)
    @Operation(summary = "Alerts per Hour", description = "Alert counts per hour and alert type.")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Hourly counts, hour ascending then type",
                content = @Content(schema = @Schema(type = SchemaType.ARRAY, implementation = AlertBucketCountDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid parameters"),
        @APIResponse(responseCode = "503", description = "Alert store unavailable"),
        @APIResponse(responseCode = "504", description = "View timed out")
    })
    public Response alertsByHour(
            @Parameter(description = "Trailing period (ISO-8601), default 24h") @QueryParam("lookback") String lookback,
            @Parameter(description = "Deadline in milliseconds") @QueryParam("timeoutMs") Long timeoutMs) {

        Duration period = durationOr("lookback", lookback, defaults.alertsByHourLookback());
        return run("AlertsByHour", timeoutMs, () -> analyticsService.alertsByHour(period));
    }

    @GET
    @Path(ApiProperties.Alerts.HISTOGRAM)
    @Operation(summary = "Alert Histogram", description = "Alert counts per type in fixed-width buckets.")
    @APIResponse(
            responseCode = "200",
            description = "Bucket counts, bucket ascending then type",
            content = @Content(schema = @Schema(type = SchemaType.ARRAY, implementation = AlertBucketCountDTO.class)))
    public Response alertHistogram(
            @Parameter(description = "Bucket width (ISO-8601), default 1 minute") @QueryParam("bucket") String bucket,
            @Parameter(description = "Trailing period (ISO-8601), default 24h") @QueryParam("lookback") String lookback,
            @Parameter(description = "Deadline in milliseconds") @QueryParam("timeoutMs") Long timeoutMs) {

        Duration width = durationOr("bucket", bucket, defaults.histogramBucket());
        Duration period = durationOr("lookback", lookback, defaults.histogramLookback());
        return run("AlertHistogram", timeoutMs, () -> analyticsService.alertHistogram(width, period));
    }

    @GET
    @Path(ApiProperties.Alerts.TOP_SOURCES)
    @Operation(summary = "Top Alert Sources", description = "Sources with the most alerts, with port scan and DDoS counts.")
    @APIResponse(
            responseCode = "200",
            description = "Sources by alert total descending, then source key",
            content = @Content(schema = @Schema(type = SchemaType.ARRAY, implementation = SourceAlertSummaryDTO.class)))
    public Response topSources(
            @Parameter(description = "Maximum number of sources, default 5") @QueryParam("limit") Integer limit,
            @Parameter(description = "Trailing period (ISO-8601), default all-time") @QueryParam("lookback") String lookback,
            @Parameter(description = "Deadline in milliseconds") @QueryParam("timeoutMs") Long timeoutMs) {

        int max = limit != null ? limit : defaults.topSourcesLimit();
        Duration period = durationOr("lookback", lookback, defaults.topSourcesLookback());
        return run("TopSources", timeoutMs, () -> analyticsService.topSources(max, period));
    }

    @GET
    @Path(ApiProperties.Alerts.COUNTS_BY_WINDOW)
    @Operation(summary = "Alert Counts by Window",
            description = "Alerts per type and source over several trailing periods ending now.")
    @APIResponse(
            responseCode = "200",
            description = "One row per type and source, type ascending then source",
            content = @Content(schema = @Schema(type = SchemaType.ARRAY, implementation = AlertWindowCountsDTO.class)))
    public Response alertCountsByWindow(
            @Parameter(description = "Trailing periods (ISO-8601), repeatable, default 1h, 12h and 24h") @QueryParam("lookback") List<String> lookbacks,
            @Parameter(description = "Deadline in milliseconds") @QueryParam("timeoutMs") Long timeoutMs) {

        List<Duration> periods = defaults.windowCountsLookbacks();
        if (lookbacks != null && !lookbacks.isEmpty()) {
            periods = new ArrayList<>(lookbacks.size());
            for (String lookback : lookbacks) {
                periods.add(durationOr("lookback", lookback, null));
            }
        }
        List<Duration> requested = periods;
        return run("AlertCountsByWindow", timeoutMs, () -> analyticsService.alertCountsByWindow(requested));
    }

    @GET
    @Path(ApiProperties.Alerts.ROLLING_COUNT)
    @Operation(summary = "Rolling Alert Count",
            description = "Count of one alert type in the trailing window, evaluated at every alert of any type.")
    @APIResponse(
            responseCode = "200",
            description = "One row per alert, time ascending then id",
            content = @Content(schema = @Schema(type = SchemaType.ARRAY, implementation = RollingAlertCountDTO.class)))
    public Response rollingAlertCount(
            @Parameter(description = "Alert type, default DDoS") @QueryParam("alertType") String alertType,
            @Parameter(description = "Trailing window (ISO-8601), default 10 minutes") @QueryParam("window") String window,
            @Parameter(description = "Reported period (ISO-8601), default 24h") @QueryParam("lookback") String lookback,
            @Parameter(description = "Deadline in milliseconds") @QueryParam("timeoutMs") Long timeoutMs) {

        String type = alertType != null ? alertType : defaults.rollingAlertType();
        Duration width = durationOr("window", window, defaults.rollingAlertWindow());
        Duration period = durationOr("lookback", lookback, defaults.rollingAlertLookback());
        return run("RollingAlertCount", timeoutMs, () -> analyticsService.rollingAlertCount(type, width, period));
    }

    @GET
    @Path(ApiProperties.Alerts.SCAN_BURSTS)
    @Operation(summary = "Scan Bursts",
            description = "Runs of alerts from one source where consecutive alerts are at most 'gap' apart.")
    @APIResponse(
            responseCode = "200",
            description = "Bursts by start ascending, then source",
            content = @Content(schema = @Schema(type = SchemaType.ARRAY, implementation = ScanBurstDTO.class)))
    public Response scanBursts(
            @Parameter(description = "Alert type, default 'Port Scan'") @QueryParam("alertType") String alertType,
            @Parameter(description = "Largest gap inside a burst (ISO-8601), default 30s") @QueryParam("gap") String gap,
            @Parameter(description = "Smallest reported burst, at least 2, default 3") @QueryParam("minSize") Integer minSize,
            @Parameter(description = "Trailing period (ISO-8601), default all-time") @QueryParam("lookback") String lookback,
            @Parameter(description = "Deadline in milliseconds") @QueryParam("timeoutMs") Long timeoutMs) {

        String type = alertType != null ? alertType : defaults.scanBurstAlertType();
        Duration maxGap = durationOr("gap", gap, defaults.scanBurstGap());
        int size = minSize != null ? minSize : defaults.scanBurstMinSize();
        Duration period = durationOr("lookback", lookback, defaults.scanBurstLookback());
        return run("ScanBursts", timeoutMs, () -> analyticsService.scanBursts(type, maxGap, size, period));
    }

    @GET
    @Path(ApiProperties.Alerts.QUIET_PERIODS)
    @Operation(summary = "Quiet Periods", description = "Gaps between consecutive alerts of at least 'minSilence'.")
    @APIResponse(
            responseCode = "200",
            description = "Gaps by length descending",
            content = @Content(schema = @Schema(type = SchemaType.ARRAY, implementation = QuietPeriodDTO.class)))
    public Response quietPeriods(
            @Parameter(description = "Shortest reported silence (ISO-8601), default 10 minutes") @QueryParam("minSilence") String minSilence,
            @Parameter(description = "Trailing period (ISO-8601), default all-time") @QueryParam("lookback") String lookback,
            @Parameter(description = "Deadline in milliseconds") @QueryParam("timeoutMs") Long timeoutMs) {

        Duration silence = durationOr("minSilence", minSilence, defaults.quietMinSilence());
        Duration period = durationOr("lookback", lookback, null);
        return run("QuietPeriods", timeoutMs, () -> analyticsService.quietPeriods(silence, period));
    }

    @GET
    @Path(ApiProperties.Alerts.GAP_STATS)
    @Operation(summary = "Alert Gap Statistics",
            description = "Mean time between consecutive alerts per type and over all types.")
    @APIResponse(
            responseCode = "200",
            description = "Per-type rows by type, then the ALL TYPES row",
            content = @Content(schema = @Schema(type = SchemaType.ARRAY, implementation = AlertGapStatsDTO.class)))
    public Response alertGapStats(
            @Parameter(description = "Trailing period (ISO-8601), default all-time") @QueryParam("lookback") String lookback,
            @Parameter(description = "Deadline in milliseconds") @QueryParam("timeoutMs") Long timeoutMs) {

        Duration period = durationOr("lookback", lookback, null);
        return run("AlertGapStats", timeoutMs, () -> analyticsService.alertGapStats(period));
    }

    @GET
    @Path(ApiProperties.Alerts.TOP_TARGETS)
    @Operation(summary = "Top Targets", description = "Destinations hit most often, per alert type.")
    @APIResponse(
            responseCode = "200",
            description = "Rows by hits descending",
            content = @Content(schema = @Schema(type = SchemaType.ARRAY, implementation = TargetHitsDTO.class)))
    public Response topTargets(
            @Parameter(description = "Maximum number of rows, default 10") @QueryParam("limit") Integer limit,
            @Parameter(description = "Deadline in milliseconds") @QueryParam("timeoutMs") Long timeoutMs) {

        int max = limit != null ? limit : defaults.topTargetsLimit();
        return run("TopTargets", timeoutMs, () -> analyticsService.topTargets(max));
    }

    @GET
    @Path(ApiProperties.Alerts.TOP_PAIRS)
    @Operation(summary = "Top Source/Destination Pairs",
            description = "Repeat offender and target pairs with the alert types seen.")
    @APIResponse(
            responseCode = "200",
            description = "Pairs by alert count descending",
            content = @Content(schema = @Schema(type = SchemaType.ARRAY, implementation = AlertPairDTO.class)))
    public Response topPairs(
            @Parameter(description = "Maximum number of pairs, default 8") @QueryParam("limit") Integer limit,
            @Parameter(description = "Deadline in milliseconds") @QueryParam("timeoutMs") Long timeoutMs) {

        int max = limit != null ? limit : defaults.topPairsLimit();
        return run("TopPairs", timeoutMs, () -> analyticsService.topPairs(max));
    }

    @GET
    @Path(ApiProperties.Alerts.HEAVIEST_FLOODS)
    @Operation(summary = "Heaviest Floods",
            description = "Flood alerts ranked by the packet count reported in their details.")
    @APIResponse(
            responseCode = "200",
            description = "Alerts by packet count descending",
            content = @Content(schema = @Schema(type = SchemaType.ARRAY, implementation = FloodAlertDTO.class)))
    public Response heaviestFloods(
            @Parameter(description = "Alert type, default DDoS") @QueryParam("alertType") String alertType,
            @Parameter(description = "Maximum number of alerts, default 10") @QueryParam("limit") Integer limit,
            @Parameter(description = "Deadline in milliseconds") @QueryParam("timeoutMs") Long timeoutMs) {

        String type = alertType != null ? alertType : defaults.floodAlertType();
        int max = limit != null ? limit : defaults.floodLimit();
        return run("HeaviestFloods", timeoutMs, () -> analyticsService.heaviestFloods(type, max));
    }

    @GET
    @Path(ApiProperties.Alerts.RECENT)
    @Operation(summary = "Recent Alerts", description = "The newest alerts, newest first.")
    @APIResponse(
            responseCode = "200",
            description = "Newest alerts",
            content = @Content(schema = @Schema(type = SchemaType.ARRAY, implementation = AlertSummaryDTO.class)))
    public Response recentAlerts(
            @Parameter(description = "Number of alerts (max 1000), default 10") @QueryParam("count") Integer count,
            @Parameter(description = "Deadline in milliseconds") @QueryParam("timeoutMs") Long timeoutMs) {

        int n = count != null ? count : defaults.recentAlertsCount();
        return run("RecentAlerts", timeoutMs, () -> analyticsService.recentAlerts(n));
    }

    // ---------------------------------------------------------------- hosts

    @GET
    @Path(ApiProperties.Hosts.TOP_BANDWIDTH)
    @Operation(summary = "Top Bandwidth", description = "Hosts moving the most bytes in the trailing window.")
    @APIResponse(
            responseCode = "200",
            description = "Hosts by bytes descending, then host key",
            content = @Content(schema = @Schema(type = SchemaType.ARRAY, implementation = BandwidthLeaderDTO.class)))
    public Response topBandwidth(
            @Parameter(description = "Trailing window (ISO-8601), default 10 minutes") @QueryParam("window") String window,
            @Parameter(description = "Maximum number of hosts, default 5") @QueryParam("limit") Integer limit,
            @Parameter(description = "Deadline in milliseconds") @QueryParam("timeoutMs") Long timeoutMs) {

        Duration width = durationOr("window", window, defaults.topBandwidthWindow());
        int max = limit != null ? limit : defaults.topBandwidthLimit();
        return run("TopBandwidth", timeoutMs, () -> analyticsService.topBandwidth(width, max));
    }

    @GET
    @Path(ApiProperties.Hosts.AVG_PACKET_SIZE)
    @Operation(summary = "Average Packet Size", description = "All-time average packet size per host.")
    @APIResponse(
            responseCode = "200",
            description = "Hosts by average descending, hosts without packets last",
            content = @Content(schema = @Schema(type = SchemaType.ARRAY, implementation = AvgPacketSizeDTO.class)))
    public Response avgPacketSize(
            @Parameter(description = "Deadline in milliseconds") @QueryParam("timeoutMs") Long timeoutMs) {

        return run("AvgPacketSizePerHost", timeoutMs, analyticsService::avgPacketSizePerHost);
    }

    @GET
    @Path(ApiProperties.Hosts.HEAVY_OUTGOING)
    @Operation(summary = "Heavy Outgoing Hosts",
            description = "Hosts whose outgoing packets reach 'multiplier' times their incoming packets.")
    @APIResponse(
            responseCode = "200",
            description = "Hosts by ratio descending, undefined ratios first",
            content = @Content(schema = @Schema(type = SchemaType.ARRAY, implementation = HeavyOutgoingHostDTO.class)))
    public Response heavyOutgoing(
            @Parameter(description = "Trailing window (ISO-8601), default 1 hour") @QueryParam("window") String window,
            @Parameter(description = "Ratio multiplier, default 1.0") @QueryParam("multiplier") Double multiplier,
            @Parameter(description = "Deadline in milliseconds") @QueryParam("timeoutMs") Long timeoutMs) {

        Duration width = durationOr("window", window, defaults.heavyOutgoingWindow());
        double k = multiplier != null ? multiplier : defaults.heavyOutgoingMultiplier();
        return run("HeavyOutgoingHosts", timeoutMs, () -> analyticsService.heavyOutgoingHosts(width, k));
    }

    @GET
    @Path(ApiProperties.Hosts.PORT_FANOUT)
    @Operation(summary = "Port Fan-out",
            description = "Hosts touching the most distinct destination ports in a single interval.")
    @APIResponse(
            responseCode = "200",
            description = "Hosts by peak port count descending, then host key",
            content = @Content(schema = @Schema(type = SchemaType.ARRAY, implementation = PortFanoutDTO.class)))
    public Response portFanout(
            @Parameter(description = "Smallest port count considered, default 10") @QueryParam("minPorts") Long minPorts,
            @Parameter(description = "Trailing window (ISO-8601), default 2 hours") @QueryParam("window") String window,
            @Parameter(description = "Maximum number of hosts, default 10") @QueryParam("limit") Integer limit,
            @Parameter(description = "Deadline in milliseconds") @QueryParam("timeoutMs") Long timeoutMs) {

        long ports = minPorts != null ? minPorts : defaults.portFanoutMinPorts();
        Duration width = durationOr("window", window, defaults.portFanoutWindow());
        int max = limit != null ? limit : defaults.portFanoutLimit();
        return run("PortFanout", timeoutMs, () -> analyticsService.portFanout(ports, width, max));
    }

    @GET
    @Path(ApiProperties.Hosts.SOURCE_SPIKES)
    @Operation(summary = "New Source Spikes",
            description = "Jumps of a metric between consecutive intervals of the same host.")
    @APIResponse(
            responseCode = "200",
            description = "Spikes by jump descending",
            content = @Content(schema = @Schema(type = SchemaType.ARRAY, implementation = SourceSpikeDTO.class)))
    public Response sourceSpikes(
            @Parameter(description = "Trailing window (ISO-8601), default 12 hours") @QueryParam("window") String window,
            @Parameter(description = "Smallest reported jump, default 10") @QueryParam("threshold") Long threshold,
            @Parameter(description = "Compared metric, default UNIQUE_SOURCES") @QueryParam("metric") String metric,
            @Parameter(description = "Deadline in milliseconds") @QueryParam("timeoutMs") Long timeoutMs) {

        Duration width = durationOr("window", window, defaults.spikeWindow());
        long min = threshold != null ? threshold : defaults.spikeThreshold();
        IntervalMetric compared = metricOr(metric, defaults.spikeMetric());
        return run("NewSourceSpikes", timeoutMs, () -> analyticsService.newSourceSpikes(width, min, compared));
    }

    @GET
    @Path(ApiProperties.Hosts.ROLLING_TOTAL)
    @Operation(summary = "Rolling Packet Total",
            description = "Trailing-window sum of a host metric at every interval end.")
    @APIResponse(
            responseCode = "200",
            description = "Rows by host, then interval end",
            content = @Content(schema = @Schema(type = SchemaType.ARRAY, implementation = RollingPacketTotalDTO.class)))
    public Response rollingTotal(
            @Parameter(description = "Trailing window (ISO-8601), default 30 minutes") @QueryParam("window") String window,
            @Parameter(description = "Reported period (ISO-8601), default 24h") @QueryParam("lookback") String lookback,
            @Parameter(description = "Summed metric, default TOTAL_PACKETS") @QueryParam("metric") String metric,
            @Parameter(description = "Deadline in milliseconds") @QueryParam("timeoutMs") Long timeoutMs) {

        Duration width = durationOr("window", window, defaults.rollingPacketWindow());
        Duration period = durationOr("lookback", lookback, defaults.rollingPacketLookback());
        IntervalMetric summed = metricOr(metric, defaults.rollingPacketMetric());
        return run("RollingPacketTotal", timeoutMs, () -> analyticsService.rollingPacketTotal(width, period, summed));
    }

    @GET
    @Path(ApiProperties.Hosts.ROLLING_TOTAL_SERIES)
    @Operation(summary = "Rolling Packet Total Series",
            description = "Per-host rolling packet totals summed over all hosts at each interval end.")
    @APIResponse(
            responseCode = "200",
            description = "Points by interval end",
            content = @Content(schema = @Schema(type = SchemaType.ARRAY, implementation = RollingTotalPointDTO.class)))
    public Response rollingTotalSeries(
            @Parameter(description = "Trailing window (ISO-8601), default 30 minutes") @QueryParam("window") String window,
            @Parameter(description = "Reported period (ISO-8601), default 24h") @QueryParam("lookback") String lookback,
            @Parameter(description = "Deadline in milliseconds") @QueryParam("timeoutMs") Long timeoutMs) {

        Duration width = durationOr("window", window, defaults.rollingPacketWindow());
        Duration period = durationOr("lookback", lookback, defaults.rollingPacketLookback());
        return run("RollingPacketTotalSeries", timeoutMs, () -> analyticsService.rollingPacketTotalSeries(width, period));
    }

    @GET
    @Path(ApiProperties.Hosts.HEATMAP)
    @Operation(summary = "Traffic Heatmap", description = "Packets and bytes per host and hour.")
    @APIResponse(
            responseCode = "200",
            description = "Cells by hour descending, then packets descending",
            content = @Content(schema = @Schema(type = SchemaType.ARRAY, implementation = TrafficHeatmapCellDTO.class)))
    public Response heatmap(
            @Parameter(description = "Trailing period (ISO-8601), default 24h") @QueryParam("lookback") String lookback,
            @Parameter(description = "Deadline in milliseconds") @QueryParam("timeoutMs") Long timeoutMs) {

        Duration period = durationOr("lookback", lookback, defaults.heatmapLookback());
        return run("TrafficHeatmap", timeoutMs, () -> analyticsService.trafficHeatmap(period));
    }

    // ---------------------------------------------------------------- helpers

    private Response run(String view, Long timeoutMs, Supplier<? extends List<?>> work) {
        Duration timeout = timeoutOr(timeoutMs);
        LOG.debugf("View request: %s (timeout %d ms)", view, timeout.toMillis());
        return Response.ok(viewExecutionService.execute(view, timeout, work)).build();
    }

    private Duration timeoutOr(Long timeoutMs) {
        if (timeoutMs == null) {
            return defaults.viewTimeout();
        }
        if (timeoutMs <= 0) {
            throw ValidationException.invalidParameter("timeoutMs", timeoutMs, "positive integer");
        }
        return Duration.ofMillis(timeoutMs);
    }

    static Duration durationOr(String name, String value, Duration fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Duration.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw ValidationException.invalidParameter(name, value, "ISO-8601 duration such as PT30M");
        }
    }

    static IntervalMetric metricOr(String value, IntervalMetric fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return IntervalMetric.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidParameter("metric", value,
                    "one of " + Arrays.toString(IntervalMetric.values()));
        }
    }
}

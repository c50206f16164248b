/* (C)2026 */
package com.ammann.traffic.service;

import static com.ammann.traffic.support.TestDataFactory.NOW;
import static com.ammann.traffic.support.TestDataFactory.alert;
import static com.ammann.traffic.support.TestDataFactory.alertAgo;
import static com.ammann.traffic.support.TestDataFactory.directional;
import static com.ammann.traffic.support.TestDataFactory.fanout;
import static com.ammann.traffic.support.TestDataFactory.traffic;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

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
import com.ammann.traffic.exception.InputUnavailableException;
import com.ammann.traffic.exception.ValidationException;
import com.ammann.traffic.model.AlertEvent;
import com.ammann.traffic.model.TimeRange;
import com.ammann.traffic.store.AlertStore;
import com.ammann.traffic.store.IntervalStore;
import com.ammann.traffic.support.InMemoryAlertStore;
import com.ammann.traffic.support.InMemoryIntervalStore;
import com.ammann.traffic.support.TestDataFactory;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AnalyticsServiceTest {

    private static final String DDOS = AnalyticsService.DDOS;
    private static final String SCAN = AnalyticsService.PORT_SCAN;

    private InMemoryAlertStore alerts;
    private InMemoryIntervalStore intervals;
    private AnalyticsService service;

    @BeforeEach
    void setUp() {
        alerts = new InMemoryAlertStore();
        intervals = new InMemoryIntervalStore();
        service = serviceOver(alerts, intervals);
    }

    private static AnalyticsService serviceOver(AlertStore alertStore, IntervalStore intervalStore) {
        return new AnalyticsService(alertStore, intervalStore, new RollingWindowAggregator(),
                new BurstClusterer(), new SpikeDetector(), new RatioDetector(), new TopKRanker(),
                TestDataFactory.fixedClock());
    }

    private static Instant minutesAgo(long minutes) {
        return NOW.minus(Duration.ofMinutes(minutes));
    }

    private void append(AlertEvent... events) {
        for (AlertEvent event : events) {
            alerts.append(event);
        }
    }

    @Nested
    class AlertViews {

        @Test
        void alertsByHourCountsPerHourAndType() {
            append(
                    alert(Instant.parse("2024-03-01T11:10:00Z"), DDOS, "a"),
                    alert(Instant.parse("2024-03-01T11:50:00Z"), DDOS, "b"),
                    alert(Instant.parse("2024-03-01T11:20:00Z"), SCAN, "a"),
                    alert(Instant.parse("2024-03-01T10:59:59Z"), DDOS, "a"),
                    alert(Instant.parse("2024-02-27T11:00:00Z"), DDOS, "old"));

            List<AlertBucketCountDTO> rows = service.alertsByHour(Duration.ofHours(24));

            assertThat(rows).containsExactly(
                    new AlertBucketCountDTO(Instant.parse("2024-03-01T10:00:00Z"), DDOS, 1),
                    new AlertBucketCountDTO(Instant.parse("2024-03-01T11:00:00Z"), DDOS, 2),
                    new AlertBucketCountDTO(Instant.parse("2024-03-01T11:00:00Z"), SCAN, 1));
        }

        @Test
        void alertHistogramAlignsBucketsToEpoch() {
            append(
                    alert(Instant.parse("2024-03-01T11:14:59Z"), DDOS, "a"),
                    alert(Instant.parse("2024-03-01T11:15:00Z"), DDOS, "a"));

            List<AlertBucketCountDTO> rows = service.alertHistogram(Duration.ofMinutes(15), null);

            assertThat(rows).extracting(AlertBucketCountDTO::bucketStart).containsExactly(
                    Instant.parse("2024-03-01T11:00:00Z"), Instant.parse("2024-03-01T11:15:00Z"));
        }

        @Test
        void topSourcesRanksByTotalWithTypeBreakdown() {
            append(
                    alertAgo(10, SCAN, "10.0.0.1"),
                    alertAgo(20, SCAN, "10.0.0.1"),
                    alertAgo(30, DDOS, "10.0.0.1"),
                    alertAgo(40, DDOS, "10.0.0.2"),
                    alertAgo(50, DDOS, "10.0.0.2"),
                    alertAgo(60, DDOS, "10.0.0.2"),
                    alertAgo(70, "Brute Force", "10.0.0.3"));

            List<SourceAlertSummaryDTO> rows = service.topSources(2, null);

            assertThat(rows).containsExactly(
                    new SourceAlertSummaryDTO(1, "10.0.0.1", 3, 2, 1),
                    new SourceAlertSummaryDTO(2, "10.0.0.2", 3, 0, 3));
        }

        @Test
        void alertCountsByWindowCountsEachPeriodPerTypeAndSource() {
            append(
                    alert(minutesAgo(30), DDOS, "10.0.0.7"),
                    alert(NOW.minus(Duration.ofHours(5)), DDOS, "10.0.0.7"),
                    alert(NOW.minus(Duration.ofHours(20)), DDOS, "10.0.0.7"),
                    alert(NOW.minus(Duration.ofHours(30)), DDOS, "10.0.0.7"),
                    alert(NOW.minus(Duration.ofHours(2)), SCAN, "10.0.0.3"),
                    alert(NOW.minus(Duration.ofHours(40)), SCAN, "10.0.0.4"));

            List<AlertWindowCountsDTO> rows = service.alertCountsByWindow(
                    List.of(Duration.ofHours(1), Duration.ofHours(12), Duration.ofHours(24)));

            assertThat(rows).containsExactly(
                    new AlertWindowCountsDTO(DDOS, "10.0.0.7", Map.of("PT1H", 1L, "PT12H", 2L, "PT24H", 3L)),
                    new AlertWindowCountsDTO(SCAN, "10.0.0.3", Map.of("PT1H", 0L, "PT12H", 1L, "PT24H", 1L)));
        }

        @Test
        void alertCountsByWindowKeepsRequestOrderAndInclusiveStart() {
            append(alert(NOW.minus(Duration.ofHours(1)), DDOS, "a"));

            List<AlertWindowCountsDTO> rows =
                    service.alertCountsByWindow(List.of(Duration.ofHours(24), Duration.ofHours(1)));

            assertThat(rows).singleElement().satisfies(row -> {
                assertThat(row.counts().keySet()).containsExactly("PT24H", "PT1H");
                assertThat(row.counts().values()).containsExactly(1L, 1L);
            });
        }

        @Test
        void alertsWithoutSourceAreGroupedUnderUnknown() {
            append(alert(minutesAgo(1), DDOS, null, null, "no src"));

            assertThat(service.topSources(5, null))
                    .extracting(SourceAlertSummaryDTO::srcKey)
                    .containsExactly(AnalyticsService.UNKNOWN_KEY);
        }

        @Test
        void rollingAlertCountIncludesWarmUpHistoryAndInclusiveLowerBound() {
            append(
                    alert(minutesAgo(65), DDOS, "a"),
                    alert(minutesAgo(58), DDOS, "a"),
                    alert(minutesAgo(56), SCAN, "a"),
                    alert(minutesAgo(55), DDOS, "a"));

            List<RollingAlertCountDTO> rows =
                    service.rollingAlertCount(DDOS, Duration.ofMinutes(10), Duration.ofHours(1));

            assertThat(rows).extracting(RollingAlertCountDTO::timestamp)
                    .containsExactly(minutesAgo(58), minutesAgo(56), minutesAgo(55));
            assertThat(rows).extracting(RollingAlertCountDTO::windowCount).containsExactly(2L, 2L, 3L);
            assertThat(rows).extracting(RollingAlertCountDTO::alertType).containsExactly(DDOS, SCAN, DDOS);
        }

        @Test
        void rollingAlertCountReportsEveryAlertButCountsOnlyRequestedType() {
            append(
                    alertAgo(300, DDOS, "a"),
                    alertAgo(200, SCAN, "b"),
                    alertAgo(100, DDOS, "a"));

            List<RollingAlertCountDTO> rows =
                    service.rollingAlertCount(DDOS, Duration.ofMinutes(10), Duration.ofHours(1));

            assertThat(rows).extracting(RollingAlertCountDTO::alertType).containsExactly(DDOS, SCAN, DDOS);
            assertThat(rows).extracting(RollingAlertCountDTO::windowCount).containsExactly(1L, 1L, 2L);
        }

        @Test
        void rollingAlertCountIsIdempotent() {
            append(alert(minutesAgo(5), DDOS, "a"), alert(minutesAgo(4), DDOS, "b"));

            var first = service.rollingAlertCount(DDOS, Duration.ofMinutes(10), Duration.ofHours(24));
            var second = service.rollingAlertCount(DDOS, Duration.ofMinutes(10), Duration.ofHours(24));

            assertThat(second).isEqualTo(first);
        }

        @Test
        void scanBurstsIgnoreRunsBelowMinimumSize() {
            Instant base = minutesAgo(60);
            for (long offset : new long[] {0, 10, 45, 50}) {
                append(alert(base.plusSeconds(offset), SCAN, "10.0.0.9"));
            }

            assertThat(service.scanBursts(SCAN, Duration.ofSeconds(30), 3, null)).isEmpty();
        }

        @Test
        void scanBurstsReportQualifyingRunsOfRequestedType() {
            Instant base = minutesAgo(60);
            for (long offset : new long[] {0, 10, 20}) {
                append(alert(base.plusSeconds(offset), SCAN, "10.0.0.9"));
            }
            append(alert(base.plusSeconds(15), DDOS, "10.0.0.9"));

            List<ScanBurstDTO> bursts = service.scanBursts(SCAN, Duration.ofSeconds(30), 3, null);

            assertThat(bursts).containsExactly(
                    new ScanBurstDTO("10.0.0.9", base, base.plusSeconds(20), 3));
        }

        @Test
        void quietPeriodsReportGapsAtOrAboveMinimum() {
            append(
                    alert(minutesAgo(100), DDOS, "a"),
                    alert(minutesAgo(95), DDOS, "a"),
                    alert(minutesAgo(60), SCAN, "b"),
                    alert(minutesAgo(59), DDOS, "a"),
                    alert(minutesAgo(49), DDOS, "a"));

            List<QuietPeriodDTO> rows = service.quietPeriods(Duration.ofMinutes(10), null);

            assertThat(rows).containsExactly(
                    new QuietPeriodDTO(minutesAgo(95), minutesAgo(60), 35 * 60),
                    new QuietPeriodDTO(minutesAgo(59), minutesAgo(49), 10 * 60));
        }

        @Test
        void alertGapStatsAveragePerTypeAndOverall() {
            Instant base = minutesAgo(10);
            append(
                    alert(base, DDOS, "a"),
                    alert(base.plusSeconds(5), SCAN, "b"),
                    alert(base.plusSeconds(10), DDOS, "a"),
                    alert(base.plusSeconds(30), DDOS, "a"));

            List<AlertGapStatsDTO> rows = service.alertGapStats(null);

            assertThat(rows).containsExactly(
                    new AlertGapStatsDTO(DDOS, 2, 15.0),
                    new AlertGapStatsDTO(AlertGapStatsDTO.ALL_TYPES, 3, 10.0));
        }

        @Test
        void topTargetsGroupByDestinationAndType() {
            append(
                    alert(minutesAgo(3), DDOS, "a", "web", null),
                    alert(minutesAgo(2), DDOS, "b", "web", null),
                    alert(minutesAgo(1), SCAN, "a", "web", null),
                    alert(minutesAgo(1), SCAN, "a", "db", null));

            List<TargetHitsDTO> rows = service.topTargets(10);

            assertThat(rows).containsExactly(
                    new TargetHitsDTO("web", DDOS, 2),
                    new TargetHitsDTO("db", SCAN, 1),
                    new TargetHitsDTO("web", SCAN, 1));
        }

        @Test
        void topPairsListDistinctTypesSorted() {
            append(
                    alert(minutesAgo(3), SCAN, "a", "web", null),
                    alert(minutesAgo(2), DDOS, "a", "web", null),
                    alert(minutesAgo(1), DDOS, "a", "web", null),
                    alert(minutesAgo(1), DDOS, "b", "web", null));

            List<AlertPairDTO> rows = service.topPairs(1);

            assertThat(rows).containsExactly(new AlertPairDTO("a", "web", 3, List.of(DDOS, SCAN)));
        }

        @Test
        void heaviestFloodsRankByReportedPacketCount() {
            append(
                    alert(minutesAgo(4), DDOS, "a", "web", "SYN flood with 300 packets in 5 seconds"),
                    alert(minutesAgo(3), DDOS, "b", "web", "SYN flood with 1200 packets in 5 seconds"),
                    alert(minutesAgo(2), DDOS, "c", "web", "flood, count unavailable"),
                    alert(minutesAgo(1), DDOS, "d", "web", "99999999999999999999 packets"),
                    alert(minutesAgo(1), SCAN, "e", "web", "5000 packets"));

            List<FloodAlertDTO> rows = service.heaviestFloods(DDOS, 10);

            assertThat(rows).extracting(FloodAlertDTO::packetCount).containsExactly(1200L, 300L);
            assertThat(rows).extracting(FloodAlertDTO::srcKey).containsExactly("b", "a");
        }

        @Test
        void recentAlertsAreNewestFirst() {
            append(alert(minutesAgo(3), DDOS, "a"), alert(minutesAgo(1), SCAN, "b"), alert(minutesAgo(2), DDOS, "c"));

            List<AlertSummaryDTO> rows = service.recentAlerts(2);

            assertThat(rows).extracting(AlertSummaryDTO::srcKey).containsExactly("b", "c");
        }

        @Test
        void recentAlertsBoundsCount() {
            assertThatThrownBy(() -> service.recentAlerts(0)).isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> service.recentAlerts(AnalyticsService.MAX_RECENT_ALERTS + 1))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    class HostViews {

        @Test
        void topBandwidthBoundsOrdersAndBreaksTies() {
            intervals.append(traffic("a", minutesAgo(5), 2, 200));
            intervals.append(traffic("a", minutesAgo(1), 3, 300));
            intervals.append(traffic("b", minutesAgo(2), 7, 500));
            intervals.append(traffic("c", minutesAgo(3), 1, 100));
            intervals.append(traffic("d", minutesAgo(11), 99, 9_999));

            List<BandwidthLeaderDTO> rows = service.topBandwidth(Duration.ofMinutes(10), 2);

            assertThat(rows).containsExactly(
                    new BandwidthLeaderDTO(1, "a", 500, 5),
                    new BandwidthLeaderDTO(2, "b", 500, 7));
        }

        @Test
        void topBandwidthIsIdempotent() {
            intervals.append(traffic("a", minutesAgo(5), 2, 200));
            intervals.append(traffic("b", minutesAgo(5), 2, 300));

            assertThat(service.topBandwidth(Duration.ofMinutes(10), 5))
                    .isEqualTo(service.topBandwidth(Duration.ofMinutes(10), 5));
        }

        @Test
        void avgPacketSizePutsHostsWithoutPacketsLast() {
            intervals.append(traffic("a", minutesAgo(5), 10, 1_000));
            intervals.append(traffic("b", minutesAgo(5), 3, 1_000));
            intervals.append(traffic("c", minutesAgo(5), 0, 0));

            List<AvgPacketSizeDTO> rows = service.avgPacketSizePerHost();

            assertThat(rows).containsExactly(
                    new AvgPacketSizeDTO("b", 333.33, 3, 1_000),
                    new AvgPacketSizeDTO("a", 100.0, 10, 1_000),
                    new AvgPacketSizeDTO("c", null, 0, 0));
        }

        @Test
        void heavyOutgoingReportsUndefinedRatioWithoutValue() {
            intervals.append(directional("x", minutesAgo(10), 0, 5));
            intervals.append(directional("y", minutesAgo(10), 10, 15));
            intervals.append(directional("z", minutesAgo(10), 10, 5));
            intervals.append(directional("idle", minutesAgo(10), 0, 0));

            List<HeavyOutgoingHostDTO> rows = service.heavyOutgoingHosts(Duration.ofHours(1), 1.0);

            assertThat(rows).containsExactly(
                    new HeavyOutgoingHostDTO("x", 0, 5, null, true),
                    new HeavyOutgoingHostDTO("y", 10, 15, 1.5, false));
        }

        @Test
        void portFanoutReportsEarliestPeakPerHost() {
            intervals.append(fanout("a", minutesAgo(30), 1, 12));
            intervals.append(fanout("a", minutesAgo(20), 1, 40));
            intervals.append(fanout("a", minutesAgo(10), 1, 40));
            intervals.append(fanout("b", minutesAgo(10), 1, 5));
            intervals.append(fanout("c", minutesAgo(5), 1, 40));

            List<PortFanoutDTO> rows = service.portFanout(10, Duration.ofHours(2), 10);

            assertThat(rows).containsExactly(
                    new PortFanoutDTO(1, "a", 40, minutesAgo(21), minutesAgo(20)),
                    new PortFanoutDTO(2, "c", 40, minutesAgo(6), minutesAgo(5)));
        }

        @Test
        void newSourceSpikesCompareWithPrecedingInterval() {
            intervals.append(fanout("h1", minutesAgo(3), 3, 0));
            intervals.append(fanout("h1", minutesAgo(2), 3, 0));
            intervals.append(fanout("h1", minutesAgo(1), 9, 0));

            List<SourceSpikeDTO> rows =
                    service.newSourceSpikes(Duration.ofHours(12), 5, IntervalMetric.UNIQUE_SOURCES);

            assertThat(rows).containsExactly(new SourceSpikeDTO("h1", minutesAgo(2), minutesAgo(3),
                    IntervalMetric.UNIQUE_SOURCES, 9, 3, 6));
        }

        @Test
        void newSourceSpikesIgnoreIntervalsBeforeWindow() {
            intervals.append(fanout("h1", minutesAgo(120), 0, 0));
            intervals.append(fanout("h1", minutesAgo(30), 50, 0));

            assertThat(service.newSourceSpikes(Duration.ofHours(1), 5, IntervalMetric.UNIQUE_SOURCES))
                    .isEmpty();
        }

        @Test
        void rollingPacketTotalWarmsUpBeforeLookback() {
            intervals.append(traffic("h", minutesAgo(70), 10, 0));
            intervals.append(traffic("h", minutesAgo(40), 20, 0));
            intervals.append(traffic("h", minutesAgo(30), 5, 0));
            intervals.append(traffic("h", minutesAgo(10), 1, 0));

            List<RollingPacketTotalDTO> rows = service.rollingPacketTotal(
                    Duration.ofMinutes(30), Duration.ofHours(1), IntervalMetric.TOTAL_PACKETS);

            assertThat(rows).containsExactly(
                    new RollingPacketTotalDTO("h", minutesAgo(40), 30),
                    new RollingPacketTotalDTO("h", minutesAgo(30), 25),
                    new RollingPacketTotalDTO("h", minutesAgo(10), 26));
        }

        @Test
        void rollingPacketTotalIsOrderedByHostThenEnd() {
            intervals.append(traffic("web", minutesAgo(2), 1, 0));
            intervals.append(traffic("db", minutesAgo(1), 1, 0));
            intervals.append(traffic("db", minutesAgo(3), 1, 0));

            assertThat(service.rollingPacketTotal(Duration.ofMinutes(30), Duration.ofHours(1),
                            IntervalMetric.TOTAL_PACKETS))
                    .extracting(RollingPacketTotalDTO::hostKey, RollingPacketTotalDTO::intervalEnd)
                    .containsExactly(
                            tuple("db", minutesAgo(3)),
                            tuple("db", minutesAgo(1)),
                            tuple("web", minutesAgo(2)));
        }

        @Test
        void rollingSeriesSumsHostsPerIntervalEnd() {
            intervals.append(traffic("a", minutesAgo(2), 4, 0));
            intervals.append(traffic("b", minutesAgo(2), 6, 0));
            intervals.append(traffic("a", minutesAgo(1), 1, 0));

            List<RollingTotalPointDTO> series =
                    service.rollingPacketTotalSeries(Duration.ofMinutes(30), Duration.ofHours(1));

            assertThat(series).containsExactly(
                    new RollingTotalPointDTO(minutesAgo(2), 10),
                    new RollingTotalPointDTO(minutesAgo(1), 5));
        }

        @Test
        void trafficHeatmapOrdersNewestHourFirstThenBusiestHost() {
            intervals.append(traffic("a", Instant.parse("2024-03-01T11:30:00Z"), 10, 100));
            intervals.append(traffic("b", Instant.parse("2024-03-01T11:45:00Z"), 50, 500));
            intervals.append(traffic("a", Instant.parse("2024-03-01T10:30:00Z"), 7, 70));

            List<TrafficHeatmapCellDTO> rows = service.trafficHeatmap(Duration.ofHours(24));

            assertThat(rows).containsExactly(
                    new TrafficHeatmapCellDTO(Instant.parse("2024-03-01T11:00:00Z"), "b", 50, 500),
                    new TrafficHeatmapCellDTO(Instant.parse("2024-03-01T11:00:00Z"), "a", 10, 100),
                    new TrafficHeatmapCellDTO(Instant.parse("2024-03-01T10:00:00Z"), "a", 7, 70));
        }

        @Test
        void emptyStoresYieldEmptyViews() {
            assertThat(service.topBandwidth(Duration.ofMinutes(10), 5)).isEmpty();
            assertThat(service.avgPacketSizePerHost()).isEmpty();
            assertThat(service.heavyOutgoingHosts(Duration.ofHours(1), 1.0)).isEmpty();
            assertThat(service.rollingPacketTotalSeries(Duration.ofMinutes(30), Duration.ofHours(1))).isEmpty();
        }
    }

    @Nested
    class Failures {

        @Test
        void invalidParametersFailBeforeAnyStoreRead() {
            AlertStore alertStore = mock(AlertStore.class);
            IntervalStore intervalStore = mock(IntervalStore.class);
            AnalyticsService guarded = serviceOver(alertStore, intervalStore);

            assertThatThrownBy(() -> guarded.scanBursts(SCAN, Duration.ofSeconds(30), 1, null))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> guarded.newSourceSpikes(Duration.ofHours(1), 0, IntervalMetric.UNIQUE_SOURCES))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> guarded.heavyOutgoingHosts(Duration.ofHours(1), -2.0))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> guarded.rollingAlertCount(DDOS, Duration.ZERO, Duration.ofHours(1)))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> guarded.topBandwidth(Duration.ofMinutes(10), 0))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> guarded.alertHistogram(Duration.ofNanos(10), null))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> guarded.rollingPacketTotal(Duration.ofMinutes(1), Duration.ofHours(1), null))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> guarded.alertCountsByWindow(List.of()))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> guarded.alertCountsByWindow(List.of(Duration.ofHours(1), Duration.ofHours(1))))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("distinct");
            assertThatThrownBy(() -> guarded.alertCountsByWindow(List.of(Duration.ofHours(1), Duration.ZERO)))
                    .isInstanceOf(ValidationException.class);

            verifyNoInteractions(alertStore, intervalStore);
        }

        @Test
        void bucketTooLargeForMillisecondsIsRejected() {
            AlertStore alertStore = mock(AlertStore.class);
            AnalyticsService guarded = serviceOver(alertStore, mock(IntervalStore.class));

            assertThatThrownBy(() -> guarded.alertHistogram(Duration.ofSeconds(Long.MAX_VALUE), null))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("bucket");
            verifyNoInteractions(alertStore);
        }

        @Test
        void storeFailurePropagatesInsteadOfEmptyResult() {
            AlertStore alertStore = mock(AlertStore.class);
            when(alertStore.findInRange(any(TimeRange.class)))
                    .thenThrow(new InputUnavailableException("Alert store", new IllegalStateException("down")));
            AnalyticsService failing = serviceOver(alertStore, mock(IntervalStore.class));

            assertThatThrownBy(() -> failing.topSources(5, null))
                    .isInstanceOf(InputUnavailableException.class)
                    .hasMessageContaining("Alert store unavailable");
        }
    }
}

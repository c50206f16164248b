/* (C)2026 */
package com.ammann.traffic.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.traffic.dto.AlertIngestDTO;
import com.ammann.traffic.dto.AlertWindowCountsDTO;
import com.ammann.traffic.dto.BandwidthLeaderDTO;
import com.ammann.traffic.dto.IntervalStatIngestDTO;
import com.ammann.traffic.dto.RollingAlertCountDTO;
import com.ammann.traffic.dto.SourceAlertSummaryDTO;
import com.ammann.traffic.enumeration.IntervalMetric;
import com.ammann.traffic.exception.ValidationException;
import com.ammann.traffic.model.AlertEntity;
import com.ammann.traffic.model.HostStatEntity;
import com.ammann.traffic.service.IngestionService;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.Response;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

@QuarkusTest
class AnalyticsResourceTest {

    @Inject AnalyticsResource resource;

    @Inject IngestionService ingestionService;

    private Instant now;

    @BeforeEach
    void cleanDatabase() {
        QuarkusTransaction.requiringNew().run(() -> {
            AlertEntity.deleteAll();
            HostStatEntity.deleteAll();
        });
        now = Instant.now().truncatedTo(ChronoUnit.MINUTES);
    }

    private void alerts(AlertIngestDTO... batch) {
        ingestionService.ingestAlerts(List.of(batch));
    }

    private AlertIngestDTO alert(long minutesAgo, String type, String src) {
        return new AlertIngestDTO(now.minus(Duration.ofMinutes(minutesAgo)), type, src, "10.0.0.1", null);
    }

    private IntervalStatIngestDTO bucket(String host, long minutesAgo, long packets, long bytes) {
        Instant end = now.minus(Duration.ofMinutes(minutesAgo));
        return new IntervalStatIngestDTO(end.minus(Duration.ofMinutes(1)), end, host,
                packets, packets / 2, packets - packets / 2, 1, 1, bytes);
    }

    @Test
    @SuppressWarnings("unchecked")
    void topSourcesRanksByAlertTotal() {
        alerts(alert(5, "Port Scan", "10.0.0.7"),
                alert(4, "DDoS", "10.0.0.7"),
                alert(3, "DDoS", "10.0.0.8"));

        Response response = resource.topSources(null, null, null);

        assertThat(response.getStatus()).isEqualTo(200);
        List<SourceAlertSummaryDTO> rows = (List<SourceAlertSummaryDTO>) response.getEntity();
        assertThat(rows).extracting(SourceAlertSummaryDTO::srcKey).containsExactly("10.0.0.7", "10.0.0.8");
        assertThat(rows.get(0).totalAlerts()).isEqualTo(2);
        assertThat(rows.get(0).portScans()).isEqualTo(1);
        assertThat(rows.get(0).ddosHits()).isEqualTo(1);
    }

    @Test
    @SuppressWarnings("unchecked")
    void rollingAlertCountUsesConfiguredDefaults() {
        alerts(alert(30, "DDoS", "a"),
                alert(25, "DDoS", "b"),
                alert(20, "DDoS", "c"),
                alert(22, "Port Scan", "d"));

        List<RollingAlertCountDTO> rows =
                (List<RollingAlertCountDTO>) resource.rollingAlertCount(null, null, null, null).getEntity();

        assertThat(rows).extracting(RollingAlertCountDTO::alertType).containsExactly("DDoS", "DDoS", "Port Scan", "DDoS");
        assertThat(rows).extracting(RollingAlertCountDTO::windowCount).containsExactly(1L, 2L, 2L, 3L);
    }

    @Test
    @SuppressWarnings("unchecked")
    void alertCountsByWindowUsesDefaultLookbacks() {
        alerts(alert(30, "DDoS", "10.0.0.7"),
                alert(5 * 60, "DDoS", "10.0.0.7"),
                alert(20 * 60, "Port Scan", "10.0.0.3"),
                alert(30 * 60, "Port Scan", "10.0.0.4"));

        List<AlertWindowCountsDTO> rows =
                (List<AlertWindowCountsDTO>) resource.alertCountsByWindow(null, null).getEntity();

        assertThat(rows).containsExactly(
                new AlertWindowCountsDTO("DDoS", "10.0.0.7", Map.of("PT1H", 1L, "PT12H", 2L, "PT24H", 2L)),
                new AlertWindowCountsDTO("Port Scan", "10.0.0.3", Map.of("PT1H", 0L, "PT12H", 0L, "PT24H", 1L)));
    }

    @Test
    void alertCountsByWindowRejectsMalformedLookback() {
        assertThatThrownBy(() -> resource.alertCountsByWindow(List.of("PT1H", "soon"), null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    void topBandwidthSumsRecentBuckets() {
        ingestionService.ingestIntervalStats(List.of(
                bucket("web", 1, 100, 10_000),
                bucket("web", 2, 100, 5_000),
                bucket("db", 1, 50, 20_000),
                bucket("old", 60, 999, 999_999)));

        List<BandwidthLeaderDTO> rows =
                (List<BandwidthLeaderDTO>) resource.topBandwidth(null, null, 5_000L).getEntity();

        assertThat(rows).extracting(BandwidthLeaderDTO::hostKey).containsExactly("db", "web");
        assertThat(rows.get(1).totalBytes()).isEqualTo(15_000);
    }

    @Test
    void emptyStoreGivesEmptyResult() {
        assertThat((List<?>) resource.heatmap(null, null).getEntity()).isEmpty();
        assertThat((List<?>) resource.recentAlerts(null, null).getEntity()).isEmpty();
    }

    @Test
    void invalidParametersAreRejected() {
        assertThatThrownBy(() -> resource.topSources(0, null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> resource.scanBursts(null, "thirty seconds", null, null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("gap");
        assertThatThrownBy(() -> resource.sourceSpikes(null, null, "JITTER", null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("metric");
        assertThatThrownBy(() -> resource.alertsByHour(null, 0L))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("timeoutMs");
    }

    @Test
    void durationParameterFallsBackWhenBlank() {
        assertThat(AnalyticsResource.durationOr("window", " ", Duration.ofMinutes(10)))
                .isEqualTo(Duration.ofMinutes(10));
        assertThat(AnalyticsResource.durationOr("window", "PT30M", Duration.ofMinutes(10)))
                .isEqualTo(Duration.ofMinutes(30));
    }

    @Test
    void metricParameterIsCaseInsensitive() {
        assertThat(AnalyticsResource.metricOr("total_bytes", IntervalMetric.TOTAL_PACKETS))
                .isEqualTo(IntervalMetric.TOTAL_BYTES);
        assertThat(AnalyticsResource.metricOr(null, IntervalMetric.TOTAL_PACKETS))
                .isEqualTo(IntervalMetric.TOTAL_PACKETS);
    }
}

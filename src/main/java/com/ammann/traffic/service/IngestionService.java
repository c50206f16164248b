/* (C)2026 */
package com.ammann.traffic.service;

import com.ammann.traffic.dto.AlertIngestDTO;
import com.ammann.traffic.dto.IngestResultDTO;
import com.ammann.traffic.dto.IntervalStatIngestDTO;
import com.ammann.traffic.exception.ValidationException;
import com.ammann.traffic.model.AlertEvent;
import com.ammann.traffic.model.IntervalStat;
import com.ammann.traffic.store.AlertStore;
import com.ammann.traffic.store.IntervalStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Batch append of alerts and interval statistics.
 *
 * <p>Every element of a batch is converted and validated before the first one is appended.
 * A batch runs in one transaction, so a bucket rejected for overlapping a stored one rolls
 * back the whole batch when the store is transactional.
 */
@ApplicationScoped
public class IngestionService {

    private static final Logger LOG = Logger.getLogger(IngestionService.class);

    static final String INGESTED_METRIC = "traffic.ingested";

    AlertStore alertStore;
    IntervalStore intervalStore;
    MeterRegistry meterRegistry;
    Duration intervalWidth;

    @Inject
    public IngestionService(AlertStore alertStore,
                            IntervalStore intervalStore,
                            MeterRegistry meterRegistry,
                            @ConfigProperty(name = "traffic.interval.width", defaultValue = "PT1M")
                            Duration intervalWidth) {
        this.alertStore = alertStore;
        this.intervalStore = intervalStore;
        this.meterRegistry = meterRegistry;
        this.intervalWidth = intervalWidth;
    }

    @Transactional
    public IngestResultDTO ingestAlerts(List<AlertIngestDTO> batch) {
        requireNonEmpty(batch);

        List<AlertEvent> events = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            events.add(requireElement(batch.get(i), i).toEvent());
        }

        List<Long> ids = new ArrayList<>(events.size());
        for (AlertEvent event : events) {
            ids.add(alertStore.append(event).id());
        }

        count("alert", ids.size());
        LOG.infof("Appended %d alerts", ids.size());
        return new IngestResultDTO("alert", ids.size(), ids);
    }

    @Transactional
    public IngestResultDTO ingestIntervalStats(List<IntervalStatIngestDTO> batch) {
        requireNonEmpty(batch);

        List<IntervalStat> stats = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            IntervalStat stat = requireElement(batch.get(i), i).toStat();
            Duration width = Duration.between(stat.intervalStart(), stat.intervalEnd());
            if (!width.equals(intervalWidth)) {
                LOG.warnf("Bucket for host %s spans %s, configured width is %s",
                        stat.hostKey(), width, intervalWidth);
            }
            stats.add(stat);
        }

        List<Long> ids = new ArrayList<>(stats.size());
        for (IntervalStat stat : stats) {
            ids.add(intervalStore.append(stat).id());
        }

        count("interval-stat", ids.size());
        LOG.infof("Appended %d interval stats", ids.size());
        return new IngestResultDTO("interval-stat", ids.size(), ids);
    }

    private void count(String kind, int amount) {
        Counter.builder(INGESTED_METRIC)
                .description("Records appended to the stores")
                .tag("kind", kind)
                .register(meterRegistry)
                .increment(amount);
    }

    private static void requireNonEmpty(List<?> batch) {
        if (batch == null || batch.isEmpty()) {
            throw ValidationException.invalidParameter("body", "[]", "non-empty JSON array");
        }
    }

    private static <T> T requireElement(T element, int index) {
        if (element == null) {
            throw ValidationException.invalidParameter("body[" + index + "]", null, "object");
        }
        return element;
    }
}

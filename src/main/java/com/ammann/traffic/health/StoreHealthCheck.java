/* (C)2026 */
package com.ammann.traffic.health;

import com.ammann.traffic.store.AlertStore;
import com.ammann.traffic.store.IntervalStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.control.ActivateRequestContext;
import jakarta.inject.Inject;
import java.time.Duration;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

/**
 * Readiness check that both stores answer and answer quickly.
 *
 * <p>Reports DOWN when a store read fails or the two count queries together take longer
 * than {@code traffic.health.max-query-time}. Exposes the row counts and the query latency.
 */
@Readiness
@ApplicationScoped
public class StoreHealthCheck implements HealthCheck {

    private static final Logger LOG = Logger.getLogger(StoreHealthCheck.class);
    static final String NAME = "store-health";

    @Inject AlertStore alertStore;

    @Inject IntervalStore intervalStore;

    @ConfigProperty(name = "traffic.health.max-query-time", defaultValue = "PT1S")
    Duration maxQueryTime;

    @Override
    @ActivateRequestContext
    public HealthCheckResponse call() {
        try {
            long start = System.nanoTime();
            long alerts = alertStore.count();
            long intervals = intervalStore.count();
            long queryMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();
            boolean performanceOk = queryMillis < maxQueryTime.toMillis();

            return HealthCheckResponse.named(NAME)
                    .status(performanceOk)
                    .withData("alerts", alerts)
                    .withData("interval-stats", intervals)
                    .withData("query-time-ms", queryMillis)
                    .withData("performance-ok", performanceOk)
                    .build();

        } catch (RuntimeException e) {
            LOG.warnf("Store health check failed: %s", e.getMessage());
            return HealthCheckResponse.named(NAME)
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .withData("store-accessible", false)
                    .build();
        }
    }
}

/* (C)2026 */
package com.ammann.traffic.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import java.time.Clock;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for the executor that runs view computations and the clock views read
 * their reference instant from.
 */
@ApplicationScoped
public class AnalyticsProducer {

    @ConfigProperty(name = "traffic.analytics.executor.max-async", defaultValue = "4")
    int maxAsync;

    @ConfigProperty(name = "traffic.analytics.executor.max-queued", defaultValue = "64")
    int maxQueued;

    /**
     * Produces the named ManagedExecutor that runs one view per task.
     *
     * <p>Configuration properties:
     * <ul>
     *   <li>traffic.analytics.executor.max-async</li>
     *   <li>traffic.analytics.executor.max-queued</li>
     * </ul>
     *
     * <p>Transactions are not propagated; every store read opens its own.
     */
    @Produces
    @Named("analytics-view-executor")
    @ApplicationScoped
    public ManagedExecutor createViewExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(maxAsync)
                .maxQueued(maxQueued)
                .propagated(ThreadContext.ALL_REMAINING)
                .cleared(ThreadContext.TRANSACTION)
                .build();
    }

    @Produces
    @ApplicationScoped
    public Clock clock() {
        return Clock.systemUTC();
    }
}

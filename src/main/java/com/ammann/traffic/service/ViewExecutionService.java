/* (C)2026 */
package com.ammann.traffic.service;

import com.ammann.traffic.exception.ApiException;
import com.ammann.traffic.exception.ViewTimeoutException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.time.Duration;
import java.util.Collection;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.jboss.logging.Logger;

/**
 * Runs a view computation on the view executor under a deadline.
 *
 * <p>The worker thread carries a {@link QueryDeadline}; when the caller stops waiting the
 * deadline is cancelled, which aborts the store read (through its query timeout) or the
 * aggregation loop at its next checkpoint. Every call records its duration, and failures are
 * counted per view and error kind.
 *
 * <p>Metrics (Prometheus names):
 * <ul>
 *   <li>{@code traffic_view_duration_seconds{view}}</li>
 *   <li>{@code traffic_view_failures_total{view,error}}</li>
 * </ul>
 */
@ApplicationScoped
public class ViewExecutionService {

    private static final Logger LOG = Logger.getLogger(ViewExecutionService.class);

    static final String DURATION_METRIC = "traffic.view.duration";
    static final String FAILURE_METRIC = "traffic.view.failures";

    Executor executor;
    MeterRegistry meterRegistry;

    @Inject
    public ViewExecutionService(@Named("analytics-view-executor") ManagedExecutor executor,
                                MeterRegistry meterRegistry) {
        this((Executor) executor, meterRegistry);
    }

    ViewExecutionService(Executor executor, MeterRegistry meterRegistry) {
        this.executor = executor;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Computes {@code work} and waits at most {@code timeout} for it.
     *
     * @param view    view name used in metrics, logs and errors
     * @param timeout positive deadline
     * @param work    the view computation
     * @return the computed rows
     * @throws ViewTimeoutException if the deadline passes first
     */
    public <T> T execute(String view, Duration timeout, Supplier<T> work) {
        ParameterChecks.requirePositive("timeoutMs", timeout);

        QueryDeadline deadline = QueryDeadline.after(view, timeout);
        Timer.Sample sample = Timer.start(meterRegistry);
        CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> deadline.runBound(work), executor);

        try {
            T result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            LOG.infof("View %s completed with %s in %d ms", view, describe(result),
                    TimeUnit.NANOSECONDS.toMillis(stop(sample, view)));
            return result;

        } catch (TimeoutException e) {
            deadline.cancel();
            future.cancel(true);
            countFailure(view, "timeout");
            stop(sample, view);
            LOG.warnf("View %s cancelled after %d ms", view, timeout.toMillis());
            throw new ViewTimeoutException(view, timeout);

        } catch (ExecutionException e) {
            stop(sample, view);
            Throwable cause = e.getCause();
            countFailure(view, errorKind(cause));
            if (cause instanceof ViewTimeoutException timeoutException) {
                LOG.warnf("View %s hit its deadline: %s", view, cause.getMessage());
                throw timeoutException;
            }
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("View " + view + " failed", cause);

        } catch (InterruptedException e) {
            deadline.cancel();
            future.cancel(true);
            stop(sample, view);
            countFailure(view, "interrupted");
            Thread.currentThread().interrupt();
            throw new ViewTimeoutException("View '" + view + "' was interrupted");
        }
    }

    private long stop(Timer.Sample sample, String view) {
        return sample.stop(Timer.builder(DURATION_METRIC)
                .description("Duration of analytics view computations")
                .tag("view", view)
                .register(meterRegistry));
    }

    private void countFailure(String view, String error) {
        Counter.builder(FAILURE_METRIC)
                .description("Analytics view computations that did not return a result")
                .tag("view", view)
                .tag("error", error)
                .register(meterRegistry)
                .increment();
    }

    private static String errorKind(Throwable cause) {
        if (cause instanceof ViewTimeoutException) {
            return "timeout";
        }
        if (cause instanceof ApiException) {
            return cause.getClass().getSimpleName();
        }
        return "internal";
    }

    private static String describe(Object result) {
        return result instanceof Collection<?> rows ? rows.size() + " rows" : "a result";
    }
}

/* (C)2026 */
package com.ammann.traffic.service;

import com.ammann.traffic.exception.ViewTimeoutException;
import java.time.Duration;
import java.util.OptionalLong;
import java.util.function.Supplier;

/**
 * Cooperative cancellation token for a single view computation.
 *
 * <p>A deadline is bound to the worker thread running the view with {@link #runBound(Supplier)}.
 * Store reads derive their JDBC query timeout from {@link #remainingMillis()} and aggregation
 * loops call {@link #check()} periodically, so an expired or cancelled view aborts both its
 * read and its computation. Views hold no mutable shared state, so aborting leaves nothing
 * to roll back.
 */
public final class QueryDeadline {

    private static final ThreadLocal<QueryDeadline> CURRENT = new ThreadLocal<>();
    private static final QueryDeadline UNBOUNDED = new QueryDeadline("unbounded", -1L, Duration.ZERO);

    /** Aggregation loops check the deadline once per this many records. */
    public static final int CHECK_INTERVAL_MASK = 0xFF;

    private final String view;
    private final long expiresAtNanos;
    private final Duration timeout;
    private volatile boolean cancelled;

    private QueryDeadline(String view, long expiresAtNanos, Duration timeout) {
        this.view = view;
        this.expiresAtNanos = expiresAtNanos;
        this.timeout = timeout;
    }

    /**
     * Deadline expiring {@code timeout} from now.
     */
    public static QueryDeadline after(String view, Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive, got " + timeout);
        }
        return new QueryDeadline(view, System.nanoTime() + timeout.toNanos(), timeout);
    }

    /**
     * Deadline that never expires and cannot be cancelled.
     */
    public static QueryDeadline none() {
        return UNBOUNDED;
    }

    /**
     * Deadline bound to the calling thread, or {@link #none()}.
     */
    public static QueryDeadline current() {
        QueryDeadline deadline = CURRENT.get();
        return deadline != null ? deadline : UNBOUNDED;
    }

    /**
     * Fails the current computation if its deadline has passed or it was cancelled.
     */
    public static void check() {
        current().checkpoint();
    }

    /**
     * Runs {@code work} with this deadline bound to the current thread.
     */
    public <T> T runBound(Supplier<T> work) {
        QueryDeadline previous = CURRENT.get();
        CURRENT.set(this);
        try {
            checkpoint();
            return work.get();
        } finally {
            if (previous == null) {
                CURRENT.remove();
            } else {
                CURRENT.set(previous);
            }
        }
    }

    public void cancel() {
        if (this != UNBOUNDED) {
            cancelled = true;
        }
    }

    public boolean isBounded() {
        return expiresAtNanos >= 0;
    }

    public boolean isExpired() {
        return cancelled || (isBounded() && System.nanoTime() - expiresAtNanos >= 0);
    }

    public void checkpoint() {
        if (cancelled) {
            throw new ViewTimeoutException("View '" + view + "' was cancelled");
        }
        if (isExpired()) {
            throw new ViewTimeoutException(view, timeout);
        }
    }

    /**
     * Milliseconds left before expiry, at least 1, or empty when unbounded.
     */
    public OptionalLong remainingMillis() {
        if (!isBounded()) {
            return OptionalLong.empty();
        }
        long remainingNanos = expiresAtNanos - System.nanoTime();
        return OptionalLong.of(Math.max(1L, Duration.ofNanos(remainingNanos).toMillis()));
    }

    public String view() {
        return view;
    }
}

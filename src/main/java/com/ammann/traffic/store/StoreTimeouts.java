/* (C)2026 */
package com.ammann.traffic.store;

import com.ammann.traffic.service.QueryDeadline;
import java.time.Duration;
import java.util.OptionalLong;

/**
 * Derives the JDBC query timeout for a store read from the configured ceiling and the
 * deadline of the view currently running on this thread.
 */
final class StoreTimeouts {

    static final String QUERY_TIMEOUT_HINT = "jakarta.persistence.query.timeout";

    private StoreTimeouts() {}

    static int effectiveMillis(Duration configured) {
        QueryDeadline.check();
        long ceiling = configured.toMillis();
        OptionalLong remaining = QueryDeadline.current().remainingMillis();
        long effective = remaining.isPresent() ? Math.min(ceiling, remaining.getAsLong()) : ceiling;
        return (int) Math.max(1L, Math.min(Integer.MAX_VALUE, effective));
    }
}

/* (C)2026 */
package com.ammann.traffic.store;

import com.ammann.traffic.exception.InputUnavailableException;
import com.ammann.traffic.exception.ValidationException;
import com.ammann.traffic.model.HostStatEntity;
import com.ammann.traffic.model.IntervalStat;
import com.ammann.traffic.model.TimeRange;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.PersistenceException;
import jakarta.transaction.Transactional;
import java.time.Duration;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * {@link IntervalStore} backed by the {@code host_stats} table through Hibernate ORM Panache.
 *
 * <p>The overlap check and the insert run in one transaction. Two capture nodes appending
 * the same host concurrently are not serialized against each other; the capture pipeline
 * owns a host's buckets.
 */
@ApplicationScoped
public class PanacheIntervalStore implements IntervalStore {

    private static final Logger LOG = Logger.getLogger(PanacheIntervalStore.class);
    private static final String STORE_NAME = "Interval store";

    @ConfigProperty(name = "traffic.store.query-timeout", defaultValue = "PT10S")
    Duration queryTimeout;

    @Override
    @Transactional
    public IntervalStat append(IntervalStat stat) {
        long overlapping;
        try {
            overlapping = HostStatEntity.countOverlapping(
                    stat.hostKey(), stat.intervalStart(), stat.intervalEnd());
        } catch (PersistenceException e) {
            throw new InputUnavailableException(STORE_NAME, e);
        }

        if (overlapping > 0) {
            LOG.warnf("Rejecting bucket [%s, %s) for host %s: overlaps %d stored bucket(s)",
                    stat.intervalStart(), stat.intervalEnd(), stat.hostKey(), overlapping);
            throw ValidationException.rejectedRecord("interval stat",
                    String.format("bucket [%s, %s) overlaps a stored bucket for host %s",
                            stat.intervalStart(), stat.intervalEnd(), stat.hostKey()));
        }

        try {
            HostStatEntity entity = HostStatEntity.from(stat);
            entity.persist();
            return entity.toStat();
        } catch (PersistenceException e) {
            throw new InputUnavailableException(STORE_NAME, e);
        }
    }

    @Override
    @Transactional
    public List<IntervalStat> findEndingInRange(TimeRange range) {
        int timeoutMs = StoreTimeouts.effectiveMillis(queryTimeout);
        try {
            List<HostStatEntity> rows = HostStatEntity.findEndingInRange(range)
                    .withHint(StoreTimeouts.QUERY_TIMEOUT_HINT, timeoutMs)
                    .list();
            LOG.debugf("Loaded %d interval stats for range %s..%s", rows.size(), range.from(), range.to());
            return rows.stream().map(HostStatEntity::toStat).toList();
        } catch (PersistenceException e) {
            throw new InputUnavailableException(STORE_NAME, e);
        }
    }

    @Override
    @Transactional
    public long count() {
        try {
            return HostStatEntity.count();
        } catch (PersistenceException e) {
            throw new InputUnavailableException(STORE_NAME, e);
        }
    }
}

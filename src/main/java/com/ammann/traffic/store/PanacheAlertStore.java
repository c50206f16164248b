/* (C)2026 */
package com.ammann.traffic.store;

import com.ammann.traffic.exception.InputUnavailableException;
import com.ammann.traffic.model.AlertEntity;
import com.ammann.traffic.model.AlertEvent;
import com.ammann.traffic.model.TimeRange;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.PersistenceException;
import jakarta.transaction.Transactional;
import java.time.Duration;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * {@link AlertStore} backed by the {@code alerts} table through Hibernate ORM Panache.
 */
@ApplicationScoped
public class PanacheAlertStore implements AlertStore {

    private static final Logger LOG = Logger.getLogger(PanacheAlertStore.class);
    private static final String STORE_NAME = "Alert store";

    @ConfigProperty(name = "traffic.store.query-timeout", defaultValue = "PT10S")
    Duration queryTimeout;

    @Override
    @Transactional
    public AlertEvent append(AlertEvent event) {
        try {
            AlertEntity entity = AlertEntity.from(event);
            entity.persist();
            return entity.toEvent();
        } catch (PersistenceException e) {
            LOG.warnf("Failed to append %s alert from %s: %s",
                    event.alertType(), event.srcKey(), e.getMessage());
            throw new InputUnavailableException(STORE_NAME, e);
        }
    }

    @Override
    @Transactional
    public List<AlertEvent> findInRange(TimeRange range) {
        int timeoutMs = StoreTimeouts.effectiveMillis(queryTimeout);
        try {
            List<AlertEntity> rows = AlertEntity.findInRange(range)
                    .withHint(StoreTimeouts.QUERY_TIMEOUT_HINT, timeoutMs)
                    .list();
            LOG.debugf("Loaded %d alerts for range %s..%s", rows.size(), range.from(), range.to());
            return rows.stream().map(AlertEntity::toEvent).toList();
        } catch (PersistenceException e) {
            throw new InputUnavailableException(STORE_NAME, e);
        }
    }

    @Override
    @Transactional
    public List<AlertEvent> findRecent(int count) {
        int timeoutMs = StoreTimeouts.effectiveMillis(queryTimeout);
        try {
            List<AlertEntity> rows = AlertEntity.findNewest()
                    .withHint(StoreTimeouts.QUERY_TIMEOUT_HINT, timeoutMs)
                    .range(0, count - 1)
                    .list();
            return rows.stream().map(AlertEntity::toEvent).toList();
        } catch (PersistenceException e) {
            throw new InputUnavailableException(STORE_NAME, e);
        }
    }

    @Override
    @Transactional
    public long count() {
        try {
            return AlertEntity.count();
        } catch (PersistenceException e) {
            throw new InputUnavailableException(STORE_NAME, e);
        }
    }
}

/* (C)2026 */
package com.ammann.traffic.model;

import io.quarkus.hibernate.orm.panache.PanacheEntity;
import io.quarkus.hibernate.orm.panache.PanacheQuery;
import io.quarkus.panache.common.Sort;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

@Entity
@Table(name = AlertEntity.TABLE_NAME, indexes = {
        @Index(name = "idx_alerts_occurred_at", columnList = "occurred_at"),
        @Index(name = "idx_alerts_src_key", columnList = "src_key"),
        @Index(name = "idx_alerts_type", columnList = "alert_type")
})
public class AlertEntity extends PanacheEntity
{
    public static final String TABLE_NAME = "alerts";

    /**
     * Chronological order with insertion-order tie-break.
     */
    public static final Sort CHRONOLOGICAL = Sort.by("occurredAt").and("id");

    /**
     * Time of detection. Primary ordering key for every alert view.
     */
    @Column(name = "occurred_at", nullable = false)
    @NotNull
    public Instant occurredAt;

    /**
     * Alert classification ('DoS', 'DDoS', 'Port Scan', ...).
     */
    @Column(name = "alert_type", nullable = false, length = 50)
    @NotNull
    public String alertType;

    /**
     * Source involved in the attack, if known. IPv6 compatible length.
     */
    @Column(name = "src_key", length = 64)
    public String srcKey;

    /**
     * Targeted destination, if known.
     */
    @Column(name = "dst_key", length = 64)
    public String dstKey;

    /**
     * Detector description, e.g. "SYN flood with 1200 packets in 5 seconds".
     */
    @Column(name = "details", length = 2048)
    public String details;

    public AlertEntity()
    {
    }

    public static AlertEntity from(AlertEvent event)
    {
        AlertEntity entity = new AlertEntity();
        entity.occurredAt = event.timestamp();
        entity.alertType = event.alertType();
        entity.srcKey = event.srcKey();
        entity.dstKey = event.dstKey();
        entity.details = event.details();
        return entity;
    }

    public AlertEvent toEvent()
    {
        return new AlertEvent(id, occurredAt, alertType, srcKey, dstKey, details);
    }

    /**
     * Alerts inside the range in chronological order.
     */
    public static PanacheQuery<AlertEntity> findInRange(TimeRange range)
    {
        if (range.isUnbounded()) {
            return find("occurredAt <= ?1", CHRONOLOGICAL, range.to());
        }
        return find("occurredAt >= ?1 AND occurredAt <= ?2", CHRONOLOGICAL, range.from(), range.to());
    }

    /**
     * Newest alerts first.
     */
    public static PanacheQuery<AlertEntity> findNewest()
    {
        return findAll(Sort.by("occurredAt", Sort.Direction.Descending)
                .and("id", Sort.Direction.Descending));
    }
}

/* (C)2026 */
package com.ammann.traffic.model;

import com.ammann.traffic.exception.ValidationException;
import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Discrete alert raised by the detection pipeline.
 *
 * <p>Alerts are totally ordered by {@code timestamp}, ties broken by {@code id}
 * (which follows insertion order), so every rolling and burst computation over
 * the same input is deterministic.
 *
 * @param id        store-assigned identifier, {@code null} until appended
 * @param timestamp time the alert was raised
 * @param alertType classification such as {@code DDoS} or {@code Port Scan}
 * @param srcKey    attacking source (usually an IP address), may be {@code null}
 * @param dstKey    targeted destination, may be {@code null}
 * @param details   free-form description from the detector
 */
public record AlertEvent(
        Long id,
        Instant timestamp,
        String alertType,
        String srcKey,
        String dstKey,
        String details
) {
    /** Time order with id tie-break. */
    public static final Comparator<AlertEvent> CHRONOLOGICAL =
            Comparator.comparing(AlertEvent::timestamp)
                    .thenComparing(AlertEvent::id, Comparator.nullsLast(Comparator.naturalOrder()));

    public AlertEvent {
        if (timestamp == null) {
            throw ValidationException.rejectedRecord("alert", "timestamp is required");
        }
        if (alertType == null || alertType.isBlank()) {
            throw ValidationException.rejectedRecord("alert", "alert type is required");
        }
    }

    public static AlertEvent of(Instant timestamp, String alertType, String srcKey, String dstKey, String details) {
        return new AlertEvent(null, timestamp, alertType, srcKey, dstKey, details);
    }

    public AlertEvent withId(long assignedId) {
        return new AlertEvent(assignedId, timestamp, alertType, srcKey, dstKey, details);
    }

    public boolean isType(String type) {
        return Objects.equals(alertType, type);
    }
}

/* (C)2026 */
package com.ammann.traffic.store;

import com.ammann.traffic.model.AlertEvent;
import com.ammann.traffic.model.TimeRange;
import java.util.List;

/**
 * Append-only access to alert events.
 *
 * <p>Reads may run concurrently with appends and with each other. Implementations report
 * read failures as {@link com.ammann.traffic.exception.InputUnavailableException} and never
 * substitute an empty result for a failed read.
 */
public interface AlertStore {

    /**
     * Appends an alert and returns it with its assigned id.
     */
    AlertEvent append(AlertEvent event);

    /**
     * Alerts with {@code timestamp} inside {@code range}, ordered by timestamp then id.
     */
    List<AlertEvent> findInRange(TimeRange range);

    /**
     * Up to {@code count} newest alerts, newest first.
     */
    List<AlertEvent> findRecent(int count);

    long count();
}

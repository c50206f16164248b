/* (C)2026 */
package com.ammann.traffic.dto;

import com.ammann.traffic.model.AlertEvent;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Alert as posted by the detector.
 */
@Schema(description = "Alert to append")
public record AlertIngestDTO(
        @Schema(description = "Detection time", required = true) Instant timestamp,
        @Schema(description = "Alert type, e.g. 'Port Scan' or 'DDoS'", required = true) String alertType,
        @Schema(description = "Offending source") String srcKey,
        @Schema(description = "Targeted destination") String dstKey,
        @Schema(description = "Free-form description, e.g. 'SYN flood with 1200 packets in 5 seconds'") String details
) {
    public AlertEvent toEvent() {
        return AlertEvent.of(timestamp, alertType, srcKey, dstKey, details);
    }
}

/* (C)2026 */
package com.ammann.traffic.dto;

import com.ammann.traffic.model.AlertEvent;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Stored alert")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AlertSummaryDTO(
        @Schema(description = "Alert id") Long id,
        @Schema(description = "Detection time") Instant timestamp,
        @Schema(description = "Alert type") String alertType,
        @Schema(description = "Source key") String srcKey,
        @Schema(description = "Destination key") String dstKey,
        @Schema(description = "Detector description") String details
) {
    public static AlertSummaryDTO from(AlertEvent event) {
        return new AlertSummaryDTO(event.id(), event.timestamp(), event.alertType(),
                event.srcKey(), event.dstKey(), event.details());
    }
}

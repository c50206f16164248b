/* (C)2026 */
package com.ammann.traffic.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Rolling count of one alert type evaluated at an alert.
 */
@Schema(description = "Trailing-window count of an alert type at an alert's timestamp")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RollingAlertCountDTO(
        @Schema(description = "Alert the window ends at") Long alertId,
        @Schema(description = "Window end") Instant timestamp,
        @Schema(description = "Type of the alert the window ends at") String alertType,
        @Schema(description = "Alerts of the counted type inside [timestamp - window, timestamp]") long windowCount
) {}

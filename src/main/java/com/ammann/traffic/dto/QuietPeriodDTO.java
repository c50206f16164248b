/* (C)2026 */
package com.ammann.traffic.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Stretch without any alert. Long silences confirm the detector is running quietly or
 * mark maintenance windows.
 */
@Schema(description = "Gap between consecutive alerts")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QuietPeriodDTO(
        @Schema(description = "Last alert before the silence") Instant gapStart,
        @Schema(description = "First alert after the silence") Instant gapEnd,
        @Schema(description = "Length of the silence in seconds") long silenceSeconds
) {}

/* (C)2026 */
package com.ammann.traffic.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Average time between consecutive alerts")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AlertGapStatsDTO(
        @Schema(description = "Alert type, or ALL TYPES for the merged stream") String alertType,
        @Schema(description = "Number of gaps averaged") long gapCount,
        @Schema(description = "Mean gap in seconds, one decimal") double avgGapSeconds
) {
    public static final String ALL_TYPES = "ALL TYPES";
}

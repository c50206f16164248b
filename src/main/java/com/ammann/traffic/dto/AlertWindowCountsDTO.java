/* (C)2026 */
package com.ammann.traffic.dto;

import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Alerts of one type from one source, counted over several trailing periods.
 */
@Schema(description = "Alert counts of one type and source over several trailing periods")
public record AlertWindowCountsDTO(
        @Schema(description = "Alert type") String alertType,
        @Schema(description = "Source key") String srcKey,
        @Schema(description = "Alerts per trailing period, keyed by the ISO-8601 period in request order")
        Map<String, Long> counts
) {}

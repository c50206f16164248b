/* (C)2026 */
package com.ammann.traffic.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Repeat offender and target pair.
 */
@Schema(description = "Alert totals of one source/destination pair")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AlertPairDTO(
        @Schema(description = "Source key") String srcKey,
        @Schema(description = "Destination key") String dstKey,
        @Schema(description = "Alerts raised for the pair") long pairAlerts,
        @Schema(description = "Distinct alert types seen, sorted") List<String> typesSeen
) {}

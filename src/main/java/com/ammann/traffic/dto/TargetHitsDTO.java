/* (C)2026 */
package com.ammann.traffic.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Alerts of one type against one destination")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TargetHitsDTO(
        @Schema(description = "Destination key") String dstKey,
        @Schema(description = "Alert type") String alertType,
        @Schema(description = "Alerts") long hits
) {}

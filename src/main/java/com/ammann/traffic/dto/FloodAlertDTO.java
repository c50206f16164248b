/* (C)2026 */
package com.ammann.traffic.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Flood alert with the packet count reported by the detector")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FloodAlertDTO(
        @Schema(description = "Alert id") Long alertId,
        @Schema(description = "Source key") String srcKey,
        @Schema(description = "Destination key") String dstKey,
        @Schema(description = "Packet count parsed from the alert details") long packetCount,
        @Schema(description = "Alert timestamp") Instant timestamp
) {}

/* (C)2026 */
package com.ammann.traffic.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Traffic of one host during one hour")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrafficHeatmapCellDTO(
        @Schema(description = "Hour bucket") Instant hourBucket,
        @Schema(description = "Host key") String hostKey,
        @Schema(description = "Packets") long packets,
        @Schema(description = "Bytes") long bytes
) {}

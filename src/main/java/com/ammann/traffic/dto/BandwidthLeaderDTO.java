/* (C)2026 */
package com.ammann.traffic.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Host ranked by bytes moved in the window")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BandwidthLeaderDTO(
        @Schema(description = "1-based rank") int rank,
        @Schema(description = "Host key") String hostKey,
        @Schema(description = "Bytes in the window") long totalBytes,
        @Schema(description = "Packets in the window") long totalPackets
) {}

/* (C)2026 */
package com.ammann.traffic.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Trailing-window total of a host metric at an interval boundary")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RollingPacketTotalDTO(
        @Schema(description = "Host key") String hostKey,
        @Schema(description = "Interval end the window ends at") Instant intervalEnd,
        @Schema(description = "Sum inside [intervalEnd - window, intervalEnd]") long windowTotal
) {}

/* (C)2026 */
package com.ammann.traffic.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Rolling totals of all hosts summed at one interval boundary")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RollingTotalPointDTO(
        @Schema(description = "Interval end") Instant intervalEnd,
        @Schema(description = "Sum of per-host rolling totals ending here") long totalPackets
) {}

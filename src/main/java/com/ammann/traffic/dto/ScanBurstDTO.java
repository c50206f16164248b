/* (C)2026 */
package com.ammann.traffic.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Concentrated run of alerts from one source")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScanBurstDTO(
        @Schema(description = "Source key") String srcKey,
        @Schema(description = "First alert of the burst") Instant burstStart,
        @Schema(description = "Last alert of the burst") Instant burstEnd,
        @Schema(description = "Alerts in the burst") int scansInBurst
) {}

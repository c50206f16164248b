/* (C)2026 */
package com.ammann.traffic.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Peak destination-port fan-out of a host, a scan indicator.
 */
@Schema(description = "Host ranked by distinct destination ports in its busiest interval")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PortFanoutDTO(
        @Schema(description = "1-based rank") int rank,
        @Schema(description = "Host key") String hostKey,
        @Schema(description = "Distinct destination ports in the peak interval") long uniqueDstPorts,
        @Schema(description = "Start of the peak interval") Instant intervalStart,
        @Schema(description = "End of the peak interval") Instant intervalEnd
) {}

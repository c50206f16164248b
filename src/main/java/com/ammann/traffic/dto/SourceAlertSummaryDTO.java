/* (C)2026 */
package com.ammann.traffic.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Leaderboard row for the noisiest alert sources.
 *
 * @param rank        1-based position
 * @param srcKey      alert source
 * @param totalAlerts alerts of any type raised for the source
 * @param portScans   of which port scans
 * @param ddosHits    of which DDoS alerts
 */
@Schema(description = "Alert totals of one source")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SourceAlertSummaryDTO(
        @Schema(description = "1-based rank") int rank,
        @Schema(description = "Source key") String srcKey,
        @Schema(description = "Alerts of any type") long totalAlerts,
        @Schema(description = "Port Scan alerts") long portScans,
        @Schema(description = "DDoS alerts") long ddosHits
) {}

/* (C)2026 */
package com.ammann.traffic.dto;

import com.ammann.traffic.enumeration.IntervalMetric;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Jump of a metric between two consecutive intervals of a host, a possible DDoS precursor.
 */
@Schema(description = "Step change between consecutive intervals of a host")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SourceSpikeDTO(
        @Schema(description = "Host key") String hostKey,
        @Schema(description = "Start of the later interval") Instant intervalStart,
        @Schema(description = "Start of the preceding interval") Instant previousIntervalStart,
        @Schema(description = "Metric compared") IntervalMetric metric,
        @Schema(description = "Value in the later interval") long currentValue,
        @Schema(description = "Value in the preceding interval") long previousValue,
        @Schema(description = "currentValue - previousValue") long jump
) {}

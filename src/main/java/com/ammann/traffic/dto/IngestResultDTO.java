/* (C)2026 */
package com.ammann.traffic.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Outcome of a batch append")
public record IngestResultDTO(
        @Schema(description = "Record kind, 'alert' or 'interval-stat'") String kind,
        @Schema(description = "Records appended") int accepted,
        @Schema(description = "Ids assigned, in request order") List<Long> ids
) {}

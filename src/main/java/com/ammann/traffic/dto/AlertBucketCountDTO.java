/* (C)2026 */
package com.ammann.traffic.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Number of alerts of one type inside one histogram bucket.
 */
@Schema(description = "Alert count per type and time bucket")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AlertBucketCountDTO(
        @Schema(description = "Bucket start (inclusive), truncated to the bucket width")
        Instant bucketStart,

        @Schema(description = "Alert type")
        String alertType,

        @Schema(description = "Alerts of this type in the bucket")
        long count
) {}

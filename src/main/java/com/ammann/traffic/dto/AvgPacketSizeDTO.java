/* (C)2026 */
package com.ammann.traffic.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Average packet size of a host over all stored intervals.
 *
 * <p>Useful for spotting hosts that send many small packets versus large data bursts.
 * {@code avgPacketSizeBytes} is {@code null} for hosts that never sent a packet.
 */
@Schema(description = "All-time average packet size of a host")
public record AvgPacketSizeDTO(
        @Schema(description = "Host key") String hostKey,
        @Schema(description = "Bytes per packet, null when the host has no packets", nullable = true)
        Double avgPacketSizeBytes,
        @Schema(description = "Packets across all intervals") long totalPackets,
        @Schema(description = "Bytes across all intervals") long totalBytes
) {}

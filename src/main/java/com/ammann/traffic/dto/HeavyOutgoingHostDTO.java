/* (C)2026 */
package com.ammann.traffic.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Host whose outgoing traffic reached the configured multiple of its incoming traffic.
 *
 * <p>When the host received nothing the ratio is undefined: {@code outInRatio} is
 * {@code null} and {@code ratioUndefined} is {@code true}.
 */
@Schema(description = "Host with outgoing-biased traffic")
public record HeavyOutgoingHostDTO(
        @Schema(description = "Host key") String hostKey,
        @Schema(description = "Incoming packets in the window") long incomingPackets,
        @Schema(description = "Outgoing packets in the window") long outgoingPackets,
        @Schema(description = "outgoing / incoming, null when incoming is zero", nullable = true)
        Double outInRatio,
        @Schema(description = "True when incoming is zero") boolean ratioUndefined
) {}

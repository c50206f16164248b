/* (C)2026 */
package com.ammann.traffic.health;

import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import java.time.Instant;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;

/**
 * Liveness check reporting the service as alive together with its uptime.
 *
 * <p>The check touches no store; a stalled database shows up in readiness only.
 */
@Liveness
@ApplicationScoped
public class LivenessCheck implements HealthCheck
{
    static final String NAME = "alive";

    private final Instant startedAt = Instant.now();

    @Override
    public HealthCheckResponse call()
    {
        return HealthCheckResponse.named(NAME)
                .up()
                .withData("uptime-seconds", Duration.between(startedAt, Instant.now()).getSeconds())
                .build();
    }
}

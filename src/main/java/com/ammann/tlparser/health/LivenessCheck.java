package com.ammann.tlparser.health;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;

/**
 * Liveness check reporting the service as alive while the JVM serves requests.
 *
 * <p>Carries no pipeline check; formula evaluation is covered by
 * {@link FormulaEngineHealthCheck} on the readiness endpoint.
 */
@Liveness
@ApplicationScoped
public class LivenessCheck implements HealthCheck
{
    static final String NAME = "alive";

    @Override
    public HealthCheckResponse call()
    {
        return HealthCheckResponse.named(NAME)
                .up()
                .withData("service", "tlparser-service")
                .build();
    }
}

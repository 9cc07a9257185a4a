package com.ammann.tlparser.health;

import com.ammann.tlparser.model.StatsRecord;
import com.ammann.tlparser.service.FormulaStatisticsService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness health check that runs a sample formula through the whole statistics pipeline.
 *
 * <p>Reports DOWN if the sample fails or its height differs from the known value.
 */
@Readiness
@ApplicationScoped
public class FormulaEngineHealthCheck implements HealthCheck {

    static final String SAMPLE_FORMULA = "G(p --> F(q == 1))";
    static final int SAMPLE_HEIGHT = 3;

    @Inject
    FormulaStatisticsService statisticsService;

    @Override
    public HealthCheckResponse call() {
        try {
            StatsRecord sample = statisticsService.compute(SAMPLE_FORMULA);
            boolean consistent = sample.asth() == SAMPLE_HEIGHT;

            return HealthCheckResponse.named("formula-engine")
                    .status(consistent)
                    .withData("sample-formula", SAMPLE_FORMULA)
                    .withData("sample-height", sample.asth())
                    .build();

        } catch (Exception e) {
            return HealthCheckResponse.named("formula-engine")
                    .down()
                    .withData("error", e.getMessage())
                    .build();
        }
    }
}

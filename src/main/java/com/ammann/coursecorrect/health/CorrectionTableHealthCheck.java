/* (C)2026 */
package com.ammann.coursecorrect.health;

import com.ammann.coursecorrect.model.CorrectionTable;
import com.ammann.coursecorrect.service.CorrectionTableRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import java.util.Optional;

/**
 * Health check for the published correction table.
 *
 * <p>Status semantics:
 * <ul>
 *   <li>UP: a table is published and conversions can be served</li>
 *   <li>UP with status EMPTY: nothing computed yet and the table is not required</li>
 *   <li>DOWN: nothing computed yet and {@code course-correct.health.require-table=true}</li>
 * </ul>
 */
@Readiness
@ApplicationScoped
public class CorrectionTableHealthCheck implements HealthCheck {

    private static final String HEALTH_CHECK_NAME = "correction-table";

    @Inject CorrectionTableRegistry registry;

    @ConfigProperty(name = "course-correct.health.require-table", defaultValue = "false")
    boolean required;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder =
                HealthCheckResponse.named(HEALTH_CHECK_NAME).withData("required", required);

        Optional<CorrectionTable> current = registry.current();
        if (current.isPresent()) {
            CorrectionTable table = current.get();
            return builder.up()
                    .withData("status", "PUBLISHED")
                    .withData("run-id", String.valueOf(table.getRunId()))
                    .withData("baseline-venue", table.getBaselineVenue())
                    .withData("entries", table.size())
                    .build();
        }

        builder.withData("status", "EMPTY");
        if (required) {
            return builder.down().build();
        }
        builder.withData("message", "No correction table computed yet - conversions unavailable");
        return builder.up().build();
    }
}

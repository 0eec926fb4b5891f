/* (C)2026 */
package com.ammann.coursecorrect.health;

import com.ammann.coursecorrect.enumeration.JobStatus;
import com.ammann.coursecorrect.model.CorrectionRun;
import com.ammann.coursecorrect.model.RaceResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.control.ActivateRequestContext;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.time.Duration;
import java.time.Instant;

/**
 * Readiness health check that verifies database connectivity and query performance.
 *
 * <p>Reports DOWN if the count queries take longer than 1 second. Exposes the number of stored
 * results and completed correction runs as health check data.
 */
@Readiness
@ApplicationScoped
public class DatabaseHealthCheck implements HealthCheck {

    @Override
    @ActivateRequestContext
    public HealthCheckResponse call() {
        try {
            Instant start = Instant.now();

            long storedResults = RaceResult.count();
            long completedRuns = CorrectionRun.countByStatus(JobStatus.COMPLETED);

            Duration queryTime = Duration.between(start, Instant.now());
            boolean performanceOk = queryTime.toMillis() < 1000;

            return HealthCheckResponse.named("database-health")
                    .status(performanceOk)
                    .withData("stored-results", storedResults)
                    .withData("completed-runs", completedRuns)
                    .withData("query-time-ms", queryTime.toMillis())
                    .withData("performance-ok", performanceOk)
                    .build();

        } catch (Exception e) {
            return HealthCheckResponse.named("database-health")
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .withData("database-accessible", false)
                    .build();
        }
    }
}

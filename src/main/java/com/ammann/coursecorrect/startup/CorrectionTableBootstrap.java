/* (C)2026 */
package com.ammann.coursecorrect.startup;

import com.ammann.coursecorrect.exception.ApiException;
import com.ammann.coursecorrect.model.CorrectionRun;
import com.ammann.coursecorrect.model.RaceResult;
import com.ammann.coursecorrect.service.CorrectionRecomputationService;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Instant;

/**
 * Restores the correction table on application startup.
 * <p>
 * A run that was RUNNING when the service stopped never committed its entries, so it is marked
 * FAILED. The latest COMPLETED run is then published. If there is none and
 * {@code course-correct.recompute-on-startup} is enabled, a recomputation over the stored
 * results is attempted; its failure leaves the service running without a table.
 */
@ApplicationScoped
public class CorrectionTableBootstrap {

    private static final Logger LOG = Logger.getLogger(CorrectionTableBootstrap.class);

    @Inject CorrectionRecomputationService recomputationService;

    @ConfigProperty(name = "course-correct.recompute-on-startup", defaultValue = "true")
    boolean recomputeOnStartup;

    /**
     * Executed on application startup.
     *
     * @param event Quarkus startup event
     */
    void onStart(@Observes StartupEvent event) {
        recoverInterruptedRuns();

        if (recomputationService.loadLatestCompleted().isPresent()) {
            return;
        }
        if (!recomputeOnStartup) {
            LOG.info("Correction bootstrap: no table available and recompute-on-startup disabled");
            return;
        }

        long stored = QuarkusTransaction.requiringNew().call(() -> RaceResult.count());
        if (stored == 0) {
            LOG.info("Correction bootstrap: no stored results, waiting for ingestion");
            return;
        }

        try {
            recomputationService.recompute(null);
        } catch (ApiException e) {
            LOG.warnf("Correction bootstrap: initial recomputation over %d results failed: %s",
                    stored, e.getMessage());
        }
    }

    /**
     * Marks runs left RUNNING by a previous process as FAILED.
     *
     * @return number of recovered runs
     */
    long recoverInterruptedRuns() {
        long recovered = QuarkusTransaction.requiringNew().call(() -> CorrectionRun.update(
                "status = 'FAILED', "
                        + "errorMessage = 'Server restarted during recomputation', "
                        + "completedAt = ?1 "
                        + "WHERE status = 'RUNNING'",
                Instant.now()));

        if (recovered > 0) {
            LOG.warnf("Correction bootstrap: marked %d interrupted runs as FAILED", recovered);
        } else {
            LOG.debug("Correction bootstrap: no interrupted runs found");
        }
        return recovered;
    }
}

/* (C)2026 */
package com.ammann.coursecorrect.scheduled;

import com.ammann.coursecorrect.model.CorrectionRun;
import com.ammann.coursecorrect.model.CorrectionTable;
import com.ammann.coursecorrect.model.VenueCorrection;
import com.ammann.coursecorrect.service.CorrectionTableRegistry;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Scheduled cleanup of old correction runs.
 * <p>
 * Deletes COMPLETED and FAILED runs, together with their entries, once they are older than the
 * retention period. The published run and the latest COMPLETED run are always kept, whatever
 * their age; RUNNING runs are left to the startup recovery.
 */
@ApplicationScoped
public class CorrectionRunMaintenanceService {

    private static final Logger LOG = Logger.getLogger(CorrectionRunMaintenanceService.class);

    @Inject CorrectionTableRegistry registry;

    @ConfigProperty(name = "course-correct.runs.retention", defaultValue = "P7D")
    Duration retention;

    @Scheduled(every = "${course-correct.runs.cleanup.every}", identity = "correction-run-cleanup")
    @Transactional
    public void cleanupOldRuns() {
        Instant cutoff = Instant.now().minus(retention);

        Set<Long> protectedIds = new HashSet<>();
        registry.current().map(CorrectionTable::getRunId).ifPresent(protectedIds::add);
        CorrectionRun.findLatestCompleted().ifPresent(run -> protectedIds.add(run.id));

        List<CorrectionRun> expired = CorrectionRun.list(
                "createdAt < ?1 AND (status = 'COMPLETED' OR status = 'FAILED')", cutoff);

        int deleted = 0;
        for (CorrectionRun run : expired) {
            if (protectedIds.contains(run.id)) {
                continue;
            }
            VenueCorrection.deleteByRunId(run.id);
            run.delete();
            deleted++;
        }

        if (deleted > 0) {
            LOG.infof("Cleanup: deleted %d correction runs created before %s", deleted, cutoff);
        } else {
            LOG.debug("Cleanup: no old correction runs to delete");
        }
    }
}

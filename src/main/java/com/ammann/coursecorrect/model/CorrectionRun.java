/* (C)2026 */
package com.ammann.coursecorrect.model;

import com.ammann.coursecorrect.enumeration.JobStatus;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Tracks a single recomputation of the correction table.
 *
 * <p>Only a COMPLETED run has committed {@link VenueCorrection} rows; the most recent
 * COMPLETED run is the persisted source of truth for offsets.
 */
@Entity
@Table(name = "correction_run")
public class CorrectionRun extends PanacheEntityBase {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    public Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    public JobStatus status;

    @Column(name = "baseline_venue", length = 128)
    public String baselineVenue;

    @Column(name = "requested_reference_venue", length = 128)
    public String requestedReferenceVenue;

    @Column(name = "baseline_median_men")
    public Double baselineMedianMen;

    @Column(name = "baseline_median_women")
    public Double baselineMedianWomen;

    @Column(name = "record_count")
    public Integer recordCount;

    @Column(name = "retained_count")
    public Integer retainedCount;

    @Column(name = "entry_count")
    public Integer entryCount;

    @Column(name = "skipped_groups")
    public Integer skippedGroups;

    @Column(name = "error_message", length = 1000)
    public String errorMessage;

    @Column(name = "created_at")
    public Instant createdAt = Instant.now();

    @Column(name = "completed_at")
    public Instant completedAt;

    public static List<CorrectionRun> findRecent(int limit) {
        return find("ORDER BY createdAt DESC, id DESC").page(0, limit).list();
    }

    public static Optional<CorrectionRun> findLatestCompleted() {
        return find("status = ?1 ORDER BY completedAt DESC, id DESC", JobStatus.COMPLETED)
                .firstResultOptional();
    }

    public static long countByStatus(JobStatus status) {
        return count("status", status);
    }
}

/* (C)2026 */
package com.ammann.coursecorrect.model;

import com.ammann.coursecorrect.enumeration.Confidence;
import com.ammann.coursecorrect.enumeration.Gender;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.List;

/**
 * Persisted correction entry of one venue/gender within a correction run.
 */
@Entity
@Table(
        name = "venue_correction",
        uniqueConstraints =
                @UniqueConstraint(
                        name = "uq_venue_correction_run_venue_gender",
                        columnNames = {"correction_run_id", "venue", "gender"}))
public class VenueCorrection extends PanacheEntityBase {

    @Id
    @GeneratedValue(generator = "venue_correction_SEQ")
    @SequenceGenerator(
            name = "venue_correction_SEQ",
            sequenceName = "venue_correction_SEQ",
            allocationSize = 50)
    public Long id;

    @Column(name = "correction_run_id", nullable = false)
    public Long correctionRunId;

    @Column(nullable = false, length = 128)
    public String venue;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 1)
    public Gender gender;

    @Column(name = "offset_seconds", nullable = false)
    public Double offsetSeconds;

    @Column(name = "offset_pct", nullable = false)
    public Double offsetPct;

    @Column(name = "sample_count", nullable = false)
    public Integer sampleCount;

    @Column(name = "median_seconds", nullable = false)
    public Double medianSeconds;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    public Confidence confidence;

    @Column(name = "created_at")
    public Instant createdAt = Instant.now();

    public static VenueCorrection from(Long runId, CorrectionEntry entry) {
        VenueCorrection correction = new VenueCorrection();
        correction.correctionRunId = runId;
        correction.venue = entry.venue();
        correction.gender = entry.gender();
        correction.offsetSeconds = entry.offsetSeconds();
        correction.offsetPct = entry.offsetPct();
        correction.sampleCount = entry.sampleCount();
        correction.medianSeconds = entry.medianSeconds();
        correction.confidence = entry.confidence();
        return correction;
    }

    public CorrectionEntry toEntry() {
        return new CorrectionEntry(
                venue, gender, offsetSeconds, offsetPct, sampleCount, medianSeconds, confidence);
    }

    public static List<VenueCorrection> findByRunId(Long runId) {
        return find("correctionRunId = ?1 ORDER BY venue, gender", runId).list();
    }

    public static long deleteByRunId(Long runId) {
        return delete("correctionRunId", runId);
    }
}

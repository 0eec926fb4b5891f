/* (C)2026 */
package com.ammann.coursecorrect.dto;

import com.ammann.coursecorrect.model.CorrectionRun;
import java.time.Instant;

/**
 * API representation of a single correction run.
 *
 * @param id run identifier
 * @param status current run status
 * @param baselineVenue selected baseline venue, {@code null} until selection succeeded
 * @param requestedReferenceVenue explicitly requested reference venue, if any
 * @param baselineMedianMen men's baseline median in seconds
 * @param baselineMedianWomen women's baseline median in seconds
 * @param recordCount stored records read by the run
 * @param retainedCount records that survived quality filtering
 * @param entryCount correction entries produced
 * @param skippedGroups venue/gender groups emptied by quality filtering
 * @param errorMessage failure reason for FAILED runs
 * @param createdAt persistence creation timestamp
 * @param completedAt completion timestamp for terminal states
 */
public record CorrectionRunDTO(
        Long id,
        String status,
        String baselineVenue,
        String requestedReferenceVenue,
        Double baselineMedianMen,
        Double baselineMedianWomen,
        Integer recordCount,
        Integer retainedCount,
        Integer entryCount,
        Integer skippedGroups,
        String errorMessage,
        Instant createdAt,
        Instant completedAt) {

    /**
     * Converts a run entity to its API DTO counterpart.
     *
     * @param run persisted correction run entity
     * @return immutable DTO suitable for response serialization
     */
    public static CorrectionRunDTO from(CorrectionRun run) {
        return new CorrectionRunDTO(
                run.id,
                run.status != null ? run.status.name() : null,
                run.baselineVenue,
                run.requestedReferenceVenue,
                run.baselineMedianMen,
                run.baselineMedianWomen,
                run.recordCount,
                run.retainedCount,
                run.entryCount,
                run.skippedGroups,
                run.errorMessage,
                run.createdAt,
                run.completedAt);
    }
}

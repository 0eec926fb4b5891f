/* (C)2026 */
package com.ammann.coursecorrect.dto;

import com.ammann.coursecorrect.enumeration.Gender;
import com.ammann.coursecorrect.model.CorrectionTable;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * API representation of the currently published correction table.
 *
 * @param runId correction run the table was built from
 * @param baselineVenue shared baseline venue
 * @param baselineMedianMen men's median at the baseline venue
 * @param baselineMedianWomen women's median at the baseline venue
 * @param computedAt completion time of the run
 * @param entries all entries ordered by venue, then gender
 */
@Schema(description = "Published correction table")
public record CorrectionTableDTO(
        Long runId,
        String baselineVenue,
        Double baselineMedianMen,
        Double baselineMedianWomen,
        Instant computedAt,
        List<CorrectionEntryDTO> entries) {

    /**
     * Converts a published table snapshot to its API DTO counterpart.
     *
     * @param table immutable correction table
     * @return DTO suitable for response serialization
     */
    public static CorrectionTableDTO from(CorrectionTable table) {
        return new CorrectionTableDTO(
                table.getRunId(),
                table.getBaselineVenue(),
                table.getBaselineMedians().get(Gender.M),
                table.getBaselineMedians().get(Gender.W),
                table.getComputedAt(),
                table.getEntries().stream().map(CorrectionEntryDTO::from).toList());
    }
}

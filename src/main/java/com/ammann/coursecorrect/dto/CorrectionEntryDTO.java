/* (C)2026 */
package com.ammann.coursecorrect.dto;

import com.ammann.coursecorrect.model.CorrectionEntry;
import com.ammann.coursecorrect.service.CorrectionCalculationService;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * API representation of a single correction entry.
 *
 * @param venue venue name
 * @param gender gender code
 * @param offsetSeconds venue median minus baseline median
 * @param offsetPct sign-inverted percentage of the baseline median
 * @param correction {@code offsetPct} formatted for display
 * @param sampleCount filtered records behind the median
 * @param medianSeconds venue median
 * @param confidence advisory sample-size flag
 */
@Schema(description = "Correction of one venue and gender")
public record CorrectionEntryDTO(
        String venue,
        String gender,
        double offsetSeconds,
        double offsetPct,
        String correction,
        int sampleCount,
        double medianSeconds,
        String confidence) {

    public static CorrectionEntryDTO from(CorrectionEntry entry) {
        return new CorrectionEntryDTO(
                entry.venue(),
                entry.gender().name(),
                entry.offsetSeconds(),
                entry.offsetPct(),
                CorrectionCalculationService.formatPercentage(entry.offsetPct()),
                entry.sampleCount(),
                entry.medianSeconds(),
                entry.confidence().name());
    }
}

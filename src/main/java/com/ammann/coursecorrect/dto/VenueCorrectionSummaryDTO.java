/* (C)2026 */
package com.ammann.coursecorrect.dto;

import com.ammann.coursecorrect.enumeration.Confidence;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * One venue of the venue listing with the corrections of both genders.
 *
 * <p>Gender-specific fields are {@code null} when the venue has no entry for that gender.
 */
@Schema(description = "Venue with its per-gender course corrections")
public record VenueCorrectionSummaryDTO(
    @Schema(description = "Venue name")
    String venue,

    @Schema(description = "Men's correction percentage (positive = fast course)", nullable = true)
    Double menCorrectionPct,

    @Schema(description = "Women's correction percentage (positive = fast course)", nullable = true)
    Double womenCorrectionPct,

    @Schema(description = "Men's correction for display, e.g. +15.7%", nullable = true)
    String menCorrection,

    @Schema(description = "Women's correction for display, e.g. -8.8%", nullable = true)
    String womenCorrection,

    @Schema(description = "Men's offset in seconds (positive = slow course)", nullable = true)
    Double menOffsetSeconds,

    @Schema(description = "Women's offset in seconds (positive = slow course)", nullable = true)
    Double womenOffsetSeconds,

    @Schema(description = "Filtered records behind both genders' medians")
    int sampleCount,

    @Schema(description = "LOW if any of the venue's entries is based on a small sample")
    Confidence confidence,

    @Schema(description = "True for the baseline venue")
    boolean baseline
) {}

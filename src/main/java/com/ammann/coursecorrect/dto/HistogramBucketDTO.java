/* (C)2026 */
package com.ammann.coursecorrect.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Represents a single bin of a finish time histogram.
 *
 * <p>Bins are half-open {@code [binStart, binEnd)} except the last one, which also holds
 * times equal to the upper quality bound.
 */
@Schema(description = "Single histogram bin with its finish time count")
public record HistogramBucketDTO(
    @Schema(description = "Bin start in seconds (inclusive)")
    double binStart,

    @Schema(description = "Bin end in seconds (exclusive, inclusive for the last bin)")
    double binEnd,

    @Schema(description = "Number of finish times in this bin")
    int count
) {}

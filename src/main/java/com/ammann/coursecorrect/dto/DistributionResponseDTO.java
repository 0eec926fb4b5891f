/* (C)2026 */
package com.ammann.coursecorrect.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.SortedMap;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Histogram and percentile summary of quality-filtered finish times.
 *
 * <p>Bins cover the full quality range and include empty bins. The median and percentile
 * ladder are omitted when the selection contains no finish times.
 */
@Schema(description = "Finish time distribution of the selected venues and genders")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DistributionResponseDTO(
    @Schema(description = "Ordered histogram bins, including empty ones")
    List<HistogramBucketDTO> bins,

    @Schema(description = "Number of finish times across all bins")
    long totalCount,

    @Schema(description = "Bin width in seconds")
    double binWidthSeconds,

    @Schema(description = "Gender codes included in the selection")
    List<String> genders,

    @Schema(description = "Venues included in the selection; empty means all venues")
    List<String> venues,

    @Schema(description = "Median finish time of the selection in seconds")
    Double medianSeconds,

    @Schema(description = "Median finish time of the selection (H:MM:SS)")
    String medianTime,

    @Schema(description = "Percentile (10/25/50/75/90) to finish time in seconds")
    SortedMap<Integer, Double> percentiles
) {}

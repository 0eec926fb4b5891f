/* (C)2026 */
package com.ammann.coursecorrect.dto;

import com.ammann.coursecorrect.model.VenueStat;
import com.ammann.coursecorrect.time.FinishTimes;
import java.util.SortedMap;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Summary statistics of one venue and gender after quality filtering.
 */
@Schema(description = "Per-venue, per-gender finish time statistics")
public record VenueStatisticsDTO(
    @Schema(description = "Venue name")
    String venue,

    @Schema(description = "Gender code")
    String gender,

    @Schema(description = "Filtered records in the group")
    int sampleCount,

    @Schema(description = "Median finish time in seconds")
    double medianSeconds,

    @Schema(description = "Median finish time (H:MM:SS)")
    String medianTime,

    @Schema(description = "Mean finish time in seconds")
    double meanSeconds,

    @Schema(description = "Percentile to finish time in seconds")
    SortedMap<Integer, Double> percentiles
) {
    public static VenueStatisticsDTO from(VenueStat stat) {
        return new VenueStatisticsDTO(
            stat.venue(),
            stat.gender().name(),
            stat.sampleCount(),
            stat.medianSeconds(),
            FinishTimes.format(stat.medianSeconds()),
            stat.meanSeconds(),
            stat.percentileLadder()
        );
    }
}

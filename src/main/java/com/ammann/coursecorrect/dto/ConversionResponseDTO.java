/* (C)2026 */
package com.ammann.coursecorrect.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Result of converting a finish time from one venue to another.
 *
 * <p>Times are formatted {@code H:MM:SS} with fractional seconds truncated; the raw seconds are
 * returned alongside for clients that need full precision.
 */
@Schema(description = "Converted finish time with the offsets that were applied")
public record ConversionResponseDTO(
    @Schema(description = "Finish time as submitted")
    String originalTime,

    @Schema(description = "Submitted finish time in seconds")
    double originalSeconds,

    @Schema(description = "Converted finish time (H:MM:SS)")
    String convertedTime,

    @Schema(description = "Converted finish time in seconds")
    double convertedSeconds,

    @Schema(description = "Gender code the conversion was done for")
    String gender,

    @Schema(description = "Source venue")
    String fromVenue,

    @Schema(description = "Target venue; the baseline venue when 'normalized' was requested")
    String toVenue,

    @Schema(description = "Offset of the source venue in seconds (positive = slower course)")
    double fromOffsetSeconds,

    @Schema(description = "Offset of the target venue in seconds (positive = slower course)")
    double toOffsetSeconds,

    @Schema(description = "Absolute difference between converted and original time (H:MM:SS)")
    String timeDifference,

    @Schema(description = "Absolute difference between converted and original time in seconds")
    double timeDifferenceSeconds,

    @Schema(description = "True if the converted time is faster than the original")
    boolean faster,

    @Schema(description = "Baseline venue of the correction table used")
    String baselineVenue
) {}

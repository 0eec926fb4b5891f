/* (C)2026 */
package com.ammann.coursecorrect.dto;

import jakarta.validation.constraints.NotBlank;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Request body of a finish time conversion.
 */
@Schema(description = "Finish time conversion request")
public record ConversionRequestDTO(
    @Schema(description = "Finish time as HH:MM:SS or MM:SS", example = "1:15:00")
    @NotBlank
    String finishTime,

    @Schema(description = "Gender code (M/W) or label (men/women)", example = "M")
    @NotBlank
    String gender,

    @Schema(description = "Venue the time was recorded at", example = "Maastricht")
    @NotBlank
    String fromVenue,

    @Schema(description = "Target venue, or 'normalized' for the baseline venue", example = "London")
    @NotBlank
    String toVenue
) {}

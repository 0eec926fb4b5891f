/* (C)2026 */
package com.ammann.coursecorrect.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * One finish time submitted for ingestion.
 *
 * <p>Either {@code finishSeconds} or {@code finishTime} must be present; when both are given,
 * {@code finishSeconds} wins and {@code finishTime} is stored for display only.
 */
@Schema(description = "Cleaned finish time to ingest")
public record ResultRecordDTO(
    @Schema(description = "Venue name", example = "London")
    String venue,

    @Schema(description = "Gender code (M/W) or label (men/women)", example = "W")
    String gender,

    @Schema(description = "Finish time in seconds", example = "4821")
    Double finishSeconds,

    @Schema(description = "Finish time as HH:MM:SS or MM:SS", example = "1:20:21")
    String finishTime
) {}

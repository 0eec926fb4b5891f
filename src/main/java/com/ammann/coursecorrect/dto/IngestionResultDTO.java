/* (C)2026 */
package com.ammann.coursecorrect.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Summary of a result ingestion, with the triggered correction run if one was requested.
 */
@Schema(description = "Result ingestion summary")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IngestionResultDTO(
    @Schema(description = "Records received in the request")
    int received,

    @Schema(description = "Records persisted")
    int persisted,

    @Schema(description = "Total stored records after ingestion")
    long totalStored,

    @Schema(description = "Correction run triggered by this ingestion, if any")
    CorrectionRunDTO correctionRun
) {}

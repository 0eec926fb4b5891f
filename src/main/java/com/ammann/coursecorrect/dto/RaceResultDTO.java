/* (C)2026 */
package com.ammann.coursecorrect.dto;

import com.ammann.coursecorrect.model.RaceResult;
import com.ammann.coursecorrect.time.FinishTimes;
import java.time.Instant;

/**
 * API representation of a stored finish time.
 *
 * @param id row identifier
 * @param venue venue name
 * @param gender gender code
 * @param finishSeconds finish time in seconds
 * @param finishTime finish time as submitted, or formatted from the seconds when none was given
 * @param ingestedAt ingestion timestamp
 */
public record RaceResultDTO(
        Long id,
        String venue,
        String gender,
        Double finishSeconds,
        String finishTime,
        Instant ingestedAt) {

    public static RaceResultDTO from(RaceResult result) {
        return new RaceResultDTO(
                result.id,
                result.venue,
                result.gender != null ? result.gender.name() : null,
                result.finishSeconds,
                result.finishTime != null
                        ? result.finishTime
                        : FinishTimes.format(result.finishSeconds),
                result.ingestedAt);
    }
}

/* (C)2026 */
package com.ammann.coursecorrect.model;

import com.ammann.coursecorrect.enumeration.Gender;
import java.util.Comparator;
import java.util.Objects;

/**
 * One cleaned finish time as delivered by data acquisition. Immutable once ingested.
 *
 * @param venue         venue name
 * @param gender        competition division
 * @param finishSeconds finish time in seconds, strictly positive
 */
public record ResultRecord(String venue, Gender gender, double finishSeconds) {

    /** Orders records fastest first. */
    public static final Comparator<ResultRecord> BY_FINISH_TIME =
            Comparator.comparingDouble(ResultRecord::finishSeconds);

    public ResultRecord {
        Objects.requireNonNull(venue, "venue");
        Objects.requireNonNull(gender, "gender");
        if (venue.isBlank()) {
            throw new IllegalArgumentException("venue must not be blank");
        }
        if (!(finishSeconds > 0) || Double.isInfinite(finishSeconds)) {
            throw new IllegalArgumentException("finishSeconds must be positive and finite: " + finishSeconds);
        }
    }

    public VenueGender key() {
        return new VenueGender(venue, gender);
    }
}

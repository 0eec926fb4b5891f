/* (C)2026 */
package com.ammann.coursecorrect.model;

import com.ammann.coursecorrect.enumeration.Confidence;
import com.ammann.coursecorrect.enumeration.Gender;

/**
 * Correction of one venue/gender relative to the baseline venue.
 *
 * @param venue         venue name
 * @param gender        competition division
 * @param offsetSeconds venue median minus baseline median; positive means a slower course
 * @param offsetPct     sign-inverted offset as a percentage of the baseline median, one decimal
 * @param sampleCount   filtered records behind the venue median
 * @param medianSeconds the venue median the offset was derived from
 * @param confidence    advisory sample-size flag
 */
public record CorrectionEntry(
        String venue,
        Gender gender,
        double offsetSeconds,
        double offsetPct,
        int sampleCount,
        double medianSeconds,
        Confidence confidence) {

    public VenueGender key() {
        return new VenueGender(venue, gender);
    }
}

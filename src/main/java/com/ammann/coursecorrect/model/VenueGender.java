/* (C)2026 */
package com.ammann.coursecorrect.model;

import com.ammann.coursecorrect.enumeration.Gender;
import java.util.Comparator;

/**
 * Grouping key of every per-venue statistic and correction.
 */
public record VenueGender(String venue, Gender gender) {

    public static final Comparator<VenueGender> NATURAL_ORDER =
            Comparator.comparing(VenueGender::venue).thenComparing(VenueGender::gender);
}

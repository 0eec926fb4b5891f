/* (C)2026 */
package com.ammann.coursecorrect.model;

import com.ammann.coursecorrect.enumeration.Gender;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Summary statistics of one venue/gender group after quality filtering.
 *
 * @param venue            venue name
 * @param gender           competition division
 * @param sampleCount      number of filtered records, always positive
 * @param medianSeconds    standard median finish time
 * @param meanSeconds      arithmetic mean finish time
 * @param percentileLadder percentile (0-100) to finish time, ascending by percentile
 */
public record VenueStat(
        String venue,
        Gender gender,
        int sampleCount,
        double medianSeconds,
        double meanSeconds,
        SortedMap<Integer, Double> percentileLadder) {

    public VenueStat {
        if (sampleCount <= 0) {
            throw new IllegalArgumentException("sampleCount must be positive");
        }
        percentileLadder = Collections.unmodifiableSortedMap(new TreeMap<>(percentileLadder));
    }

    public VenueGender key() {
        return new VenueGender(venue, gender);
    }
}

/* (C)2026 */
package com.ammann.coursecorrect.model;

import com.ammann.coursecorrect.enumeration.Gender;
import java.util.Map;

/**
 * Outcome of baseline selection.
 *
 * @param venue           shared baseline venue
 * @param medianByGender  baseline median per gender
 * @param perGenderPicks  the venue each gender's own ranking selected
 */
public record BaselineSelection(
        String venue, Map<Gender, Double> medianByGender, Map<Gender, String> perGenderPicks) {

    public BaselineSelection {
        medianByGender = Map.copyOf(medianByGender);
        perGenderPicks = Map.copyOf(perGenderPicks);
    }

    public double medianFor(Gender gender) {
        Double median = medianByGender.get(gender);
        if (median == null) {
            throw new IllegalStateException("No baseline median for gender " + gender);
        }
        return median;
    }
}

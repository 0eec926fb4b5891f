/* (C)2026 */
package com.ammann.coursecorrect.enumeration;

import java.util.Locale;

/**
 * Competition division a finish time was recorded in.
 *
 * <p>Corrections are always computed and applied per gender; offsets of one division are
 * never used to convert a time of the other.
 */
public enum Gender {
    /** Men's division. */
    M("men"),
    /** Women's division. */
    W("women");

    private final String label;

    Gender(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Resolves a gender from its code ({@code M}/{@code W}) or label ({@code men}/{@code women}),
     * ignoring case and surrounding whitespace.
     *
     * @param value gender code or label
     * @return the matching gender
     * @throws IllegalArgumentException if the value matches no gender
     */
    public static Gender fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Gender must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Gender gender : values()) {
            if (gender.name().toLowerCase(Locale.ROOT).equals(normalized)
                    || gender.label.equals(normalized)) {
                return gender;
            }
        }
        throw new IllegalArgumentException("Unknown gender: " + value);
    }
}

/* (C)2026 */
package com.ammann.coursecorrect.resource;

import com.ammann.coursecorrect.enumeration.Gender;
import com.ammann.coursecorrect.exception.ValidationException;

import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Conversion of raw query and body parameters shared by the resources.
 */
final class RequestParameters
{
    private RequestParameters() {}

    /**
     * Parses a required gender parameter.
     *
     * @throws ValidationException if the value is not a gender code or label
     */
    static Gender requireGender(String name, String value)
    {
        try {
            return Gender.fromCode(value);
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidParameter(name, value, "M, W, men or women");
        }
    }

    /** Parses an optional gender parameter; blank means "no filter". */
    static Gender optionalGender(String name, String value)
    {
        return value == null || value.isBlank() ? null : requireGender(name, value);
    }

    static Set<Gender> genders(String name, Collection<String> values)
    {
        Set<Gender> genders = EnumSet.noneOf(Gender.class);
        if (values != null) {
            values.stream()
                    .filter(v -> v != null && !v.isBlank())
                    .forEach(v -> genders.add(requireGender(name, v)));
        }
        return genders;
    }

    static Set<String> names(Collection<String> values)
    {
        Set<String> names = new LinkedHashSet<>();
        if (values != null) {
            values.stream()
                    .filter(v -> v != null && !v.isBlank())
                    .map(String::strip)
                    .forEach(names::add);
        }
        return names;
    }

    static int clampLimit(int limit, int max)
    {
        return Math.min(Math.max(1, limit), max);
    }
}

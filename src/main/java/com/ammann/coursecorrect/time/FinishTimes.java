/* (C)2026 */
package com.ammann.coursecorrect.time;

import com.ammann.coursecorrect.exception.InvalidTimeException;

/**
 * Strict parsing and formatting of finish times.
 *
 * <p>Accepted inputs are {@code H:MM:SS} (minutes and seconds below 60) and {@code MM:SS}
 * (seconds below 60, minutes unbounded), with non-negative ASCII integer components and optional
 * surrounding whitespace. Formatting always produces {@code H:MM:SS}, truncating fractions.
 */
public final class FinishTimes {

    private FinishTimes() {}

    /**
     * Parses a time string without throwing.
     *
     * @param input time string in {@code HH:MM:SS} or {@code MM:SS} form
     * @return {@link TimeParseResult.Parsed} or {@link TimeParseResult.Invalid}
     */
    public static TimeParseResult parse(String input) {
        if (input == null || input.isBlank()) {
            return new TimeParseResult.Invalid(input, "time is empty");
        }

        String[] parts = input.strip().split(":", -1);
        if (parts.length != 2 && parts.length != 3) {
            return new TimeParseResult.Invalid(input, "expected 2 or 3 ':'-separated fields");
        }

        long[] fields = new long[parts.length];
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            if (part.isEmpty() || part.length() > 6 || !part.chars().allMatch(c -> c >= '0' && c <= '9')) {
                return new TimeParseResult.Invalid(input, "field '" + part + "' is not a number");
            }
            fields[i] = Long.parseLong(part);
        }

        long seconds;
        if (fields.length == 3) {
            if (fields[1] >= 60 || fields[2] >= 60) {
                return new TimeParseResult.Invalid(input, "minutes and seconds must be below 60");
            }
            seconds = fields[0] * 3600 + fields[1] * 60 + fields[2];
        } else {
            if (fields[1] >= 60) {
                return new TimeParseResult.Invalid(input, "seconds must be below 60");
            }
            seconds = fields[0] * 60 + fields[1];
        }

        if (seconds <= 0) {
            return new TimeParseResult.Invalid(input, "time must be positive");
        }
        return new TimeParseResult.Parsed(input, seconds);
    }

    /**
     * Parses a time string, throwing on rejection.
     *
     * @throws InvalidTimeException if the input cannot be parsed or is not positive
     */
    public static double parseSeconds(String input) {
        return parse(input).orElseThrow();
    }

    /**
     * Validates a raw seconds value.
     *
     * @throws InvalidTimeException if the value is not positive and finite
     */
    public static double requireValidSeconds(double seconds) {
        if (Double.isNaN(seconds) || Double.isInfinite(seconds) || seconds <= 0) {
            throw new InvalidTimeException(String.valueOf(seconds), "time must be a positive finite number of seconds");
        }
        return seconds;
    }

    /**
     * Formats seconds as {@code H:MM:SS}, truncating the fractional part. Negative values keep
     * their sign, e.g. {@code -0:12:34}.
     */
    public static String format(double seconds) {
        long total = (long) Math.abs(seconds);
        long hours = total / 3600;
        long minutes = (total % 3600) / 60;
        long secs = total % 60;
        String sign = seconds < 0 && total > 0 ? "-" : "";
        return String.format("%s%d:%02d:%02d", sign, hours, minutes, secs);
    }
}

/* (C)2026 */
package com.ammann.coursecorrect.time;

import com.ammann.coursecorrect.exception.InvalidTimeException;

/**
 * Outcome of parsing a finish time string: either {@link Parsed} seconds or an
 * {@link Invalid} input with the reason it was rejected.
 */
public sealed interface TimeParseResult permits TimeParseResult.Parsed, TimeParseResult.Invalid {

    /**
     * Returns the parsed seconds or throws the rejection as an {@link InvalidTimeException}.
     */
    double orElseThrow();

    boolean isValid();

    /**
     * A successfully parsed, strictly positive finish time.
     *
     * @param input the original string
     * @param seconds total seconds
     */
    record Parsed(String input, double seconds) implements TimeParseResult {
        @Override
        public double orElseThrow() {
            return seconds;
        }

        @Override
        public boolean isValid() {
            return true;
        }
    }

    /**
     * A rejected input.
     *
     * @param input the original string, possibly {@code null}
     * @param reason why the input was rejected
     */
    record Invalid(String input, String reason) implements TimeParseResult {
        @Override
        public double orElseThrow() {
            throw new InvalidTimeException(input, reason);
        }

        @Override
        public boolean isValid() {
            return false;
        }
    }
}

/* (C)2026 */
package com.ammann.coursecorrect.exception;

/**
 * A finish time that is not a positive finite number of seconds, or a time string that is
 * neither {@code HH:MM:SS} nor {@code MM:SS}.
 *
 * <p>Mapped to HTTP 400 by {@link GlobalExceptionHandler}. Rejects the single request only.
 */
public class InvalidTimeException extends ValidationException
{
    private final String input;

    public InvalidTimeException(String input, String reason)
    {
        super(String.format("Invalid finish time '%s': %s. Use HH:MM:SS or MM:SS", input, reason));
        this.input = input;
    }

    public String getInput()
    {
        return input;
    }
}

/* (C)2026 */
package com.ammann.coursecorrect.exception;

/**
 * Base unchecked exception for all application-level errors in the course correction API.
 *
 * <p>Subclasses represent specific error categories (invalid input, unknown venues, failed
 * recomputations) and are mapped to appropriate HTTP status codes by
 * {@link GlobalExceptionHandler}.
 */
public class ApiException extends RuntimeException
{
    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }

    public ApiException(String message) {
        super(message);
    }
}

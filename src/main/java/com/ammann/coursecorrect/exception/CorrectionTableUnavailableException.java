/* (C)2026 */
package com.ammann.coursecorrect.exception;

/**
 * No correction table has been published yet, so conversions cannot be served.
 *
 * <p>Mapped to HTTP 503 (Service Unavailable) by {@link GlobalExceptionHandler}.
 */
public class CorrectionTableUnavailableException extends ApiException
{
    public CorrectionTableUnavailableException()
    {
        super("No correction table has been computed yet");
    }
}

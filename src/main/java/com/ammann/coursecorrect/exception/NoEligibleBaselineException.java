/* (C)2026 */
package com.ammann.coursecorrect.exception;

/**
 * No venue can serve as the shared baseline: one gender has no data at all, no venue has data
 * for both genders, or a requested reference venue is not eligible.
 *
 * <p>Fatal to a recomputation run; the previously published table stays in place.
 * Mapped to HTTP 409 (Conflict) by {@link GlobalExceptionHandler}.
 */
public class NoEligibleBaselineException extends ApiException
{
    public NoEligibleBaselineException(String message)
    {
        super(message);
    }
}

/* (C)2026 */
package com.ammann.coursecorrect.exception;

import com.ammann.coursecorrect.enumeration.Gender;

/**
 * The requested venue has no correction entry for the requested gender, either because it was
 * never ingested or because no record survived quality filtering.
 *
 * <p>Mapped to HTTP 400 by {@link GlobalExceptionHandler}.
 */
public class UnknownVenueException extends ApiException
{
    private final String venue;
    private final Gender gender;

    public UnknownVenueException(String venue, Gender gender)
    {
        super(String.format("Unknown venue '%s' for gender %s", venue, gender));
        this.venue = venue;
        this.gender = gender;
    }

    public String getVenue()
    {
        return venue;
    }

    public Gender getGender()
    {
        return gender;
    }
}

/* (C)2026 */
package com.ammann.coursecorrect.exception;

import com.ammann.coursecorrect.enumeration.Gender;

/**
 * A venue/gender group that was expected to exist has no records left to aggregate.
 *
 * <p>During recomputation the group is skipped and omitted from the published table; the
 * run itself continues. Mapped to HTTP 422 when it reaches a client.
 */
public class InsufficientDataException extends ApiException
{
    private final String venue;
    private final Gender gender;

    public InsufficientDataException(String venue, Gender gender)
    {
        super(String.format("No records available for venue '%s' and gender %s", venue, gender));
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

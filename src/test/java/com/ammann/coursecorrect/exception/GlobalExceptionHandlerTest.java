/* (C)2026 */
package com.ammann.coursecorrect.exception;

import com.ammann.coursecorrect.enumeration.Gender;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest
{

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp()
    {
        handler = new GlobalExceptionHandler();
        handler.uriInfo = null; // default path handling
    }

    @Test
    void mapsValidationExceptionToBadRequest()
    {
        Response response = handler.toResponse(new ValidationException("bad input"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.BAD_REQUEST.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = body(response);
        assertThat(body.path).isNull();
        assertThat(body.code).isEqualTo("VALIDATION_ERROR");
        assertThat(body.status).isEqualTo(400);
    }

    @Test
    void mapsInvalidTimeToBadRequestWithOwnCode()
    {
        Response response = handler.toResponse(new InvalidTimeException("1:75:00", "minutes and seconds must be below 60"));

        assertThat(response.getStatus()).isEqualTo(400);
        assertThat(body(response).code).isEqualTo("INVALID_TIME");
        assertThat(body(response).error).contains("1:75:00");
    }

    @Test
    void mapsUnknownVenueToBadRequest()
    {
        Response response = handler.toResponse(new UnknownVenueException("Nowhere", Gender.M));

        assertThat(response.getStatus()).isEqualTo(400);
        assertThat(body(response).code).isEqualTo("UNKNOWN_VENUE");
        assertThat(body(response).error).contains("Nowhere");
    }

    @Test
    void mapsInsufficientDataToUnprocessable()
    {
        Response response = handler.toResponse(new InsufficientDataException("London", Gender.W));

        assertThat(response.getStatus()).isEqualTo(422);
        assertThat(body(response).code).isEqualTo("INSUFFICIENT_DATA");
    }

    @Test
    void mapsNoEligibleBaselineToConflict()
    {
        Response response = handler.toResponse(new NoEligibleBaselineException("no venue has both genders"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.CONFLICT.getStatusCode());
        assertThat(body(response).code).isEqualTo("NO_ELIGIBLE_BASELINE");
    }

    @Test
    void mapsMissingTableToServiceUnavailable()
    {
        Response response = handler.toResponse(new CorrectionTableUnavailableException());

        assertThat(response.getStatus()).isEqualTo(Response.Status.SERVICE_UNAVAILABLE.getStatusCode());
        assertThat(body(response).code).isEqualTo("CORRECTION_TABLE_UNAVAILABLE");
    }

    @Test
    void mapsNotFoundTo404()
    {
        Response response = handler.toResponse(new NotFoundException("missing"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.NOT_FOUND.getStatusCode());
        assertThat(body(response).code).isEqualTo("NOT_FOUND");
        assertThat(body(response).error).contains("missing");
    }

    @Test
    void mapsUnhandledTo500()
    {
        Response response = handler.toResponse(new RuntimeException("boom"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.INTERNAL_SERVER_ERROR.getStatusCode());
        assertThat(body(response).code).isEqualTo("INTERNAL_ERROR");
        assertThat(body(response).error).isEqualTo("An unexpected error occurred");
    }

    private static GlobalExceptionHandler.ErrorResponse body(Response response)
    {
        return (GlobalExceptionHandler.ErrorResponse) response.getEntity();
    }
}

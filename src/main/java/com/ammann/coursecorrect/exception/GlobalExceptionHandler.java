/* (C)2026 */
package com.ammann.coursecorrect.exception;

import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.time.LocalDateTime;

/**
 * Global JAX-RS exception mapper that translates application and framework exceptions
 * into structured JSON error responses with appropriate HTTP status codes.
 *
 * <p>Request-scoped errors (invalid times, unknown venues, bad parameters) are returned as
 * 4xx responses; recomputation failures as 409/422; a missing correction table as 503.
 * Unhandled exceptions are logged at ERROR level and returned as HTTP 500 responses.
 */
@Provider
public class GlobalExceptionHandler implements ExceptionMapper<Exception>
{
    private static final Logger LOG = Logger.getLogger(GlobalExceptionHandler.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(Exception exception)
    {
        String path = uriInfo != null ? uriInfo.getPath() : null;

        if (exception instanceof InvalidTimeException) {
            LOG.debugf("Rejected finish time for path %s: %s", path, exception.getMessage());
            return createResponse(
                    Response.Status.BAD_REQUEST,
                    exception.getMessage(),
                    "INVALID_TIME",
                    path
            );
        }

        if (exception instanceof ValidationException) {
            return createResponse(
                    Response.Status.BAD_REQUEST,
                    exception.getMessage(),
                    "VALIDATION_ERROR",
                    path
            );
        }

        if (exception instanceof UnknownVenueException) {
            LOG.debugf("Unknown venue for path %s: %s", path, exception.getMessage());
            return createResponse(
                    Response.Status.BAD_REQUEST,
                    exception.getMessage(),
                    "UNKNOWN_VENUE",
                    path
            );
        }

        if (exception instanceof InsufficientDataException) {
            return createResponse(
                    422,
                    exception.getMessage(),
                    "INSUFFICIENT_DATA",
                    path
            );
        }

        if (exception instanceof NoEligibleBaselineException) {
            LOG.warnf("Recomputation rejected: %s", exception.getMessage());
            return createResponse(
                    Response.Status.CONFLICT,
                    exception.getMessage(),
                    "NO_ELIGIBLE_BASELINE",
                    path
            );
        }

        if (exception instanceof CorrectionTableUnavailableException) {
            return createResponse(
                    Response.Status.SERVICE_UNAVAILABLE,
                    exception.getMessage(),
                    "CORRECTION_TABLE_UNAVAILABLE",
                    path
            );
        }

        if (exception instanceof NotFoundException) {
            return createResponse(
                    Response.Status.NOT_FOUND,
                    exception.getMessage(),
                    "NOT_FOUND",
                    path
            );
        }

        LOG.error("Unhandled exception: " + exception.getClass().getSimpleName(), exception);
        return createResponse(
                Response.Status.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred",
                "INTERNAL_ERROR",
                path
        );
    }

    private Response createResponse(Response.Status status, String message, String code, String path)
    {
        return createResponse(status.getStatusCode(), message, code, path);
    }

    private Response createResponse(int status, String message, String code, String path)
    {
        ErrorResponse errorResponse = new ErrorResponse(code, message, path, status);
        return Response.status(status).entity(errorResponse).build();
    }


    /**
     * Structured error response body returned to API clients.
     */
    public static class ErrorResponse
    {
        public String error;
        public String code;
        public LocalDateTime timestamp;
        public String path;
        public Integer status;

        public ErrorResponse(String code, String error)
        {
            this.code = code;
            this.error = error;
            this.timestamp = LocalDateTime.now();
        }

        public ErrorResponse(String code, String error, String path, Integer status)
        {
            this(code, error);
            this.path = path;
            this.status = status;
        }
    }
}

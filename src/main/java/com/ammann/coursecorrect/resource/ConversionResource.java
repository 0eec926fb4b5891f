/* (C)2026 */
package com.ammann.coursecorrect.resource;

import com.ammann.coursecorrect.dto.ConversionRequestDTO;
import com.ammann.coursecorrect.dto.ConversionResponseDTO;
import com.ammann.coursecorrect.enumeration.Gender;
import com.ammann.coursecorrect.exception.GlobalExceptionHandler;
import com.ammann.coursecorrect.exception.ValidationException;
import com.ammann.coursecorrect.properties.ApiProperties;
import com.ammann.coursecorrect.service.TimeConversionService;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * REST resource converting finish times between venues.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Conversion.BASE)
@Tag(name = "Conversion API", description = "Venue-corrected finish time conversion")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConversionResource
{

    @Inject TimeConversionService conversionService;

    @POST
    @Operation(
            summary = "Convert a finish time",
            description = "Converts a finish time recorded at one venue to its equivalent at another venue. "
                    + "Use 'normalized' as target to convert onto the baseline venue.")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Converted time",
                    content = @Content(schema = @Schema(implementation = ConversionResponseDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid time, gender or unknown venue",
                    content = @Content(schema = @Schema(implementation = GlobalExceptionHandler.ErrorResponse.class))),
            @APIResponse(responseCode = "503", description = "No correction table computed yet")
    })
    public Response convert(@Valid ConversionRequestDTO request)
    {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        Gender gender = RequestParameters.requireGender("gender", request.gender());
        ConversionResponseDTO response = conversionService.convert(
                request.finishTime(), gender, request.fromVenue(), request.toVenue());
        return Response.ok(response).build();
    }
}

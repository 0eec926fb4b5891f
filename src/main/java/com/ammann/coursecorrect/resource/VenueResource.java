/* (C)2026 */
package com.ammann.coursecorrect.resource;

import com.ammann.coursecorrect.dto.VenueCorrectionSummaryDTO;
import com.ammann.coursecorrect.dto.VenueStatisticsDTO;
import com.ammann.coursecorrect.enumeration.Gender;
import com.ammann.coursecorrect.properties.ApiProperties;
import com.ammann.coursecorrect.service.DistributionService;
import com.ammann.coursecorrect.service.TimeConversionService;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * REST resource listing venues with their corrections and statistics.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Venues.BASE)
@Tag(name = "Venue API", description = "Venues, corrections and per-venue statistics")
@Produces(MediaType.APPLICATION_JSON)
public class VenueResource {

    @Inject TimeConversionService conversionService;

    @Inject DistributionService distributionService;

    @GET
    @Operation(
            summary = "List venues",
            description = "Returns every venue of the published correction table, fastest men's course first")
    public Response listVenues() {
        List<VenueCorrectionSummaryDTO> venues = conversionService.listVenues();
        return Response.ok(venues).build();
    }

    @GET
    @Path(ApiProperties.Venues.STATISTICS)
    @Operation(
            summary = "Venue statistics",
            description = "Returns sample count, median, mean and percentiles per venue and gender "
                    + "after quality filtering")
    public Response getStatistics(
            @Parameter(description = "Gender code (M/W); omit for both")
            @QueryParam("gender") String gender) {
        Gender selected = RequestParameters.optionalGender("gender", gender);
        List<VenueStatisticsDTO> statistics = distributionService.venueStatistics(selected).stream()
                .map(VenueStatisticsDTO::from)
                .toList();
        return Response.ok(statistics).build();
    }
}

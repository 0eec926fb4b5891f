/* (C)2026 */
package com.ammann.coursecorrect.resource;

import com.ammann.coursecorrect.dto.DistributionResponseDTO;
import com.ammann.coursecorrect.properties.ApiProperties;
import com.ammann.coursecorrect.service.DistributionService;
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
import org.jboss.logging.Logger;

/**
 * REST resource exposing the finish time histogram.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Distribution.BASE)
@Tag(name = "Distribution API", description = "Finish time histograms and percentiles")
@Produces(MediaType.APPLICATION_JSON)
public class DistributionResource {

    private static final Logger LOG = Logger.getLogger(DistributionResource.class);

    @Inject DistributionService distributionService;

    @GET
    @Operation(
            summary = "Finish time distribution",
            description = "Histogram of quality-filtered finish times over the quality bounds, "
                    + "optionally restricted to genders and venues")
    public Response getDistribution(
            @Parameter(description = "Gender codes to include (repeatable); omit for both")
            @QueryParam("gender") List<String> genders,
            @Parameter(description = "Venues to include (repeatable); omit for all")
            @QueryParam("venue") List<String> venues,
            @Parameter(description = "Bin width in seconds; defaults to the configured width")
            @QueryParam("binWidth") Double binWidth) {
        LOG.debugf("Distribution requested: genders=%s venues=%s binWidth=%s", genders, venues, binWidth);
        DistributionResponseDTO distribution = distributionService.distribution(
                RequestParameters.genders("gender", genders),
                RequestParameters.names(venues),
                binWidth);
        return Response.ok(distribution).build();
    }
}

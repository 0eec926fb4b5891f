/* (C)2026 */
package com.ammann.coursecorrect.resource;

import com.ammann.coursecorrect.dto.CorrectionRunDTO;
import com.ammann.coursecorrect.dto.CorrectionTableDTO;
import com.ammann.coursecorrect.model.CorrectionRun;
import com.ammann.coursecorrect.properties.ApiProperties;
import com.ammann.coursecorrect.service.CorrectionRecomputationService;
import com.ammann.coursecorrect.service.CorrectionTableRegistry;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource exposing the correction table and its recomputation runs.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Corrections.BASE)
@Tag(name = "Correction API", description = "Correction table, runs and recomputation")
@Produces(MediaType.APPLICATION_JSON)
public class CorrectionResource {

    private static final Logger LOG = Logger.getLogger(CorrectionResource.class);
    private static final int MAX_LIMIT = 50;

    @Inject CorrectionTableRegistry registry;

    @Inject CorrectionRecomputationService recomputationService;

    @GET
    @Operation(
            summary = "Current correction table",
            description = "Returns the baseline venue, baseline medians and all correction entries")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Published correction table"),
            @APIResponse(responseCode = "503", description = "No correction table computed yet")
    })
    public Response getCorrections() {
        return Response.ok(CorrectionTableDTO.from(registry.require())).build();
    }

    @GET
    @Path(ApiProperties.Corrections.RUNS)
    @Operation(
            summary = "Recent correction runs",
            description = "Returns the most recent recomputation runs, newest first")
    public Response getRecentRuns(@QueryParam("limit") @DefaultValue("10") int limit) {
        int effectiveLimit = RequestParameters.clampLimit(limit, MAX_LIMIT);
        List<CorrectionRunDTO> runs = recomputationService.getRecentRuns(effectiveLimit).stream()
                .map(CorrectionRunDTO::from)
                .toList();
        return Response.ok(runs).build();
    }

    @POST
    @Path(ApiProperties.Corrections.RECOMPUTE)
    @Operation(
            summary = "Recompute corrections",
            description = "Rebuilds the correction table from all stored results and publishes it. "
                    + "An optional reference venue replaces the median baseline selection.")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Completed run"),
            @APIResponse(responseCode = "409", description = "No eligible baseline venue")
    })
    public Response recompute(@QueryParam("reference") String reference) {
        LOG.infof("Manual recomputation triggered (reference=%s)", reference);
        CorrectionRun run = recomputationService.recompute(reference);
        return Response.ok(CorrectionRunDTO.from(run)).build();
    }
}

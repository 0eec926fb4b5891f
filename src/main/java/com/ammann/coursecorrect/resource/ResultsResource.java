/* (C)2026 */
package com.ammann.coursecorrect.resource;

import com.ammann.coursecorrect.dto.IngestionResultDTO;
import com.ammann.coursecorrect.dto.RaceResultDTO;
import com.ammann.coursecorrect.dto.ResultRecordDTO;
import com.ammann.coursecorrect.enumeration.Gender;
import com.ammann.coursecorrect.properties.ApiProperties;
import com.ammann.coursecorrect.service.RaceResultPersistenceService;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
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
 * REST resource for ingesting and inspecting stored finish times.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Results.BASE)
@Tag(name = "Results API", description = "Cleaned finish time ingestion and inspection")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ResultsResource {

    private static final Logger LOG = Logger.getLogger(ResultsResource.class);
    private static final int MAX_LIMIT = 1000;

    @Inject RaceResultPersistenceService persistenceService;

    @POST
    @Operation(
            summary = "Ingest results",
            description = "Stores cleaned finish times. All rows are validated first; a single invalid "
                    + "row rejects the whole request. With recompute=true the correction table is "
                    + "rebuilt afterwards.")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Results stored"),
            @APIResponse(responseCode = "400", description = "Invalid result record")
    })
    public Response ingest(
            List<ResultRecordDTO> records,
            @QueryParam("recompute") @DefaultValue("false") boolean recompute) {
        LOG.infof("Ingesting %d results (recompute=%s)", records != null ? records.size() : 0, recompute);
        IngestionResultDTO result = persistenceService.ingest(records, recompute);
        return Response.ok(result).build();
    }

    @GET
    @Operation(
            summary = "Stored results",
            description = "Returns stored finish times ordered by venue, gender and time")
    public Response getResults(
            @QueryParam("venue") String venue,
            @QueryParam("gender") String gender,
            @QueryParam("limit") @DefaultValue("100") int limit) {
        Gender selected = RequestParameters.optionalGender("gender", gender);
        String selectedVenue = venue == null || venue.isBlank() ? null : venue.strip();
        List<RaceResultDTO> results = persistenceService
                .findResults(selectedVenue, selected, RequestParameters.clampLimit(limit, MAX_LIMIT))
                .stream()
                .map(RaceResultDTO::from)
                .toList();
        return Response.ok(results).build();
    }

    @GET
    @Path(ApiProperties.Results.VENUES)
    @Operation(
            summary = "Stored venue names",
            description = "Returns the distinct venue names of the stored results, sorted")
    public Response getVenueNames() {
        return Response.ok(persistenceService.listVenueNames()).build();
    }
}

/* (C)2026 */
package com.ammann.traffic.resource;

import com.ammann.traffic.dto.AlertIngestDTO;
import com.ammann.traffic.dto.IngestResultDTO;
import com.ammann.traffic.dto.IntervalStatIngestDTO;
import com.ammann.traffic.properties.ApiProperties;
import com.ammann.traffic.service.IngestionService;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for appending alerts and host interval statistics in batches.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Ingest API", description = "Append-only ingestion of alerts and interval statistics")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class IngestResource {

    private static final Logger LOG = Logger.getLogger(IngestResource.class);

    @Inject IngestionService ingestionService;

    @POST
    @Path(ApiProperties.Ingest.ALERTS)
    @Operation(summary = "Append Alerts", description = "Appends a JSON array of alerts.")
    @APIResponses({
        @APIResponse(
                responseCode = "201",
                description = "Alerts appended",
                content = @Content(schema = @Schema(implementation = IngestResultDTO.class))),
        @APIResponse(responseCode = "400", description = "Malformed alert"),
        @APIResponse(responseCode = "503", description = "Alert store unavailable")
    })
    public Response appendAlerts(List<AlertIngestDTO> alerts) {
        LOG.debugf("Alert batch received: %d elements", alerts != null ? alerts.size() : 0);
        IngestResultDTO result = ingestionService.ingestAlerts(alerts);
        return Response.status(Response.Status.CREATED).entity(result).build();
    }

    @POST
    @Path(ApiProperties.Ingest.INTERVAL_STATS)
    @Operation(summary = "Append Interval Statistics",
            description = "Appends a JSON array of per-host interval buckets. Buckets overlapping a stored"
                    + " bucket of the same host are rejected.")
    @APIResponses({
        @APIResponse(
                responseCode = "201",
                description = "Buckets appended",
                content = @Content(schema = @Schema(implementation = IngestResultDTO.class))),
        @APIResponse(responseCode = "400", description = "Malformed or overlapping bucket"),
        @APIResponse(responseCode = "503", description = "Interval store unavailable")
    })
    public Response appendIntervalStats(List<IntervalStatIngestDTO> stats) {
        LOG.debugf("Interval batch received: %d elements", stats != null ? stats.size() : 0);
        IngestResultDTO result = ingestionService.ingestIntervalStats(stats);
        return Response.status(Response.Status.CREATED).entity(result).build();
    }
}

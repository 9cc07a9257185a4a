package com.ammann.tlparser.resource;

import com.ammann.tlparser.dto.ErrorResponseDTO;
import com.ammann.tlparser.dto.EvaluateFormulaRequestDTO;
import com.ammann.tlparser.exception.ValidationException;
import com.ammann.tlparser.model.StatsRecord;
import com.ammann.tlparser.properties.ApiProperties;
import com.ammann.tlparser.service.FormulaStatisticsService;
import jakarta.inject.Inject;
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
import org.jboss.logging.Logger;

/**
 * REST resource computing the statistics of a single temporal-logic formula.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Formulas.BASE)
@Tag(name = "Formula API", description = "Structural and entropy statistics of temporal-logic formulas")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class FormulaResource {

    private static final Logger LOG = Logger.getLogger(FormulaResource.class);

    @Inject
    FormulaStatisticsService statisticsService;

    @POST
    @Path(ApiProperties.Formulas.EVALUATE)
    @Operation(
            summary = "Evaluate formula",
            description = "Normalizes comparisons, parses the formula and returns height, atomic propositions, operator counts, totals and entropy"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Statistics computed",
                    content = @Content(schema = @Schema(implementation = StatsRecord.class))),
            @APIResponse(responseCode = "400", description = "Malformed formula or operator not supported by the logic",
                    content = @Content(schema = @Schema(implementation = ErrorResponseDTO.class)))
    })
    public Response evaluate(EvaluateFormulaRequestDTO request) {
        if (request == null || request.formula() == null) {
            throw ValidationException.invalidParameter("formula", null, "a formula string");
        }

        LOG.debugf("Evaluate request: formula='%s', type=%s", request.formula(), request.type());
        StatsRecord stats = statisticsService.compute(request.formula(), request.text(), request.type());

        LOG.infof("Evaluated formula: height=%d, aps=%d, entropy=%.3f bits",
                stats.asth(), stats.agg().aps(), stats.entropy().lopsTops());
        return Response.ok(stats).build();
    }
}

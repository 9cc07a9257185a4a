/* (C)2026 */
package com.ammann.tlparser.resource;

import com.ammann.tlparser.exception.ValidationException;
import com.ammann.tlparser.model.DatasetRow;
import com.ammann.tlparser.model.RequirementDocument;
import com.ammann.tlparser.model.RequirementEntry;
import com.ammann.tlparser.properties.ApiProperties;
import com.ammann.tlparser.service.DatasetRowFlattener;
import com.ammann.tlparser.service.RequirementDigestService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource digesting batches of formalized requirements into dataset rows.
 *
 * <p>Rows are returned in input order. A requirement whose formula is rejected yields a
 * FAILED row; the request itself only fails for malformed batches.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Requirements.BASE)
@Tag(name = "Requirement API", description = "Batch statistics of formalized requirements")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class RequirementResource {

    private static final Logger LOG = Logger.getLogger(RequirementResource.class);

    @Inject RequirementDigestService digestService;

    @Inject DatasetRowFlattener flattener;

    @POST
    @Path(ApiProperties.Requirements.DIGEST)
    @Operation(
            summary = "Digest requirements",
            description = "Computes one dataset row per formalized requirement")
    public Response digest(List<RequirementEntry> entries) {
        validate(entries);
        LOG.debugf("Digest request with %d requirements", entries.size());
        List<DatasetRow> rows = digestService.digest(entries);
        return Response.ok(rows).build();
    }

    @POST
    @Path(ApiProperties.Requirements.DIGEST_DOCUMENTS)
    @Operation(
            summary = "Digest requirement catalogue",
            description = "Expands catalogue entries with an accepted status into one dataset row per logic")
    public Response digestDocuments(List<RequirementDocument> documents) {
        if (documents == null) {
            throw ValidationException.invalidParameter("body", null, "a list of requirements");
        }
        for (RequirementDocument document : documents) {
            if (document == null || document.id() == null || document.id().isBlank()) {
                throw ValidationException.invalidParameter(
                        "id", document == null ? null : document.id(), "a non-blank requirement id");
            }
        }
        LOG.debugf("Catalogue digest request with %d requirements", documents.size());
        return Response.ok(digestService.digestDocuments(documents)).build();
    }

    @POST
    @Path(ApiProperties.Requirements.DIGEST_ROWS)
    @Operation(
            summary = "Digest requirements into flat rows",
            description = "Computes dataset rows and flattens them into the tabular column layout")
    public Response digestRows(List<RequirementEntry> entries) {
        validate(entries);
        List<Map<String, Object>> rows = flattener.flattenAll(digestService.digest(entries));
        return Response.ok(rows).build();
    }

    private void validate(List<RequirementEntry> entries) {
        if (entries == null) {
            throw ValidationException.invalidParameter("body", null, "a list of requirements");
        }
        for (RequirementEntry entry : entries) {
            if (entry == null || entry.id() == null || entry.id().isBlank()) {
                throw ValidationException.invalidParameter(
                        "id", entry == null ? null : entry.id(), "a non-blank requirement id");
            }
        }
    }
}

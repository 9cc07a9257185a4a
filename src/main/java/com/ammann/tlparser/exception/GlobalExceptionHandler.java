package com.ammann.tlparser.exception;

import com.ammann.tlparser.dto.ErrorResponseDTO;
import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Global JAX-RS exception mapper that translates application and framework exceptions
 * into structured JSON error responses with appropriate HTTP status codes.
 *
 * <p>Formula errors (format, syntax, unsupported operator) and request validation errors
 * become HTTP 400 carrying the error kind as code. Unhandled exceptions are logged at
 * ERROR level and returned as HTTP 500 responses.
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

        if (exception instanceof FormulaException formulaException) {
            LOG.debugf("Formula rejected for path %s: %s", path, exception.getMessage());
            Integer position = formulaException.position() == FormulaException.NO_POSITION
                    ? null
                    : formulaException.position();
            return createResponse(
                    Response.Status.BAD_REQUEST,
                    exception.getMessage(),
                    formulaException.kind(),
                    position,
                    formulaException.fragment(),
                    path
            );
        }

        if (exception instanceof ValidationException) {
            return createResponse(
                    Response.Status.BAD_REQUEST,
                    exception.getMessage(),
                    "VALIDATION_ERROR",
                    null,
                    null,
                    path
            );
        }

        JsonProcessingException jsonException = jsonCause(exception);
        if (jsonException != null) {
            Throwable cause = jsonException.getCause();
            String message = cause instanceof ValidationException
                    ? cause.getMessage()
                    : "Malformed request body: " + jsonException.getOriginalMessage();
            return createResponse(
                    Response.Status.BAD_REQUEST,
                    message,
                    "VALIDATION_ERROR",
                    null,
                    null,
                    path
            );
        }

        if (exception instanceof NotFoundException) {
            return createResponse(
                    Response.Status.NOT_FOUND,
                    exception.getMessage(),
                    "NOT_FOUND",
                    null,
                    null,
                    path
            );
        }

        if (exception instanceof WebApplicationException webException) {
            Response.Status status = Response.Status.fromStatusCode(webException.getResponse().getStatus());
            return createResponse(
                    status != null ? status : Response.Status.BAD_REQUEST,
                    exception.getMessage(),
                    "HTTP_ERROR",
                    null,
                    null,
                    path
            );
        }

        LOG.error("Unhandled exception: " + exception.getClass().getSimpleName(), exception);
        return createResponse(
                Response.Status.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred",
                "INTERNAL_ERROR",
                null,
                null,
                path
        );
    }

    // Request body readers may wrap Jackson failures in a WebApplicationException
    private static JsonProcessingException jsonCause(Throwable exception)
    {
        if (exception instanceof JsonProcessingException json) {
            return json;
        }
        if (exception instanceof WebApplicationException && exception.getCause() instanceof JsonProcessingException json) {
            return json;
        }
        return null;
    }

    private Response createResponse(
            Response.Status status, String message, String code, Integer position, String fragment, String path)
    {
        ErrorResponseDTO errorResponse =
                new ErrorResponseDTO(code, message, position, fragment, path, status.getStatusCode());
        return Response.status(status).entity(errorResponse).build();
    }
}

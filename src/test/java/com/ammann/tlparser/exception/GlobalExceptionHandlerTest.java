package com.ammann.tlparser.exception;

import com.ammann.tlparser.dto.ErrorResponseDTO;
import com.ammann.tlparser.enumeration.LogicType;
import com.fasterxml.jackson.databind.JsonMappingException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest
{

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp()
    {
        handler = new GlobalExceptionHandler();
        handler.uriInfo = null; // default path handling
    }

    @Test
    void mapsSyntaxExceptionToBadRequestWithPosition()
    {
        Response response = handler.toResponse(
                FormulaSyntaxException.unexpected("end of formula", 5, "')'"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.BAD_REQUEST.getStatusCode());
        ErrorResponseDTO body = (ErrorResponseDTO) response.getEntity();
        assertThat(body.code()).isEqualTo("SYNTAX_ERROR");
        assertThat(body.position()).isEqualTo(5);
        assertThat(body.fragment()).isNull();
        assertThat(body.path()).isNull();
        assertThat(body.timestamp()).isNotNull();
    }

    @Test
    void mapsFormatExceptionToBadRequest()
    {
        Response response = handler.toResponse(FormatException.danglingOperator("=", 2));

        ErrorResponseDTO body = (ErrorResponseDTO) response.getEntity();
        assertThat(response.getStatus()).isEqualTo(400);
        assertThat(body.code()).isEqualTo("FORMAT_ERROR");
        assertThat(body.message()).contains("'='");
        assertThat(body.fragment()).isEqualTo("=");
        assertThat(body.position()).isEqualTo(2);
    }

    @Test
    void unsupportedOperatorHasNoPosition()
    {
        Response response = handler.toResponse(new UnsupportedOperatorException("A", LogicType.LTL));

        ErrorResponseDTO body = (ErrorResponseDTO) response.getEntity();
        assertThat(body.code()).isEqualTo("UNSUPPORTED_OPERATOR");
        assertThat(body.position()).isNull();
        assertThat(body.fragment()).isEqualTo("A");
        assertThat(body.message()).contains("LTL");
    }

    @Test
    void mapsValidationExceptionToBadRequest()
    {
        Response response = handler.toResponse(new ValidationException("bad input"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.BAD_REQUEST.getStatusCode());
        ErrorResponseDTO body = (ErrorResponseDTO) response.getEntity();
        assertThat(body.code()).isEqualTo("VALIDATION_ERROR");
        assertThat(body.message()).isEqualTo("bad input");
        assertThat(body.fragment()).isNull();
    }

    @Test
    void unwrapsValidationErrorsRaisedDuringDeserialization()
    {
        ValidationException cause = ValidationException.invalidParameter("type", "ltl", "a logic");
        JsonMappingException wrapped = new JsonMappingException(null, "cannot build", cause);

        Response response = handler.toResponse(wrapped);

        ErrorResponseDTO body = (ErrorResponseDTO) response.getEntity();
        assertThat(response.getStatus()).isEqualTo(400);
        assertThat(body.message()).isEqualTo(cause.getMessage());
    }

    @Test
    void unwrapsJsonFailureWrappedByBodyReader()
    {
        ValidationException cause = ValidationException.invalidParameter("translation", "maybe", "a value");
        WebApplicationException wrapped = new WebApplicationException(
                new JsonMappingException(null, "cannot build", cause), Response.Status.BAD_REQUEST);

        ErrorResponseDTO body = (ErrorResponseDTO) handler.toResponse(wrapped).getEntity();

        assertThat(body.code()).isEqualTo("VALIDATION_ERROR");
        assertThat(body.message()).isEqualTo(cause.getMessage());
    }

    @Test
    void keepsStatusOfOtherWebApplicationExceptions()
    {
        Response response = handler.toResponse(new WebApplicationException(415));

        assertThat(response.getStatus()).isEqualTo(415);
        assertThat(((ErrorResponseDTO) response.getEntity()).code()).isEqualTo("HTTP_ERROR");
    }

    @Test
    void mapsNotFoundTo404()
    {
        Response response = handler.toResponse(new NotFoundException("missing"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.NOT_FOUND.getStatusCode());
        ErrorResponseDTO body = (ErrorResponseDTO) response.getEntity();
        assertThat(body.code()).isEqualTo("NOT_FOUND");
        assertThat(body.message()).contains("missing");
    }

    @Test
    void mapsUnhandledTo500()
    {
        Response response = handler.toResponse(new RuntimeException("boom"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.INTERNAL_SERVER_ERROR.getStatusCode());
        ErrorResponseDTO body = (ErrorResponseDTO) response.getEntity();
        assertThat(body.code()).isEqualTo("INTERNAL_ERROR");
        assertThat(body.message()).doesNotContain("boom");
    }
}

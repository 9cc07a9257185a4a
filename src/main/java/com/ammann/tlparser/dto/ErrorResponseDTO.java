/* (C)2026 */
package com.ammann.tlparser.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Standardized error payload for REST responses.
 *
 * @param code machine-readable error code
 * @param message human-readable error message
 * @param position character offset of the offending formula input, if known
 * @param fragment offending formula input, if known
 * @param path request path
 * @param status HTTP status code
 * @param timestamp server-side error timestamp
 */
@Schema(description = "API error response")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponseDTO(
        @Schema(description = "Error code for programmatic handling") String code,
        @Schema(description = "Error message describing what went wrong") String message,
        @Schema(description = "Character position in the formula") Integer position,
        @Schema(description = "Offending part of the formula") String fragment,
        @Schema(description = "Request path") String path,
        @Schema(description = "HTTP status code") Integer status,
        @Schema(description = "Timestamp when the error occurred") Instant timestamp) {

    /**
     * Creates an error payload with the current timestamp.
     */
    public ErrorResponseDTO(String code, String message, Integer position, String fragment, String path, Integer status) {
        this(code, message, position, fragment, path, status, Instant.now());
    }
}

package com.ammann.tlparser.model;

import com.ammann.tlparser.exception.FormulaException;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Why a dataset row has no statistics.
 *
 * @param kind     error kind, e.g. {@code SYNTAX_ERROR}
 * @param message  human-readable description
 * @param position character offset in the formula, {@code null} when unknown
 */
@Schema(description = "Per-row processing error")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RowError(
        String kind,
        String message,
        Integer position
) {
    public static final String CANCELLED = "CANCELLED";
    public static final String INTERNAL = "INTERNAL_ERROR";

    /**
     * Error of a formula rejected by one of the pipeline stages.
     */
    public static RowError of(FormulaException e) {
        Integer position = e.position() == FormulaException.NO_POSITION ? null : e.position();
        return new RowError(e.kind(), e.getMessage(), position);
    }

    public static RowError cancelled(String message) {
        return new RowError(CANCELLED, message, null);
    }

    public static RowError internal(Throwable cause) {
        return new RowError(INTERNAL, cause.getClass().getSimpleName() + ": " + cause.getMessage(), null);
    }
}

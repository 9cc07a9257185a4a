package com.ammann.tlparser.exception;

import java.util.Collection;

/**
 * Exception indicating that a client-supplied request or dataset does not meet the
 * constraints of the requested operation.
 *
 * <p>Mapped to HTTP 400 (Bad Request) by {@link GlobalExceptionHandler}.
 * Provides factory methods for common validation failure patterns.
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(message, null);
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }

    /**
     * Creates validation exception for requirement ids that occur more than once.
     */
    public static ValidationException duplicateIds(Collection<String> ids) {
        return new ValidationException(
                String.format("Duplicate requirement ids found: %s", String.join(", ", ids)));
    }
}

package com.ammann.tlparser.exception;

/**
 * Base unchecked exception for all application-level errors of the formula statistics API.
 *
 * <p>Subclasses represent specific error categories (request validation, formula
 * normalization, parsing and logic checks) and are mapped to HTTP status codes by
 * {@link GlobalExceptionHandler}.
 */
public class ApiException extends RuntimeException
{
    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }
    public ApiException(String message) {
        super(message);
    }
}

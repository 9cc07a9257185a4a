package com.ammann.tlparser.exception;

/**
 * Base unchecked exception for failures while turning a formula string into statistics.
 *
 * <p>Subclasses name the pipeline stage that rejected the formula (normalization, parsing,
 * logic checking). Each carries a stable {@link #kind()} used in per-row batch errors and
 * a character position where one is known. Mapped to HTTP 400 by
 * {@link GlobalExceptionHandler}.
 */
public abstract class FormulaException extends ApiException
{
    /** Marker for failures that are not tied to a character offset. */
    public static final int NO_POSITION = -1;

    private final int position;

    protected FormulaException(String message, int position)
    {
        super(message);
        this.position = position;
    }

    protected FormulaException(String message, int position, Throwable cause)
    {
        super(message, cause);
        this.position = position;
    }

    /**
     * Zero-based character offset of the offending input, or {@link #NO_POSITION}.
     */
    public int position()
    {
        return position;
    }

    /**
     * Offending piece of the formula input, or {@code null} when the failure has none.
     */
    public String fragment()
    {
        return null;
    }

    /**
     * Stable error kind reported in dataset rows and REST error bodies.
     */
    public abstract String kind();
}

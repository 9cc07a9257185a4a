package com.ammann.tlparser.exception;

/**
 * Exception indicating a malformed comparison expression in a raw formula, such as a
 * missing operand, an unknown comparison operator or an operand that is neither an
 * identifier nor a numeric literal.
 *
 * <p>Mapped to HTTP 400 (Bad Request) by {@link GlobalExceptionHandler}.
 */
public class FormatException extends FormulaException
{
    public static final String KIND = "FORMAT_ERROR";

    private final String fragment;

    public FormatException(String message, String fragment, int position)
    {
        super(String.format("%s at position %d: '%s'", message, position, fragment), position);
        this.fragment = fragment;
    }

    /**
     * Creates format exception for a comparison operator without a usable operand.
     */
    public static FormatException danglingOperator(String operator, int position)
    {
        return new FormatException("Malformed comparison, operator without operands", operator, position);
    }

    /**
     * Creates format exception for an operand that is not an identifier or literal.
     */
    public static FormatException invalidOperand(String operand, int position)
    {
        return new FormatException("Invalid comparison operand", operand, position);
    }

    @Override
    public String fragment()
    {
        return fragment;
    }

    @Override
    public String kind()
    {
        return KIND;
    }
}

package com.ammann.tlparser.exception;

/**
 * Exception indicating that a parsable formula does not conform to the formula grammar:
 * empty input, unbalanced parentheses, a missing operand, an unrecognized token or
 * trailing input.
 *
 * <p>Carries the offending character position and a description of what the parser
 * expected there. Mapped to HTTP 400 (Bad Request) by {@link GlobalExceptionHandler}.
 */
public class FormulaSyntaxException extends FormulaException
{
    public static final String KIND = "SYNTAX_ERROR";

    private final String expected;

    public FormulaSyntaxException(String message, int position, String expected)
    {
        super(String.format("%s at position %d, expected %s", message, position, expected), position);
        this.expected = expected;
    }

    /**
     * Creates syntax exception for an empty or blank formula.
     */
    public static FormulaSyntaxException emptyFormula()
    {
        return new FormulaSyntaxException("Empty formula", 0, "a formula");
    }

    /**
     * Creates syntax exception for a token the parser did not expect.
     */
    public static FormulaSyntaxException unexpected(String found, int position, String expected)
    {
        return new FormulaSyntaxException(String.format("Unexpected %s", found), position, expected);
    }

    public String expected()
    {
        return expected;
    }

    @Override
    public String kind()
    {
        return KIND;
    }
}

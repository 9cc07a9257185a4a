package com.ammann.tlparser.exception;

import com.ammann.tlparser.enumeration.LogicType;

/**
 * Exception indicating that a formula uses an operator its declared logic does not
 * offer, for example a path quantifier in a linear-time logic.
 *
 * <p>Mapped to HTTP 400 (Bad Request) by {@link GlobalExceptionHandler}.
 */
public class UnsupportedOperatorException extends FormulaException
{
    public static final String KIND = "UNSUPPORTED_OPERATOR";

    private final String operator;

    public UnsupportedOperatorException(String operator, LogicType logicType)
    {
        super(String.format("Operator '%s' is not supported by logic %s", operator, logicType.label()),
                NO_POSITION);
        this.operator = operator;
    }

    /**
     * The operator the logic does not offer.
     */
    @Override
    public String fragment()
    {
        return operator;
    }

    @Override
    public String kind()
    {
        return KIND;
    }
}

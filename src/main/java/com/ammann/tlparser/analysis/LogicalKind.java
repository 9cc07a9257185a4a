package com.ammann.tlparser.analysis;

/**
 * Logical connectives, in column order of the exported {@code stats.lops.*} fields.
 */
public enum LogicalKind implements OperatorKind
{
    AND("and"),
    IMPL("impl"),
    NOT("not"),
    OR("or");

    private final String key;

    LogicalKind(String key)
    {
        this.key = key;
    }

    @Override
    public String key()
    {
        return key;
    }
}

package com.ammann.tlparser.analysis;

/**
 * Temporal operators and path quantifiers, in column order of the exported
 * {@code stats.tops.*} fields.
 */
public enum TemporalKind implements OperatorKind
{
    /** For all paths */
    A,
    /** Exists a path */
    E,
    /** Finally (eventually) */
    F,
    /** Globally */
    G,
    /** Release */
    R,
    /** Until */
    U,
    /** Next */
    X;

    @Override
    public String key()
    {
        return name();
    }

    /**
     * Whether this kind quantifies over paths rather than over positions on a path.
     */
    public boolean isPathQuantifier()
    {
        return this == A || this == E;
    }
}

package com.ammann.tlparser.parser;

import com.ammann.tlparser.analysis.LogicalKind;
import com.ammann.tlparser.analysis.TemporalKind;

/**
 * Tag of a {@link FormulaNode}.
 *
 * <p>Each non-atomic kind belongs to exactly one operator family: it maps either to a
 * {@link LogicalKind} or to a {@link TemporalKind}.
 */
public enum NodeKind
{
    ATOM(Arity.LEAF, null, null),
    NOT(Arity.UNARY, LogicalKind.NOT, null),
    AND(Arity.NARY, LogicalKind.AND, null),
    OR(Arity.NARY, LogicalKind.OR, null),
    IMPLIES(Arity.BINARY, LogicalKind.IMPL, null),
    FINALLY(Arity.UNARY, null, TemporalKind.F),
    GLOBALLY(Arity.UNARY, null, TemporalKind.G),
    NEXT(Arity.UNARY, null, TemporalKind.X),
    UNTIL(Arity.BINARY, null, TemporalKind.U),
    RELEASE(Arity.BINARY, null, TemporalKind.R),
    FOR_ALL(Arity.UNARY, null, TemporalKind.A),
    EXISTS(Arity.UNARY, null, TemporalKind.E);

    /** Number of children a node of a kind holds. */
    public enum Arity
    {
        LEAF,
        UNARY,
        BINARY,
        /** Two or more operands */
        NARY
    }

    private final Arity arity;
    private final LogicalKind logicalKind;
    private final TemporalKind temporalKind;

    NodeKind(Arity arity, LogicalKind logicalKind, TemporalKind temporalKind)
    {
        this.arity = arity;
        this.logicalKind = logicalKind;
        this.temporalKind = temporalKind;
    }

    public Arity arity()
    {
        return arity;
    }

    /** Logical connective of this kind, or {@code null}. */
    public LogicalKind logicalKind()
    {
        return logicalKind;
    }

    /** Temporal operator of this kind, or {@code null}. */
    public TemporalKind temporalKind()
    {
        return temporalKind;
    }

    /**
     * Node kind for a single-letter temporal operator.
     */
    public static NodeKind ofTemporal(TemporalKind kind)
    {
        return switch (kind) {
            case A -> FOR_ALL;
            case E -> EXISTS;
            case F -> FINALLY;
            case G -> GLOBALLY;
            case R -> RELEASE;
            case U -> UNTIL;
            case X -> NEXT;
        };
    }
}

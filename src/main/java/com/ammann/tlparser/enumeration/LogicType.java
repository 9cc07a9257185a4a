/* (C)2026 */
package com.ammann.tlparser.enumeration;

import com.ammann.tlparser.analysis.TemporalKind;
import com.ammann.tlparser.exception.UnsupportedOperatorException;
import com.ammann.tlparser.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Collection;

/**
 * Temporal logic a requirement has been formalized in.
 *
 * <p>Only {@link #CTLS} is a branching-time logic; every other logic is linear-time and
 * rejects the path quantifiers {@code A} and {@code E}.
 */
public enum LogicType {
    /** Invariant (state property) */
    INV("INV", false),
    /** Linear Temporal Logic */
    LTL("LTL", false),
    /** Metric Temporal Logic, bounded */
    MTLB("MTLb", false),
    /** Metric Interval Temporal Logic */
    MITL("MITL", false),
    /** Timed Propositional Temporal Logic */
    TPTL("TPTL", false),
    /** Computation Tree Logic star */
    CTLS("CTLS", true),
    /** Signal Temporal Logic */
    STL("STL", false);

    private final String label;
    private final boolean branchingTime;

    LogicType(String label, boolean branchingTime) {
        this.label = label;
        this.branchingTime = branchingTime;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isBranchingTime() {
        return branchingTime;
    }

    /**
     * Whether formulas of this logic may use the given temporal operator.
     */
    public boolean supports(TemporalKind kind) {
        return branchingTime || !kind.isPathQuantifier();
    }

    /**
     * Fails fast on the first operator of {@code used} this logic does not offer.
     *
     * @throws UnsupportedOperatorException if an operator is not supported
     */
    public void checkSupported(Collection<TemporalKind> used) {
        for (TemporalKind kind : used) {
            if (!supports(kind)) {
                throw new UnsupportedOperatorException(kind.key(), this);
            }
        }
    }

    /**
     * Resolves a logic by its dataset label, e.g. {@code MTLb}.
     *
     * @throws ValidationException if the label names no known logic
     */
    @JsonCreator
    public static LogicType fromLabel(String label) {
        return Arrays.stream(values())
                .filter(t -> t.label.equals(label))
                .findFirst()
                .orElseThrow(() -> ValidationException.invalidParameter(
                        "type", label, "one of " + Arrays.toString(labels())));
    }

    private static String[] labels() {
        return Arrays.stream(values()).map(LogicType::label).toArray(String[]::new);
    }
}

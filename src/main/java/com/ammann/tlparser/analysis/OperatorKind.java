package com.ammann.tlparser.analysis;

/**
 * An operator kind that is tallied in one {@link OperatorCounts} family.
 */
public interface OperatorKind
{
    /**
     * Column key of this kind in the exported dataset, e.g. {@code eq}, {@code impl} or {@code G}.
     */
    String key();
}

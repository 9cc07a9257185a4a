package com.ammann.tlparser.analysis;

import com.ammann.tlparser.normalize.ComparisonKind;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Structural metrics of one syntax tree.
 *
 * @param height             edge count of the longest root-to-leaf path
 * @param atomicPropositions distinct atom names, sorted lexicographically
 * @param comparisons        comparison-derived atom occurrences per kind
 * @param logical            logical connective occurrences per kind
 * @param temporal           temporal operator occurrences per kind
 */
public record FormulaAnalysis(
        int height,
        List<String> atomicPropositions,
        OperatorCounts<ComparisonKind> comparisons,
        OperatorCounts<LogicalKind> logical,
        OperatorCounts<TemporalKind> temporal
)
{
    public FormulaAnalysis
    {
        atomicPropositions = List.copyOf(atomicPropositions);
    }

    /**
     * Temporal kinds that occur at least once.
     */
    public Set<TemporalKind> temporalKindsUsed()
    {
        Set<TemporalKind> used = EnumSet.noneOf(TemporalKind.class);
        for (TemporalKind kind : TemporalKind.values()) {
            if (temporal.get(kind) > 0) {
                used.add(kind);
            }
        }
        return used;
    }
}

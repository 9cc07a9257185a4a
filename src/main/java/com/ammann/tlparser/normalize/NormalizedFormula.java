package com.ammann.tlparser.normalize;

import com.ammann.tlparser.analysis.OperatorCounts;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of folding the comparisons of a raw formula into atomic propositions.
 *
 * @param raw         formula as written, with comparison expressions
 * @param parsable    formula containing only atomic identifiers, operators and parentheses
 * @param comparisons atom name to comparison kind, for every comparison in the formula,
 *                    in order of first occurrence
 * @param comparisonCounts comparison expressions per kind, one per occurrence in {@code raw}
 */
public record NormalizedFormula(
        String raw,
        String parsable,
        Map<String, ComparisonKind> comparisons,
        OperatorCounts<ComparisonKind> comparisonCounts
)
{
    public NormalizedFormula
    {
        comparisons = Collections.unmodifiableMap(new LinkedHashMap<>(comparisons));
    }

    /**
     * Comparison kind of an atom name, or {@code null} for plain boolean atoms.
     */
    public ComparisonKind comparisonOf(String atomName)
    {
        return comparisons.get(atomName);
    }
}

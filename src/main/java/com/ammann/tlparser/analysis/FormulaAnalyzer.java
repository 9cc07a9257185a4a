package com.ammann.tlparser.analysis;

import com.ammann.tlparser.normalize.ComparisonKind;
import com.ammann.tlparser.parser.FormulaNode;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Computes height, atomic-proposition set and operator counts of a syntax tree in one
 * depth-first post-order traversal.
 *
 * <p>Operators are counted per occurrence: a chained {@code AND}/{@code OR} node with
 * k operands counts k - 1 connectives. Comparison counts come from normalization and are
 * passed through unchanged.
 */
@ApplicationScoped
public class FormulaAnalyzer
{

    /**
     * Analyzes a tree.
     *
     * @param root        syntax tree
     * @param comparisons comparison occurrences per kind, from normalization
     * @return metrics of the tree
     */
    public FormulaAnalysis analyze(FormulaNode root, OperatorCounts<ComparisonKind> comparisons)
    {
        Traversal traversal = new Traversal();
        int height = traversal.visit(root);
        return new FormulaAnalysis(
                height,
                new ArrayList<>(traversal.atoms),
                comparisons,
                traversal.logicalCounts.build(),
                traversal.temporalCounts.build());
    }

    /**
     * Accumulators of one traversal.
     */
    private static final class Traversal
    {
        private final SortedSet<String> atoms = new TreeSet<>();
        private final OperatorCounts.Builder<LogicalKind> logicalCounts =
                OperatorCounts.builder(LogicalKind.class);
        private final OperatorCounts.Builder<TemporalKind> temporalCounts =
                OperatorCounts.builder(TemporalKind.class);

        /** Returns the height of {@code node}. */
        int visit(FormulaNode node)
        {
            int childHeight = -1;
            for (FormulaNode child : node.children()) {
                childHeight = Math.max(childHeight, visit(child));
            }
            count(node);
            return childHeight + 1;
        }

        private void count(FormulaNode node)
        {
            if (node.isAtom()) {
                atoms.add(node.name());
                return;
            }

            int connectives = node.children().size() - 1;
            switch (node.kind()) {
                case AND, OR -> logicalCounts.increment(node.kind().logicalKind(), connectives);
                case NOT, IMPLIES -> logicalCounts.increment(node.kind().logicalKind());
                case FINALLY, GLOBALLY, NEXT, UNTIL, RELEASE, FOR_ALL, EXISTS ->
                        temporalCounts.increment(node.kind().temporalKind());
                case ATOM -> throw new IllegalStateException("atom handled above");
            }
        }
    }
}

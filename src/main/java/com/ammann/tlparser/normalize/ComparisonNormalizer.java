package com.ammann.tlparser.normalize;

import com.ammann.tlparser.analysis.OperatorCounts;
import com.ammann.tlparser.exception.FormatException;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites infix comparison sub-expressions of a raw formula into atomic-proposition
 * identifiers, producing the parsable formula.
 *
 * <p>{@code u == 9} becomes {@code u_eq_9}, {@code x < -2} becomes {@code x_lt_n2}.
 * Whitespace inside a comparison is dropped, so identical comparisons always map to the
 * same name. Boolean identifiers, operator tokens and parentheses pass through unchanged,
 * which makes normalization idempotent on formulas without comparisons.
 *
 * <p>Comparisons are counted here, per occurrence, so an identifier that merely looks like
 * a folded comparison ({@code u_eq_9} written by hand) never counts as one.
 *
 * <p>Stateless: the comparison table is built per call and returned with the result.
 */
@ApplicationScoped
public class ComparisonNormalizer
{
    private static final Logger LOG = Logger.getLogger(ComparisonNormalizer.class);

    private static final Pattern COMPARISON = Pattern.compile(
            "(?<![\\w.])([\\w.]+)\\s*(==|!=|<=|>=|<|>)\\s*(-?[\\w.]+)(?![\\w.])");

    // Arrows are consumed first so their '>' never counts as a comparison
    private static final Pattern STRAY_OPERATOR = Pattern.compile(
            "(-{1,2}>)|(==|!=|<=|>=|=<|=>|<>|<|>|=)");

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][\\w.]*");
    private static final Pattern LITERAL = Pattern.compile("-?\\d+(\\.\\d+)?");

    /**
     * Normalizes a raw formula.
     *
     * @param raw formula with comparison expressions
     * @return parsable formula and the comparison table
     * @throws FormatException if a comparison is malformed
     */
    public NormalizedFormula normalize(String raw)
    {
        Map<String, ComparisonKind> comparisons = new LinkedHashMap<>();
        OperatorCounts.Builder<ComparisonKind> counts = OperatorCounts.builder(ComparisonKind.class);
        StringBuilder parsable = new StringBuilder(raw.length());
        Matcher matcher = COMPARISON.matcher(raw);
        int last = 0;

        while (matcher.find()) {
            checkNoStrayOperator(raw, last, matcher.start());
            String lhs = operand(matcher.group(1), matcher.start(1));
            String rhs = operand(matcher.group(3), matcher.start(3));
            ComparisonKind kind = ComparisonKind.fromSymbol(matcher.group(2))
                    .orElseThrow(() -> FormatException.danglingOperator(matcher.group(2), matcher.start(2)));

            String atom = atomName(lhs, kind, rhs);
            comparisons.putIfAbsent(atom, kind);
            counts.increment(kind);
            parsable.append(raw, last, matcher.start()).append(atom);
            last = matcher.end();
        }
        checkNoStrayOperator(raw, last, raw.length());
        parsable.append(raw, last, raw.length());

        LOG.debugf("Normalized '%s' -> '%s' (%d distinct comparisons)", raw, parsable, comparisons.size());
        return new NormalizedFormula(raw, parsable.toString(), comparisons, counts.build());
    }

    /**
     * Canonical atom name of a comparison; a leading minus of a literal becomes {@code n}.
     */
    static String atomName(String lhs, ComparisonKind kind, String rhs)
    {
        return (lhs + "_" + kind.key() + "_" + rhs).replace('-', 'n');
    }

    private String operand(String text, int position)
    {
        if (IDENTIFIER.matcher(text).matches() || LITERAL.matcher(text).matches()) {
            return text;
        }
        throw FormatException.invalidOperand(text, position);
    }

    private void checkNoStrayOperator(String raw, int from, int to)
    {
        Matcher stray = STRAY_OPERATOR.matcher(raw).region(from, to);
        while (stray.find()) {
            if (stray.group(2) != null) {
                throw FormatException.danglingOperator(stray.group(2), stray.start(2));
            }
        }
    }
}

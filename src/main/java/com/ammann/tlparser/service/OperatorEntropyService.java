package com.ammann.tlparser.service;

import com.ammann.tlparser.analysis.FormulaAnalysis;
import com.ammann.tlparser.analysis.LogicalKind;
import com.ammann.tlparser.analysis.OperatorCounts;
import com.ammann.tlparser.analysis.TemporalKind;
import com.ammann.tlparser.model.AggregateTotals;
import com.ammann.tlparser.model.EntropyMetrics;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Service reducing operator counts into family totals and Shannon-entropy diversity scores.
 *
 * <p>Entropy is computed over the distribution of operator kinds with a non-zero count,
 * H(X) = -sum(p(x) * log2(p(x))). A family without any operator has entropy 0. Reported
 * values are rounded to {@value #ENTROPY_SCALE} decimals with {@link RoundingMode#HALF_EVEN}.
 */
@ApplicationScoped
public class OperatorEntropyService
{

    private static final Logger LOG = Logger.getLogger(OperatorEntropyService.class);

    static final int ENTROPY_SCALE = 3;
    private static final double LOG_2 = Math.log(2.0);

    /**
     * Family totals of an analyzed formula.
     */
    public AggregateTotals aggregate(FormulaAnalysis analysis)
    {
        return new AggregateTotals(
                analysis.atomicPropositions().size(),
                analysis.comparisons().total(),
                analysis.logical().total(),
                analysis.temporal().total());
    }

    /**
     * Calculates Shannon entropy of a category distribution given as counts.
     *
     * @param counts occurrences per category; zero counts are ignored
     * @return entropy in bits, unrounded
     * @throws IllegalArgumentException if a count is negative
     */
    public double calculateShannonEntropy(Collection<Integer> counts)
    {
        long total = 0;
        for (int count : counts) {
            if (count < 0) {
                throw new IllegalArgumentException(
                        String.format("Category counts must not be negative, got %d", count));
            }
            total += count;
        }
        if (total == 0) {
            return 0.0;
        }

        double entropy = 0.0;
        for (int count : counts) {
            if (count > 0) {
                double probability = (double) count / total;
                entropy -= probability * (Math.log(probability) / LOG_2);
            }
        }
        return entropy;
    }

    /**
     * Entropy scores of a formula's logical and temporal operator counts.
     */
    public EntropyMetrics calculate(OperatorCounts<LogicalKind> logical, OperatorCounts<TemporalKind> temporal)
    {
        double logicalEntropy = calculateShannonEntropy(logical.values());
        double temporalEntropy = calculateShannonEntropy(temporal.values());

        List<Integer> pooled = new ArrayList<>(logical.values());
        pooled.addAll(temporal.values());
        double pooledEntropy = calculateShannonEntropy(pooled);

        LOG.debugf("Operator entropy: logical=%.4f, temporal=%.4f, pooled=%.4f bits",
                logicalEntropy, temporalEntropy, pooledEntropy);

        // The dataset columns are crossed: 'lops' carries the temporal entropy
        return new EntropyMetrics(round(temporalEntropy), round(logicalEntropy), round(pooledEntropy));
    }

    /**
     * Rounds to {@value #ENTROPY_SCALE} decimals, half to even.
     */
    public static double round(double value)
    {
        return BigDecimal.valueOf(value).setScale(ENTROPY_SCALE, RoundingMode.HALF_EVEN).doubleValue();
    }
}

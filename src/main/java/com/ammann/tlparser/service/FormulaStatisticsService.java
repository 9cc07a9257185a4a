package com.ammann.tlparser.service;

import com.ammann.tlparser.analysis.FormulaAnalysis;
import com.ammann.tlparser.analysis.FormulaAnalyzer;
import com.ammann.tlparser.enumeration.LogicType;
import com.ammann.tlparser.exception.FormulaException;
import com.ammann.tlparser.exception.FormulaSyntaxException;
import com.ammann.tlparser.model.StatsRecord;
import com.ammann.tlparser.normalize.ComparisonNormalizer;
import com.ammann.tlparser.normalize.NormalizedFormula;
import com.ammann.tlparser.parser.FormulaNode;
import com.ammann.tlparser.parser.FormulaParser;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Service computing the statistics record of a single formula.
 *
 * <p>Pipeline: normalize comparisons, parse, check the operators against the declared
 * logic, analyze the tree, aggregate totals and entropy. Every stage is pure, so calls
 * may run concurrently without coordination. A formula either yields a complete
 * {@link StatsRecord} or fails with a {@link FormulaException}.
 */
@ApplicationScoped
public class FormulaStatisticsService
{

    private static final Logger LOG = Logger.getLogger(FormulaStatisticsService.class);

    private final ComparisonNormalizer normalizer;
    private final FormulaParser parser;
    private final FormulaAnalyzer analyzer;
    private final OperatorEntropyService entropyService;

    @Inject
    public FormulaStatisticsService(
            ComparisonNormalizer normalizer,
            FormulaParser parser,
            FormulaAnalyzer analyzer,
            OperatorEntropyService entropyService)
    {
        this.normalizer = normalizer;
        this.parser = parser;
        this.analyzer = analyzer;
        this.entropyService = entropyService;
    }

    /**
     * Computes the statistics of a formula without requirement text or logic check.
     */
    public StatsRecord compute(String formulaRaw)
    {
        return compute(formulaRaw, null, null);
    }

    /**
     * Computes the statistics of a formalized requirement.
     *
     * @param formulaRaw      formula with comparison expressions
     * @param requirementText natural-language requirement, may be {@code null}
     * @param logicType       logic the formula is written in; {@code null} skips the operator check
     * @return complete statistics record
     * @throws FormulaException if the formula is malformed or uses an unsupported operator
     */
    public StatsRecord compute(String formulaRaw, String requirementText, LogicType logicType)
    {
        if (formulaRaw == null || formulaRaw.isBlank()) {
            throw FormulaSyntaxException.emptyFormula();
        }

        NormalizedFormula normalized = normalizer.normalize(formulaRaw);
        FormulaNode root = parser.parse(normalized.parsable());
        FormulaAnalysis analysis = analyzer.analyze(root, normalized.comparisonCounts());
        if (logicType != null) {
            logicType.checkSupported(analysis.temporalKindsUsed());
        }

        RequirementTextStatistics textStats = RequirementTextStatistics.of(requirementText);
        StatsRecord record = new StatsRecord(
                formulaRaw,
                normalized.parsable(),
                root.toFormulaString(),
                analysis.height(),
                analysis.atomicPropositions(),
                analysis.comparisons(),
                analysis.logical(),
                analysis.temporal(),
                entropyService.aggregate(analysis),
                entropyService.calculate(analysis.logical(), analysis.temporal()),
                textStats == null ? null : textStats.length(),
                textStats == null ? null : textStats.wordCount(),
                textStats == null ? null : textStats.sentenceCount());

        LOG.debugf("Formula '%s': height=%d, aps=%d, lops=%d, tops=%d",
                formulaRaw, record.asth(), record.agg().aps(), record.agg().lops(), record.agg().tops());
        return record;
    }
}

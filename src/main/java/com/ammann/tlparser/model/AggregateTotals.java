package com.ammann.tlparser.model;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Family totals of one formula.
 *
 * @param aps  number of distinct atomic propositions
 * @param cops comparison operator occurrences
 * @param lops logical connective occurrences
 * @param tops temporal operator occurrences
 */
@Schema(description = "Aggregate operator totals")
public record AggregateTotals(
        int aps,
        int cops,
        int lops,
        int tops
) {}

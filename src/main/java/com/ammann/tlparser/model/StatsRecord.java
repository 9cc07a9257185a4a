package com.ammann.tlparser.model;

import com.ammann.tlparser.analysis.LogicalKind;
import com.ammann.tlparser.analysis.OperatorCounts;
import com.ammann.tlparser.analysis.TemporalKind;
import com.ammann.tlparser.normalize.ComparisonKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Statistics of one formalized requirement.
 *
 * <p>Computed once per formula and never mutated. Field names are the {@code stats.*}
 * columns consumed by the tabular export and the plots, they must not change.
 */
@Schema(description = "Structural and distributional statistics of a formula")
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
        "req_len", "req_sentence_count", "req_word_count",
        "formula_raw", "formula_parsable", "formula_parsed",
        "asth", "ap", "cops", "lops", "tops", "agg", "entropy"
})
public record StatsRecord(
        @Schema(description = "Formula as written, with comparisons")
        @JsonProperty("formula_raw")
        String formulaRaw,

        @Schema(description = "Formula with comparisons folded into atomic propositions")
        @JsonProperty("formula_parsable")
        String formulaParsable,

        @Schema(description = "Canonical parenthesized rendering of the syntax tree")
        @JsonProperty("formula_parsed")
        String formulaParsed,

        @Schema(description = "Syntax tree height in edges")
        int asth,

        @Schema(description = "Distinct atomic propositions, sorted")
        List<String> ap,

        @Schema(description = "Comparison operator counts")
        OperatorCounts<ComparisonKind> cops,

        @Schema(description = "Logical connective counts")
        OperatorCounts<LogicalKind> lops,

        @Schema(description = "Temporal operator counts")
        OperatorCounts<TemporalKind> tops,

        @Schema(description = "Family totals")
        AggregateTotals agg,

        @Schema(description = "Operator entropy scores")
        EntropyMetrics entropy,

        @Schema(description = "Requirement text length in characters")
        @JsonProperty("req_len")
        Integer reqLen,

        @Schema(description = "Requirement text word count")
        @JsonProperty("req_word_count")
        Integer reqWordCount,

        @Schema(description = "Requirement text sentence count")
        @JsonProperty("req_sentence_count")
        Integer reqSentenceCount
) {
    public StatsRecord {
        ap = List.copyOf(ap);
    }
}

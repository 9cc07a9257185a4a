package com.ammann.tlparser.service;

import com.ammann.tlparser.analysis.OperatorCounts;
import com.ammann.tlparser.model.DatasetRow;
import com.ammann.tlparser.model.StatsRecord;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens dataset rows into the fixed column layout consumed by tabular export and plots.
 *
 * <p>Nested fields become dotted column names ({@code stats.cops.eq}). Every row has
 * every column of {@link #COLUMNS}, in that order; columns without a value map to
 * {@code null}. The atomic-proposition list is joined with {@code " | "}.
 */
@ApplicationScoped
public class DatasetRowFlattener
{
    public static final String AP_SEPARATOR = " | ";

    public static final List<String> COLUMNS = List.of(
            "id",
            "text",
            "type",
            "reasoning",
            "translation",
            "translationclass",
            "stats.req_len",
            "stats.req_sentence_count",
            "stats.req_word_count",
            "stats.formula_raw",
            "stats.formula_parsable",
            "stats.formula_parsed",
            "stats.asth",
            "stats.ap",
            "stats.cops.eq",
            "stats.cops.geq",
            "stats.cops.gt",
            "stats.cops.leq",
            "stats.cops.lt",
            "stats.cops.neq",
            "stats.lops.and",
            "stats.lops.impl",
            "stats.lops.not",
            "stats.lops.or",
            "stats.tops.A",
            "stats.tops.E",
            "stats.tops.F",
            "stats.tops.G",
            "stats.tops.R",
            "stats.tops.U",
            "stats.tops.X",
            "stats.agg.aps",
            "stats.agg.cops",
            "stats.agg.lops",
            "stats.agg.tops",
            "stats.entropy.lops",
            "stats.entropy.tops",
            "stats.entropy.lops_tops",
            "status",
            "error.kind",
            "error.message");

    /**
     * Flattens one row.
     */
    public Map<String, Object> flatten(DatasetRow row)
    {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("id", row.id());
        values.put("text", row.text());
        values.put("type", row.type() == null ? null : row.type().label());
        values.put("reasoning", row.reasoning());
        values.put("translation", row.translation() == null ? null : row.translation().value());
        values.put("translationclass", row.translationclass());

        StatsRecord stats = row.stats();
        if (stats != null) {
            values.put("stats.req_len", stats.reqLen());
            values.put("stats.req_sentence_count", stats.reqSentenceCount());
            values.put("stats.req_word_count", stats.reqWordCount());
            values.put("stats.formula_raw", stats.formulaRaw());
            values.put("stats.formula_parsable", stats.formulaParsable());
            values.put("stats.formula_parsed", stats.formulaParsed());
            values.put("stats.asth", stats.asth());
            values.put("stats.ap", String.join(AP_SEPARATOR, stats.ap()));
            putCounts(values, "stats.cops.", stats.cops());
            putCounts(values, "stats.lops.", stats.lops());
            putCounts(values, "stats.tops.", stats.tops());
            values.put("stats.agg.aps", stats.agg().aps());
            values.put("stats.agg.cops", stats.agg().cops());
            values.put("stats.agg.lops", stats.agg().lops());
            values.put("stats.agg.tops", stats.agg().tops());
            values.put("stats.entropy.lops", stats.entropy().lops());
            values.put("stats.entropy.tops", stats.entropy().tops());
            values.put("stats.entropy.lops_tops", stats.entropy().lopsTops());
        }

        values.put("status", row.status() == null ? null : row.status().name());
        if (row.error() != null) {
            values.put("error.kind", row.error().kind());
            values.put("error.message", row.error().message());
        }

        Map<String, Object> ordered = new LinkedHashMap<>();
        for (String column : COLUMNS) {
            ordered.put(column, values.get(column));
        }
        return ordered;
    }

    public List<Map<String, Object>> flattenAll(List<DatasetRow> rows)
    {
        return rows.stream().map(this::flatten).toList();
    }

    private static void putCounts(Map<String, Object> values, String prefix, OperatorCounts<?> counts)
    {
        counts.asMap().forEach((key, count) -> values.put(prefix + key, count));
    }
}

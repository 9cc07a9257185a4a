package com.ammann.tlparser.model;

import com.ammann.tlparser.enumeration.LogicType;
import com.ammann.tlparser.enumeration.RecordStatus;
import com.ammann.tlparser.enumeration.TranslationStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * A requirement's metadata merged with the statistics of its formula.
 *
 * <p>Exactly one of {@code stats} and {@code error} is set, depending on {@code status}.
 */
@Schema(description = "Dataset row: requirement metadata plus formula statistics")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DatasetRow(
        String id,
        String text,
        LogicType type,
        String reasoning,
        TranslationStatus translation,
        String translationclass,
        RecordStatus status,
        StatsRecord stats,
        RowError error
) {
    /**
     * Creates a row for a formula whose statistics were computed.
     */
    public static DatasetRow success(RequirementEntry entry, StatsRecord stats) {
        return new DatasetRow(entry.id(), entry.text(), entry.type(), entry.reasoning(), entry.translation(),
                entry.translationClass(), RecordStatus.OK, stats, null);
    }

    /**
     * Creates a row for a formula that could not be processed.
     */
    public static DatasetRow failure(RequirementEntry entry, RowError error) {
        return new DatasetRow(entry.id(), entry.text(), entry.type(), entry.reasoning(), entry.translation(),
                entry.translationClass(), RecordStatus.FAILED, null, error);
    }

    public DatasetRow withTranslationClass(String translationClass) {
        return new DatasetRow(id, text, type, reasoning, translation, translationClass, status, stats, error);
    }

    public boolean failed() {
        return status == RecordStatus.FAILED;
    }
}

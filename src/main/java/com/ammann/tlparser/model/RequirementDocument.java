package com.ammann.tlparser.model;

import com.ammann.tlparser.enumeration.LogicType;
import com.ammann.tlparser.enumeration.TranslationStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * A requirement with all of its formalizations, in the layout of the requirement
 * catalogue files.
 *
 * @param id     requirement id, unique within a catalogue
 * @param text   natural-language requirement
 * @param status review status; only configured statuses are digested
 * @param logics formalizations, one per logic
 */
@Schema(description = "Requirement catalogue entry")
public record RequirementDocument(
        String id,
        String text,
        String status,
        List<Formalization> logics
) {
    public RequirementDocument {
        logics = logics == null ? List.of() : List.copyOf(logics);
    }

    /**
     * Formalization of a requirement in one logic.
     */
    public record Formalization(
            LogicType type,
            @JsonProperty("f_code")
            String formula,
            TranslationStatus translation,
            String reasoning
    ) {}

    /**
     * Flattens this document into one entry per formalization.
     */
    public List<RequirementEntry> toEntries() {
        return logics.stream()
                .map(f -> new RequirementEntry(id, text, f.type(), f.reasoning(), f.translation(), null, f.formula()))
                .toList();
    }
}

package com.ammann.tlparser.model;

import com.ammann.tlparser.enumeration.LogicType;
import com.ammann.tlparser.enumeration.TranslationStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * One formalization of a requirement, as delivered by the ingestion side.
 *
 * @param id               requirement id, shared by all formalizations of the requirement
 * @param text             natural-language requirement
 * @param type             logic of the formalization
 * @param reasoning        free-text rationale of the formalization
 * @param translation      translation status relative to the other logics
 * @param translationClass precomputed translation class, may be {@code null}
 * @param formulaRaw       formula with comparison expressions
 */
@Schema(description = "Formalized requirement")
public record RequirementEntry(
        String id,
        String text,
        LogicType type,
        String reasoning,
        TranslationStatus translation,
        @JsonProperty("translation_class")
        String translationClass,
        @JsonProperty("formula_raw")
        String formulaRaw
) {}

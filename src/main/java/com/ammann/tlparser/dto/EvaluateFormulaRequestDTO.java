package com.ammann.tlparser.dto;

import com.ammann.tlparser.enumeration.LogicType;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Request to compute the statistics of a single formula.
 */
@Schema(description = "Single formula evaluation request")
public record EvaluateFormulaRequestDTO(
        @Schema(description = "Formula with comparison expressions", example = "G((y and u == 9) --> F(not y or i < 3))")
        String formula,

        @Schema(description = "Natural-language requirement the formula formalizes")
        String text,

        @Schema(description = "Logic the formula is written in; enables the operator check")
        LogicType type
) {}

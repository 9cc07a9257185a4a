package com.ammann.tlparser.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Shannon-entropy diversity scores of a formula's operators, in bits, rounded to three
 * decimals.
 *
 * <p>Column assignment follows the published datasets: {@code lops} holds the entropy of
 * the temporal-operator distribution and {@code tops} the entropy of the
 * logical-connective distribution. {@code lops_tops} is the entropy of both families
 * pooled into one distribution.
 */
@Schema(description = "Operator entropy scores in bits")
public record EntropyMetrics(
        @Schema(description = "Column 'entropy.lops'")
        double lops,

        @Schema(description = "Column 'entropy.tops'")
        double tops,

        @Schema(description = "Entropy of logical and temporal operators pooled")
        @JsonProperty("lops_tops")
        double lopsTops
) {
    public static final EntropyMetrics NONE = new EntropyMetrics(0.0, 0.0, 0.0);
}

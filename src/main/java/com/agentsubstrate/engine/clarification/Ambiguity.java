package com.agentsubstrate.engine.clarification;

import com.agentsubstrate.engine.Severity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * A passage of the objective that admits more than one reading.
 *
 * @param id                  stable id derived from the trigger, e.g. {@code amb-quant-many}
 * @param type                kind of ambiguity
 * @param sourceText          the trigger with up to three words of context on each side
 * @param description         what is unclear
 * @param interpretations     candidate readings with their likelihood
 * @param severity            how much the ambiguity matters
 * @param clarificationPrompt question that would resolve it
 */
public record Ambiguity(
        @NotBlank String id,
        @NotNull AmbiguityType type,
        @NotNull String sourceText,
        @NotNull String description,
        @NotEmpty List<@Valid Interpretation> interpretations,
        @NotNull Severity severity,
        @NotNull String clarificationPrompt
) {

    public record Interpretation(
            @NotNull String interpretation,
            @DecimalMin("0.0") @DecimalMax("1.0") double likelihood,
            @NotNull List<String> assumptions
    ) {
    }

    Interpretation mostLikely() {
        Interpretation best = interpretations.get(0);
        for (Interpretation candidate : interpretations) {
            if (candidate.likelihood() > best.likelihood()) {
                best = candidate;
            }
        }
        return best;
    }
}

package com.agentsubstrate.engine.clarification;

import com.agentsubstrate.engine.Severity;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * A class of constraint the objective is silent about.
 *
 * @param defaultAssumption what silently applies if the gap is left open
 */
public record MissingConstraint(
        @NotBlank String id,
        @NotNull ConstraintCategory category,
        @NotNull String description,
        @NotNull String impact,
        @NotNull Severity severity,
        @NotNull String clarificationPrompt,
        String defaultAssumption
) {
}

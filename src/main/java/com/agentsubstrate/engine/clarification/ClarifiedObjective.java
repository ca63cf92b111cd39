package com.agentsubstrate.engine.clarification;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * The objective restated from its goals, with what was assumed and what is still open.
 */
public record ClarifiedObjective(
        @NotNull String statement,
        @NotNull List<String> assumptions,
        @NotNull List<String> unresolved,
        @DecimalMin("0.0") @DecimalMax("1.0") double confidence
) {
}

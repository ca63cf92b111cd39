package com.agentsubstrate.engine.clarification;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record ClarificationAnalysis(
        @PositiveOrZero int totalAmbiguities,
        @PositiveOrZero int totalMissingConstraints,
        @PositiveOrZero int totalGoals,
        @DecimalMin("0.0") @DecimalMax("1.0") double clarityScore,
        @DecimalMin("0.0") @DecimalMax("1.0") double completenessScore,
        @PositiveOrZero int wordCount,
        @NotNull ObjectiveComplexity complexity
) {
}

package com.agentsubstrate.engine.reflection;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

public record ReflectionSummary(
        @DecimalMin("0.0") @DecimalMax("1.0") double overallQualityScore,
        @PositiveOrZero int totalQualitySignals,
        @PositiveOrZero int totalLearningSignals,
        @PositiveOrZero int totalGaps,
        @DecimalMin("0.0") @DecimalMax("1.0") double expectationsMetRate,
        @NotNull List<String> keyFindings,
        @NotNull List<String> improvementSuggestions
) {
}

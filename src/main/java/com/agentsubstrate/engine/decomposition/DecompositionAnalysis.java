package com.agentsubstrate.engine.decomposition;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;
import java.util.Map;

public record DecompositionAnalysis(
        @PositiveOrZero int totalSubObjectives,
        @PositiveOrZero int maxDepthReached,
        @PositiveOrZero int atomicCount,
        @DecimalMin("0.0") @DecimalMax("1.0") double coverageScore,
        @NotNull Map<String, Integer> complexityDistribution,
        @NotNull List<String> assumptions
) {
}

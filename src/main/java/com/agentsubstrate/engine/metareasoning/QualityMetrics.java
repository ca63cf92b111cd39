package com.agentsubstrate.engine.metareasoning;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Aggregate reasoning quality of a batch of traces. Scores are in [0, 1].
 */
public record QualityMetrics(
        @DecimalMin("0.0") @DecimalMax("1.0") double overallScore,
        @DecimalMin("0.0") @DecimalMax("1.0") double consistencyScore,
        @DecimalMin("0.0") @DecimalMax("1.0") double completenessScore,
        @DecimalMin("0.0") @DecimalMax("1.0") double clarityScore,
        @DecimalMin("0.0") @DecimalMax("1.0") double constraintAdherenceScore,
        @PositiveOrZero int tracesAnalyzed,
        @PositiveOrZero int agentsAnalyzed,
        @DecimalMin("0.0") @DecimalMax("100.0") double coveragePercentage
) {
}

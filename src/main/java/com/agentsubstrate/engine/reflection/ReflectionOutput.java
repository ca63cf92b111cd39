package com.agentsubstrate.engine.reflection;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;
import java.util.List;

/**
 * Output of {@link ReflectionAgent}. Describes the analysed decision events without altering them.
 */
public record ReflectionOutput(
        @NotBlank String reflectionId,
        @PositiveOrZero int eventsAnalyzed,
        @NotNull List<String> agentsAnalyzed,
        @NotNull @Valid TimeRange analysisTimeRange,
        @NotNull List<@Valid OutcomeEvaluation> outcomeEvaluations,
        @NotNull List<@Valid QualitySignal> qualitySignals,
        @NotNull List<@Valid LearningSignal> learningSignals,
        @NotNull List<@Valid GapAnalysis> gapAnalysis,
        @NotNull List<@Valid Correlation> correlations,
        @NotNull @Valid ReflectionSummary summary,
        @NotBlank String version
) {

    public record TimeRange(@NotNull Instant earliest, @NotNull Instant latest) {
    }
}

package com.agentsubstrate.engine.metareasoning;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;

/**
 * Bookkeeping about what a meta-reasoning run looked at.
 */
public record AnalysisMetadata(
        @PositiveOrZero int totalTraces,
        @PositiveOrZero int tracesAnalyzed,
        @PositiveOrZero int uniqueAgents,
        @PositiveOrZero int uniqueDecisionTypes,
        @Valid TimeSpan timeSpan,
        @NotNull ScopeExecuted scopeExecuted
) {

    public record TimeSpan(@NotNull Instant earliest, @NotNull Instant latest) {
    }

    public record ScopeExecuted(
            boolean contradictionsChecked,
            boolean calibrationAssessed,
            boolean systemicIssuesChecked,
            boolean fallaciesChecked,
            boolean completenessChecked
    ) {

        static ScopeExecuted of(MetaReasoningInput.Scope scope) {
            return new ScopeExecuted(scope.detectContradictions(), scope.assessConfidenceCalibration(),
                    scope.identifySystemicIssues(), scope.detectFallacies(), scope.checkCompleteness());
        }
    }
}

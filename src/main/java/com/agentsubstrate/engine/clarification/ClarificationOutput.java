package com.agentsubstrate.engine.clarification;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Output of {@link ObjectiveClarifierAgent}.
 */
public record ClarificationOutput(
        @NotBlank String clarificationId,
        @NotNull String originalObjective,
        @NotNull ClarificationStatus status,
        @NotNull List<@Valid Ambiguity> ambiguities,
        @NotNull List<@Valid MissingConstraint> missingConstraints,
        @NotNull List<@Valid NormalizedGoal> normalizedGoals,
        @NotNull @Valid ClarifiedObjective clarifiedObjective,
        @NotNull List<@Valid ClarificationQuestion> clarificationQuestions,
        @NotNull @Valid ClarificationAnalysis analysis,
        @NotBlank String version
) {
}

package com.agentsubstrate.engine.clarification;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * One goal statement lifted out of the objective.
 *
 * @param goalId     {@code goal-N}, N being the clause position in the objective
 * @param statement  the clause, whitespace-collapsed, leading article and trailing punctuation removed
 * @param type       goal family
 * @param action     action verb
 * @param subject    who or what the goal is for, {@code system} when unstated
 * @param object     what the action applies to, if found
 * @param qualifiers {@code with}/{@code using}/{@code that} phrases
 * @param confidence how completely the clause could be parsed
 * @param sourceText the clause as written
 */
public record NormalizedGoal(
        @NotBlank String goalId,
        @NotBlank String statement,
        @NotNull GoalType type,
        @NotNull String action,
        @NotNull String subject,
        String object,
        @NotNull List<String> qualifiers,
        @DecimalMin("0.0") @DecimalMax("1.0") double confidence,
        @NotNull String sourceText
) {
}

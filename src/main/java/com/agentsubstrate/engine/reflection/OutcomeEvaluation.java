package com.agentsubstrate.engine.reflection;

import com.agentsubstrate.core.contract.DecisionEvents;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.util.List;

/**
 * How one past decision scored.
 *
 * @param decisionRef     execution ref of the decision event
 * @param outcomeScore    mean of the dimension scores, two decimals
 * @param dimensions      confidence, completeness, determinism and output quality
 * @param metExpectations outcome score at least 0.7 and confidence at least 0.6
 * @param deviationNotes  why expectations were missed, absent when they were met
 */
public record OutcomeEvaluation(
        @NotNull @Pattern(regexp = DecisionEvents.UUID_PATTERN, message = "must be a UUID") String decisionRef,
        @NotBlank String agentId,
        @NotBlank String decisionType,
        @DecimalMin("0.0") @DecimalMax("1.0") double outcomeScore,
        @NotBlank String summary,
        @NotNull List<@Valid Dimension> dimensions,
        boolean metExpectations,
        String deviationNotes
) {

    public record Dimension(
            @NotNull String name,
            @DecimalMin("0.0") @DecimalMax("1.0") double score,
            String notes
    ) {
    }
}

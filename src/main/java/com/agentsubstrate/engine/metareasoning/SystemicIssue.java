package com.agentsubstrate.engine.metareasoning;

import com.agentsubstrate.engine.Severity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * A reasoning weakness that shows up across several traces rather than in one.
 *
 * @param id                {@code issue-N}
 * @param type              failure mode
 * @param severity          how much it matters
 * @param affectedAgents    agents exhibiting it
 * @param occurrences       sample of execution refs where it shows
 * @param frequency         how widespread it is
 * @param description       human-readable statement
 * @param evidence          observations supporting the finding
 * @param impact            likely consequence
 * @param findingConfidence confidence in the finding itself
 */
public record SystemicIssue(
        @NotBlank String id,
        @NotNull SystemicIssueType type,
        @NotNull Severity severity,
        @NotEmpty List<String> affectedAgents,
        @NotEmpty List<String> occurrences,
        @NotNull Frequency frequency,
        @NotBlank String description,
        @NotEmpty List<@Valid Observation> evidence,
        @NotBlank String impact,
        @DecimalMin("0.0") @DecimalMax("1.0") double findingConfidence
) {

    public record Observation(@NotBlank String traceRef, @NotNull String observation) {
    }
}

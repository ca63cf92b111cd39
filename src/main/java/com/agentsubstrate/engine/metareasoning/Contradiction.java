package com.agentsubstrate.engine.metareasoning;

import com.agentsubstrate.engine.Severity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Two or more traces that disagree where they should agree.
 *
 * @param id                {@code contradiction-N}
 * @param type              how the traces disagree
 * @param severity          how much the disagreement matters
 * @param involvedTraces    execution refs of the traces involved
 * @param involvedAgents    agents that produced them
 * @param description       human-readable statement of the disagreement
 * @param evidence          excerpts supporting the finding
 * @param findingConfidence confidence in the finding itself
 */
public record Contradiction(
        @NotBlank String id,
        @NotNull ContradictionType type,
        @NotNull Severity severity,
        @NotNull @Size(min = 2) List<String> involvedTraces,
        @NotEmpty List<String> involvedAgents,
        @NotBlank String description,
        @NotEmpty List<@Valid Evidence> evidence,
        @DecimalMin("0.0") @DecimalMax("1.0") double findingConfidence
) {

    public record Evidence(@NotBlank String traceRef, @NotNull String excerpt, @NotNull String relevance) {
    }
}

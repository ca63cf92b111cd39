package com.agentsubstrate.engine.decomposition;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;
import java.util.List;

/**
 * A DAG of routed steps derived from an objective. Steps are listed in dependency order.
 */
public record PipelineSpec(
        @NotBlank String planId,
        @NotEmpty List<@Valid PipelineStep> steps,
        @NotNull @Valid Metadata metadata
) {

    public PipelineSpec {
        steps = List.copyOf(steps);
    }

    public record Metadata(String sourceQuery, @NotNull Instant createdAt, @PositiveOrZero int estimatedSteps) {
    }
}

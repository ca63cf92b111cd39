package com.agentsubstrate.engine.reflection;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Decision events that appear related.
 *
 * @param correlationId {@code corr-N}
 * @param strength      1 is the strongest relation
 */
public record Correlation(
        @NotBlank String correlationId,
        @NotNull CorrelationType type,
        @NotNull @Size(min = 2) List<String> eventRefs,
        @NotBlank String description,
        @DecimalMin("0.0") @DecimalMax("1.0") double strength
) {
}

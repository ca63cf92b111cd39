package com.agentsubstrate.engine.reflection;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Something worth learning from the analysed decisions. Recommendations are informational only.
 *
 * @param learningId {@code ls-N}
 */
public record LearningSignal(
        @NotBlank String learningId,
        @NotNull LearningCategory category,
        @NotBlank @Size(max = 200) String title,
        @NotBlank String description,
        @DecimalMin("0.0") @DecimalMax("1.0") double confidence,
        @NotNull List<String> affectedAgents,
        @NotNull List<String> recommendations
) {
}

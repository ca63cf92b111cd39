package com.agentsubstrate.engine.reflection;

import com.agentsubstrate.engine.Severity;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * @param gapId         {@code gap-N}
 * @param affectedSteps execution refs of the decisions concerned
 */
public record GapAnalysis(
        @NotBlank String gapId,
        @NotNull GapType type,
        @NotBlank @Size(max = 200) String title,
        @NotBlank String description,
        @NotNull Severity impact,
        @NotNull List<String> affectedSteps,
        @NotNull List<String> evidence
) {
}

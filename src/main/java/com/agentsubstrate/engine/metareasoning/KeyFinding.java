package com.agentsubstrate.engine.metareasoning;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * @param priority         1 is most urgent, 10 least
 * @param category         area the finding belongs to
 * @param finding          the finding
 * @param affectedEntities agent ids concerned, possibly empty
 */
public record KeyFinding(
        @Min(1) @Max(10) int priority,
        @NotNull FindingCategory category,
        @NotBlank String finding,
        @NotNull List<String> affectedEntities
) {
}

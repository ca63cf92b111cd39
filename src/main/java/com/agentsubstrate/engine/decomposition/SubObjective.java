package com.agentsubstrate.engine.decomposition;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * A unit of work produced by decomposing an objective.
 *
 * @param id                 identifier, {@code sub-N}
 * @param title              short title
 * @param description        what the sub-objective covers
 * @param parentId           parent sub-objective, null for top-level entries
 * @param depth              0 for top-level entries
 * @param dependencies       other sub-objectives this one relies on
 * @param tags               classification tags
 * @param complexity         estimated complexity
 * @param isAtomic           true when the entry should not be decomposed further
 * @param acceptanceCriteria conditions under which the sub-objective is satisfied
 */
public record SubObjective(
        @NotBlank String id,
        @NotBlank @Size(max = 200) String title,
        @NotBlank String description,
        String parentId,
        @PositiveOrZero int depth,
        @NotNull List<@Valid Dependency> dependencies,
        @NotNull List<String> tags,
        @NotNull Complexity complexity,
        @JsonProperty("is_atomic") boolean isAtomic,
        @NotNull List<String> acceptanceCriteria
) {

    public SubObjective {
        dependencies = List.copyOf(dependencies);
        tags = List.copyOf(tags);
        acceptanceCriteria = List.copyOf(acceptanceCriteria);
    }

    /**
     * @param dependsOn id of the sub-objective depended on
     * @param type      nature of the dependency
     */
    public record Dependency(@NotBlank String dependsOn, @NotNull DependencyType type) {
    }
}

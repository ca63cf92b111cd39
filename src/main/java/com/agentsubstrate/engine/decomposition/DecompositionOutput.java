package com.agentsubstrate.engine.decomposition;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;

/**
 * Output of {@link DecomposerAgent}.
 *
 * @param decompositionId   fresh UUID for this decomposition
 * @param originalObjective the objective, whitespace-collapsed and cut to 200 characters
 * @param subObjectives     the sub-objectives, in creation order
 * @param treeStructure     parent id to child ids; top-level entries sit under {@code root}
 * @param dependencyGraph   sub-objective id to the ids it depends on
 * @param analysis          structural metrics
 * @param version           output format version
 * @param pipelineSpec      routed pipeline DAG
 */
public record DecompositionOutput(
        @NotBlank String decompositionId,
        @NotNull String originalObjective,
        @NotEmpty List<@Valid SubObjective> subObjectives,
        @NotNull Map<String, List<String>> treeStructure,
        @NotNull Map<String, List<String>> dependencyGraph,
        @NotNull @Valid DecompositionAnalysis analysis,
        @NotBlank String version,
        @NotNull @Valid PipelineSpec pipelineSpec
) {
}

package com.agentsubstrate.engine.decomposition;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;

/**
 * One routed step of a pipeline spec.
 *
 * @param stepId       step id, unique within the spec ("1", "2", ...)
 * @param domain       registry domain the step routes to
 * @param agent        agent within the domain
 * @param description  what the step does
 * @param inputFrom    step whose output feeds this one, null for the root step
 * @param outputSchema label of the artifact the step produces
 */
public record PipelineStep(
        @NotBlank String stepId,
        @NotBlank String domain,
        @NotBlank String agent,
        @NotBlank String description,
        @JsonInclude(JsonInclude.Include.ALWAYS) String inputFrom,
        @NotBlank String outputSchema
) {

    @JsonIgnore
    public boolean isRoot() {
        return inputFrom == null;
    }
}

package com.agentsubstrate.engine.metareasoning;

import com.agentsubstrate.core.contract.DecisionEvents;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.time.Instant;
import java.util.List;

/**
 * One agent decision as seen by the meta-reasoner: a projection of a decision event.
 *
 * @param agentId            agent that made the decision
 * @param agentVersion       optional agent version
 * @param decisionType       kind of decision
 * @param executionRef       UUID of the invocation
 * @param timestamp          when the decision was made
 * @param reportedConfidence confidence the agent reported
 * @param reasoningContent   optional reasoning payload, carried but not interpreted
 * @param constraintsApplied constraints the agent reported honouring
 * @param tags               optional free tags
 */
public record ReasoningTrace(
        @NotBlank String agentId,
        @Pattern(regexp = DecisionEvents.SEMVER_PATTERN, message = "must be a semantic version MAJOR.MINOR.PATCH")
        String agentVersion,
        @NotBlank String decisionType,
        @NotNull @Pattern(regexp = DecisionEvents.UUID_PATTERN, message = "must be a UUID") String executionRef,
        @NotNull Instant timestamp,
        @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double reportedConfidence,
        JsonNode reasoningContent,
        List<String> constraintsApplied,
        List<String> tags
) {

    public ReasoningTrace {
        constraintsApplied = constraintsApplied == null ? List.of() : List.copyOf(constraintsApplied);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /** Shorthand for the common projection without version, content or tags. */
    public ReasoningTrace(String agentId, String decisionType, String executionRef, Instant timestamp,
                          double reportedConfidence, List<String> constraintsApplied) {
        this(agentId, null, decisionType, executionRef, timestamp, reportedConfidence, null, constraintsApplied, null);
    }
}

package com.agentsubstrate.core.contract;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.List;

/**
 * The envelope every agent emits exactly once per invocation.
 * Immutable once created; consumers never rewrite it.
 *
 * @param agentId            identifier of the emitting agent
 * @param agentVersion       semantic version of the agent, {@code MAJOR.MINOR.PATCH}
 * @param decisionType       kind of decision, e.g. {@code objective_decomposition}
 * @param inputsHash         SHA-256 hex of the canonical input (see {@link DecisionEvents#hashInputs})
 * @param outputs            the agent's structured output
 * @param confidence         heuristic confidence in [0, 1]
 * @param constraintsApplied ordered constraints the agent honoured
 * @param executionRef       UUID correlating the invocation with its execution trace
 * @param timestamp          creation time, UTC
 */
public record DecisionEvent(
        @NotBlank String agentId,
        @NotNull @Pattern(regexp = DecisionEvents.SEMVER_PATTERN, message = "must be a semantic version MAJOR.MINOR.PATCH")
        String agentVersion,
        @NotBlank String decisionType,
        @NotNull @Size(min = 64, max = 64) String inputsHash,
        JsonNode outputs,
        @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double confidence,
        @NotNull List<String> constraintsApplied,
        @NotNull @Pattern(regexp = DecisionEvents.UUID_PATTERN, message = "must be a UUID") String executionRef,
        @NotNull Instant timestamp
) {

    public DecisionEvent {
        constraintsApplied = constraintsApplied == null ? null : List.copyOf(constraintsApplied);
        outputs = outputs == null ? null : outputs.deepCopy();
    }
}

package com.agentsubstrate.engine.decomposition;

import com.agentsubstrate.core.contract.DecisionEvents;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Input accepted by {@link DecomposerAgent}.
 *
 * @param objective the objective to decompose
 * @param context   optional domain context and limits
 * @param config    optional output shaping
 * @param requestId optional caller request id (UUID)
 */
public record DecompositionInput(
        @NotNull @Size(min = 1, max = 50000) String objective,
        @Valid Context context,
        @Valid Config config,
        @Pattern(regexp = DecisionEvents.UUID_PATTERN, message = "must be a UUID") String requestId
) {

    static final int DEFAULT_MAX_DEPTH = 3;
    static final int DEFAULT_MAX_SUB_OBJECTIVES = 20;

    public record Context(
            String domain,
            List<String> existingComponents,
            List<String> constraints,
            @Positive @Max(10) Integer maxDepth
    ) {
    }

    public record Config(
            Granularity targetGranularity,
            @Positive @Max(50) Integer maxSubObjectives
    ) {
    }

    public int effectiveMaxDepth() {
        return context != null && context.maxDepth() != null ? context.maxDepth() : DEFAULT_MAX_DEPTH;
    }

    public int effectiveMaxSubObjectives() {
        return config != null && config.maxSubObjectives() != null
                ? config.maxSubObjectives() : DEFAULT_MAX_SUB_OBJECTIVES;
    }

    public List<String> userConstraints() {
        return context != null && context.constraints() != null ? context.constraints() : List.of();
    }

    public boolean hasExistingComponents() {
        return context != null && context.existingComponents() != null && !context.existingComponents().isEmpty();
    }

    public boolean hasGranularity() {
        return config != null && config.targetGranularity() != null;
    }
}

package com.agentsubstrate.engine.clarification;

import com.agentsubstrate.core.contract.DecisionEvents;
import com.agentsubstrate.engine.Severity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Input accepted by {@link ObjectiveClarifierAgent}.
 */
public record ClarificationInput(
        @NotNull @Size(min = 1, max = 50000) String objective,
        @Valid Context context,
        @Valid Config config,
        @Pattern(regexp = DecisionEvents.UUID_PATTERN, message = "must be a UUID") String requestId
) {

    static final int DEFAULT_MAX_QUESTIONS = 10;

    /**
     * @param existingContext background that resolves pronouns; suppresses referential ambiguities
     * @param knownConstraints constraints already agreed, checked before flagging gaps
     */
    public record Context(
            String domain,
            List<String> stakeholders,
            String existingContext,
            List<String> knownConstraints,
            List<String> priorities
    ) {
    }

    /**
     * @param minSeverity            findings below this severity are dropped
     * @param maxQuestions           cap on clarification questions, default 10
     * @param autoResolveLowSeverity resolve low-severity ambiguities to their most likely reading
     * @param interpretationStyle    caller's reading preference, recorded with the decision
     */
    public record Config(
            Severity minSeverity,
            @Positive @Max(20) Integer maxQuestions,
            Boolean autoResolveLowSeverity,
            InterpretationStyle interpretationStyle
    ) {
    }

    public boolean hasExistingContext() {
        return context != null && context.existingContext() != null && !context.existingContext().isEmpty();
    }

    public List<String> knownConstraints() {
        return context != null && context.knownConstraints() != null ? context.knownConstraints() : List.of();
    }

    public Severity minSeverity() {
        return config != null && config.minSeverity() != null ? config.minSeverity() : Severity.LOW;
    }

    public int maxQuestions() {
        return config != null && config.maxQuestions() != null ? config.maxQuestions() : DEFAULT_MAX_QUESTIONS;
    }

    public boolean autoResolveLowSeverity() {
        return config != null && Boolean.TRUE.equals(config.autoResolveLowSeverity());
    }
}

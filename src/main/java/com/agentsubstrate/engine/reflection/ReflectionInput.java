package com.agentsubstrate.engine.reflection;

import com.agentsubstrate.core.contract.DecisionEvent;
import com.agentsubstrate.core.contract.DecisionEvents;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Input accepted by {@link ReflectionAgent}.
 *
 * @param decisionEvents past decision events to reflect on, 1 to 100
 * @param context        optional focus and filters
 * @param preferences    optional thresholds and switches
 * @param requestId      optional caller request id (UUID)
 */
public record ReflectionInput(
        @NotNull @Size(min = 1, max = 100) List<@Valid @NotNull DecisionEvent> decisionEvents,
        @Valid Context context,
        @Valid Preferences preferences,
        @Pattern(regexp = DecisionEvents.UUID_PATTERN, message = "must be a UUID") String requestId
) {

    /**
     * @param focusAreas          parts of the reflection to produce, {@code all} by default
     * @param timeRange           only events inside this window (inclusive) are analysed
     * @param targetAgents        only events from these agents are analysed
     * @param priorReflectionRefs earlier reflections this one follows up, recorded only
     * @param domainContext       free key/value hints, recorded only
     */
    public record Context(
            List<FocusArea> focusAreas,
            @Valid TimeRange timeRange,
            List<String> targetAgents,
            List<@Pattern(regexp = DecisionEvents.UUID_PATTERN, message = "must be a UUID") String> priorReflectionRefs,
            Map<String, String> domainContext
    ) {
    }

    public record TimeRange(Instant from, Instant to) {

        boolean contains(Instant instant) {
            return (from == null || !instant.isBefore(from)) && (to == null || !instant.isAfter(to));
        }
    }

    public record Preferences(
            @DecimalMin("0.0") @DecimalMax("1.0") Double minConfidence,
            @Positive @Max(50) Integer maxSignalsPerCategory,
            Boolean includeEvidence,
            Boolean correlateEvents
    ) {

        public Preferences {
            minConfidence = minConfidence != null ? minConfidence : DEFAULT_MIN_CONFIDENCE;
            maxSignalsPerCategory = maxSignalsPerCategory != null ? maxSignalsPerCategory : DEFAULT_MAX_SIGNALS;
            includeEvidence = includeEvidence == null || includeEvidence;
            correlateEvents = correlateEvents == null || correlateEvents;
        }

        public static Preferences defaults() {
            return new Preferences(null, null, null, null);
        }
    }

    static final double DEFAULT_MIN_CONFIDENCE = 0.5;
    static final int DEFAULT_MAX_SIGNALS = 10;

    public Preferences effectivePreferences() {
        return preferences != null ? preferences : Preferences.defaults();
    }

    public List<FocusArea> focusAreas() {
        return context != null && context.focusAreas() != null && !context.focusAreas().isEmpty()
                ? context.focusAreas() : List.of(FocusArea.ALL);
    }

    public boolean focusesOn(FocusArea area) {
        List<FocusArea> areas = focusAreas();
        return areas.contains(FocusArea.ALL) || areas.contains(area);
    }

    /**
     * @return the events passing the time range and target agent filters, in input order
     */
    public List<DecisionEvent> selectedEvents() {
        if (context == null) {
            return decisionEvents;
        }
        return decisionEvents.stream()
                .filter(e -> context.timeRange() == null || context.timeRange().contains(e.timestamp()))
                .filter(e -> context.targetAgents() == null || context.targetAgents().isEmpty()
                        || context.targetAgents().contains(e.agentId()))
                .toList();
    }
}

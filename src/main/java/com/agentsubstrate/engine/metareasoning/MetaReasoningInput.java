package com.agentsubstrate.engine.metareasoning;

import com.agentsubstrate.core.contract.DecisionEvents;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Map;

/**
 * Input accepted by {@link MetaReasonerAgent}.
 *
 * @param traces    the traces to cross-examine, 1 to 100
 * @param scope     which analyses to run; all core analyses when absent
 * @param context   optional calibration baseline and grouping hints
 * @param requestId optional caller request id (UUID)
 */
public record MetaReasoningInput(
        @NotNull @Size(min = 1, max = 100) List<@Valid @NotNull ReasoningTrace> traces,
        @Valid Scope scope,
        @Valid Context context,
        @Pattern(regexp = DecisionEvents.UUID_PATTERN, message = "must be a UUID") String requestId
) {

    /**
     * Analysis toggles. Missing flags take their defaults: the three core analyses on,
     * fallacy and completeness checks off.
     */
    public record Scope(
            Boolean detectContradictions,
            Boolean assessConfidenceCalibration,
            Boolean identifySystemicIssues,
            Boolean detectFallacies,
            Boolean checkCompleteness
    ) {

        public Scope {
            detectContradictions = detectContradictions == null || detectContradictions;
            assessConfidenceCalibration = assessConfidenceCalibration == null || assessConfidenceCalibration;
            identifySystemicIssues = identifySystemicIssues == null || identifySystemicIssues;
            detectFallacies = detectFallacies != null && detectFallacies;
            checkCompleteness = checkCompleteness != null && checkCompleteness;
        }

        public static Scope defaults() {
            return new Scope(null, null, null, null, null);
        }

        int enabledCount() {
            int count = 0;
            for (Boolean flag : List.of(detectContradictions, assessConfidenceCalibration, identifySystemicIssues,
                    detectFallacies, checkCompleteness)) {
                if (flag) {
                    count++;
                }
            }
            return count;
        }
    }

    /**
     * @param domain             optional domain label
     * @param referenceStandards optional standards the traces should follow
     * @param historicalAccuracy observed accuracy per agent id, each in [0, 1]
     * @param correlationGroups  groups of execution refs known to be related
     */
    public record Context(
            String domain,
            List<String> referenceStandards,
            Map<String, @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double> historicalAccuracy,
            List<List<String>> correlationGroups
    ) {
    }

    public Scope effectiveScope() {
        return scope != null ? scope : Scope.defaults();
    }

    public Map<String, Double> historicalAccuracy() {
        return context != null ? context.historicalAccuracy() : null;
    }

    public boolean hasCorrelationGroups() {
        return context != null && context.correlationGroups() != null && !context.correlationGroups().isEmpty();
    }
}

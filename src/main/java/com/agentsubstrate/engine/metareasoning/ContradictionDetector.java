package com.agentsubstrate.engine.metareasoning;

import com.agentsubstrate.engine.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.agentsubstrate.engine.Scores.percent;
import static com.agentsubstrate.engine.Scores.plain;

/**
 * Finds statistical and contextual contradictions between traces of the same decision type,
 * then temporal contradictions within each agent's own history.
 */
class ContradictionDetector {

    static final double STATISTICAL_GAP = 0.5;
    // below 0.65 so that a 0.95 vs 0.30 split on one decision type rates high
    static final double STATISTICAL_HIGH_GAP = 0.6;
    static final double TEMPORAL_SWING = 0.3;
    static final double TEMPORAL_HIGH_SWING = 0.5;

    private final ConflictingConstraintPairs conflictingPairs;

    ContradictionDetector(ConflictingConstraintPairs conflictingPairs) {
        this.conflictingPairs = conflictingPairs;
    }

    List<Contradiction> detect(List<ReasoningTrace> traces) {
        List<Contradiction> found = new ArrayList<>();

        for (Map.Entry<String, List<ReasoningTrace>> group
                : TraceStatistics.groupBy(traces, ReasoningTrace::decisionType).entrySet()) {
            List<ReasoningTrace> sameType = group.getValue();
            for (int i = 0; i < sameType.size(); i++) {
                for (int j = i + 1; j < sameType.size(); j++) {
                    comparePair(group.getKey(), sameType.get(i), sameType.get(j), found);
                }
            }
        }

        for (Map.Entry<String, List<ReasoningTrace>> group
                : TraceStatistics.groupBy(traces, ReasoningTrace::agentId).entrySet()) {
            List<ReasoningTrace> history = TraceStatistics.byTime(group.getValue());
            for (int i = 1; i < history.size(); i++) {
                compareConsecutive(group.getKey(), history.get(i - 1), history.get(i), found);
            }
        }
        return found;
    }

    private void comparePair(String decisionType, ReasoningTrace first, ReasoningTrace second,
                             List<Contradiction> found) {
        double gap = Math.abs(first.reportedConfidence() - second.reportedConfidence());
        if (gap > STATISTICAL_GAP) {
            found.add(new Contradiction(
                    nextId(found),
                    ContradictionType.STATISTICAL,
                    gap > STATISTICAL_HIGH_GAP ? Severity.HIGH : Severity.MEDIUM,
                    List.of(first.executionRef(), second.executionRef()),
                    List.of(first.agentId(), second.agentId()),
                    "Large confidence gap (%s) between agents for same decision type \"%s\""
                            .formatted(percent(gap), decisionType),
                    List.of(
                            new Contradiction.Evidence(first.executionRef(),
                                    "Confidence: " + plain(first.reportedConfidence()), "First trace confidence value"),
                            new Contradiction.Evidence(second.executionRef(),
                                    "Confidence: " + plain(second.reportedConfidence()), "Second trace confidence value")),
                    0.8));
        }

        if (!conflictingPairs.conflicts(first.constraintsApplied(), second.constraintsApplied()).isEmpty()) {
            found.add(new Contradiction(
                    nextId(found),
                    ContradictionType.CONTEXTUAL,
                    Severity.MEDIUM,
                    List.of(first.executionRef(), second.executionRef()),
                    List.of(first.agentId(), second.agentId()),
                    "Conflicting constraints applied for same decision type \"%s\"".formatted(decisionType),
                    List.of(
                            new Contradiction.Evidence(first.executionRef(),
                                    "Constraints: " + distinctJoined(first.constraintsApplied()), "First trace constraints"),
                            new Contradiction.Evidence(second.executionRef(),
                                    "Constraints: " + distinctJoined(second.constraintsApplied()), "Second trace constraints")),
                    0.7));
        }
    }

    private void compareConsecutive(String agentId, ReasoningTrace earlier, ReasoningTrace later,
                                    List<Contradiction> found) {
        if (!earlier.decisionType().equals(later.decisionType())) {
            return;
        }
        double swing = Math.abs(later.reportedConfidence() - earlier.reportedConfidence());
        if (swing <= TEMPORAL_SWING) {
            return;
        }
        found.add(new Contradiction(
                nextId(found),
                ContradictionType.TEMPORAL,
                swing > TEMPORAL_HIGH_SWING ? Severity.HIGH : Severity.LOW,
                List.of(earlier.executionRef(), later.executionRef()),
                List.of(agentId),
                "Rapid confidence change (%s) for agent \"%s\" on same decision type".formatted(percent(swing), agentId),
                List.of(
                        new Contradiction.Evidence(earlier.executionRef(),
                                "Earlier confidence: %s at %s".formatted(plain(earlier.reportedConfidence()), earlier.timestamp()),
                                "Previous confidence value"),
                        new Contradiction.Evidence(later.executionRef(),
                                "Later confidence: %s at %s".formatted(plain(later.reportedConfidence()), later.timestamp()),
                                "Current confidence value")),
                0.75));
    }

    private static String nextId(List<Contradiction> found) {
        return "contradiction-" + (found.size() + 1);
    }

    private static String distinctJoined(List<String> constraints) {
        return String.join(", ", constraints.stream().distinct().toList());
    }
}

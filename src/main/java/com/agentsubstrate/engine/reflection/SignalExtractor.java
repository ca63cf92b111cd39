package com.agentsubstrate.engine.reflection;

import com.agentsubstrate.core.contract.DecisionEvent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives quality and learning signals from batch statistics over the decision events.
 */
class SignalExtractor {

    static final double HIGH_CONFIDENCE = 0.8;
    static final double LOW_CONFIDENCE = 0.5;
    static final double UNDERUSED_CONSTRAINTS = 3;
    static final double OUTLIER_DEVIATIONS = 2;

    List<QualitySignal> qualitySignals(List<DecisionEvent> events, double minConfidence) {
        List<QualitySignal> signals = new ArrayList<>();
        int n = events.size();

        double avgConfidence = events.stream().mapToDouble(DecisionEvent::confidence).average().orElse(0);
        if (avgConfidence >= minConfidence) {
            signals.add(new QualitySignal(qualityId(signals), QualitySignalType.ACCURACY, avgConfidence,
                    "Average decision confidence across %d events".formatted(n),
                    List.of("Calculated from %d DecisionEvents".formatted(n)),
                    avgConfidence < 0.5 ? SignalSeverity.WARNING : null));
        }

        double avgConstraints = events.stream().mapToInt(e -> e.constraintsApplied().size()).average().orElse(0);
        double constraintScore = Math.min(1, avgConstraints / 6);
        if (constraintScore >= minConfidence) {
            signals.add(new QualitySignal(qualityId(signals), QualitySignalType.COMPLETENESS, constraintScore,
                    "Average constraint coverage across decisions",
                    List.of(String.format(Locale.ROOT, "Average %.1f constraints per decision", avgConstraints)),
                    null));
        }

        long decisionTypes = events.stream().map(DecisionEvent::decisionType).distinct().count();
        signals.add(new QualitySignal(qualityId(signals), QualitySignalType.CONSISTENCY,
                Math.min(1, 1.0 / decisionTypes),
                "Decision type consistency across analyzed events",
                List.of("%d unique decision types found".formatted(decisionTypes)),
                null));

        long agentVersions = events.stream().map(e -> e.agentId() + "@" + e.agentVersion()).distinct().count();
        signals.add(new QualitySignal(qualityId(signals), QualitySignalType.RELIABILITY,
                Math.min(1, 1.0 / agentVersions),
                "Agent version stability across decisions",
                List.of("%d unique agent versions".formatted(agentVersions)),
                null));
        return signals;
    }

    List<LearningSignal> learningSignals(List<DecisionEvent> events, double minConfidence) {
        List<LearningSignal> signals = new ArrayList<>();
        int n = events.size();

        List<DecisionEvent> confident = events.stream().filter(e -> e.confidence() >= HIGH_CONFIDENCE).toList();
        if (!confident.isEmpty()) {
            signals.add(new LearningSignal(learningId(signals), LearningCategory.PATTERN,
                    "High-Confidence Decision Pattern",
                    "%d decisions achieved high confidence (>=0.8)".formatted(confident.size()),
                    confident.size() / (double) n,
                    agents(confident),
                    List.of("Study common characteristics of high-confidence decisions",
                            "Identify input patterns that lead to confident outputs")));
        }

        List<DecisionEvent> unsure = events.stream().filter(e -> e.confidence() < LOW_CONFIDENCE).toList();
        if (!unsure.isEmpty() && unsure.size() / (double) n >= minConfidence * 0.5) {
            signals.add(new LearningSignal(learningId(signals), LearningCategory.ANTI_PATTERN,
                    "Low-Confidence Decision Pattern",
                    "%d decisions had low confidence (<0.5)".formatted(unsure.size()),
                    Math.min(1, unsure.size() / (double) n + 0.3),
                    agents(unsure),
                    List.of("Investigate causes of low confidence",
                            "Review input quality for affected decisions")));
        }

        List<String> underutilized = underutilizingAgents(events);
        if (!underutilized.isEmpty()) {
            signals.add(new LearningSignal(learningId(signals), LearningCategory.OPTIMIZATION,
                    "Constraint Utilization Opportunity",
                    "Some decisions apply fewer constraints than optimal",
                    0.7,
                    underutilized,
                    List.of("Review constraint application consistency",
                            "Ensure all relevant constraints are considered")));
        }

        List<DecisionEvent> outliers = outliers(events);
        if (!outliers.isEmpty()) {
            signals.add(new LearningSignal(learningId(signals), LearningCategory.EDGE_CASE,
                    "Outlier Decision Detection",
                    "%d decisions exhibited unusual characteristics".formatted(outliers.size()),
                    0.65,
                    agents(outliers),
                    List.of("Review outlier decisions for edge cases",
                            "Consider adding handling for unusual input patterns")));
        }
        return signals;
    }

    /** Agents averaging fewer than three constraints per decision. */
    static List<String> underutilizingAgents(List<DecisionEvent> events) {
        Map<String, List<Integer>> counts = new LinkedHashMap<>();
        for (DecisionEvent event : events) {
            counts.computeIfAbsent(event.agentId(), k -> new ArrayList<>()).add(event.constraintsApplied().size());
        }
        List<String> underutilized = new ArrayList<>();
        counts.forEach((agentId, values) -> {
            double avg = values.stream().mapToInt(Integer::intValue).average().orElse(0);
            if (avg < UNDERUSED_CONSTRAINTS) {
                underutilized.add(agentId);
            }
        });
        return underutilized;
    }

    /** Events whose confidence lies more than two standard deviations from the batch mean. */
    static List<DecisionEvent> outliers(List<DecisionEvent> events) {
        if (events.size() < 3) {
            return List.of();
        }
        double mean = events.stream().mapToDouble(DecisionEvent::confidence).average().orElse(0);
        double variance = events.stream().mapToDouble(e -> Math.pow(e.confidence() - mean, 2)).sum() / events.size();
        double stdDev = Math.sqrt(variance);
        return events.stream()
                .filter(e -> Math.abs(e.confidence() - mean) > OUTLIER_DEVIATIONS * stdDev)
                .toList();
    }

    private static List<String> agents(List<DecisionEvent> events) {
        return events.stream().map(DecisionEvent::agentId).distinct().toList();
    }

    private static String qualityId(List<QualitySignal> signals) {
        return "qs-" + (signals.size() + 1);
    }

    private static String learningId(List<LearningSignal> signals) {
        return "ls-" + (signals.size() + 1);
    }
}

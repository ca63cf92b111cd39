package com.agentsubstrate.engine.metareasoning;

import com.agentsubstrate.engine.Scores;
import com.agentsubstrate.engine.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Looks for biases that only show across a batch: anchoring, missing uncertainty and
 * inconsistent evaluation criteria.
 */
class SystemicIssueDetector {

    static final double ANCHORING_DRIFT = 0.05;
    static final double ANCHORING_EARLY_VARIANCE = 0.01;
    static final double HIGH_CONFIDENCE = 0.9;
    static final double MAJORITY = 0.5;
    static final double PERVASIVE = 0.7;
    static final int CRITERIA_MIN_TRACES = 5;
    static final int CRITERIA_MAX_COMBINATIONS = 3;

    List<SystemicIssue> detect(List<ReasoningTrace> traces) {
        List<SystemicIssue> issues = new ArrayList<>();
        detectAnchoring(traces, issues);
        detectMissingUncertainty(traces, issues);
        detectInconsistentCriteria(traces, issues);
        return issues;
    }

    private void detectAnchoring(List<ReasoningTrace> traces, List<SystemicIssue> issues) {
        List<ReasoningTrace> sorted = TraceStatistics.byTime(traces);
        int third = sorted.size() / 3;
        if (third == 0) {
            return;
        }
        List<Double> early = TraceStatistics.confidences(sorted.subList(0, third));
        List<Double> late = TraceStatistics.confidences(sorted.subList(sorted.size() - third, sorted.size()));
        double earlyMean = TraceStatistics.mean(early);
        double lateMean = TraceStatistics.mean(late);
        if (Math.abs(earlyMean - lateMean) >= ANCHORING_DRIFT
                || TraceStatistics.variance(early) >= ANCHORING_EARLY_VARIANCE) {
            return;
        }
        issues.add(new SystemicIssue(
                nextId(issues),
                SystemicIssueType.ANCHORING_BIAS,
                Severity.MEDIUM,
                TraceStatistics.distinctAgents(traces),
                refs(sorted, 3),
                Frequency.OCCASIONAL,
                "Early confidence values may be anchoring subsequent analyses",
                List.of(
                        new SystemicIssue.Observation(sorted.get(0).executionRef(),
                                String.format(Locale.ROOT, "Early mean confidence: %.3f", earlyMean)),
                        new SystemicIssue.Observation(sorted.get(sorted.size() - 1).executionRef(),
                                String.format(Locale.ROOT, "Late mean confidence: %.3f (minimal drift suggests anchoring)", lateMean))),
                "May reduce adaptability to new information",
                0.6));
    }

    private void detectMissingUncertainty(List<ReasoningTrace> traces, List<SystemicIssue> issues) {
        List<ReasoningTrace> confident = traces.stream()
                .filter(t -> t.reportedConfidence() > HIGH_CONFIDENCE)
                .toList();
        if (confident.size() <= traces.size() * MAJORITY) {
            return;
        }
        issues.add(new SystemicIssue(
                nextId(issues),
                SystemicIssueType.MISSING_UNCERTAINTY,
                Severity.MEDIUM,
                TraceStatistics.distinctAgents(confident),
                refs(confident, 5),
                confident.size() > traces.size() * PERVASIVE ? Frequency.PERVASIVE : Frequency.FREQUENT,
                "Majority of traces report very high confidence (>90%), potentially underestimating uncertainty",
                confident.stream().limit(3)
                        .map(t -> new SystemicIssue.Observation(t.executionRef(),
                                "Confidence: " + Scores.percent(t.reportedConfidence())))
                        .toList(),
                "High confidence without uncertainty bounds may lead to overreliance on outputs",
                0.75));
    }

    private void detectInconsistentCriteria(List<ReasoningTrace> traces, List<SystemicIssue> issues) {
        for (Map.Entry<String, List<ReasoningTrace>> group
                : TraceStatistics.groupBy(traces, ReasoningTrace::decisionType).entrySet()) {
            List<ReasoningTrace> sameType = group.getValue();
            Set<List<String>> combinations = sameType.stream()
                    .map(t -> t.constraintsApplied().stream().sorted().toList())
                    .collect(Collectors.toSet());
            if (combinations.size() <= CRITERIA_MAX_COMBINATIONS || sameType.size() <= CRITERIA_MIN_TRACES) {
                continue;
            }
            issues.add(new SystemicIssue(
                    nextId(issues),
                    SystemicIssueType.INCONSISTENT_CRITERIA,
                    Severity.LOW,
                    TraceStatistics.distinctAgents(sameType),
                    refs(sameType, 3),
                    Frequency.OCCASIONAL,
                    "Multiple different constraint sets (%d) used for decision type \"%s\""
                            .formatted(combinations.size(), group.getKey()),
                    sameType.stream().limit(2)
                            .map(t -> new SystemicIssue.Observation(t.executionRef(),
                                    "Constraints: " + String.join(", ", t.constraintsApplied())))
                            .toList(),
                    "May indicate inconsistent evaluation standards",
                    0.65));
        }
    }

    private static List<String> refs(List<ReasoningTrace> traces, int limit) {
        return traces.stream().limit(limit).map(ReasoningTrace::executionRef).toList();
    }

    private static String nextId(List<SystemicIssue> issues) {
        return "issue-" + (issues.size() + 1);
    }
}

package com.agentsubstrate.engine.metareasoning;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Small numeric and grouping helpers shared by the meta-reasoning analyses.
 */
final class TraceStatistics {

    private TraceStatistics() {}

    static double mean(Collection<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    /** Population variance; 0 for fewer than two values. */
    static double variance(Collection<Double> values) {
        if (values.size() < 2) {
            return 0.0;
        }
        double mean = mean(values);
        return values.stream().mapToDouble(v -> (v - mean) * (v - mean)).sum() / values.size();
    }

    static List<Double> confidences(List<ReasoningTrace> traces) {
        return traces.stream().map(ReasoningTrace::reportedConfidence).toList();
    }

    /** Groups preserving first-seen order of keys and input order within groups. */
    static Map<String, List<ReasoningTrace>> groupBy(List<ReasoningTrace> traces,
                                                      Function<ReasoningTrace, String> key) {
        Map<String, List<ReasoningTrace>> groups = new LinkedHashMap<>();
        for (ReasoningTrace trace : traces) {
            groups.computeIfAbsent(key.apply(trace), k -> new ArrayList<>()).add(trace);
        }
        return groups;
    }

    static List<ReasoningTrace> byTime(List<ReasoningTrace> traces) {
        return traces.stream().sorted(Comparator.comparing(ReasoningTrace::timestamp)).toList();
    }

    static List<String> distinctAgents(List<ReasoningTrace> traces) {
        return traces.stream().map(ReasoningTrace::agentId).distinct().toList();
    }
}

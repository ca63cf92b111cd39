package com.agentsubstrate.engine.reflection;

import com.agentsubstrate.core.contract.DecisionEvent;
import com.agentsubstrate.engine.Scores;
import com.agentsubstrate.engine.Severity;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags coverage, process, data and capability gaps in a batch of decision events.
 */
class GapAnalyzer {

    static final int COVERAGE_MIN_EVENTS = 5;
    static final double LOW_OUTCOME = 0.6;
    static final double PROCESS_GAP_RATE = 0.3;
    static final double CAPABILITY_GAP_RATE = 0.2;

    List<GapAnalysis> analyze(List<DecisionEvent> events, List<OutcomeEvaluation> outcomes) {
        List<GapAnalysis> gaps = new ArrayList<>();

        List<String> types = events.stream().map(DecisionEvent::decisionType).distinct().toList();
        if (types.size() == 1 && events.size() > COVERAGE_MIN_EVENTS) {
            gaps.add(new GapAnalysis(nextId(gaps), GapType.COVERAGE,
                    "Limited Decision Type Coverage",
                    "Only one decision type analyzed, limiting cross-functional insights",
                    Severity.MEDIUM,
                    List.of(),
                    List.of("Single decision type: " + types.get(0))));
        }

        List<OutcomeEvaluation> low = outcomes.stream().filter(o -> o.outcomeScore() < LOW_OUTCOME).toList();
        if (low.size() > outcomes.size() * PROCESS_GAP_RATE) {
            gaps.add(new GapAnalysis(nextId(gaps), GapType.PROCESS,
                    "High Rate of Suboptimal Outcomes",
                    "%d of %d decisions had low outcome scores".formatted(low.size(), outcomes.size()),
                    Severity.HIGH,
                    refs(low),
                    List.of("%s%% suboptimal rate".formatted(Scores.wholePercent(low.size() / (double) outcomes.size())))));
        }

        List<DecisionEvent> sparse = events.stream().filter(e -> isSparse(e.outputs())).toList();
        if (!sparse.isEmpty()) {
            gaps.add(new GapAnalysis(nextId(gaps), GapType.DATA,
                    "Incomplete Decision Outputs",
                    "%d decisions have minimal or missing outputs".formatted(sparse.size()),
                    sparse.size() > events.size() * 0.5 ? Severity.HIGH : Severity.MEDIUM,
                    sparse.stream().map(DecisionEvent::executionRef).toList(),
                    List.of("%d events with sparse outputs".formatted(sparse.size()))));
        }

        List<OutcomeEvaluation> unmet = outcomes.stream().filter(o -> !o.metExpectations()).toList();
        if (unmet.size() > outcomes.size() * CAPABILITY_GAP_RATE) {
            gaps.add(new GapAnalysis(nextId(gaps), GapType.CAPABILITY,
                    "Expectations Gap",
                    "Significant portion of decisions did not meet expectations",
                    Severity.HIGH,
                    refs(unmet),
                    List.of("%d decisions below expectations".formatted(unmet.size()))));
        }
        return gaps;
    }

    static boolean isSparse(JsonNode outputs) {
        return outputs == null || !outputs.isContainerNode() || outputs.size() < 2;
    }

    private static List<String> refs(List<OutcomeEvaluation> outcomes) {
        return outcomes.stream().map(OutcomeEvaluation::decisionRef).toList();
    }

    private static String nextId(List<GapAnalysis> gaps) {
        return "gap-" + (gaps.size() + 1);
    }
}

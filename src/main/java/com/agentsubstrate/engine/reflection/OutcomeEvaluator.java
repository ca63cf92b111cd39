package com.agentsubstrate.engine.reflection;

import com.agentsubstrate.core.contract.DecisionEvent;
import com.agentsubstrate.engine.Scores;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Scores each decision event on confidence, completeness, determinism and output quality.
 */
class OutcomeEvaluator {

    static final double EXPECTED_OUTCOME = 0.7;
    static final double EXPECTED_CONFIDENCE = 0.6;

    private static final Pattern SHA256_HEX = Pattern.compile("^[a-fA-F0-9]{64}$");

    List<OutcomeEvaluation> evaluate(List<DecisionEvent> events) {
        return events.stream().map(this::evaluate).toList();
    }

    private OutcomeEvaluation evaluate(DecisionEvent event) {
        List<OutcomeEvaluation.Dimension> dimensions = dimensions(event);
        double score = dimensions.stream().mapToDouble(OutcomeEvaluation.Dimension::score).average().orElse(0);
        boolean met = score >= EXPECTED_OUTCOME && event.confidence() >= EXPECTED_CONFIDENCE;
        return new OutcomeEvaluation(
                event.executionRef(),
                event.agentId(),
                event.decisionType(),
                Scores.round2(score),
                "%s from %s produced %s quality output with %s%% confidence".formatted(
                        event.decisionType(), event.agentId(), qualityLabel(score), Scores.wholePercent(event.confidence())),
                dimensions,
                met,
                met ? null : deviationNotes(event, score));
    }

    static List<OutcomeEvaluation.Dimension> dimensions(DecisionEvent event) {
        List<OutcomeEvaluation.Dimension> dimensions = new ArrayList<>();

        double confidence = event.confidence();
        dimensions.add(new OutcomeEvaluation.Dimension("confidence", confidence,
                confidence < 0.5 ? "Low confidence indicates uncertainty" : null));

        double completeness = Math.min(1, event.constraintsApplied().size() / 5.0);
        dimensions.add(new OutcomeEvaluation.Dimension("completeness", completeness,
                completeness < 0.5 ? "Few constraints applied" : null));

        double determinism = isSha256Hex(event.inputsHash()) ? 1.0 : 0.5;
        dimensions.add(new OutcomeEvaluation.Dimension("determinism", determinism,
                determinism < 1 ? "Input hashing may be incomplete" : null));

        double output = outputQuality(event.outputs());
        dimensions.add(new OutcomeEvaluation.Dimension("output_quality", output,
                output < 0.6 ? "Output structure may be incomplete" : null));
        return dimensions;
    }

    static boolean isSha256Hex(String hash) {
        return hash != null && SHA256_HEX.matcher(hash).matches();
    }

    /** Stepped by the number of top-level entries: more structure scores higher. */
    static double outputQuality(JsonNode outputs) {
        if (outputs == null || outputs.isNull() || outputs.isMissingNode()) {
            return 0.3;
        }
        if (!outputs.isContainerNode()) {
            return 0.5;
        }
        int keys = outputs.size();
        if (keys == 0) {
            return 0.4;
        }
        if (keys < 3) {
            return 0.6;
        }
        if (keys < 6) {
            return 0.8;
        }
        return 0.9;
    }

    private static String qualityLabel(double score) {
        return score >= 0.8 ? "high" : score >= 0.6 ? "acceptable" : "needs improvement";
    }

    private static String deviationNotes(DecisionEvent event, double score) {
        List<String> issues = new ArrayList<>();
        if (event.confidence() < EXPECTED_CONFIDENCE) {
            issues.add("low confidence");
        }
        if (score < EXPECTED_OUTCOME) {
            issues.add("suboptimal outcome score");
        }
        return "Decision deviated from expectations due to: " + String.join(", ", issues);
    }
}

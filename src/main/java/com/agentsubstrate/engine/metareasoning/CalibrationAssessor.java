package com.agentsubstrate.engine.metareasoning;

import com.agentsubstrate.engine.Scores;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rates each agent's confidence calibration, against historical accuracy when it is known and
 * against the agent's own consistency otherwise.
 */
class CalibrationAssessor {

    static final double WELL_CALIBRATED_GAP = 0.1;
    static final double INCONSISTENT_VARIANCE = 0.1;
    static final double WELL_CALIBRATED_SCORE = 0.9;
    static final double NO_BASELINE_SCORE = 0.7;

    List<ConfidenceCalibration> assess(List<ReasoningTrace> traces, Map<String, Double> historicalAccuracy) {
        List<ConfidenceCalibration> calibrations = new ArrayList<>();
        for (Map.Entry<String, List<ReasoningTrace>> group
                : TraceStatistics.groupBy(traces, ReasoningTrace::agentId).entrySet()) {
            String agentId = group.getKey();
            List<Double> confidences = TraceStatistics.confidences(group.getValue());
            double mean = TraceStatistics.mean(confidences);
            Double expected = historicalAccuracy != null ? historicalAccuracy.get(agentId) : null;

            if (expected != null) {
                calibrations.add(againstBaseline(agentId, mean, expected, confidences.size()));
            } else {
                calibrations.add(againstConsistency(agentId, mean, confidences));
            }
        }
        return calibrations;
    }

    private ConfidenceCalibration againstBaseline(String agentId, double mean, double expected, int count) {
        double gap = mean - expected;
        if (Math.abs(gap) <= WELL_CALIBRATED_GAP) {
            return new ConfidenceCalibration(agentId, WELL_CALIBRATED_SCORE, CalibrationAssessment.WELL_CALIBRATED,
                    mean, expected, gap, count, List.of());
        }
        if (gap > 0) {
            return new ConfidenceCalibration(agentId, Math.max(0, 1 - gap), CalibrationAssessment.OVERCONFIDENT,
                    mean, expected, gap, count, List.of(
                            "Consider reducing confidence by ~%s%%".formatted(Scores.wholePercent(gap)),
                            "Review historical accuracy data for calibration"));
        }
        return new ConfidenceCalibration(agentId, Math.max(0, 1 + gap), CalibrationAssessment.UNDERCONFIDENT,
                mean, expected, gap, count, List.of(
                        "Consider increasing confidence by ~%s%%".formatted(Scores.wholePercent(Math.abs(gap))),
                        "Agent may be underestimating its capabilities"));
    }

    private ConfidenceCalibration againstConsistency(String agentId, double mean, List<Double> confidences) {
        double variance = TraceStatistics.variance(confidences);
        if (variance > INCONSISTENT_VARIANCE) {
            return new ConfidenceCalibration(agentId, Math.max(0, 1 - variance), CalibrationAssessment.INCONSISTENT,
                    mean, null, null, confidences.size(), List.of(
                            "Confidence varies significantly across invocations",
                            "Consider implementing more stable confidence estimation"));
        }
        return new ConfidenceCalibration(agentId, NO_BASELINE_SCORE, CalibrationAssessment.INSUFFICIENT_DATA,
                mean, null, null, confidences.size(), List.of(
                        "Historical accuracy data needed for proper calibration assessment",
                        "Track prediction outcomes to build accuracy baseline"));
    }
}

package com.agentsubstrate.engine.metareasoning;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

/**
 * How well one agent's reported confidence tracks its accuracy.
 *
 * @param agentId                the agent assessed
 * @param calibrationScore       1 is perfectly calibrated
 * @param assessment             verdict
 * @param meanReportedConfidence mean of the agent's reported confidences
 * @param expectedAccuracy       historical accuracy, when supplied
 * @param calibrationGap         mean confidence minus expected accuracy, when accuracy is known
 * @param tracesAnalyzed         number of the agent's traces
 * @param recommendations        suggested follow-ups, advisory only
 */
public record ConfidenceCalibration(
        @NotBlank String agentId,
        @DecimalMin("0.0") @DecimalMax("1.0") double calibrationScore,
        @NotNull CalibrationAssessment assessment,
        @DecimalMin("0.0") @DecimalMax("1.0") double meanReportedConfidence,
        @DecimalMin("0.0") @DecimalMax("1.0") Double expectedAccuracy,
        @DecimalMin("-1.0") @DecimalMax("1.0") Double calibrationGap,
        @PositiveOrZero int tracesAnalyzed,
        @NotNull List<String> recommendations
) {

    public boolean miscalibrated() {
        return assessment == CalibrationAssessment.OVERCONFIDENT || assessment == CalibrationAssessment.UNDERCONFIDENT;
    }
}

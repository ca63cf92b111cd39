package com.agentsubstrate.engine.metareasoning;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Output of {@link MetaReasonerAgent}. Findings are advisory; the analysed traces are never altered.
 */
public record MetaReasoningOutput(
        @NotBlank String analysisId,
        @NotBlank String summary,
        @NotNull @Valid QualityMetrics qualityMetrics,
        @NotNull List<@Valid Contradiction> contradictions,
        @NotNull List<@Valid ConfidenceCalibration> confidenceCalibrations,
        @NotNull List<@Valid SystemicIssue> systemicIssues,
        @NotNull @Valid AnalysisMetadata analysisMetadata,
        @NotNull List<@Valid KeyFinding> keyFindings,
        @NotNull List<String> assumptions,
        @NotBlank String version
) {
}

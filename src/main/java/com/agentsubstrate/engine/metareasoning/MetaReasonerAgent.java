package com.agentsubstrate.engine.metareasoning;

import com.agentsubstrate.core.agent.AgentClassification;
import com.agentsubstrate.core.agent.AgentMetadata;
import com.agentsubstrate.core.agent.AnalyticalAgent;
import com.agentsubstrate.engine.Scores;
import com.agentsubstrate.engine.Severity;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Cross-examines a batch of reasoning traces for contradictions, miscalibrated confidence and
 * systemic bias.
 * <p>
 * Purely analytical: findings are reported, never enforced, and the traces are not modified.
 */
@Component
public class MetaReasonerAgent implements AnalyticalAgent<MetaReasoningInput, MetaReasoningOutput> {

    public static final String AGENT_ID = "meta-reasoner-agent";
    public static final String AGENT_VERSION = "1.0.0";
    public static final String DECISION_TYPE = "meta_reasoning_analysis";

    static final String OUTPUT_VERSION = "1.0.0";

    private static final AgentMetadata METADATA = new AgentMetadata(
            AGENT_ID,
            "Meta-Reasoner Agent",
            AGENT_VERSION,
            List.of(AgentClassification.META_ANALYSIS, AgentClassification.REASONING_QUALITY_ASSESSMENT),
            DECISION_TYPE,
            "Evaluates reasoning quality across agent traces: contradictions, confidence calibration and systemic issues."
    );

    private final ContradictionDetector contradictionDetector;
    private final CalibrationAssessor calibrationAssessor;
    private final SystemicIssueDetector systemicIssueDetector;

    public MetaReasonerAgent() {
        this(ConflictingConstraintPairs.defaults());
    }

    public MetaReasonerAgent(ConflictingConstraintPairs conflictingPairs) {
        this.contradictionDetector = new ContradictionDetector(conflictingPairs);
        this.calibrationAssessor = new CalibrationAssessor();
        this.systemicIssueDetector = new SystemicIssueDetector();
    }

    @Override
    public AgentMetadata metadata() {
        return METADATA;
    }

    @Override
    public Class<MetaReasoningInput> inputType() {
        return MetaReasoningInput.class;
    }

    @Override
    public MetaReasoningOutput analyze(MetaReasoningInput input) {
        List<ReasoningTrace> traces = input.traces();
        MetaReasoningInput.Scope scope = input.effectiveScope();

        List<Contradiction> contradictions = scope.detectContradictions()
                ? contradictionDetector.detect(traces) : List.of();
        List<ConfidenceCalibration> calibrations = scope.assessConfidenceCalibration()
                ? calibrationAssessor.assess(traces, input.historicalAccuracy()) : List.of();
        List<SystemicIssue> issues = scope.identifySystemicIssues()
                ? systemicIssueDetector.detect(traces) : List.of();

        QualityMetrics metrics = qualityMetrics(traces, contradictions, calibrations, issues);
        int uniqueAgents = TraceStatistics.distinctAgents(traces).size();
        int uniqueTypes = (int) traces.stream().map(ReasoningTrace::decisionType).distinct().count();

        var metadata = new AnalysisMetadata(
                traces.size(),
                traces.size(),
                uniqueAgents,
                uniqueTypes,
                timeSpan(traces),
                AnalysisMetadata.ScopeExecuted.of(scope)
        );

        return new MetaReasoningOutput(
                UUID.randomUUID().toString(),
                summarize(traces.size(), uniqueAgents, contradictions.size(), issues.size(), metrics.overallScore()),
                metrics,
                contradictions,
                calibrations,
                issues,
                metadata,
                keyFindings(contradictions, calibrations, issues, metrics),
                assumptions(input),
                OUTPUT_VERSION
        );
    }

    @Override
    public double confidence(MetaReasoningInput input, MetaReasoningOutput output) {
        double confidence = 0.7;
        int traceCount = input.traces().size();
        if (traceCount >= 10) {
            confidence += 0.1;
        } else if (traceCount >= 5) {
            confidence += 0.05;
        }
        // cross-validation across agents
        if (output.analysisMetadata().uniqueAgents() >= 3) {
            confidence += 0.05;
        }
        if (input.historicalAccuracy() != null) {
            confidence += 0.05;
        }
        if (input.effectiveScope().enabledCount() < 3) {
            confidence -= 0.05;
        }
        return Scores.clamp(confidence);
    }

    @Override
    public List<String> constraintsApplied(MetaReasoningInput input, MetaReasoningOutput output) {
        List<String> constraints = new ArrayList<>(List.of(
                "read_only_analysis",
                "no_output_override",
                "no_correction_enforcement",
                "no_logic_execution",
                "deterministic_output",
                "stateless_processing"
        ));
        MetaReasoningInput.Scope scope = input.effectiveScope();
        if (scope.detectContradictions()) {
            constraints.add("contradiction_detection_enabled");
        }
        if (scope.assessConfidenceCalibration()) {
            constraints.add("calibration_assessment_enabled");
        }
        if (scope.identifySystemicIssues()) {
            constraints.add("systemic_analysis_enabled");
        }
        return constraints;
    }

    // -- Aggregation ----------------------------------------------------------

    static QualityMetrics qualityMetrics(List<ReasoningTrace> traces, List<Contradiction> contradictions,
                                         List<ConfidenceCalibration> calibrations, List<SystemicIssue> issues) {
        double consistency = Math.max(0, 1 - Math.min(contradictions.size() * 0.1, 0.5));
        long withConstraints = traces.stream().filter(t -> !t.constraintsApplied().isEmpty()).count();
        double completeness = traces.isEmpty() ? 0 : withConstraints / (double) traces.size();
        double clarity = calibrations.isEmpty() ? 0.7
                : calibrations.stream().mapToDouble(ConfidenceCalibration::calibrationScore).average().orElse(0.7);
        double adherence = traces.isEmpty() ? 0 : completeness;

        double overall = (consistency * 0.35 + completeness * 0.2 + clarity * 0.25 + adherence * 0.2)
                * (1 - Math.min(issues.size() * 0.05, 0.3));

        return new QualityMetrics(
                Scores.clamp(overall),
                consistency,
                completeness,
                clarity,
                adherence,
                traces.size(),
                TraceStatistics.distinctAgents(traces).size(),
                100
        );
    }

    static List<KeyFinding> keyFindings(List<Contradiction> contradictions, List<ConfidenceCalibration> calibrations,
                                        List<SystemicIssue> issues, QualityMetrics metrics) {
        List<KeyFinding> findings = new ArrayList<>();

        List<Contradiction> severe = contradictions.stream().filter(c -> isSevere(c.severity())).toList();
        if (!severe.isEmpty()) {
            findings.add(new KeyFinding(1, FindingCategory.CONTRADICTION,
                    "Found %d high-severity contradiction(s) requiring attention".formatted(severe.size()),
                    severe.stream().flatMap(c -> c.involvedAgents().stream()).toList()));
        }

        List<ConfidenceCalibration> miscalibrated = calibrations.stream()
                .filter(ConfidenceCalibration::miscalibrated).toList();
        if (!miscalibrated.isEmpty()) {
            findings.add(new KeyFinding(2, FindingCategory.CALIBRATION,
                    "%d agent(s) show calibration issues (%s)".formatted(miscalibrated.size(),
                            miscalibrated.stream().map(c -> c.assessment().value()).collect(Collectors.joining(", "))),
                    miscalibrated.stream().map(ConfidenceCalibration::agentId).toList()));
        }

        List<SystemicIssue> severeIssues = issues.stream().filter(i -> isSevere(i.severity())).toList();
        if (!severeIssues.isEmpty()) {
            findings.add(new KeyFinding(3, FindingCategory.SYSTEMIC,
                    "Identified %d systemic issue(s): %s".formatted(severeIssues.size(),
                            severeIssues.stream().map(i -> i.type().value()).collect(Collectors.joining(", "))),
                    severeIssues.stream().flatMap(i -> i.affectedAgents().stream()).toList()));
        }

        double overall = metrics.overallScore();
        if (overall < 0.5) {
            findings.add(new KeyFinding(4, FindingCategory.QUALITY,
                    "Overall reasoning quality score is low (%s)".formatted(Scores.percent(overall)), List.of()));
        } else if (overall >= 0.8) {
            findings.add(new KeyFinding(10, FindingCategory.QUALITY,
                    "Overall reasoning quality is good (%s)".formatted(Scores.percent(overall)), List.of()));
        }

        findings.sort(Comparator.comparingInt(KeyFinding::priority));
        return findings;
    }

    static String summarize(int traceCount, int agentCount, int contradictionCount, int issueCount, double overall) {
        String descriptor = overall >= 0.8 ? "good"
                : overall >= 0.6 ? "moderate"
                : overall >= 0.4 ? "fair" : "poor";
        StringBuilder summary = new StringBuilder()
                .append("Meta-reasoning analysis of %d trace(s) from %d agent(s). ".formatted(traceCount, agentCount))
                .append("Overall reasoning quality is %s (%s). ".formatted(descriptor, Scores.percent(overall)));
        if (contradictionCount > 0) {
            summary.append("Detected %d contradiction(s). ".formatted(contradictionCount));
        }
        if (issueCount > 0) {
            summary.append("Identified %d systemic issue(s). ".formatted(issueCount));
        }
        if (contradictionCount == 0 && issueCount == 0) {
            summary.append("No significant issues detected.");
        }
        return summary.toString().trim();
    }

    private static List<String> assumptions(MetaReasoningInput input) {
        List<String> assumptions = new ArrayList<>(List.of(
                "All provided traces are authentic and unmodified",
                "Timestamps are accurate and timezone-consistent (UTC)",
                "Reported confidence values reflect agent certainty"
        ));
        if (input.historicalAccuracy() == null) {
            assumptions.add("No historical accuracy baseline available - calibration assessment limited");
        }
        if (input.traces().size() < 5) {
            assumptions.add("Limited trace count may reduce statistical significance of findings");
        }
        if (!input.hasCorrelationGroups()) {
            assumptions.add("No correlation groups specified - assuming all traces are independent");
        }
        return assumptions;
    }

    private static AnalysisMetadata.TimeSpan timeSpan(List<ReasoningTrace> traces) {
        List<Instant> times = traces.stream().map(ReasoningTrace::timestamp).sorted().toList();
        return times.isEmpty() ? null : new AnalysisMetadata.TimeSpan(times.get(0), times.get(times.size() - 1));
    }

    private static boolean isSevere(Severity severity) {
        return severity == Severity.HIGH || severity == Severity.CRITICAL;
    }
}

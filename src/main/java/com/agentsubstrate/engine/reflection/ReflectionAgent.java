package com.agentsubstrate.engine.reflection;

import com.agentsubstrate.core.agent.AgentClassification;
import com.agentsubstrate.core.agent.AgentMetadata;
import com.agentsubstrate.core.agent.AnalyticalAgent;
import com.agentsubstrate.core.contract.DecisionEvent;
import com.agentsubstrate.core.validation.ValidationFailedException;
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
 * Looks back over past decision events and extracts quality signals, learning signals, gaps and
 * correlations.
 * <p>
 * Strictly informational: recommendations are never applied, no agent behaviour is changed and no
 * retry is triggered.
 */
@Component
public class ReflectionAgent implements AnalyticalAgent<ReflectionInput, ReflectionOutput> {

    public static final String AGENT_ID = "reflection-agent";
    public static final String AGENT_VERSION = "1.0.0";
    public static final String DECISION_TYPE = "reflection_analysis";

    static final String OUTPUT_VERSION = "1.0.0";

    private static final AgentMetadata METADATA = new AgentMetadata(
            AGENT_ID,
            "Reflection Agent",
            AGENT_VERSION,
            List.of(AgentClassification.POST_EXECUTION_ANALYSIS, AgentClassification.QUALITY_ASSESSMENT),
            DECISION_TYPE,
            "Analyzes DecisionEvents to extract learning and quality signals for continuous improvement insights."
    );

    private final OutcomeEvaluator outcomeEvaluator = new OutcomeEvaluator();
    private final SignalExtractor signalExtractor = new SignalExtractor();
    private final GapAnalyzer gapAnalyzer = new GapAnalyzer();
    private final CorrelationFinder correlationFinder = new CorrelationFinder();

    @Override
    public AgentMetadata metadata() {
        return METADATA;
    }

    @Override
    public Class<ReflectionInput> inputType() {
        return ReflectionInput.class;
    }

    @Override
    public ReflectionOutput analyze(ReflectionInput input) {
        List<DecisionEvent> events = input.selectedEvents();
        if (events.isEmpty()) {
            throw new ValidationFailedException("No decision events match the time range and target agent filters");
        }
        ReflectionInput.Preferences preferences = input.effectivePreferences();
        double minConfidence = preferences.minConfidence();
        int cap = preferences.maxSignalsPerCategory();

        // gaps and the summary need outcomes even when they are not reported
        List<OutcomeEvaluation> evaluated = outcomeEvaluator.evaluate(events);
        List<OutcomeEvaluation> outcomes = input.focusesOn(FocusArea.OUTCOMES) ? evaluated : List.of();

        List<QualitySignal> quality = input.focusesOn(FocusArea.QUALITY)
                ? limit(signalExtractor.qualitySignals(events, minConfidence), cap) : List.of();
        List<LearningSignal> learning = input.focusesOn(FocusArea.LEARNING)
                ? limit(signalExtractor.learningSignals(events, minConfidence), cap) : List.of();
        List<GapAnalysis> gaps = input.focusesOn(FocusArea.GAPS)
                ? limit(gapAnalyzer.analyze(events, evaluated), cap) : List.of();
        List<Correlation> correlations = preferences.correlateEvents()
                ? correlationFinder.find(events) : List.of();

        if (!preferences.includeEvidence()) {
            quality = quality.stream()
                    .map(s -> new QualitySignal(s.signalId(), s.type(), s.value(), s.description(), List.of(), s.severity()))
                    .toList();
            gaps = gaps.stream()
                    .map(g -> new GapAnalysis(g.gapId(), g.type(), g.title(), g.description(), g.impact(),
                            g.affectedSteps(), List.of()))
                    .toList();
        }

        return new ReflectionOutput(
                UUID.randomUUID().toString(),
                events.size(),
                events.stream().map(DecisionEvent::agentId).distinct().toList(),
                timeRange(events),
                outcomes,
                quality,
                learning,
                gaps,
                correlations,
                summarize(evaluated, quality, learning, gaps),
                OUTPUT_VERSION
        );
    }

    @Override
    public double confidence(ReflectionInput input, ReflectionOutput output) {
        double confidence = 0.6;
        int events = output.eventsAnalyzed();
        if (events >= 10) {
            confidence += 0.1;
        }
        if (events >= 50) {
            confidence += 0.05;
        }
        if (output.agentsAnalyzed().size() > 1) {
            confidence += 0.05;
        }
        if (!output.qualitySignals().isEmpty()) {
            confidence += 0.05;
        }
        if (!output.learningSignals().isEmpty()) {
            confidence += 0.05;
        }
        if (!output.correlations().isEmpty()) {
            confidence += 0.05;
        }
        if (events < 3) {
            confidence -= 0.1;
        }
        return Scores.clamp(confidence);
    }

    @Override
    public List<String> constraintsApplied(ReflectionInput input, ReflectionOutput output) {
        List<String> constraints = new ArrayList<>(List.of(
                "read_only_analysis",
                "no_behavior_modification",
                "no_retry_triggering",
                "no_optimization_application",
                "informational_output_only",
                "deterministic_analysis"
        ));
        if (input.context() != null && input.context().focusAreas() != null && !input.context().focusAreas().isEmpty()) {
            constraints.add("focus_areas:" + input.context().focusAreas().stream()
                    .map(FocusArea::value).collect(Collectors.joining(",")));
        }
        if (input.preferences() != null) {
            constraints.add("min_confidence:" + Scores.plain(input.preferences().minConfidence()));
        }
        return constraints;
    }

    // -- Summary --------------------------------------------------------------

    static ReflectionSummary summarize(List<OutcomeEvaluation> outcomes, List<QualitySignal> quality,
                                       List<LearningSignal> learning, List<GapAnalysis> gaps) {
        double overall = outcomes.isEmpty() ? 0.5
                : Scores.round2(outcomes.stream().mapToDouble(OutcomeEvaluation::outcomeScore).average().orElse(0.5));
        double metRate = outcomes.isEmpty() ? 0
                : Scores.round2(outcomes.stream().filter(OutcomeEvaluation::metExpectations).count()
                / (double) outcomes.size());

        List<String> findings = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();

        if (overall >= 0.8) {
            findings.add("Overall decision quality is high");
        } else if (overall < 0.6) {
            findings.add("Decision quality needs attention");
            suggestions.add("Review low-scoring decisions for common issues");
        }

        if (metRate >= 0.9) {
            findings.add("Decisions consistently meet expectations");
        } else if (metRate < 0.7) {
            findings.add("Expectations gap detected in decision outcomes");
            suggestions.add("Calibrate expectation thresholds or improve decision confidence");
        }

        long patterns = learning.stream()
                .filter(s -> s.category() == LearningCategory.PATTERN && s.confidence() >= 0.7)
                .count();
        if (patterns > 0) {
            findings.add("%d high-value patterns identified for replication".formatted(patterns));
        }

        List<GapAnalysis> highImpact = gaps.stream()
                .filter(g -> g.impact().compareTo(Severity.HIGH) >= 0)
                .toList();
        if (!highImpact.isEmpty()) {
            findings.add("%d high-impact gaps require attention".formatted(highImpact.size()));
            highImpact.forEach(g -> suggestions.add("Address %s gap: %s".formatted(g.type().value(), g.title())));
        }

        return new ReflectionSummary(overall, quality.size(), learning.size(), gaps.size(), metRate,
                findings, suggestions);
    }

    private static ReflectionOutput.TimeRange timeRange(List<DecisionEvent> events) {
        Instant earliest = events.stream().map(DecisionEvent::timestamp).min(Comparator.naturalOrder()).orElseThrow();
        Instant latest = events.stream().map(DecisionEvent::timestamp).max(Comparator.naturalOrder()).orElseThrow();
        return new ReflectionOutput.TimeRange(earliest, latest);
    }

    private static <T> List<T> limit(List<T> signals, int cap) {
        return signals.size() > cap ? List.copyOf(signals.subList(0, cap)) : signals;
    }
}

package com.agentsubstrate.engine.clarification;

import com.agentsubstrate.core.agent.AgentClassification;
import com.agentsubstrate.core.agent.AgentMetadata;
import com.agentsubstrate.core.agent.AnalyticalAgent;
import com.agentsubstrate.engine.Scores;
import com.agentsubstrate.engine.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Finds what is unclear or unstated in an objective and restates it as normalized goals.
 * <p>
 * Never plans or proposes a solution; the output only describes the objective.
 */
@Component
public class ObjectiveClarifierAgent implements AnalyticalAgent<ClarificationInput, ClarificationOutput> {

    public static final String AGENT_ID = "objective-clarifier-agent";
    public static final String AGENT_VERSION = "1.0.0";
    public static final String DECISION_TYPE = "objective_clarification";

    static final String OUTPUT_VERSION = "1.0.0";

    static final int MIN_WORDS = 3;
    static final int MAX_GOALS = 7;
    static final int MAX_LENGTH = 2000;
    static final int MAX_ISSUES = 5;

    private static final AgentMetadata METADATA = new AgentMetadata(
            AGENT_ID,
            "Objective Clarifier Agent",
            AGENT_VERSION,
            List.of(AgentClassification.INTENT_ANALYSIS, AgentClassification.AMBIGUITY_DETECTION),
            DECISION_TYPE,
            "Clarifies ambiguous or incomplete objectives by identifying ambiguities, missing constraints, and normalizing goals."
    );

    private final AmbiguityDetector ambiguityDetector;
    private final MissingConstraintDetector constraintDetector;
    private final GoalNormalizer goalNormalizer;

    public ObjectiveClarifierAgent() {
        this(PolysemyDictionary.defaults());
    }

    public ObjectiveClarifierAgent(PolysemyDictionary polysemy) {
        this.ambiguityDetector = new AmbiguityDetector(polysemy);
        this.constraintDetector = new MissingConstraintDetector();
        this.goalNormalizer = new GoalNormalizer();
    }

    @Override
    public AgentMetadata metadata() {
        return METADATA;
    }

    @Override
    public Class<ClarificationInput> inputType() {
        return ClarificationInput.class;
    }

    @Override
    public ClarificationOutput analyze(ClarificationInput input) {
        String objective = input.objective();
        Severity floor = input.minSeverity();

        List<Ambiguity> ambiguities = ambiguityDetector.detect(objective, input.hasExistingContext()).stream()
                .filter(a -> atLeast(a.severity(), floor))
                .toList();
        List<MissingConstraint> missing = constraintDetector.detect(objective, input.knownConstraints()).stream()
                .filter(c -> atLeast(c.severity(), floor))
                .toList();
        List<NormalizedGoal> goals = goalNormalizer.normalize(objective);

        return new ClarificationOutput(
                UUID.randomUUID().toString(),
                objective,
                status(objective, ambiguities, missing, goals),
                ambiguities,
                missing,
                goals,
                clarify(objective, ambiguities, missing, goals, input.autoResolveLowSeverity()),
                questions(ambiguities, missing, input.maxQuestions()),
                metrics(objective, ambiguities, missing, goals),
                OUTPUT_VERSION
        );
    }

    @Override
    public double confidence(ClarificationInput input, ClarificationOutput output) {
        double confidence = 0.6;
        if (output.status() == ClarificationStatus.CLEAR) {
            confidence += 0.2;
        }
        int goals = output.normalizedGoals().size();
        if (goals > 0 && goals <= 5) {
            confidence += 0.1;
        }
        if (output.ambiguities().size() > 5) {
            confidence -= 0.15;
        }
        if (output.ambiguities().stream().anyMatch(a -> a.severity() == Severity.CRITICAL)) {
            confidence -= 0.1;
        }
        confidence = confidence * 0.7 + output.analysis().clarityScore() * 0.3;
        return Scores.clamp(confidence);
    }

    @Override
    public List<String> constraintsApplied(ClarificationInput input, ClarificationOutput output) {
        List<String> constraints = new ArrayList<>(List.of(
                "read_only_analysis",
                "no_plan_generation",
                "no_solution_definition",
                "no_logic_execution",
                "deterministic_output",
                "semantic_normalization",
                "intent_clarification"
        ));
        input.knownConstraints().forEach(c -> constraints.add("user_constraint:" + c));
        ClarificationInput.Config config = input.config();
        if (config != null && config.minSeverity() != null) {
            constraints.add("min_severity:" + config.minSeverity().value());
        }
        if (input.autoResolveLowSeverity()) {
            constraints.add("auto_resolve_low_severity");
        }
        if (config != null && config.interpretationStyle() != null) {
            constraints.add("interpretation_style:" + config.interpretationStyle().value());
        }
        return constraints;
    }

    // -- Verdict --------------------------------------------------------------

    static ClarificationStatus status(String objective, List<Ambiguity> ambiguities,
                                      List<MissingConstraint> missing, List<NormalizedGoal> goals) {
        if (wordCount(objective) < MIN_WORDS) {
            return ClarificationStatus.INSUFFICIENT;
        }
        if (goals.size() > MAX_GOALS || objective.length() > MAX_LENGTH) {
            return ClarificationStatus.REQUIRES_DECOMPOSITION;
        }
        boolean critical = ambiguities.stream().anyMatch(a -> a.severity() == Severity.CRITICAL)
                || missing.stream().anyMatch(c -> c.severity() == Severity.CRITICAL);
        boolean manyHigh = ambiguities.stream().filter(a -> a.severity() == Severity.HIGH).count() > 2
                || missing.stream().filter(c -> c.severity() == Severity.HIGH).count() > 2;
        if (critical || manyHigh) {
            return ClarificationStatus.NEEDS_CLARIFICATION;
        }
        if (ambiguities.size() + missing.size() > MAX_ISSUES) {
            return ClarificationStatus.NEEDS_CLARIFICATION;
        }
        return ClarificationStatus.CLEAR;
    }

    static ClarifiedObjective clarify(String objective, List<Ambiguity> ambiguities, List<MissingConstraint> missing,
                                      List<NormalizedGoal> goals, boolean autoResolveLow) {
        List<String> assumptions = new ArrayList<>();
        List<String> unresolved = new ArrayList<>();

        for (Ambiguity ambiguity : ambiguities) {
            if (autoResolveLow && ambiguity.severity() == Severity.LOW) {
                assumptions.add("Assumed \"%s\" means: %s".formatted(ambiguity.sourceText(),
                        ambiguity.mostLikely().interpretation()));
            } else if (atLeast(ambiguity.severity(), Severity.HIGH)) {
                unresolved.add("Ambiguous: " + ambiguity.description());
            }
        }
        for (MissingConstraint constraint : missing) {
            if (constraint.defaultAssumption() != null) {
                assumptions.add(constraint.defaultAssumption());
            }
            if (atLeast(constraint.severity(), Severity.HIGH)) {
                unresolved.add("Missing: " + constraint.description());
            }
        }

        String statement = objective;
        if (!goals.isEmpty() && goals.size() <= 5) {
            statement = String.join("; ", goals.stream().map(NormalizedGoal::statement).toList());
        }

        double confidence = 1.0
                - count(ambiguities, Severity.CRITICAL) * 0.2
                - count(ambiguities, Severity.HIGH) * 0.1
                - countMissing(missing, Severity.CRITICAL) * 0.15
                - countMissing(missing, Severity.HIGH) * 0.08;
        return new ClarifiedObjective(statement, assumptions, unresolved, Math.max(0.1, confidence));
    }

    static List<ClarificationQuestion> questions(List<Ambiguity> ambiguities, List<MissingConstraint> missing,
                                                 int maxQuestions) {
        List<ClarificationQuestion> questions = new ArrayList<>();
        ambiguities.forEach(a -> questions.add(ClarificationQuestion.of(a)));
        missing.forEach(c -> questions.add(ClarificationQuestion.of(c)));
        // stable: equal priorities keep detection order
        questions.sort(Comparator.comparing(ClarificationQuestion::priority).reversed());
        return questions.size() > maxQuestions ? List.copyOf(questions.subList(0, maxQuestions)) : questions;
    }

    static ClarificationAnalysis metrics(String objective, List<Ambiguity> ambiguities,
                                         List<MissingConstraint> missing, List<NormalizedGoal> goals) {
        int words = wordCount(objective);

        double clarity = 1.0
                - count(ambiguities, Severity.CRITICAL) * 0.25
                - count(ambiguities, Severity.HIGH) * 0.15
                - count(ambiguities, Severity.MEDIUM) * 0.08
                - count(ambiguities, Severity.LOW) * 0.03;
        double completeness = 1.0
                - countMissing(missing, Severity.CRITICAL) * 0.2
                - countMissing(missing, Severity.HIGH) * 0.12
                - countMissing(missing, Severity.MEDIUM) * 0.06
                - countMissing(missing, Severity.LOW) * 0.02;

        ObjectiveComplexity complexity;
        if (goals.size() <= 2 && words < 50) {
            complexity = ObjectiveComplexity.SIMPLE;
        } else if (goals.size() <= 4 && words < 150) {
            complexity = ObjectiveComplexity.MODERATE;
        } else if (goals.size() <= 7 && words < 500) {
            complexity = ObjectiveComplexity.COMPLEX;
        } else {
            complexity = ObjectiveComplexity.VERY_COMPLEX;
        }

        return new ClarificationAnalysis(ambiguities.size(), missing.size(), goals.size(),
                Math.max(0, clarity), Math.max(0, completeness), words, complexity);
    }

    static int wordCount(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    private static boolean atLeast(Severity severity, Severity floor) {
        return severity.compareTo(floor) >= 0;
    }

    private static long count(List<Ambiguity> ambiguities, Severity severity) {
        return ambiguities.stream().filter(a -> a.severity() == severity).count();
    }

    private static long countMissing(List<MissingConstraint> missing, Severity severity) {
        return missing.stream().filter(c -> c.severity() == severity).count();
    }
}

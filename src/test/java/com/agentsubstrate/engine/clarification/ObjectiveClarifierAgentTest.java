package com.agentsubstrate.engine.clarification;

import com.agentsubstrate.core.agent.AgentInvoker;
import com.agentsubstrate.core.contract.AgentResult;
import com.agentsubstrate.core.json.AgentJson;
import com.agentsubstrate.core.persistence.InMemoryDecisionEventStore;
import com.agentsubstrate.core.telemetry.NoopAgentTelemetry;
import com.agentsubstrate.engine.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ObjectiveClarifierAgentTest {

    private static final String VAGUE = "Build a system that handles many users soon";
    private static final String CLEAR =
            "Create an admin report by Friday within budget to the quality standard, scope limited to sales, after the export job";

    private final ObjectiveClarifierAgent agent = new ObjectiveClarifierAgent();

    private static ClarificationInput input(String objective) {
        return new ClarificationInput(objective, null, null, null);
    }

    private static ClarificationInput input(String objective, ClarificationInput.Config config) {
        return new ClarificationInput(objective, null, config, null);
    }

    // -- Ambiguities -----------------------------------------------------------

    @Nested
    @DisplayName("ambiguity detection")
    class Ambiguities {

        @Test
        @DisplayName("vague quantifiers, temporals and dangling pronouns are flagged")
        void vagueObjective() {
            var output = agent.analyze(input(VAGUE));

            List<AmbiguityType> types = output.ambiguities().stream().map(Ambiguity::type).toList();
            assertEquals(List.of(AmbiguityType.QUANTITATIVE, AmbiguityType.TEMPORAL, AmbiguityType.REFERENTIAL), types);

            Ambiguity quantity = output.ambiguities().get(0);
            assertEquals("amb-quant-many", quantity.id());
            assertEquals(Severity.MEDIUM, quantity.severity());
            assertEquals("system that handles many users soon", quantity.sourceText());
            assertEquals(3, quantity.interpretations().size());
            assertEquals("How many specifically is meant by \"many\"?", quantity.clarificationPrompt());

            assertEquals("amb-temp-soon", output.ambiguities().get(1).id());
            assertEquals(Severity.HIGH, output.ambiguities().get(2).severity());
        }

        @Test
        @DisplayName("existing context suppresses referential ambiguities")
        void existingContext() {
            var context = new ClarificationInput.Context(null, null, "The system is the billing portal", null, null);
            var output = agent.analyze(new ClarificationInput(VAGUE, context, null, null));
            assertTrue(output.ambiguities().stream().noneMatch(a -> a.type() == AmbiguityType.REFERENTIAL));
        }

        @Test
        @DisplayName("triggers match whole words only")
        void wholeWords() {
            var output = agent.analyze(input("Improve the handsome homepage layout thoroughly"));
            assertTrue(output.ambiguities().stream().noneMatch(a -> a.id().equals("amb-quant-some")));
        }

        @Test
        @DisplayName("an open conditional is flagged, one with an outcome is not")
        void conditionals() {
            var open = agent.analyze(input("Notify the team if the build fails"));
            assertTrue(open.ambiguities().stream().anyMatch(a -> a.id().equals("amb-cond-if")));

            var closed = agent.analyze(input("If the build fails, notify the team"));
            assertTrue(closed.ambiguities().stream().noneMatch(a -> a.type() == AmbiguityType.CONDITIONAL));
        }

        @Test
        @DisplayName("polysemous words offer each meaning with equal likelihood")
        void polysemy() {
            var output = agent.analyze(input("Run the model nightly"));
            Ambiguity run = output.ambiguities().stream()
                    .filter(a -> a.id().equals("amb-sem-run"))
                    .findFirst().orElseThrow();
            assertEquals(AmbiguityType.SEMANTIC, run.type());
            assertEquals(1.0 / 3, run.interpretations().get(0).likelihood(), 1e-9);
            assertEquals("Which meaning of \"run\" is intended: execute, manage, operate?", run.clarificationPrompt());
            assertTrue(output.ambiguities().stream().anyMatch(a -> a.id().equals("amb-sem-model")));
        }

        @Test
        @DisplayName("a custom dictionary replaces the default one")
        void customDictionary() {
            var custom = new ObjectiveClarifierAgent(new PolysemyDictionary(
                    Map.of("ship", List.of("deliver", "vessel"))));
            var output = custom.analyze(input("Ship the model today"));
            List<String> ids = output.ambiguities().stream().map(Ambiguity::id).toList();
            assertTrue(ids.contains("amb-sem-ship"));
            assertFalse(ids.contains("amb-sem-model"));
        }
    }

    // -- Missing constraints ---------------------------------------------------

    @Nested
    @DisplayName("missing constraints")
    class MissingConstraints {

        @Test
        @DisplayName("a technical objective about users misses timeline, quality, technology and compliance")
        void vagueObjective() {
            var output = agent.analyze(input(VAGUE));
            List<String> ids = output.missingConstraints().stream().map(MissingConstraint::id).toList();
            assertEquals(List.of("missing-temporal", "missing-budget", "missing-quality", "missing-scope",
                    "missing-dependency", "missing-technical", "missing-performance", "missing-compliance"), ids);
        }

        @Test
        @DisplayName("known constraints count as stated")
        void knownConstraints() {
            var context = new ClarificationInput.Context(null, null, null,
                    List.of("Deadline is end of Q3", "Budget capped at 10k", "Tech stack is Java"), null);
            var output = agent.analyze(new ClarificationInput(VAGUE, context, null, null));
            List<String> ids = output.missingConstraints().stream().map(MissingConstraint::id).toList();
            assertFalse(ids.contains("missing-temporal"));
            assertFalse(ids.contains("missing-budget"));
            assertFalse(ids.contains("missing-technical"));
        }

        @Test
        @DisplayName("the severity floor drops lesser findings")
        void severityFloor() {
            var output = agent.analyze(input(VAGUE, new ClarificationInput.Config(Severity.HIGH, null, null, null)));
            assertTrue(output.ambiguities().stream().allMatch(a -> a.severity() == Severity.HIGH));
            assertEquals(3, output.missingConstraints().size());
        }
    }

    // -- Goals -----------------------------------------------------------------

    @Nested
    @DisplayName("goal normalization")
    class Goals {

        @Test
        @DisplayName("each clause with an action verb becomes a goal")
        void clauses() {
            var output = agent.analyze(input("Build a login page; Deploy the API with rate limits"));
            List<NormalizedGoal> goals = output.normalizedGoals();
            assertEquals(2, goals.size());

            NormalizedGoal first = goals.get(0);
            assertEquals("goal-1", first.goalId());
            assertEquals("build", first.action());
            assertEquals("system", first.subject());
            assertEquals("a login page", first.object());
            assertEquals(GoalType.FUNCTIONAL, first.type());
            assertEquals(0.85, first.confidence(), 1e-9);

            NormalizedGoal second = goals.get(1);
            assertEquals("deploy", second.action());
            assertEquals("the api", second.object());
            assertEquals(List.of("rate limits"), second.qualifiers());
            assertEquals(GoalType.CONSTRAINT, second.type());
            assertEquals(0.95, second.confidence(), 1e-9);

            assertEquals("Build a login page; Deploy the API with rate limits",
                    output.clarifiedObjective().statement());
        }

        @Test
        @DisplayName("leading articles and trailing punctuation are stripped")
        void normalizeStatement() {
            assertEquals("system must scale", GoalNormalizer.normalizeStatement("  The   system must scale,"));
        }
    }

    // -- Verdict and questions -------------------------------------------------

    @Nested
    @DisplayName("verdict")
    class Verdict {

        @Test
        @DisplayName("a vague objective needs clarification")
        void needsClarification() {
            var output = agent.analyze(input(VAGUE));
            assertEquals(ClarificationStatus.NEEDS_CLARIFICATION, output.status());
            assertTrue(output.clarifiedObjective().unresolved().contains("Missing: No timeline or deadline specified for completion."));
        }

        @Test
        @DisplayName("fewer than three words is insufficient")
        void insufficient() {
            assertEquals(ClarificationStatus.INSUFFICIENT, agent.analyze(input("Do")).status());
        }

        @Test
        @DisplayName("a fully stated objective is clear")
        void clear() {
            var in = input(CLEAR);
            var output = agent.analyze(in);

            assertEquals(ClarificationStatus.CLEAR, output.status());
            assertTrue(output.ambiguities().isEmpty());
            assertTrue(output.missingConstraints().isEmpty());
            assertEquals(1.0, output.analysis().clarityScore());
            assertEquals(ObjectiveComplexity.SIMPLE, output.analysis().complexity());
            assertEquals(0.93, agent.confidence(in, output), 1e-9);
        }

        @Test
        @DisplayName("questions are ordered by priority and capped")
        void questions() {
            var output = agent.analyze(input(VAGUE));
            assertEquals(10, output.clarificationQuestions().size());

            ClarificationQuestion first = output.clarificationQuestions().get(0);
            assertEquals(Severity.HIGH, first.priority());
            assertEquals("amb-ref-that", first.relatedAmbiguityId());
            assertNull(first.relatedConstraintId());

            var capped = agent.analyze(input(VAGUE, new ClarificationInput.Config(null, 3, null, null)));
            assertEquals(3, capped.clarificationQuestions().size());
            assertTrue(capped.clarificationQuestions().stream().allMatch(q -> q.priority() == Severity.HIGH));
        }

        @Test
        @DisplayName("low-severity ambiguities can be resolved to their most likely reading")
        void autoResolve() {
            var config = new ClarificationInput.Config(null, null, true, InterpretationStyle.CONSERVATIVE);
            var in = input("Update all pages", config);
            var output = agent.analyze(in);

            assertEquals("Assumed \"Update all pages\" means: Full system scope",
                    output.clarifiedObjective().assumptions().get(0));
            List<String> constraints = agent.constraintsApplied(in, output);
            assertTrue(constraints.contains("auto_resolve_low_severity"));
            assertTrue(constraints.contains("interpretation_style:conservative"));
        }
    }

    @Test
    @DisplayName("runs through the invocation runtime and emits objective_clarification")
    void throughRuntime() throws Exception {
        var invoker = new AgentInvoker(new InMemoryDecisionEventStore(), new NoopAgentTelemetry(),
                Runnable::run, Duration.ofSeconds(5));
        var json = AgentJson.mapper().createObjectNode().put("objective", VAGUE);
        AgentResult result = invoker.invoke(agent, json, null);

        var success = assertInstanceOf(AgentResult.Success.class, result);
        assertEquals(ObjectiveClarifierAgent.DECISION_TYPE, success.event().decisionType());
        assertEquals("needs_clarification", success.event().outputs().get("status").asText());
        assertEquals("quantitative", success.event().outputs().at("/ambiguities/0/type").asText());
    }
}

package com.agentsubstrate.engine.decomposition;

import com.agentsubstrate.core.validation.ValidationFailedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PipelineBuilderTest {

    private static final Instant NOW = Instant.parse("2024-06-01T09:00:00Z");

    private final PipelineBuilder builder = new PipelineBuilder(DomainRouteRegistry.defaults());

    private static PipelineStep step(PipelineSpec spec, String domain) {
        return spec.steps().stream()
                .filter(s -> s.domain().equals(domain))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no " + domain + " step"));
    }

    // -- Routing ---------------------------------------------------------------

    @Nested
    @DisplayName("routing")
    class Routing {

        @Test
        @DisplayName("always opens with the copilot planner as the only root")
        void plannerRoot() {
            PipelineSpec spec = builder.build("Ship the SDK", NOW);
            PipelineStep first = spec.steps().get(0);
            assertEquals("1", first.stepId());
            assertEquals("copilot", first.domain());
            assertEquals("planner", first.agent());
            assertNull(first.inputFrom());
            assertEquals(1, spec.steps().stream().filter(PipelineStep::isRoot).count());
        }

        @Test
        @DisplayName("falls back to a forge/sdk scaffold when nothing matches")
        void defaultScaffold() {
            PipelineSpec spec = builder.build("Hello", NOW);
            assertEquals(2, spec.steps().size());
            PipelineStep scaffold = spec.steps().get(1);
            assertEquals("forge", scaffold.domain());
            assertEquals("sdk", scaffold.agent());
            assertEquals("1", scaffold.inputFrom());
            assertEquals(2, spec.metadata().estimatedSteps());
            assertEquals("Hello", spec.metadata().sourceQuery());
            assertEquals(NOW, spec.metadata().createdAt());
        }

        @Test
        @DisplayName("wires test after build, deploy after test and docs after build")
        void wiring() {
            PipelineSpec spec = builder.build("Build an SDK, add unit tests, deploy it and document it", NOW);

            PipelineStep sdk = step(spec, "forge");
            PipelineStep test = step(spec, "test");
            PipelineStep deploy = step(spec, "deploy");
            PipelineStep docs = step(spec, "docs");

            assertEquals(sdk.stepId(), test.inputFrom());
            assertEquals(test.stepId(), deploy.inputFrom());
            assertEquals(sdk.stepId(), docs.inputFrom());
        }

        @Test
        @DisplayName("deploy falls back to the planner without build or test steps")
        void deployWithoutProducers() {
            PipelineSpec spec = builder.build("Release v3", NOW);
            assertEquals(PipelineBuilder.PLANNER_STEP_ID, step(spec, "deploy").inputFrom());
        }

        @Test
        @DisplayName("each domain/agent pair is used once")
        void pairsUsedOnce() {
            PipelineSpec spec = builder.build("deploy, release, ship to production", NOW);
            assertEquals(1, spec.steps().stream().filter(s -> s.domain().equals("deploy")).count());
        }

        @Test
        @DisplayName("an edited registry changes the routing")
        void customRegistry() {
            var registry = new DomainRouteRegistry(List.of(
                    new DomainRoute("search", "index", List.of("catalog"), "Index the catalog", "search_artifact")));
            PipelineSpec spec = new PipelineBuilder(registry).build("Make the catalog searchable", NOW);
            assertEquals(List.of("copilot", "search"), spec.steps().stream().map(PipelineStep::domain).toList());
        }
    }

    // -- DAG validation --------------------------------------------------------

    @Nested
    @DisplayName("DAG validation")
    class DagValidation {

        private PipelineStep step(String id, String inputFrom) {
            return new PipelineStep(id, "forge", "sdk", "step " + id, inputFrom, "forge_artifact");
        }

        @Test
        @DisplayName("accepts a chain rooted at the first step")
        void acceptsChain() {
            assertDoesNotThrow(() -> PipelineBuilder.validateDag(List.of(step("1", null), step("2", "1"), step("3", "1"))));
        }

        @Test
        @DisplayName("rejects duplicate step ids")
        void duplicateIds() {
            assertThrows(ValidationFailedException.class,
                    () -> PipelineBuilder.validateDag(List.of(step("1", null), step("1", "1"))));
        }

        @Test
        @DisplayName("rejects a second root")
        void secondRoot() {
            assertThrows(ValidationFailedException.class,
                    () -> PipelineBuilder.validateDag(List.of(step("1", null), step("2", null))));
        }

        @Test
        @DisplayName("rejects forward references and self references")
        void cycles() {
            assertThrows(ValidationFailedException.class,
                    () -> PipelineBuilder.validateDag(List.of(step("1", null), step("2", "3"), step("3", "2"))));
            assertThrows(ValidationFailedException.class,
                    () -> PipelineBuilder.validateDag(List.of(step("1", null), step("2", "2"))));
        }

        @Test
        @DisplayName("rejects an empty pipeline")
        void empty() {
            assertThrows(ValidationFailedException.class, () -> PipelineBuilder.validateDag(List.of()));
        }
    }
}

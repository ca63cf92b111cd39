package com.agentsubstrate.engine.decomposition;

import com.agentsubstrate.core.validation.ValidationFailedException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Routes an objective across the {@link DomainRouteRegistry} into a pipeline DAG.
 * <p>
 * The pipeline always opens with a {@code copilot/planner} root step. Each matching route adds one
 * step, wired to its producer: test steps read from the latest build step, deploy steps from the
 * latest test step (falling back to build), docs from the latest build step, everything else
 * from the planner.
 */
public class PipelineBuilder {

    static final String PLANNER_STEP_ID = "1";

    private static final Set<String> BUILD_DOMAINS = Set.of("forge", "runtime");

    private final DomainRouteRegistry registry;

    public PipelineBuilder(DomainRouteRegistry registry) {
        this.registry = registry;
    }

    public PipelineSpec build(String objective, Instant createdAt) {
        String lower = objective.toLowerCase(Locale.ROOT);
        List<PipelineStep> steps = new ArrayList<>();
        steps.add(new PipelineStep(PLANNER_STEP_ID, DomainRouteRegistry.PLANNER_DOMAIN,
                DomainRouteRegistry.PLANNER_AGENT, "Generate implementation plan", null, "plan_artifact"));

        Set<String> used = new HashSet<>();
        used.add(DomainRouteRegistry.PLANNER_DOMAIN + "/" + DomainRouteRegistry.PLANNER_AGENT);

        for (DomainRoute route : registry.routes()) {
            if (used.contains(route.key()) || !route.matches(lower)) {
                continue;
            }
            used.add(route.key());
            steps.add(new PipelineStep(String.valueOf(steps.size() + 1), route.domain(), route.agent(),
                    route.description(), producerFor(route.domain(), steps), route.outputSchema()));
        }

        if (steps.size() == 1) {
            steps.add(new PipelineStep("2", "forge", "sdk", "Scaffold MVP from plan",
                    PLANNER_STEP_ID, "forge_artifact"));
        }

        validateDag(steps);
        return new PipelineSpec(UUID.randomUUID().toString(), steps,
                new PipelineSpec.Metadata(objective, createdAt, steps.size()));
    }

    private static String producerFor(String domain, List<PipelineStep> steps) {
        String build = latest(steps, BUILD_DOMAINS);
        return switch (domain) {
            case "test", "docs" -> build != null ? build : PLANNER_STEP_ID;
            case "deploy" -> {
                String test = latest(steps, Set.of("test"));
                if (test != null) {
                    yield test;
                }
                yield build != null ? build : PLANNER_STEP_ID;
            }
            default -> PLANNER_STEP_ID;
        };
    }

    private static String latest(List<PipelineStep> steps, Set<String> domains) {
        for (int i = steps.size() - 1; i >= 0; i--) {
            if (domains.contains(steps.get(i).domain())) {
                return steps.get(i).stepId();
            }
        }
        return null;
    }

    /**
     * Checks that step ids are unique, exactly the first step is a root, and every
     * {@code input_from} names an earlier step. Together these rule out cycles.
     *
     * @throws ValidationFailedException when the steps do not form a DAG
     */
    static void validateDag(List<PipelineStep> steps) {
        if (steps.isEmpty()) {
            throw new ValidationFailedException("pipeline_spec.steps must not be empty");
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < steps.size(); i++) {
            PipelineStep step = steps.get(i);
            if (!seen.add(step.stepId())) {
                throw new ValidationFailedException("pipeline_spec.steps[" + i + "]: duplicate step_id " + step.stepId());
            }
            if (step.isRoot()) {
                if (i != 0) {
                    throw new ValidationFailedException("pipeline_spec.steps[" + i + "]: only the first step may be a root");
                }
            } else if (step.inputFrom().equals(step.stepId()) || !seen.contains(step.inputFrom())) {
                throw new ValidationFailedException("pipeline_spec.steps[" + i + "]: input_from "
                        + step.inputFrom() + " does not reference an earlier step");
            }
        }
    }
}

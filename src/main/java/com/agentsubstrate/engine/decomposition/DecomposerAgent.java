package com.agentsubstrate.engine.decomposition;

import com.agentsubstrate.core.agent.AgentClassification;
import com.agentsubstrate.core.agent.AgentMetadata;
import com.agentsubstrate.core.agent.AnalyticalAgent;
import com.agentsubstrate.engine.Scores;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Breaks an objective into sub-objectives and routes it into a pipeline DAG.
 * <p>
 * Purely structural: the agent never executes, assigns, allocates or schedules the work it describes.
 */
@Component
public class DecomposerAgent implements AnalyticalAgent<DecompositionInput, DecompositionOutput> {

    public static final String AGENT_ID = "decomposer-agent";
    public static final String AGENT_VERSION = "1.0.0";
    public static final String DECISION_TYPE = "objective_decomposition";

    static final String OUTPUT_VERSION = "1.0.0";
    static final String ROOT = "root";

    private static final AgentMetadata METADATA = new AgentMetadata(
            AGENT_ID,
            "Decomposer Agent",
            AGENT_VERSION,
            List.of(AgentClassification.DECOMPOSITION, AgentClassification.STRUCTURAL_SYNTHESIS),
            DECISION_TYPE,
            "Decomposes complex objectives into manageable sub-objectives with relationships and completeness assessment."
    );

    private static final List<String> BUILD_KEYWORDS = List.of("build", "create", "implement", "develop");
    private static final List<String> INTERFACE_KEYWORDS = List.of("api", "service", "endpoint", "interface");
    private static final List<String> VALIDATION_KEYWORDS = List.of("test", "validate", "verify", "quality");
    private static final List<String> DEPLOYMENT_KEYWORDS = List.of("deploy", "release", "production", "launch");
    private static final List<String> INTEGRATION_KEYWORDS = List.of("integrate", "connect", "migrate");

    private final PipelineBuilder pipelineBuilder;

    public DecomposerAgent() {
        this(new PipelineBuilder(DomainRouteRegistry.defaults()));
    }

    DecomposerAgent(PipelineBuilder pipelineBuilder) {
        this.pipelineBuilder = pipelineBuilder;
    }

    @Override
    public AgentMetadata metadata() {
        return METADATA;
    }

    @Override
    public Class<DecompositionInput> inputType() {
        return DecompositionInput.class;
    }

    @Override
    public DecompositionOutput analyze(DecompositionInput input) {
        List<SubObjective> subs = extractSubObjectives(input);

        int maxDepthReached = subs.stream().mapToInt(SubObjective::depth).max().orElse(0);
        int atomicCount = (int) subs.stream().filter(SubObjective::isAtomic).count();

        var analysis = new DecompositionAnalysis(
                subs.size(),
                maxDepthReached,
                atomicCount,
                coverage(subs),
                complexityDistribution(subs),
                assumptions(input)
        );

        return new DecompositionOutput(
                UUID.randomUUID().toString(),
                summarize(input.objective()),
                subs,
                treeStructure(subs),
                dependencyGraph(subs),
                analysis,
                OUTPUT_VERSION,
                pipelineBuilder.build(input.objective(), Instant.now())
        );
    }

    @Override
    public double confidence(DecompositionInput input, DecompositionOutput output) {
        int count = output.subObjectives().size();
        double confidence = 0.65;
        if (count >= 3 && count <= 20) {
            confidence += 0.1;
        }
        if (output.analysis().coverageScore() >= 0.7) {
            confidence += 0.1;
        }
        if (output.analysis().maxDepthReached() >= 1) {
            confidence += 0.05;
        }
        if (output.analysis().atomicCount() > 0) {
            confidence += 0.05;
        }
        // over-decomposition
        if (count > 25) {
            confidence -= 0.1;
        }
        return Scores.clamp(confidence);
    }

    @Override
    public List<String> constraintsApplied(DecompositionInput input, DecompositionOutput output) {
        List<String> constraints = new ArrayList<>(List.of(
                "read_only_analysis",
                "no_execution",
                "no_agent_assignment",
                "no_resource_allocation",
                "no_scheduling",
                "deterministic_output"
        ));
        input.userConstraints().forEach(c -> constraints.add("user_constraint:" + c));
        return constraints;
    }

    // -- Sub-objective extraction ---------------------------------------------

    private List<SubObjective> extractSubObjectives(DecompositionInput input) {
        String objective = input.objective().toLowerCase(Locale.ROOT);
        var subs = new SubObjectiveList(input.effectiveMaxDepth(), input.effectiveMaxSubObjectives());

        String understandId = subs.add("Understand Requirements",
                "Analyze and capture all requirements from the objective",
                null, 0, List.of("requirements", "analysis"), Complexity.SIMPLE, true,
                List.of(),
                List.of("All requirements identified", "Ambiguities documented"));

        String designId = subs.add("Design Approach",
                "Design the solution approach and architecture",
                null, 0, List.of("design", "architecture"), Complexity.MODERATE, false,
                dependsOn(understandId, DependencyType.DATA),
                List.of("Architecture decisions documented", "Approach validated"));

        if (containsAny(objective, BUILD_KEYWORDS)) {
            String implId = subs.add("Implement Core Logic",
                    "Implement the core functionality described in the objective",
                    null, 0, List.of("implementation", "core"), Complexity.COMPLEX, false,
                    dependsOn(designId, DependencyType.BLOCKING),
                    List.of("Core functionality working", "Unit tests passing"));

            if (implId != null && input.effectiveMaxDepth() >= 1) {
                subs.add("Set Up Project Structure",
                        "Create the project scaffolding and configuration",
                        implId, 1, List.of("setup", "scaffolding"), Complexity.SIMPLE, true,
                        List.of(),
                        List.of("Project structure created", "Dependencies installed"));
                subs.add("Implement Business Logic",
                        "Build the primary business logic components",
                        implId, 1, List.of("business-logic", "core"), Complexity.COMPLEX, true,
                        List.of(),
                        List.of("Business rules implemented", "Edge cases handled"));
            }
        }

        if (containsAny(objective, INTERFACE_KEYWORDS)) {
            subs.add("Define Interface Contracts",
                    "Specify API contracts, schemas, and interface boundaries",
                    designId, designId != null ? 1 : 0, List.of("interfaces", "contracts", "api"),
                    Complexity.MODERATE, true,
                    List.of(),
                    List.of("API contracts defined", "Schemas validated"));
        }

        if (containsAny(objective, VALIDATION_KEYWORDS)) {
            subs.add("Establish Validation Strategy",
                    "Define the testing and validation approach",
                    null, 0, List.of("testing", "validation"), Complexity.MODERATE, true,
                    dependsOn(designId, DependencyType.DATA),
                    List.of("Test strategy defined", "Coverage targets set"));
        }

        if (containsAny(objective, DEPLOYMENT_KEYWORDS)) {
            subs.add("Plan Deployment",
                    "Define the deployment and release strategy",
                    null, 0, List.of("deployment", "release"), Complexity.MODERATE, true,
                    dependsOn(designId, DependencyType.DATA),
                    List.of("Deployment pipeline defined", "Rollback plan documented"));
        }

        if (containsAny(objective, INTEGRATION_KEYWORDS)) {
            subs.add("Plan Integration",
                    "Define integration points and data flow between systems",
                    null, 0, List.of("integration", "connectivity"), Complexity.COMPLEX, false,
                    dependsOn(designId, DependencyType.DATA),
                    List.of("Integration points mapped", "Data flow documented"));
        }

        List<SubObjective.Dependency> reviewDeps = subs.entries().stream()
                .filter(s -> s.parentId() == null)
                .map(s -> new SubObjective.Dependency(s.id(), DependencyType.DATA))
                .toList();
        subs.add("Review and Validate Completeness",
                "Ensure all sub-objectives adequately cover the original objective",
                null, 0, List.of("review", "completeness"), Complexity.SIMPLE, true,
                reviewDeps,
                List.of("All sub-objectives addressed", "Coverage verified"));

        return subs.entries();
    }

    private static List<SubObjective.Dependency> dependsOn(String id, DependencyType type) {
        return id == null ? List.of() : List.of(new SubObjective.Dependency(id, type));
    }

    /**
     * Accumulates sub-objectives under the count and depth limits, numbering them {@code sub-N}.
     */
    private static final class SubObjectiveList {

        private final int maxDepth;
        private final int maxCount;
        private final List<SubObjective> entries = new ArrayList<>();

        SubObjectiveList(int maxDepth, int maxCount) {
            this.maxDepth = maxDepth;
            this.maxCount = maxCount;
        }

        /**
         * @return the new id, or null when a limit rejected the entry
         */
        String add(String title, String description, String parentId, int depth, List<String> tags,
                   Complexity complexity, boolean atomic, List<SubObjective.Dependency> dependencies,
                   List<String> criteria) {
            if (entries.size() >= maxCount || depth > maxDepth) {
                return null;
            }
            String id = "sub-" + (entries.size() + 1);
            entries.add(new SubObjective(id, title, description, parentId, depth, dependencies, tags,
                    complexity, atomic, criteria));
            return id;
        }

        List<SubObjective> entries() {
            return List.copyOf(entries);
        }
    }

    // -- Structure and metrics ------------------------------------------------

    static Map<String, List<String>> treeStructure(List<SubObjective> subs) {
        Map<String, List<String>> tree = new LinkedHashMap<>();
        tree.put(ROOT, new ArrayList<>());
        for (SubObjective sub : subs) {
            String bucket = sub.parentId() == null ? ROOT : sub.parentId();
            tree.computeIfAbsent(bucket, k -> new ArrayList<>()).add(sub.id());
        }
        return tree;
    }

    static Map<String, List<String>> dependencyGraph(List<SubObjective> subs) {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        for (SubObjective sub : subs) {
            graph.put(sub.id(), sub.dependencies().stream().map(SubObjective.Dependency::dependsOn).toList());
        }
        return graph;
    }

    static Map<String, Integer> complexityDistribution(List<SubObjective> subs) {
        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (Complexity complexity : Complexity.values()) {
            distribution.put(complexity.value(), 0);
        }
        for (SubObjective sub : subs) {
            distribution.merge(sub.complexity().value(), 1, Integer::sum);
        }
        return distribution;
    }

    static double coverage(List<SubObjective> subs) {
        if (subs.isEmpty()) {
            return 0.0;
        }
        double score = 0.5;
        int count = subs.size();
        if (count >= 3 && count <= 15) {
            score += 0.15;
        }
        if (count > 15) {
            score += 0.1;
        }
        double atomicRatio = subs.stream().filter(SubObjective::isAtomic).count() / (double) count;
        if (atomicRatio > 0.4) {
            score += 0.1;
        }
        double criteriaRatio = subs.stream().filter(s -> !s.acceptanceCriteria().isEmpty()).count() / (double) count;
        score += criteriaRatio * 0.15;
        if (subs.stream().anyMatch(s -> s.depth() >= 1)) {
            score += 0.1;
        }
        return Scores.clamp(score);
    }

    static String summarize(String objective) {
        String cleaned = objective.trim().replaceAll("\\s+", " ");
        return cleaned.length() > 200 ? cleaned.substring(0, 197) + "..." : cleaned;
    }

    private static List<String> assumptions(DecompositionInput input) {
        List<String> assumptions = new ArrayList<>(List.of(
                "Objective has been validated for clarity",
                "Decomposition is based on structural analysis of the objective text"
        ));
        if (input.userConstraints().isEmpty()) {
            assumptions.add("No explicit constraints provided - using default decomposition strategy");
        }
        if (!input.hasExistingComponents()) {
            assumptions.add("No existing components specified - decomposing as new work");
        }
        if (!input.hasGranularity()) {
            assumptions.add("Using medium granularity as default");
        }
        return assumptions;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }
}

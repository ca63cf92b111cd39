package com.agentsubstrate.engine.decomposition;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered table of domain routes consulted by {@link PipelineBuilder}.
 * <p>
 * Order matters: routes are swept top to bottom, so producers (forge, runtime, test)
 * are listed before the steps that consume their output (deploy, docs).
 */
public final class DomainRouteRegistry {

    public static final String PLANNER_DOMAIN = "copilot";
    public static final String PLANNER_AGENT = "planner";

    private static final List<DomainRoute> DEFAULT_ROUTES = List.of(
            // copilot
            new DomainRoute("copilot", "planner", List.of("plan", "strategy", "roadmap", "approach"),
                    "Generate implementation plan", "plan_artifact"),
            new DomainRoute("copilot", "clarifier", List.of("clarify", "ambiguous", "unclear", "requirements"),
                    "Clarify objective requirements", "clarification_artifact"),
            new DomainRoute("copilot", "intent", List.of("intent", "classify", "categorize"),
                    "Classify user intent", "intent_artifact"),
            new DomainRoute("copilot", "reflection", List.of("reflect", "evaluate", "review", "quality"),
                    "Evaluate decision quality", "reflection_artifact"),
            new DomainRoute("copilot", "config", List.of("validate", "config", "configuration"),
                    "Validate configuration", "config_artifact"),
            // build
            new DomainRoute("forge", "scaffold", List.of("scaffold", "mvp", "prototype", "boilerplate"),
                    "Scaffold project structure", "forge_artifact"),
            new DomainRoute("forge", "sdk", List.of("sdk", "library", "package"),
                    "Generate SDK / library scaffold", "forge_artifact"),
            new DomainRoute("forge", "template", List.of("template", "starter"),
                    "Apply project template", "forge_artifact"),
            new DomainRoute("runtime", "executor", List.of("execute", "run", "sandbox"),
                    "Execute code in sandbox", "runtime_artifact"),
            // verification
            new DomainRoute("test", "unit", List.of("test", "unit test", "spec"),
                    "Generate unit tests", "test_artifact"),
            new DomainRoute("test", "integration",
                    List.of("integration test", "contract test", "health check", "smoke test"),
                    "Generate integration tests", "test_artifact"),
            new DomainRoute("test", "e2e", List.of("e2e", "end-to-end", "acceptance test"),
                    "Generate end-to-end tests", "test_artifact"),
            // delivery
            new DomainRoute("deploy", "cd", List.of("deploy", "release", "ship", "production", "ci/cd"),
                    "Plan deployment pipeline", "deploy_artifact"),
            new DomainRoute("deploy", "rollback", List.of("rollback", "revert"),
                    "Plan rollback strategy", "deploy_artifact"),
            new DomainRoute("docs", "generate", List.of("document", "docs", "readme", "api doc"),
                    "Generate documentation", "docs_artifact"),
            // platform domains
            new DomainRoute("data", "ingest", List.of("ingest", "etl", "import", "data pipeline"),
                    "Ingest data from sources", "data_artifact"),
            new DomainRoute("data", "transform", List.of("transform", "clean", "normalize data"),
                    "Transform and clean data", "data_artifact"),
            new DomainRoute("data", "query", List.of("query", "sql", "database", "db"),
                    "Query data sources", "data_artifact"),
            new DomainRoute("auth", "identity", List.of("auth", "login", "identity", "sso", "oauth"),
                    "Set up authentication / identity", "auth_artifact"),
            new DomainRoute("auth", "rbac", List.of("rbac", "permission", "role", "access control"),
                    "Configure role-based access", "auth_artifact"),
            new DomainRoute("security", "scan", List.of("security", "scan", "vulnerability"),
                    "Run security scan", "security_artifact"),
            new DomainRoute("security", "audit", List.of("audit", "compliance", "gdpr", "hipaa", "soc2"),
                    "Perform security audit", "security_artifact"),
            new DomainRoute("ml", "train", List.of("train", "model", "machine learning", "ml"),
                    "Train ML model", "ml_artifact"),
            new DomainRoute("ml", "inference", List.of("inference", "predict"),
                    "Run ML inference", "ml_artifact"),
            new DomainRoute("ui", "component", List.of("ui", "component", "frontend", "react", "vue"),
                    "Build UI components", "ui_artifact"),
            new DomainRoute("messaging", "pubsub", List.of("event", "pubsub", "queue", "message", "kafka"),
                    "Configure messaging / events", "messaging_artifact"),
            new DomainRoute("storage", "blob", List.of("storage", "upload", "blob", "file", "s3"),
                    "Configure storage", "storage_artifact"),
            new DomainRoute("storage", "cache", List.of("cache", "redis", "memcache"),
                    "Configure caching layer", "storage_artifact"),
            new DomainRoute("gateway", "route", List.of("api gateway", "route", "proxy", "rate limit"),
                    "Configure API gateway", "gateway_artifact"),
            new DomainRoute("analytics", "report", List.of("analytics", "metrics", "dashboard", "report"),
                    "Set up analytics / reporting", "analytics_artifact"),
            new DomainRoute("notification", "webhook", List.of("notify", "email", "push", "webhook", "alert"),
                    "Configure notifications", "notification_artifact"),
            new DomainRoute("migration", "schema", List.of("migrate", "migration", "upgrade"),
                    "Plan migration", "migration_artifact"),
            new DomainRoute("i18n", "translate", List.of("translate", "i18n", "locale", "internationali"),
                    "Set up internationalisation", "i18n_artifact"),
            new DomainRoute("devtools", "lint", List.of("lint", "format", "prettier", "eslint"),
                    "Configure linting / formatting", "devtools_artifact"),
            new DomainRoute("observability", "trace", List.of("monitor", "trace", "observability", "log"),
                    "Set up observability", "observability_artifact"),
            new DomainRoute("edge", "cdn", List.of("cdn", "edge", "serverless function"),
                    "Configure edge / CDN", "edge_artifact"),
            new DomainRoute("secret", "vault", List.of("secret", "vault", "credential", "env var"),
                    "Manage secrets / credentials", "secret_artifact"),
            new DomainRoute("workflow", "orchestrate", List.of("workflow", "pipeline", "orchestrat"),
                    "Design workflow orchestration", "workflow_artifact"),
            new DomainRoute("billing", "meter", List.of("billing", "payment", "invoice", "subscription"),
                    "Configure billing / metering", "billing_artifact"),
            new DomainRoute("config", "distribute", List.of("feature flag", "remote config", "distribute config"),
                    "Distribute configuration", "config_dist_artifact"),
            new DomainRoute("search", "index", List.of("search", "elasticsearch", "full-text", "index"),
                    "Set up search indexing", "search_artifact")
    );

    private final List<DomainRoute> routes;

    public DomainRouteRegistry(List<DomainRoute> routes) {
        this.routes = List.copyOf(routes);
    }

    public static DomainRouteRegistry defaults() {
        return new DomainRouteRegistry(DEFAULT_ROUTES);
    }

    public List<DomainRoute> routes() {
        return routes;
    }

    /**
     * Distinct domains in registry order.
     */
    public Set<String> domains() {
        Set<String> domains = new LinkedHashSet<>();
        routes.forEach(r -> domains.add(r.domain()));
        return domains;
    }
}

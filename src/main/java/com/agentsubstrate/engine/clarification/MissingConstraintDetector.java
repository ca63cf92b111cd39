package com.agentsubstrate.engine.clarification;

import com.agentsubstrate.engine.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Flags constraint classes the objective never mentions. Each check looks for the signal words of
 * its class in the objective (and, for some classes, in the caller's known constraints); absence
 * yields a {@link MissingConstraint} with the default that would otherwise silently apply.
 */
class MissingConstraintDetector {

    private static final Pattern TEMPORAL_SIGNAL =
            Pattern.compile("\\b(by|within|before|after|deadline|due)\\b", Pattern.CASE_INSENSITIVE);

    static final List<String> TECHNICAL_KEYWORDS =
            List.of("api", "database", "system", "application", "service", "platform");
    static final List<String> COMPLIANCE_KEYWORDS =
            List.of("user", "data", "personal", "customer", "financial", "health");

    List<MissingConstraint> detect(String objective, List<String> knownConstraints) {
        String lower = objective.toLowerCase(Locale.ROOT);
        List<String> known = knownConstraints.stream().map(c -> c.toLowerCase(Locale.ROOT)).toList();
        List<MissingConstraint> missing = new ArrayList<>();

        boolean temporalKnown = known.stream().anyMatch(c -> c.contains("deadline") || c.contains("by ") || c.contains("within"));
        if (!temporalKnown && !TEMPORAL_SIGNAL.matcher(objective).find()) {
            missing.add(new MissingConstraint("missing-temporal", ConstraintCategory.TEMPORAL,
                    "No timeline or deadline specified for completion.",
                    "Cannot prioritize or schedule work without knowing time constraints.",
                    Severity.HIGH,
                    "What is the expected timeline or deadline for this objective?",
                    "Standard project timeline will be applied."));
        }

        if (!containsAny(lower, "budget", "cost") && known.stream().noneMatch(c -> c.contains("budget"))) {
            missing.add(new MissingConstraint("missing-budget", ConstraintCategory.RESOURCE,
                    "No budget or cost constraints specified.",
                    "Cannot determine feasibility or scope without budget information.",
                    Severity.MEDIUM,
                    "Are there any budget or cost constraints for this objective?",
                    "Standard budget allocation will be assumed."));
        }

        if (!containsAny(lower, "quality", "standard", "requirement", "criteria")) {
            missing.add(new MissingConstraint("missing-quality", ConstraintCategory.QUALITY,
                    "No quality standards or acceptance criteria specified.",
                    "Cannot determine when the objective is satisfactorily achieved.",
                    Severity.HIGH,
                    "What are the quality standards or acceptance criteria for this objective?",
                    "Industry-standard quality practices will be followed."));
        }

        if (!containsAny(lower, "scope", "exclude", "only", "limit")) {
            missing.add(new MissingConstraint("missing-scope", ConstraintCategory.SCOPE,
                    "No explicit scope boundaries or exclusions defined.",
                    "Risk of scope creep without clear boundaries.",
                    Severity.MEDIUM,
                    "What is explicitly out of scope for this objective?",
                    "Scope will be interpreted conservatively."));
        }

        if (!containsAny(lower, "depend", "prerequisite", "require", "after")) {
            missing.add(new MissingConstraint("missing-dependency", ConstraintCategory.DEPENDENCY,
                    "No dependencies or prerequisites mentioned.",
                    "Unknown blockers may delay or prevent completion.",
                    Severity.LOW,
                    "Are there any dependencies or prerequisites for this objective?",
                    "No external dependencies assumed."));
        }

        boolean technical = TECHNICAL_KEYWORDS.stream().anyMatch(lower::contains);
        if (technical && !containsAny(lower, "technology", "stack", "language")
                && known.stream().noneMatch(c -> c.contains("tech"))) {
            missing.add(new MissingConstraint("missing-technical", ConstraintCategory.TECHNICAL,
                    "Technical objective without specified technology constraints.",
                    "Technology choices may conflict with existing systems or preferences.",
                    Severity.MEDIUM,
                    "Are there any technology preferences or constraints (languages, frameworks, platforms)?",
                    "Appropriate technologies will be selected based on requirements."));
        }

        if (technical && !containsAny(lower, "performance", "latency", "throughput", "scale")) {
            missing.add(new MissingConstraint("missing-performance", ConstraintCategory.PERFORMANCE,
                    "No performance requirements specified.",
                    "Cannot optimize or test for specific performance targets.",
                    Severity.LOW,
                    "Are there any performance requirements (response time, throughput, scale)?",
                    "Standard performance levels will be targeted."));
        }

        if (COMPLIANCE_KEYWORDS.stream().anyMatch(lower::contains)
                && !containsAny(lower, "compliance", "regulation", "gdpr", "hipaa")) {
            missing.add(new MissingConstraint("missing-compliance", ConstraintCategory.COMPLIANCE,
                    "Potential compliance requirements not addressed.",
                    "May face legal or regulatory issues if compliance requirements exist.",
                    Severity.HIGH,
                    "Are there any compliance or regulatory requirements (GDPR, HIPAA, SOC2, etc.)?",
                    "Standard data protection practices will be followed."));
        }
        return missing;
    }

    private static boolean containsAny(String text, String... keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}

package com.agentsubstrate.engine.clarification;

import com.agentsubstrate.engine.Severity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs the ambiguity pattern battery over an objective: vague quantifiers, vague temporals,
 * scope words, unresolved pronouns, open conditionals and polysemous words.
 * <p>
 * Triggers match whole words, case-insensitively. Each trigger yields at most one ambiguity.
 */
class AmbiguityDetector {

    static final List<String> VAGUE_QUANTIFIERS =
            List.of("some", "many", "few", "several", "various", "multiple", "numerous");
    static final List<String> VAGUE_TEMPORALS = List.of("soon", "quickly", "fast", "later", "eventually", "asap");
    static final List<String> SCOPE_INDICATORS = List.of("all", "everything", "entire", "whole", "complete");
    static final List<String> PRONOUNS = List.of("it", "they", "them", "this", "that", "these", "those");
    static final List<String> CONDITIONALS = List.of("if", "when", "unless", "depending");

    private final PolysemyDictionary polysemy;

    AmbiguityDetector(PolysemyDictionary polysemy) {
        this.polysemy = polysemy;
    }

    List<Ambiguity> detect(String objective, boolean hasExistingContext) {
        List<Ambiguity> found = new ArrayList<>();

        for (String quantifier : VAGUE_QUANTIFIERS) {
            if (mentions(objective, quantifier)) {
                found.add(new Ambiguity("amb-quant-" + quantifier, AmbiguityType.QUANTITATIVE,
                        contextFor(objective, quantifier),
                        "The quantifier \"%s\" is vague and does not specify an exact amount.".formatted(quantifier),
                        List.of(
                                reading("2-5 items", 0.4, "Small scale"),
                                reading("5-10 items", 0.3, "Medium scale"),
                                reading("10+ items", 0.3, "Larger scale")),
                        Severity.MEDIUM,
                        "How many specifically is meant by \"%s\"?".formatted(quantifier)));
            }
        }

        for (String temporal : VAGUE_TEMPORALS) {
            if (mentions(objective, temporal)) {
                found.add(new Ambiguity("amb-temp-" + temporal, AmbiguityType.TEMPORAL,
                        contextFor(objective, temporal),
                        "The temporal term \"%s\" does not specify a concrete timeframe.".formatted(temporal),
                        List.of(
                                reading("Within hours", 0.2, "Urgent"),
                                reading("Within days", 0.4, "Standard priority"),
                                reading("Within weeks", 0.4, "Lower priority")),
                        Severity.MEDIUM,
                        "What is the specific timeframe for \"%s\"?".formatted(temporal)));
            }
        }

        for (String indicator : SCOPE_INDICATORS) {
            if (mentions(objective, indicator)) {
                found.add(new Ambiguity("amb-scope-" + indicator, AmbiguityType.SCOPE,
                        contextFor(objective, indicator),
                        "The scope indicator \"%s\" may have different interpretations of boundaries.".formatted(indicator),
                        List.of(
                                reading("Full system scope", 0.5, "No exclusions"),
                                reading("Primary components only", 0.3, "Standard interpretation"),
                                reading("Core functionality", 0.2, "Minimal scope")),
                        Severity.LOW,
                        "What specifically is included in \"%s\"? Are there any exclusions?".formatted(indicator)));
            }
        }

        if (!hasExistingContext) {
            // one referential ambiguity is enough to ask for context
            for (String pronoun : PRONOUNS) {
                if (mentions(objective, pronoun)) {
                    found.add(new Ambiguity("amb-ref-" + pronoun, AmbiguityType.REFERENTIAL,
                            contextFor(objective, pronoun),
                            "The pronoun \"%s\" has no clear antecedent in the provided context.".formatted(pronoun),
                            List.of(
                                    reading("Refers to the main subject", 0.6, "Most recent noun"),
                                    reading("Refers to the system/project", 0.4, "Contextual inference")),
                            Severity.HIGH,
                            "What does \"%s\" refer to specifically?".formatted(pronoun)));
                    break;
                }
            }
        }

        for (String indicator : CONDITIONALS) {
            if (!mentions(objective, indicator)) {
                continue;
            }
            String conditional = contextFor(objective, indicator);
            if (!conditional.contains("then") && !conditional.contains(",")) {
                found.add(new Ambiguity("amb-cond-" + indicator, AmbiguityType.CONDITIONAL,
                        conditional,
                        "The conditional \"%s\" may have an incomplete or ambiguous outcome.".formatted(indicator),
                        List.of(
                                reading("Proceed with action", 0.5, "Positive case"),
                                reading("Skip/alternative action", 0.5, "Negative case")),
                        Severity.MEDIUM,
                        "What should happen %s the condition is not met?".formatted(indicator)));
            }
        }

        List<String> words = Arrays.asList(objective.toLowerCase(Locale.ROOT).trim().split("\\s+"));
        for (Map.Entry<String, List<String>> entry : polysemy.entries().entrySet()) {
            String word = entry.getKey();
            if (!words.contains(word)) {
                continue;
            }
            List<String> meanings = entry.getValue();
            List<Ambiguity.Interpretation> readings = new ArrayList<>();
            for (int i = 0; i < meanings.size(); i++) {
                readings.add(reading(meanings.get(i), 1.0 / meanings.size(), "Interpretation " + (i + 1)));
            }
            found.add(new Ambiguity("amb-sem-" + word, AmbiguityType.SEMANTIC,
                    contextFor(objective, word),
                    "The word \"%s\" has multiple possible meanings in this context.".formatted(word),
                    readings,
                    Severity.MEDIUM,
                    "Which meaning of \"%s\" is intended: %s?".formatted(word, String.join(", ", meanings))));
        }
        return found;
    }

    static boolean mentions(String text, String word) {
        return wordPattern(word).matcher(text).find();
    }

    /**
     * @return the first occurrence of {@code word} with up to three surrounding words each side,
     *         or the word itself when it does not occur
     */
    static String contextFor(String text, String word) {
        Pattern pattern = Pattern.compile("(?:\\S+\\s+){0,3}\\b" + Pattern.quote(word) + "\\b(?:\\s+\\S+){0,3}",
                Pattern.CASE_INSENSITIVE);
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group() : word;
    }

    private static Pattern wordPattern(String word) {
        return Pattern.compile("\\b" + Pattern.quote(word) + "\\b", Pattern.CASE_INSENSITIVE);
    }

    private static Ambiguity.Interpretation reading(String interpretation, double likelihood, String assumption) {
        return new Ambiguity.Interpretation(interpretation, likelihood, List.of(assumption));
    }
}

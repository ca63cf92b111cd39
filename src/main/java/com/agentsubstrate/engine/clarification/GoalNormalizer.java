package com.agentsubstrate.engine.clarification;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lifts goal statements out of an objective. The objective is split on sentence and clause
 * boundaries; each clause with an action verb becomes a {@link NormalizedGoal}.
 */
class GoalNormalizer {

    static final List<String> ACTION_VERBS = List.of(
            "create", "build", "develop", "implement", "design", "deploy",
            "update", "modify", "change", "improve", "enhance", "optimize",
            "remove", "delete", "deprecate", "migrate", "refactor",
            "integrate", "connect", "link", "sync",
            "test", "validate", "verify", "check", "audit",
            "document", "describe", "explain", "define",
            "configure", "setup", "initialize", "enable", "disable",
            "monitor", "track", "log", "measure", "analyze"
    );

    private static final List<String> OBJECT_STOP_WORDS = List.of("for", "to", "with", "using", "by", "that", "which");

    private static final List<String> NON_FUNCTIONAL = List.of(
            "performance", "scalab", "secur", "reliab", "availab", "maintain",
            "usab", "access", "portab", "fast", "quick", "efficient");
    private static final List<String> CONSTRAINT = List.of(
            "must", "shall", "require", "limit", "restrict", "only", "cannot", "never");
    private static final List<String> ASSUMPTION = List.of("assume", "expect", "given", "provided that", "if ");

    private static final Pattern SENTENCE_BREAK = Pattern.compile("[.;]\\s*");
    private static final Pattern CLAUSE_BREAK = Pattern.compile("\\s*(?:and|,)\\s+(?=[A-Z])");
    private static final List<Pattern> QUALIFIERS = List.of(
            Pattern.compile("\\bwith\\s+(.+?)(?:\\s+and|\\s+for|$)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\busing\\s+(.+?)(?:\\s+and|\\s+for|$)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bthat\\s+(.+?)(?:\\s+and|\\s+for|$)", Pattern.CASE_INSENSITIVE));

    private record Clause(String action, String subject, String object, List<String> qualifiers, double confidence) {
    }

    List<NormalizedGoal> normalize(String objective) {
        List<String> statements = split(objective);
        List<NormalizedGoal> goals = new ArrayList<>();
        for (int i = 0; i < statements.size(); i++) {
            String statement = statements.get(i).trim();
            if (statement.length() < 5) {
                continue;
            }
            Clause clause = parse(statement);
            if (clause.action() == null) {
                continue;
            }
            goals.add(new NormalizedGoal(
                    "goal-" + (i + 1),
                    normalizeStatement(statement),
                    classify(statement),
                    clause.action(),
                    clause.subject() != null ? clause.subject() : "system",
                    clause.object(),
                    clause.qualifiers(),
                    clause.confidence(),
                    statement));
        }
        return goals;
    }

    static List<String> split(String objective) {
        List<String> statements = new ArrayList<>();
        for (String sentence : SENTENCE_BREAK.split(objective)) {
            for (String clause : CLAUSE_BREAK.split(sentence)) {
                if (!clause.isEmpty()) {
                    statements.add(clause);
                }
            }
        }
        return statements;
    }

    private Clause parse(String statement) {
        List<String> words = Arrays.asList(statement.toLowerCase(Locale.ROOT).trim().split("\\s+"));

        String action = null;
        int actionIndex = -1;
        for (int i = 0; i < words.size(); i++) {
            if (ACTION_VERBS.contains(words.get(i))) {
                action = words.get(i);
                actionIndex = i;
                break;
            }
        }
        // imperative fallback: "Improve", "Automate", ...
        if (action == null && !words.isEmpty() && words.get(0).endsWith("e")) {
            action = words.get(0);
            actionIndex = 0;
        }

        String subject = null;
        int forIndex = words.indexOf("for");
        if (forIndex != -1 && forIndex < words.size() - 1) {
            subject = String.join(" ", words.subList(forIndex + 1, Math.min(forIndex + 4, words.size())));
        } else if (actionIndex > 0) {
            subject = String.join(" ", words.subList(0, actionIndex));
        }

        String object = null;
        if (actionIndex != -1 && actionIndex < words.size() - 1) {
            List<String> afterAction = words.subList(actionIndex + 1, words.size());
            int stop = -1;
            for (int i = 0; i < afterAction.size(); i++) {
                if (OBJECT_STOP_WORDS.contains(afterAction.get(i))) {
                    stop = i;
                    break;
                }
            }
            object = String.join(" ", afterAction.subList(0, stop != -1 ? stop : Math.min(4, afterAction.size())));
            if (object.isEmpty()) {
                object = null;
            }
        }

        List<String> qualifiers = new ArrayList<>();
        for (Pattern pattern : QUALIFIERS) {
            Matcher matcher = pattern.matcher(statement);
            if (matcher.find()) {
                qualifiers.add(matcher.group(1).trim());
            }
        }

        double confidence = 0.5;
        if (action != null) {
            confidence += 0.2;
        }
        if (subject != null || object != null) {
            confidence += 0.15;
        }
        if (!qualifiers.isEmpty()) {
            confidence += 0.1;
        }
        return new Clause(action, subject, object, List.copyOf(qualifiers), Math.min(1.0, confidence));
    }

    static GoalType classify(String statement) {
        String lower = statement.toLowerCase(Locale.ROOT);
        if (NON_FUNCTIONAL.stream().anyMatch(lower::contains)) {
            return GoalType.NON_FUNCTIONAL;
        }
        if (CONSTRAINT.stream().anyMatch(lower::contains)) {
            return GoalType.CONSTRAINT;
        }
        if (ASSUMPTION.stream().anyMatch(lower::contains)) {
            return GoalType.ASSUMPTION;
        }
        return GoalType.FUNCTIONAL;
    }

    static String normalizeStatement(String statement) {
        return statement.trim()
                .replaceAll("\\s+", " ")
                .replaceFirst("(?i)^(the|a|an)\\s+", "")
                .replaceFirst("[.;,]$", "");
    }
}

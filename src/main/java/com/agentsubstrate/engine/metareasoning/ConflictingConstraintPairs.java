package com.agentsubstrate.engine.metareasoning;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Constraint pairs that cannot both be honoured for the same decision type.
 */
public class ConflictingConstraintPairs {

    public record Pair(String first, String second) {

        boolean splitAcross(Set<String> a, Set<String> b) {
            return (a.contains(first) && b.contains(second)) || (a.contains(second) && b.contains(first));
        }

        @Override
        public String toString() {
            return first + " vs " + second;
        }
    }

    private static final ConflictingConstraintPairs DEFAULTS = new ConflictingConstraintPairs(List.of(
            new Pair("strict_validation", "relaxed_validation"),
            new Pair("high_precision", "high_recall"),
            new Pair("fast_execution", "thorough_analysis")
    ));

    private final List<Pair> pairs;

    public ConflictingConstraintPairs(List<Pair> pairs) {
        this.pairs = List.copyOf(pairs);
    }

    public static ConflictingConstraintPairs defaults() {
        return DEFAULTS;
    }

    public List<Pair> pairs() {
        return pairs;
    }

    /**
     * @return the pairs with one member in each set, rendered as {@code "a vs b"}
     */
    public List<String> conflicts(Collection<String> first, Collection<String> second) {
        Set<String> a = Set.copyOf(first);
        Set<String> b = Set.copyOf(second);
        List<String> conflicts = new ArrayList<>();
        for (Pair pair : pairs) {
            if (pair.splitAcross(a, b)) {
                conflicts.add(pair.toString());
            }
        }
        return conflicts;
    }
}

package com.agentsubstrate.engine.reflection;

import com.agentsubstrate.core.contract.DecisionEvent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Relates decision events by temporal adjacency across agents and by confidence similarity
 * within a decision type.
 */
class CorrelationFinder {

    static final Duration ADJACENCY_WINDOW = Duration.ofSeconds(60);
    static final double SIMILAR_VARIANCE = 0.05;
    static final int MAX_CORRELATIONS = 10;

    List<Correlation> find(List<DecisionEvent> events) {
        List<Correlation> correlations = new ArrayList<>();
        if (events.size() < 2) {
            return correlations;
        }

        List<DecisionEvent> byTime = events.stream().sorted(Comparator.comparing(DecisionEvent::timestamp)).toList();
        long windowMs = ADJACENCY_WINDOW.toMillis();
        for (int i = 0; i < byTime.size() - 1; i++) {
            DecisionEvent current = byTime.get(i);
            DecisionEvent next = byTime.get(i + 1);
            long gapMs = Duration.between(current.timestamp(), next.timestamp()).toMillis();
            if (gapMs < windowMs && !current.agentId().equals(next.agentId())) {
                correlations.add(new Correlation(nextId(correlations), CorrelationType.TEMPORAL,
                        List.of(current.executionRef(), next.executionRef()),
                        "Sequential decisions by different agents within %ds".formatted(Math.round(gapMs / 1000.0)),
                        Math.min(1, 1 - gapMs / (double) windowMs)));
            }
        }

        Map<String, List<DecisionEvent>> byType = new LinkedHashMap<>();
        for (DecisionEvent event : events) {
            byType.computeIfAbsent(event.decisionType(), k -> new ArrayList<>()).add(event);
        }
        byType.forEach((decisionType, sameType) -> {
            if (sameType.size() < 2) {
                return;
            }
            double mean = sameType.stream().mapToDouble(DecisionEvent::confidence).average().orElse(0);
            double variance = sameType.stream().mapToDouble(e -> Math.pow(e.confidence() - mean, 2)).sum() / sameType.size();
            if (variance < SIMILAR_VARIANCE) {
                correlations.add(new Correlation(nextId(correlations), CorrelationType.SIMILARITY,
                        sameType.stream().map(DecisionEvent::executionRef).toList(),
                        "%d %s decisions with consistent confidence patterns".formatted(sameType.size(), decisionType),
                        1 - Math.sqrt(variance)));
            }
        });

        return correlations.size() > MAX_CORRELATIONS
                ? List.copyOf(correlations.subList(0, MAX_CORRELATIONS)) : correlations;
    }

    private static String nextId(List<Correlation> correlations) {
        return "corr-" + (correlations.size() + 1);
    }
}

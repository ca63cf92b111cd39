package com.agentsubstrate.core.agent;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Assertions the runtime applies to every agent output before a decision event is built.
 * Agents analyse; they never assign, allocate or schedule work.
 */
public final class InvocationPostconditions {

    public static final Set<String> FORBIDDEN_OUTPUT_FIELDS =
            Set.of("assigned_agent", "resource_allocation", "scheduled_at");

    private InvocationPostconditions() {}

    public static void checkOutputs(JsonNode outputs) {
        if (outputs == null || outputs.isNull()) {
            throw new PostconditionViolationException("Agent produced no output");
        }
        findForbidden(outputs, "$");
    }

    public static double checkConfidence(double confidence) {
        if (!Double.isFinite(confidence)) {
            throw new PostconditionViolationException("Agent produced a non-finite confidence: " + confidence);
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    private static void findForbidden(JsonNode node, String path) {
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                var field = fields.next();
                if (FORBIDDEN_OUTPUT_FIELDS.contains(field.getKey())) {
                    throw new PostconditionViolationException(
                            "Agent output contains forbidden field '%s' at %s".formatted(field.getKey(), path));
                }
                findForbidden(field.getValue(), path + "." + field.getKey());
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                findForbidden(node.get(i), path + "[" + i + "]");
            }
        }
    }
}

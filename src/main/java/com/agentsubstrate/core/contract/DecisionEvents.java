package com.agentsubstrate.core.contract;

import com.agentsubstrate.core.json.AgentJson;
import com.agentsubstrate.core.validation.SchemaValidator;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;

/**
 * Factory and hashing rules for {@link DecisionEvent}.
 */
public final class DecisionEvents {

    public static final String SEMVER_PATTERN = "^\\d+\\.\\d+\\.\\d+$";
    public static final String UUID_PATTERN =
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$";

    private DecisionEvents() {}

    /**
     * Hashes the canonical JSON form of {@code raw} with SHA-256.
     * Object keys are sorted at every depth, so inputs that differ only in key order hash identically.
     *
     * @param raw a {@link com.fasterxml.jackson.databind.JsonNode}, map, record or scalar
     * @return 64 lower-case hex characters
     */
    public static String hashInputs(Object raw) {
        String canonical = AgentJson.canonicalString(raw);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Builds and validates a decision event stamped with the current time.
     *
     * @throws com.agentsubstrate.core.validation.ValidationFailedException if the version is not semver,
     *         the confidence is outside [0, 1] or the execution ref is not a UUID
     */
    public static DecisionEvent create(String agentId,
                                       String agentVersion,
                                       String decisionType,
                                       Object inputs,
                                       Object outputs,
                                       double confidence,
                                       List<String> constraints,
                                       String executionRef) {
        var event = new DecisionEvent(
                agentId,
                agentVersion,
                decisionType,
                hashInputs(inputs),
                AgentJson.toTree(outputs),
                confidence,
                constraints,
                executionRef,
                Instant.now()
        );
        return SchemaValidator.shared().validate(event);
    }
}

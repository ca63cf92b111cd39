package com.agentsubstrate.core.agent;

import com.agentsubstrate.core.contract.ErrorCode;
import com.agentsubstrate.core.persistence.PersistenceException;
import com.agentsubstrate.core.validation.ValidationFailedException;

import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps a caught throwable to the error code reported in an {@link com.agentsubstrate.core.contract.AgentResult}.
 */
public final class ErrorClassifier {

    private ErrorClassifier() {}

    public static ErrorCode classify(Throwable error) {
        if (error == null) {
            return ErrorCode.AGENT_UNKNOWN_ERROR;
        }
        if (error instanceof ValidationFailedException) {
            return ErrorCode.AGENT_VALIDATION_FAILED;
        }
        if (error instanceof TimeoutException || error instanceof HttpTimeoutException) {
            return ErrorCode.AGENT_TIMEOUT;
        }
        if (error instanceof PersistenceException || mentionsPersistence(error.getMessage())) {
            return ErrorCode.AGENT_PERSISTENCE_ERROR;
        }
        if (error instanceof Exception) {
            return ErrorCode.AGENT_PROCESSING_ERROR;
        }
        return ErrorCode.AGENT_UNKNOWN_ERROR;
    }

    private static boolean mentionsPersistence(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("persistence") || lower.contains("ruvector") || lower.contains("ledger");
    }
}

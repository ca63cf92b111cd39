package com.agentsubstrate.engine.clarification;

import com.agentsubstrate.engine.Severity;
import jakarta.validation.constraints.NotNull;

/**
 * A question for the requester. Exactly one of the related ids is set.
 */
public record ClarificationQuestion(
        @NotNull String question,
        @NotNull Severity priority,
        String relatedAmbiguityId,
        String relatedConstraintId
) {

    static ClarificationQuestion of(Ambiguity ambiguity) {
        return new ClarificationQuestion(ambiguity.clarificationPrompt(), ambiguity.severity(), ambiguity.id(), null);
    }

    static ClarificationQuestion of(MissingConstraint constraint) {
        return new ClarificationQuestion(constraint.clarificationPrompt(), constraint.severity(), null, constraint.id());
    }
}

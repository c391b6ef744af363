package com.z254.lumina.tutor.domain.payload;

import com.z254.lumina.tutor.domain.model.AgentType;
import com.z254.lumina.tutor.domain.model.ErrorCode;

/**
 * Typed failure sent back to a requester and reported to the orchestrator.
 *
 * @param failedMessageId id of the message whose handling failed
 */
public record AgentErrorPayload(AgentType agentType, ErrorCode code, String message, boolean retryable,
                                String failedMessageId) implements AgentPayload {

    @Override
    public Operation operation() {
        return Operation.AGENT_ERROR;
    }
}

package com.z254.lumina.tutor.domain.payload;

import com.z254.lumina.tutor.domain.model.ConversationContext;

/**
 * Asks the conversation agent to normalise a raw student query.
 */
public record ProcessQueryRequest(String query, ConversationContext context) implements AgentPayload {

    @Override
    public Operation operation() {
        return Operation.PROCESS_QUERY;
    }
}

package com.z254.lumina.tutor.domain.payload;

import com.z254.lumina.tutor.domain.model.AgentType;
import com.z254.lumina.tutor.domain.model.ConversationContext;

import java.util.Map;

public record ComposeReplyRequest(String query, ProcessedQuery processedQuery, ConversationContext context,
                                  Map<AgentType, AgentContribution> previousResults) implements StageRequest {

    public ComposeReplyRequest {
        previousResults = Map.copyOf(previousResults);
    }

    @Override
    public Operation operation() {
        return Operation.COMPOSE_REPLY;
    }
}

package com.z254.lumina.tutor.domain.payload;

import com.z254.lumina.tutor.domain.model.AgentType;
import com.z254.lumina.tutor.domain.model.ConversationContext;

import java.util.List;
import java.util.Map;

public record FindResourcesRequest(String query, ProcessedQuery processedQuery, ConversationContext context,
                                   Map<AgentType, AgentContribution> previousResults,
                                   List<String> topics, List<String> resourceTypes) implements StageRequest {

    public FindResourcesRequest {
        previousResults = Map.copyOf(previousResults);
        topics = List.copyOf(topics);
        resourceTypes = List.copyOf(resourceTypes);
    }

    @Override
    public Operation operation() {
        return Operation.FIND_RESOURCES;
    }
}

package com.z254.lumina.tutor.domain.payload;

import com.z254.lumina.tutor.domain.model.AgentType;
import com.z254.lumina.tutor.domain.model.ConversationContext;
import com.z254.lumina.tutor.domain.model.DifficultyLevel;

import java.util.List;
import java.util.Map;

public record ExplainConceptRequest(String query, ProcessedQuery processedQuery, ConversationContext context,
                                    Map<AgentType, AgentContribution> previousResults,
                                    List<String> concepts, DifficultyLevel difficulty) implements StageRequest {

    public ExplainConceptRequest {
        previousResults = Map.copyOf(previousResults);
        concepts = List.copyOf(concepts);
    }

    @Override
    public Operation operation() {
        return Operation.EXPLAIN_CONCEPT;
    }
}

package com.z254.lumina.tutor.domain.payload;

import com.z254.lumina.tutor.domain.model.AgentType;
import com.z254.lumina.tutor.domain.model.ConversationContext;
import com.z254.lumina.tutor.domain.model.Modality;

import java.util.List;
import java.util.Map;

/**
 * @param preferredModality modality the student asked for, or {@code null}
 * @param detailLevel       low, medium or high
 */
public record CreateVisualizationRequest(String query, ProcessedQuery processedQuery, ConversationContext context,
                                         Map<AgentType, AgentContribution> previousResults,
                                         List<String> concepts, Modality preferredModality,
                                         String detailLevel) implements StageRequest {

    public CreateVisualizationRequest {
        previousResults = Map.copyOf(previousResults);
        concepts = List.copyOf(concepts);
    }

    @Override
    public Operation operation() {
        return Operation.CREATE_VISUALIZATION;
    }
}

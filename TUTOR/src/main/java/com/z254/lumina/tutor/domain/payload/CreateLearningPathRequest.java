package com.z254.lumina.tutor.domain.payload;

import com.z254.lumina.tutor.domain.model.AgentType;
import com.z254.lumina.tutor.domain.model.ConversationContext;

import java.util.List;
import java.util.Map;

public record CreateLearningPathRequest(String query, ProcessedQuery processedQuery, ConversationContext context,
                                        Map<AgentType, AgentContribution> previousResults,
                                        List<String> learningGoals) implements StageRequest {

    public CreateLearningPathRequest {
        previousResults = Map.copyOf(previousResults);
        learningGoals = List.copyOf(learningGoals);
    }

    @Override
    public Operation operation() {
        return Operation.CREATE_LEARNING_PATH;
    }
}

package com.z254.lumina.tutor.domain.payload;

import com.z254.lumina.tutor.domain.model.AgentType;
import com.z254.lumina.tutor.domain.model.ConversationContext;

import java.util.List;
import java.util.Map;

/**
 * @param difficulty   1 (easiest) to 5
 * @param questionType preferred question format, or {@code null}
 */
public record GenerateQuestionRequest(String query, ProcessedQuery processedQuery, ConversationContext context,
                                      Map<AgentType, AgentContribution> previousResults,
                                      List<String> concepts, int difficulty,
                                      String questionType) implements StageRequest {

    public GenerateQuestionRequest {
        previousResults = Map.copyOf(previousResults);
        concepts = List.copyOf(concepts);
    }

    @Override
    public Operation operation() {
        return Operation.GENERATE_QUESTION;
    }
}

package com.z254.lumina.tutor.domain.payload;

import com.z254.lumina.tutor.domain.model.ConversationContext;
import com.z254.lumina.tutor.domain.model.Modality;
import lombok.Builder;

import java.util.List;

/**
 * Normalised student query produced by the conversation agent. The {@code needs*} flags come
 * from query analysis, the {@code requests*} flags from explicit wording.
 */
@Builder(toBuilder = true)
public record ProcessedQuery(
        String originalQuery,
        String intent,
        List<String> concepts,
        boolean needsExplanation,
        boolean needsVisualization,
        boolean needsAssessment,
        boolean needsLearningPath,
        boolean needsResources,
        boolean requestsVisualContent,
        boolean requestsPractice,
        boolean requestsStudyPlan,
        boolean requestsAdditionalMaterials,
        boolean requestsAssessment,
        boolean requestsResources,
        boolean requestsEncouragement,
        boolean requestsFeedback,
        Modality preferredModality,
        Integer requestedDifficulty,
        List<String> learningGoals,
        ConversationContext context) implements AgentPayload {

    public ProcessedQuery {
        concepts = concepts != null ? List.copyOf(concepts) : List.of();
        learningGoals = learningGoals != null ? List.copyOf(learningGoals) : List.of();
    }

    @Override
    public Operation operation() {
        return Operation.QUERY_ANALYSIS;
    }
}

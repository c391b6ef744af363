package com.z254.lumina.tutor.orchestration;

import com.z254.lumina.tutor.domain.model.AgentType;
import com.z254.lumina.tutor.domain.model.ConversationContext;
import com.z254.lumina.tutor.domain.model.DifficultyLevel;
import com.z254.lumina.tutor.domain.model.ExecutionPlan;
import com.z254.lumina.tutor.domain.payload.AgentContribution;
import com.z254.lumina.tutor.domain.payload.AgentPayload;
import com.z254.lumina.tutor.domain.payload.ComposeReplyRequest;
import com.z254.lumina.tutor.domain.payload.CreateLearningPathRequest;
import com.z254.lumina.tutor.domain.payload.CreateVisualizationRequest;
import com.z254.lumina.tutor.domain.payload.ExplainConceptRequest;
import com.z254.lumina.tutor.domain.payload.FindResourcesRequest;
import com.z254.lumina.tutor.domain.payload.GenerateQuestionRequest;
import com.z254.lumina.tutor.domain.payload.ProcessedQuery;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a processed query into an execution plan and builds the request for each planned agent.
 */
@Component
public class QueryPlanner {

    static final int DEFAULT_QUESTION_DIFFICULTY = 3;
    static final String DEFAULT_DETAIL_LEVEL = "medium";

    /**
     * Rule table from query flags to agents. CONVERSATION is always required.
     */
    public Set<AgentType> requiredAgents(ProcessedQuery query) {
        Set<AgentType> required = EnumSet.of(AgentType.CONVERSATION);
        if (query.needsExplanation() || !query.concepts().isEmpty()) {
            required.add(AgentType.CONTENT_SPECIALIST);
        }
        if (query.needsVisualization() || query.requestsVisualContent()) {
            required.add(AgentType.VISUAL_LEARNING);
        }
        if (query.needsAssessment() || query.requestsPractice()) {
            required.add(AgentType.ASSESSMENT);
        }
        if (query.needsLearningPath() || query.requestsStudyPlan()) {
            required.add(AgentType.PEDAGOGY);
        }
        if (query.needsResources() || query.requestsAdditionalMaterials()) {
            required.add(AgentType.RESOURCE);
        }
        return required;
    }

    public ExecutionPlan plan(String requestId, ProcessedQuery query) {
        return ExecutionPlan.forAgents(requestId, requiredAgents(query));
    }

    /**
     * Stage request for {@code agentType}, carrying what earlier stages produced.
     */
    public AgentPayload payloadFor(AgentType agentType, String text, ProcessedQuery query,
                                   ConversationContext context, Map<AgentType, AgentContribution> previous) {
        List<String> concepts = query.concepts();
        return switch (agentType) {
            case CONVERSATION -> new ComposeReplyRequest(text, query, context, previous);
            case CONTENT_SPECIALIST -> new ExplainConceptRequest(text, query, context, previous, concepts,
                    context != null ? context.getStudentLevelOrDefault() : DifficultyLevel.INTERMEDIATE);
            case VISUAL_LEARNING -> new CreateVisualizationRequest(text, query, context, previous, concepts,
                    query.preferredModality(), detailLevel(context));
            case ASSESSMENT -> new GenerateQuestionRequest(text, query, context, previous, concepts,
                    query.requestedDifficulty() != null ? query.requestedDifficulty() : DEFAULT_QUESTION_DIFFICULTY,
                    null);
            case PEDAGOGY -> new CreateLearningPathRequest(text, query, context, previous, query.learningGoals());
            case RESOURCE -> new FindResourcesRequest(text, query, context, previous, concepts, List.of());
            case ORCHESTRATOR -> throw new IllegalArgumentException("The orchestrator is never planned");
        };
    }

    private static String detailLevel(ConversationContext context) {
        if (context != null && context.getPreferences() != null
                && context.getPreferences().get("detailLevel") instanceof String level) {
            return level;
        }
        return DEFAULT_DETAIL_LEVEL;
    }
}

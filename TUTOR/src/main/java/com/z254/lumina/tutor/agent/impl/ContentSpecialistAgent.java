package com.z254.lumina.tutor.agent.impl;

import com.z254.lumina.tutor.agent.Agent;
import com.z254.lumina.tutor.agent.AgentException;
import com.z254.lumina.tutor.client.McpServiceLayer;
import com.z254.lumina.tutor.config.TutorProperties;
import com.z254.lumina.tutor.domain.model.AgentCapabilities;
import com.z254.lumina.tutor.domain.model.AgentMessage;
import com.z254.lumina.tutor.domain.model.AgentType;
import com.z254.lumina.tutor.domain.model.DifficultyLevel;
import com.z254.lumina.tutor.domain.model.ErrorCode;
import com.z254.lumina.tutor.domain.payload.AgentContribution;
import com.z254.lumina.tutor.domain.payload.ExplainConceptRequest;
import com.z254.lumina.tutor.domain.payload.Operation;
import com.z254.lumina.tutor.observability.TutorEventPublisher;
import com.z254.lumina.tutor.orchestration.MessageBus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Subject-matter expert. Explains concepts at the student's level and places them in the
 * curriculum via the {@link ConceptGraph}.
 */
@Component
@Slf4j
public class ContentSpecialistAgent extends Agent {

    private static final double DEFAULT_CONFIDENCE = 0.8;

    private final ConceptGraph conceptGraph;

    public ContentSpecialistAgent(MessageBus messageBus, McpServiceLayer mcpService, TutorEventPublisher events,
                                  TutorProperties properties, ConceptGraph conceptGraph) {
        super(AgentType.CONTENT_SPECIALIST, configFrom(properties, McpServiceLayer.TOOL_AI_CLAUDE), messageBus,
                mcpService, events, properties.getAgent().getLatencyWindow());
        this.conceptGraph = conceptGraph;
    }

    @Override
    public AgentCapabilities getCapabilities() {
        return new AgentCapabilities(Set.of(Operation.EXPLAIN_CONCEPT), conceptGraph.getConcepts(),
                Set.of("text", "structured-explanation"));
    }

    @Override
    public Mono<AgentMessage> processMessage(AgentMessage message) {
        if (!(message.getPayload() instanceof ExplainConceptRequest request)) {
            return Mono.error(new AgentException(ErrorCode.UNSUPPORTED_OPERATION, agentType, message.getId(),
                    "Unexpected payload " + message.getPayload().operation()));
        }
        return explain(request).map(contribution -> respond(message, contribution));
    }

    @Override
    protected Mono<Boolean> performHealthCheck() {
        return Mono.just(!conceptGraph.getConcepts().isEmpty());
    }

    private Mono<AgentContribution> explain(ExplainConceptRequest request) {
        List<String> concepts = request.concepts().isEmpty() ? List.of(request.query()) : request.concepts();
        String concept = concepts.get(0);
        DifficultyLevel difficulty = request.difficulty() != null ? request.difficulty() : DifficultyLevel.INTERMEDIATE;

        Set<String> prerequisites = new LinkedHashSet<>();
        Set<String> nextConcepts = new LinkedHashSet<>();
        for (String c : concepts) {
            prerequisites.addAll(conceptGraph.getPrerequisites(c));
            nextConcepts.addAll(conceptGraph.getNextConcepts(c));
        }
        prerequisites.removeAll(concepts);
        nextConcepts.removeAll(concepts);

        String prompt = buildPrompt(request.query(), concepts, difficulty, prerequisites);
        String conversationId = request.context() != null ? request.context().getSessionId() : null;

        return mcpService.queryAI(McpServiceLayer.AiProvider.CLAUDE, prompt,
                        Map.of("concept", concept, "difficulty", difficulty.getValue()), conversationId, agentType)
                .flatMap(answer -> mcpService.trackEvent("concept_explained", Map.of(
                                "concept", concept,
                                "difficulty", difficulty.getValue(),
                                "hasPrerequisites", !prerequisites.isEmpty()))
                        .thenReturn(AgentContribution.builder()
                                .agentType(agentType)
                                .text(answer.response())
                                .confidence(answer.confidence() != null ? answer.confidence() : DEFAULT_CONFIDENCE)
                                .prerequisites(List.copyOf(prerequisites))
                                .relatedTopics(List.copyOf(nextConcepts))
                                .sources(List.of("chemistry_knowledge_base", "ai_explanation"))
                                .build()));
    }

    private String buildPrompt(String query, List<String> concepts, DifficultyLevel difficulty,
                               Set<String> prerequisites) {
        StringBuilder prompt = new StringBuilder()
                .append("Explain ").append(String.join(", ", concepts))
                .append(" in organic chemistry for a ").append(difficulty.getValue()).append(" student.\n")
                .append("Student question: ").append(query).append('\n');
        if (!prerequisites.isEmpty()) {
            prompt.append("Assume familiarity with: ").append(String.join(", ", prerequisites)).append('\n');
        }
        prompt.append("Cover the mechanism step by step and mention common misconceptions.");
        return prompt.toString();
    }
}

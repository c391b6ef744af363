package com.z254.lumina.tutor.agent.impl;

import com.z254.lumina.tutor.adaptive.AdaptiveEngine;
import com.z254.lumina.tutor.agent.Agent;
import com.z254.lumina.tutor.agent.AgentException;
import com.z254.lumina.tutor.client.McpServiceLayer;
import com.z254.lumina.tutor.config.TutorProperties;
import com.z254.lumina.tutor.domain.model.AgentCapabilities;
import com.z254.lumina.tutor.domain.model.AgentMessage;
import com.z254.lumina.tutor.domain.model.AgentType;
import com.z254.lumina.tutor.domain.model.ConceptAnalysis;
import com.z254.lumina.tutor.domain.model.ConversationContext;
import com.z254.lumina.tutor.domain.model.DifficultyLevel;
import com.z254.lumina.tutor.domain.model.ErrorCode;
import com.z254.lumina.tutor.domain.model.GeneratedContent;
import com.z254.lumina.tutor.domain.model.LearningQuery;
import com.z254.lumina.tutor.domain.model.Modality;
import com.z254.lumina.tutor.domain.payload.AgentContribution;
import com.z254.lumina.tutor.domain.payload.CreateVisualizationRequest;
import com.z254.lumina.tutor.domain.payload.Operation;
import com.z254.lumina.tutor.observability.TutorEventPublisher;
import com.z254.lumina.tutor.orchestration.MessageBus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Produces visual content through the {@link AdaptiveEngine}, which picks the modality for the
 * learner and falls back when a generator fails.
 */
@Component
@Slf4j
public class VisualLearningAgent extends Agent {

    private static final Set<Modality> INTERACTIVE_MODALITIES =
            EnumSet.of(Modality.SIMULATION, Modality.INTERACTIVE, Modality.THREE_D);

    private final AdaptiveEngine adaptiveEngine;

    public VisualLearningAgent(MessageBus messageBus, McpServiceLayer mcpService, TutorEventPublisher events,
                               TutorProperties properties, AdaptiveEngine adaptiveEngine) {
        super(AgentType.VISUAL_LEARNING, configFrom(properties), messageBus, mcpService, events,
                properties.getAgent().getLatencyWindow());
        this.adaptiveEngine = adaptiveEngine;
    }

    @Override
    public AgentCapabilities getCapabilities() {
        return new AgentCapabilities(Set.of(Operation.CREATE_VISUALIZATION), Set.of(),
                Arrays.stream(Modality.values()).map(Modality::getValue).collect(Collectors.toSet()));
    }

    @Override
    public Mono<AgentMessage> processMessage(AgentMessage message) {
        if (!(message.getPayload() instanceof CreateVisualizationRequest request)) {
            return Mono.error(new AgentException(ErrorCode.UNSUPPORTED_OPERATION, agentType, message.getId(),
                    "Unexpected payload " + message.getPayload().operation()));
        }
        return visualize(request).map(contribution -> respond(message, contribution));
    }

    private Mono<AgentContribution> visualize(CreateVisualizationRequest request) {
        ConversationContext context = request.context();
        String userId = context != null ? context.getUserId() : null;
        ConceptAnalysis analysis = analyse(request);

        return adaptiveEngine.generateAdaptiveContent(LearningQuery.of(request.query(), userId), analysis, userId)
                .map(content -> {
                    if (userId != null) {
                        adaptiveEngine.startAdaptiveSession(userId, content.getId());
                    }
                    return AgentContribution.builder()
                            .agentType(agentType)
                            .text(content.getMetadata().getDescription())
                            .confidence(0.75)
                            .visualizations(List.of(describe(content)))
                            .interactiveElements(INTERACTIVE_MODALITIES.contains(content.getModality())
                                    ? List.of(Map.of("type", content.getModality().getValue(),
                                            "contentId", content.getId()))
                                    : List.of())
                            .sources(List.of("adaptive_engine"))
                            .build();
                });
    }

    private ConceptAnalysis analyse(CreateVisualizationRequest request) {
        String topic = request.concepts().isEmpty() ? request.query() : String.join(" ", request.concepts());
        DifficultyLevel level = request.context() != null
                ? request.context().getStudentLevelOrDefault()
                : DifficultyLevel.INTERMEDIATE;
        if ("high".equals(request.detailLevel())) {
            level = level.harder();
        } else if ("low".equals(request.detailLevel())) {
            level = level.easier();
        }

        AgentContribution content = request.previousResults().get(AgentType.CONTENT_SPECIALIST);
        return ConceptAnalysis.builder()
                .topic(topic)
                .complexity(level)
                .keywords(request.concepts())
                .suggestedModality(request.preferredModality())
                .prerequisites(content != null ? content.prerequisites() : List.of())
                .build();
    }

    private static Map<String, Object> describe(GeneratedContent content) {
        Map<String, Object> visualization = new LinkedHashMap<>();
        visualization.put("id", content.getId());
        visualization.put("modality", content.getModality().getValue());
        visualization.put("title", content.getMetadata().getTitle());
        visualization.put("estimatedDurationSeconds", content.getMetadata().getEstimatedDurationSeconds());
        visualization.put("data", content.getData());
        return visualization;
    }
}

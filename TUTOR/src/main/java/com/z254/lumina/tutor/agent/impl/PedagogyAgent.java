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
import com.z254.lumina.tutor.domain.payload.CreateLearningPathRequest;
import com.z254.lumina.tutor.domain.payload.Operation;
import com.z254.lumina.tutor.observability.TutorEventPublisher;
import com.z254.lumina.tutor.orchestration.MessageBus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Plans what to study next. Runs last so it can build on everything the other agents produced.
 */
@Component
@Slf4j
public class PedagogyAgent extends Agent {

    private final ConceptGraph conceptGraph;

    public PedagogyAgent(MessageBus messageBus, McpServiceLayer mcpService, TutorEventPublisher events,
                         TutorProperties properties, ConceptGraph conceptGraph) {
        super(AgentType.PEDAGOGY, configFrom(properties, McpServiceLayer.TOOL_ANALYTICS), messageBus,
                mcpService, events, properties.getAgent().getLatencyWindow());
        this.conceptGraph = conceptGraph;
    }

    @Override
    public AgentCapabilities getCapabilities() {
        return AgentCapabilities.of(Set.of(Operation.CREATE_LEARNING_PATH));
    }

    @Override
    public Mono<AgentMessage> processMessage(AgentMessage message) {
        if (!(message.getPayload() instanceof CreateLearningPathRequest request)) {
            return Mono.error(new AgentException(ErrorCode.UNSUPPORTED_OPERATION, agentType, message.getId(),
                    "Unexpected payload " + message.getPayload().operation()));
        }
        AgentContribution contribution = plan(request);
        String userId = request.context() != null ? request.context().getUserId() : null;
        Map<String, Object> analytics = userId != null
                ? Map.of("userId", userId, "steps", contribution.nextSteps().size())
                : Map.of("steps", contribution.nextSteps().size());
        return mcpService.trackEvent("learning_path_created", analytics)
                .thenReturn(respond(message, contribution));
    }

    AgentContribution plan(CreateLearningPathRequest request) {
        List<String> targets = new ArrayList<>(request.learningGoals());
        if (request.processedQuery() != null) {
            targets.addAll(request.processedQuery().concepts());
        }
        if (targets.isEmpty()) {
            targets.add(request.query());
        }

        DifficultyLevel level = request.context() != null
                ? request.context().getStudentLevelOrDefault()
                : DifficultyLevel.INTERMEDIATE;
        Set<String> known = level == DifficultyLevel.BEGINNER
                ? Set.of()
                : foundations(level == DifficultyLevel.ADVANCED ? 3 : 1);

        List<String> order = conceptGraph.studyOrder(targets, known);
        double pace = switch (level) {
            case BEGINNER -> 1.5;
            case INTERMEDIATE -> 1.0;
            case ADVANCED -> 0.75;
        };

        List<String> steps = new ArrayList<>();
        int totalMinutes = 0;
        for (String concept : order) {
            int minutes = (int) Math.round(conceptGraph.getEstimatedMinutes(concept) * pace);
            totalMinutes += minutes;
            steps.add("Study " + concept + " (~" + minutes + " min)");
        }
        Set<String> after = new LinkedHashSet<>();
        targets.forEach(target -> after.addAll(conceptGraph.getNextConcepts(target)));
        after.removeAll(order);
        after.forEach(next -> steps.add("Then move on to " + next));

        if (request.previousResults().containsKey(AgentType.ASSESSMENT)) {
            steps.add(Math.min(steps.size(), order.size()), "Work through the practice questions");
        }

        return AgentContribution.builder()
                .agentType(agentType)
                .text("Suggested path: " + String.join(" → ", order) + " (about " + totalMinutes + " minutes).")
                .confidence(0.85)
                .nextSteps(steps)
                .relatedTopics(List.copyOf(after))
                .sources(List.of("curriculum_graph"))
                .build();
    }

    private Set<String> foundations(int maxDifficulty) {
        Set<String> known = new LinkedHashSet<>();
        for (String concept : conceptGraph.getConcepts()) {
            if (conceptGraph.getDifficulty(concept) <= maxDifficulty) {
                known.add(concept);
            }
        }
        return known;
    }
}

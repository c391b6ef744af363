package com.z254.lumina.tutor.agent.impl;

import com.z254.lumina.tutor.agent.Agent;
import com.z254.lumina.tutor.agent.AgentException;
import com.z254.lumina.tutor.client.McpServiceLayer;
import com.z254.lumina.tutor.config.TutorProperties;
import com.z254.lumina.tutor.domain.model.AgentCapabilities;
import com.z254.lumina.tutor.domain.model.AgentMessage;
import com.z254.lumina.tutor.domain.model.AgentType;
import com.z254.lumina.tutor.domain.model.ConversationContext;
import com.z254.lumina.tutor.domain.model.ErrorCode;
import com.z254.lumina.tutor.domain.model.Modality;
import com.z254.lumina.tutor.domain.payload.AgentContribution;
import com.z254.lumina.tutor.domain.payload.ComposeReplyRequest;
import com.z254.lumina.tutor.domain.payload.Operation;
import com.z254.lumina.tutor.domain.payload.ProcessQueryRequest;
import com.z254.lumina.tutor.domain.payload.ProcessedQuery;
import com.z254.lumina.tutor.observability.TutorEventPublisher;
import com.z254.lumina.tutor.orchestration.MessageBus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Front door of every query. Normalises the student's wording into a {@link ProcessedQuery} and
 * writes the conversational part of the reply.
 */
@Component
@Slf4j
public class ConversationAgent extends Agent {

    private static final Pattern WORD_SPLIT = Pattern.compile("[^a-z0-9]+");

    private static final List<String> EXPLANATION_CUES = List.of("how", "why", "what", "explain", "describe", "mean");
    private static final List<String> VISUAL_CUES = List.of("show", "visualize", "visualise", "diagram", "draw",
            "picture", "animation", "animate", "3d", "model", "simulation");
    private static final List<String> PRACTICE_CUES = List.of("quiz", "practice", "test me", "exercise", "questions");
    private static final List<String> ASSESSMENT_CUES = List.of("quiz me", "test me", "assess");
    private static final List<String> STUDY_PLAN_CUES = List.of("study plan", "learning path", "roadmap",
            "where should i start", "what should i learn");
    private static final List<String> RESOURCE_CUES = List.of("resource", "video", "reading", "material",
            "reference", "book");
    private static final List<String> ENCOURAGEMENT_CUES = List.of("struggling", "frustrated", "give up",
            "too hard", "confused", "lost");
    private static final List<String> FEEDBACK_CUES = List.of("is this right", "is this correct", "check my",
            "did i get", "am i right");

    private final ConceptGraph conceptGraph;

    public ConversationAgent(MessageBus messageBus, McpServiceLayer mcpService, TutorEventPublisher events,
                             TutorProperties properties, ConceptGraph conceptGraph) {
        super(AgentType.CONVERSATION, configFrom(properties, McpServiceLayer.TOOL_AI_CLAUDE), messageBus,
                mcpService, events, properties.getAgent().getLatencyWindow());
        this.conceptGraph = conceptGraph;
    }

    @Override
    public AgentCapabilities getCapabilities() {
        return new AgentCapabilities(Set.of(Operation.PROCESS_QUERY, Operation.COMPOSE_REPLY),
                Set.of(), Set.of("text"));
    }

    @Override
    public Mono<AgentMessage> processMessage(AgentMessage message) {
        if (message.getPayload() instanceof ProcessQueryRequest request) {
            return Mono.fromCallable(() -> respond(message, analyse(request.query(), request.context())));
        }
        if (message.getPayload() instanceof ComposeReplyRequest request) {
            return composeReply(request).map(contribution -> respond(message, contribution));
        }
        return Mono.error(new AgentException(ErrorCode.UNSUPPORTED_OPERATION, agentType, message.getId(),
                "Unexpected payload " + message.getPayload().operation()));
    }

    /**
     * Keyword analysis of the raw query.
     */
    ProcessedQuery analyse(String query, ConversationContext context) {
        if (query == null || query.isBlank()) {
            throw new AgentException(ErrorCode.INVALID_MESSAGE, agentType, null, "Query text is empty");
        }
        String text = query.toLowerCase(Locale.ROOT);
        List<String> concepts = extractConcepts(text, context);

        boolean visual = containsAny(text, VISUAL_CUES);
        boolean practice = containsAny(text, PRACTICE_CUES);
        boolean studyPlan = containsAny(text, STUDY_PLAN_CUES);
        boolean materials = containsAny(text, RESOURCE_CUES);
        boolean encouragement = containsAny(text, ENCOURAGEMENT_CUES);
        boolean feedback = containsAny(text, FEEDBACK_CUES);
        boolean explanation = startsWithAny(text, EXPLANATION_CUES) || text.contains("explain")
                || (!practice && !studyPlan && !materials && !feedback);

        ProcessedQuery processed = ProcessedQuery.builder()
                .originalQuery(query)
                .intent(intentOf(explanation, visual, practice, studyPlan, materials, encouragement, feedback))
                .concepts(concepts)
                .needsExplanation(explanation)
                .needsVisualization(visual)
                .needsAssessment(practice)
                .needsLearningPath(studyPlan)
                .needsResources(materials)
                .requestsVisualContent(visual)
                .requestsPractice(practice)
                .requestsStudyPlan(studyPlan)
                .requestsAdditionalMaterials(materials)
                .requestsAssessment(containsAny(text, ASSESSMENT_CUES))
                .requestsResources(text.contains("resources") || text.contains("videos"))
                .requestsEncouragement(encouragement)
                .requestsFeedback(feedback)
                .preferredModality(preferredModality(text, context))
                .requestedDifficulty(requestedDifficulty(text))
                .learningGoals(learningGoals(context))
                .context(context)
                .build();

        log.debug("Processed query intent={} concepts={}", processed.intent(), processed.concepts());
        return processed;
    }

    private Mono<AgentContribution> composeReply(ComposeReplyRequest request) {
        ConversationContext context = request.context();
        String level = context != null ? context.getStudentLevelOrDefault().getValue() : "intermediate";
        String prompt = "You are a friendly organic chemistry tutor talking to a " + level
                + " student. Reply conversationally to: " + request.query();
        String conversationId = context != null ? context.getSessionId() : null;

        return mcpService.queryAI(McpServiceLayer.AiProvider.CLAUDE, prompt,
                        Map.of("concepts", request.processedQuery().concepts()), conversationId, agentType)
                .map(answer -> AgentContribution.builder()
                        .agentType(agentType)
                        .text(answer.response())
                        .confidence(answer.confidence() != null ? answer.confidence() : 0.8)
                        .sources(List.of("ai_conversation"))
                        .build());
    }

    private List<String> extractConcepts(String text, ConversationContext context) {
        Set<String> words = new LinkedHashSet<>(List.of(WORD_SPLIT.split(text)));
        List<String> concepts = new ArrayList<>();
        for (String word : words) {
            if (conceptGraph.find(word).isPresent()) {
                concepts.add(word);
            }
        }
        for (String concept : conceptGraph.getConcepts()) {
            if (concept.contains(" ") && text.contains(concept)) {
                concepts.add(concept);
            }
        }
        if (concepts.isEmpty() && context != null && context.getCurrentTopic() != null) {
            concepts.add(context.getCurrentTopic());
        }
        return concepts;
    }

    private static String intentOf(boolean explanation, boolean visual, boolean practice, boolean studyPlan,
                                   boolean materials, boolean encouragement, boolean feedback) {
        if (feedback) {
            return "feedback";
        }
        if (practice) {
            return "practice";
        }
        if (studyPlan) {
            return "study_plan";
        }
        if (materials) {
            return "resources";
        }
        if (encouragement) {
            return "encouragement";
        }
        if (visual) {
            return "visualization";
        }
        return explanation ? "explanation" : "question";
    }

    private static Modality preferredModality(String text, ConversationContext context) {
        if (preference(context, "preferredModality") instanceof String value) {
            try {
                return Modality.fromValue(value);
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring unknown preferred modality '{}'", value);
            }
        }
        if (text.contains("3d")) {
            return Modality.THREE_D;
        }
        if (text.contains("simulat")) {
            return Modality.SIMULATION;
        }
        if (text.contains("concept map")) {
            return Modality.CONCEPT_MAP;
        }
        if (text.contains("animat")) {
            return Modality.ANIMATION;
        }
        if (text.contains("diagram")) {
            return Modality.DIAGRAM;
        }
        return null;
    }

    private static Integer requestedDifficulty(String text) {
        if (text.contains("harder") || text.contains("challenging") || text.contains("advanced")) {
            return 5;
        }
        if (text.contains("easy") || text.contains("simple") || text.contains("basic")) {
            return 1;
        }
        return null;
    }

    private static List<String> learningGoals(ConversationContext context) {
        if (!(preference(context, "learningGoals") instanceof List<?> goals)) {
            return List.of();
        }
        return goals.stream().map(String::valueOf).toList();
    }

    private static Object preference(ConversationContext context, String key) {
        if (context == null || context.getPreferences() == null) {
            return null;
        }
        return context.getPreferences().get(key);
    }

    private static boolean containsAny(String text, List<String> cues) {
        return cues.stream().anyMatch(text::contains);
    }

    private static boolean startsWithAny(String text, List<String> cues) {
        return cues.stream().anyMatch(text::startsWith);
    }
}

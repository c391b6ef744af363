package com.z254.lumina.tutor.agent.impl;

import com.z254.lumina.tutor.agent.Agent;
import com.z254.lumina.tutor.agent.AgentException;
import com.z254.lumina.tutor.client.McpServiceLayer;
import com.z254.lumina.tutor.config.TutorProperties;
import com.z254.lumina.tutor.domain.model.AgentCapabilities;
import com.z254.lumina.tutor.domain.model.AgentMessage;
import com.z254.lumina.tutor.domain.model.AgentType;
import com.z254.lumina.tutor.domain.model.ErrorCode;
import com.z254.lumina.tutor.domain.payload.AgentContribution;
import com.z254.lumina.tutor.domain.payload.GenerateQuestionRequest;
import com.z254.lumina.tutor.domain.payload.Operation;
import com.z254.lumina.tutor.observability.TutorEventPublisher;
import com.z254.lumina.tutor.orchestration.MessageBus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Writes practice questions for the concepts in a query.
 */
@Component
@Slf4j
public class AssessmentAgent extends Agent {

    private static final int MAX_QUESTIONS = 3;
    private static final String DEFAULT_QUESTION_TYPE = "multiple_choice";

    public AssessmentAgent(MessageBus messageBus, McpServiceLayer mcpService, TutorEventPublisher events,
                           TutorProperties properties) {
        super(AgentType.ASSESSMENT, configFrom(properties, McpServiceLayer.TOOL_AI_CLAUDE), messageBus,
                mcpService, events, properties.getAgent().getLatencyWindow());
    }

    @Override
    public AgentCapabilities getCapabilities() {
        return AgentCapabilities.of(Set.of(Operation.GENERATE_QUESTION));
    }

    @Override
    public Mono<AgentMessage> processMessage(AgentMessage message) {
        if (!(message.getPayload() instanceof GenerateQuestionRequest request)) {
            return Mono.error(new AgentException(ErrorCode.UNSUPPORTED_OPERATION, agentType, message.getId(),
                    "Unexpected payload " + message.getPayload().operation()));
        }
        return generateQuestions(request).map(contribution -> respond(message, contribution));
    }

    private Mono<AgentContribution> generateQuestions(GenerateQuestionRequest request) {
        List<String> concepts = request.concepts().isEmpty() ? List.of(request.query()) : request.concepts();
        String questionType = request.questionType() != null ? request.questionType() : DEFAULT_QUESTION_TYPE;
        String primary = concepts.get(0);

        String prompt = "Write one " + questionType.replace('_', ' ') + " question of difficulty "
                + request.difficulty() + "/5 testing understanding of " + primary
                + " in organic chemistry. Include the answer.";
        String conversationId = request.context() != null ? request.context().getSessionId() : null;

        return mcpService.queryAI(McpServiceLayer.AiProvider.OPENAI, prompt, Map.of("concept", primary),
                        conversationId, agentType)
                .map(answer -> {
                    List<Map<String, Object>> assessments = new ArrayList<>();
                    assessments.add(question(primary, answer.response(), questionType, request.difficulty()));
                    for (String concept : concepts.subList(1, Math.min(concepts.size(), MAX_QUESTIONS))) {
                        assessments.add(question(concept, templateQuestion(concept, request.difficulty()),
                                "short_answer", request.difficulty()));
                    }
                    return AgentContribution.builder()
                            .agentType(agentType)
                            .text("Try these to check your understanding of " + String.join(", ", concepts) + ".")
                            .confidence(answer.confidence() != null ? answer.confidence() : 0.8)
                            .assessments(assessments)
                            .sources(List.of("ai_question_generation"))
                            .build();
                });
    }

    private static Map<String, Object> question(String concept, String prompt, String type, int difficulty) {
        Map<String, Object> question = new LinkedHashMap<>();
        question.put("id", "q_" + UUID.randomUUID());
        question.put("concept", concept);
        question.put("type", type);
        question.put("difficulty", difficulty);
        question.put("prompt", prompt);
        return question;
    }

    private static String templateQuestion(String concept, int difficulty) {
        if (difficulty <= 2) {
            return "In your own words, what is " + concept + "?";
        }
        if (difficulty <= 4) {
            return "Describe the key steps of " + concept + " and what controls its outcome.";
        }
        return "Predict the product and justify the mechanism when " + concept + " competes with an alternative pathway.";
    }
}

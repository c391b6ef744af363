package com.z254.lumina.tutor.orchestration;

import com.z254.lumina.tutor.domain.model.AgentType;
import com.z254.lumina.tutor.domain.model.ResponseType;
import com.z254.lumina.tutor.domain.model.TutorResponse;
import com.z254.lumina.tutor.domain.payload.AgentContribution;
import com.z254.lumina.tutor.domain.payload.ProcessedQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Merges the contributions of the agents that succeeded into one {@link TutorResponse}.
 */
@Component
@Slf4j
public class ResponseSynthesizer {

    static final double DEFAULT_CONFIDENCE = 0.7;

    static final String DEGRADED_TEXT = "I'm sorry, I encountered an error while processing your question. "
            + "Please try rephrasing your question or ask something else.";

    static final List<String> DEGRADED_FOLLOW_UPS = List.of(
            "Try asking a more specific question",
            "Check if your question is about organic chemistry",
            "Ask for help with a particular concept");

    /**
     * @param results   contributions of the agents that succeeded
     * @param failed    agents that were planned but failed
     * @param startedAt {@link System#currentTimeMillis()} when processing began
     */
    public TutorResponse synthesize(String requestId, ProcessedQuery query,
                                    Map<AgentType, AgentContribution> results,
                                    Collection<AgentType> failed, long startedAt) {
        AgentContribution conversation = results.get(AgentType.CONVERSATION);
        AgentContribution content = results.get(AgentType.CONTENT_SPECIALIST);
        AgentContribution visual = results.get(AgentType.VISUAL_LEARNING);
        AgentContribution assessment = results.get(AgentType.ASSESSMENT);
        AgentContribution pedagogy = results.get(AgentType.PEDAGOGY);
        AgentContribution resource = results.get(AgentType.RESOURCE);

        String text = firstText(conversation, content);

        List<Map<String, Object>> videos = resource != null && !resource.videos().isEmpty()
                ? resource.videos()
                : visual != null ? visual.videos() : List.of();

        List<String> followUps = pedagogy != null && !pedagogy.nextSteps().isEmpty()
                ? pedagogy.nextSteps()
                : content != null ? content.relatedTopics() : List.of();

        double confidence = results.values().stream()
                .map(AgentContribution::confidence)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(DEFAULT_CONFIDENCE);

        Set<String> sources = new LinkedHashSet<>();
        results.values().forEach(contribution -> sources.addAll(contribution.sources()));

        return TutorResponse.builder()
                .id("resp_" + UUID.randomUUID())
                .type(responseType(query))
                .text(text)
                .visualizations(new ArrayList<>(visual != null ? visual.visualizations() : List.of()))
                .videos(new ArrayList<>(videos))
                .assessments(new ArrayList<>(assessment != null ? assessment.assessments() : List.of()))
                .resources(new ArrayList<>(resource != null ? resource.resources() : List.of()))
                .interactiveElements(new ArrayList<>(visual != null ? visual.interactiveElements() : List.of()))
                .followUpSuggestions(new ArrayList<>(followUps))
                .relatedTopics(new ArrayList<>(content != null ? content.prerequisites() : List.of()))
                .metadata(TutorResponse.Metadata.builder()
                        .requestId(requestId)
                        .agentsInvolved(sorted(results.keySet()))
                        .failedAgents(sorted(failed))
                        .confidence(confidence)
                        .processingTimeMs(System.currentTimeMillis() - startedAt)
                        .sources(new ArrayList<>(sources))
                        .build())
                .build();
    }

    /**
     * Fixed apology returned when a query cannot be answered.
     */
    public TutorResponse degraded(String requestId, Collection<AgentType> failed, long startedAt) {
        return TutorResponse.builder()
                .id("resp_" + UUID.randomUUID())
                .type(ResponseType.FEEDBACK)
                .text(DEGRADED_TEXT)
                .followUpSuggestions(new ArrayList<>(DEGRADED_FOLLOW_UPS))
                .metadata(TutorResponse.Metadata.builder()
                        .requestId(requestId)
                        .agentsInvolved(new ArrayList<>(List.of(AgentType.ORCHESTRATOR)))
                        .failedAgents(sorted(failed))
                        .confidence(0.0)
                        .processingTimeMs(System.currentTimeMillis() - startedAt)
                        .degraded(true)
                        .build())
                .build();
    }

    /**
     * question &gt; resources &gt; encouragement &gt; feedback &gt; explanation.
     */
    static ResponseType responseType(ProcessedQuery query) {
        if (query == null) {
            return ResponseType.EXPLANATION;
        }
        if (query.requestsAssessment()) {
            return ResponseType.QUESTION;
        }
        if (query.requestsResources()) {
            return ResponseType.RESOURCES;
        }
        if (query.requestsEncouragement()) {
            return ResponseType.ENCOURAGEMENT;
        }
        if (query.requestsFeedback()) {
            return ResponseType.FEEDBACK;
        }
        return ResponseType.EXPLANATION;
    }

    private static String firstText(AgentContribution... candidates) {
        return Arrays.stream(candidates)
                .filter(Objects::nonNull)
                .map(AgentContribution::text)
                .filter(text -> text != null && !text.isBlank())
                .findFirst()
                .orElse("");
    }

    private static List<AgentType> sorted(Collection<AgentType> types) {
        return types.stream().sorted().toList();
    }
}

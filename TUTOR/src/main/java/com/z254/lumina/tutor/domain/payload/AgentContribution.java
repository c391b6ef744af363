package com.z254.lumina.tutor.domain.payload;

import com.z254.lumina.tutor.domain.model.AgentType;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Partial result reported by an agent for one stage call.
 *
 * @param confidence self-reported confidence in [0, 1], or {@code null} when the agent has none
 * @param nextSteps  suggested follow-ups
 */
@Builder(toBuilder = true)
public record AgentContribution(
        AgentType agentType,
        String text,
        Double confidence,
        List<Map<String, Object>> visualizations,
        List<Map<String, Object>> videos,
        List<Map<String, Object>> assessments,
        List<Map<String, Object>> resources,
        List<Map<String, Object>> interactiveElements,
        List<String> nextSteps,
        List<String> relatedTopics,
        List<String> prerequisites,
        List<String> sources) implements AgentPayload {

    public AgentContribution {
        visualizations = visualizations != null ? List.copyOf(visualizations) : List.of();
        videos = videos != null ? List.copyOf(videos) : List.of();
        assessments = assessments != null ? List.copyOf(assessments) : List.of();
        resources = resources != null ? List.copyOf(resources) : List.of();
        interactiveElements = interactiveElements != null ? List.copyOf(interactiveElements) : List.of();
        nextSteps = nextSteps != null ? List.copyOf(nextSteps) : List.of();
        relatedTopics = relatedTopics != null ? List.copyOf(relatedTopics) : List.of();
        prerequisites = prerequisites != null ? List.copyOf(prerequisites) : List.of();
        sources = sources != null ? List.copyOf(sources) : List.of();
    }

    @Override
    public Operation operation() {
        return Operation.AGENT_RESULT;
    }
}

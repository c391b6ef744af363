package com.z254.lumina.tutor.orchestration;

import com.z254.lumina.tutor.domain.model.AgentType;
import com.z254.lumina.tutor.domain.model.ResponseType;
import com.z254.lumina.tutor.domain.model.TutorResponse;
import com.z254.lumina.tutor.domain.payload.AgentContribution;
import com.z254.lumina.tutor.domain.payload.ProcessedQuery;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ResponseSynthesizerTest {

    private final ResponseSynthesizer synthesizer = new ResponseSynthesizer();

    @Test
    void shouldPreferConversationTextOverContent() {
        // Given
        Map<AgentType, AgentContribution> results = new EnumMap<>(AgentType.class);
        results.put(AgentType.CONVERSATION, contribution(AgentType.CONVERSATION, "Friendly answer", 0.8));
        results.put(AgentType.CONTENT_SPECIALIST, contribution(AgentType.CONTENT_SPECIALIST, "Technical answer", 0.6));

        // When
        TutorResponse response = synthesizer.synthesize("req_1", ProcessedQuery.builder().build(), results,
                List.of(), System.currentTimeMillis());

        // Then
        assertThat(response.getText()).isEqualTo("Friendly answer");
        assertThat(response.getMetadata().getConfidence()).isCloseTo(0.7, within(1e-9));
        assertThat(response.getMetadata().getRequestId()).isEqualTo("req_1");
    }

    @Test
    void shouldFallBackToContentTextWhenConversationIsBlank() {
        // Given
        Map<AgentType, AgentContribution> results = new EnumMap<>(AgentType.class);
        results.put(AgentType.CONVERSATION, contribution(AgentType.CONVERSATION, " ", null));
        results.put(AgentType.CONTENT_SPECIALIST, contribution(AgentType.CONTENT_SPECIALIST, "Technical answer", null));

        // When
        TutorResponse response = synthesizer.synthesize("req_1", ProcessedQuery.builder().build(), results,
                List.of(), System.currentTimeMillis());

        // Then
        assertThat(response.getText()).isEqualTo("Technical answer");
        assertThat(response.getMetadata().getConfidence()).isEqualTo(ResponseSynthesizer.DEFAULT_CONFIDENCE);
    }

    @Test
    void shouldPreferResourceVideosAndPedagogyNextSteps() {
        // Given
        Map<AgentType, AgentContribution> results = new EnumMap<>(AgentType.class);
        results.put(AgentType.VISUAL_LEARNING, AgentContribution.builder()
                .agentType(AgentType.VISUAL_LEARNING)
                .videos(List.of(Map.of("title", "visual video")))
                .visualizations(List.of(Map.of("type", "diagram")))
                .build());
        results.put(AgentType.RESOURCE, AgentContribution.builder()
                .agentType(AgentType.RESOURCE)
                .videos(List.of(Map.of("title", "resource video")))
                .build());
        results.put(AgentType.CONTENT_SPECIALIST, AgentContribution.builder()
                .agentType(AgentType.CONTENT_SPECIALIST)
                .relatedTopics(List.of("sn1"))
                .build());
        results.put(AgentType.PEDAGOGY, AgentContribution.builder()
                .agentType(AgentType.PEDAGOGY)
                .nextSteps(List.of("Review nucleophiles"))
                .build());

        // When
        TutorResponse response = synthesizer.synthesize("req_1", ProcessedQuery.builder().build(), results,
                List.of(AgentType.ASSESSMENT), System.currentTimeMillis());

        // Then
        assertThat(response.getVideos()).containsExactly(Map.of("title", "resource video"));
        assertThat(response.getVisualizations()).hasSize(1);
        assertThat(response.getFollowUpSuggestions()).containsExactly("Review nucleophiles");
        assertThat(response.getMetadata().getFailedAgents()).containsExactly(AgentType.ASSESSMENT);
        assertThat(response.getMetadata().getAgentsInvolved()).containsExactly(AgentType.CONTENT_SPECIALIST,
                AgentType.PEDAGOGY, AgentType.VISUAL_LEARNING, AgentType.RESOURCE);
    }

    @Test
    void shouldPickResponseTypeByPrecedence() {
        assertThat(ResponseSynthesizer.responseType(ProcessedQuery.builder()
                .requestsAssessment(true).requestsResources(true).build())).isEqualTo(ResponseType.QUESTION);
        assertThat(ResponseSynthesizer.responseType(ProcessedQuery.builder()
                .requestsResources(true).requestsEncouragement(true).build())).isEqualTo(ResponseType.RESOURCES);
        assertThat(ResponseSynthesizer.responseType(ProcessedQuery.builder()
                .requestsEncouragement(true).requestsFeedback(true).build())).isEqualTo(ResponseType.ENCOURAGEMENT);
        assertThat(ResponseSynthesizer.responseType(ProcessedQuery.builder()
                .requestsFeedback(true).build())).isEqualTo(ResponseType.FEEDBACK);
        assertThat(ResponseSynthesizer.responseType(ProcessedQuery.builder().build()))
                .isEqualTo(ResponseType.EXPLANATION);
    }

    @Test
    void shouldBuildDegradedResponse() {
        // When
        TutorResponse response = synthesizer.degraded("req_9", List.of(AgentType.CONVERSATION),
                System.currentTimeMillis());

        // Then
        assertThat(response.getType()).isEqualTo(ResponseType.FEEDBACK);
        assertThat(response.getFollowUpSuggestions()).isEqualTo(ResponseSynthesizer.DEGRADED_FOLLOW_UPS);
        assertThat(response.getMetadata().isDegraded()).isTrue();
        assertThat(response.getMetadata().getAgentsInvolved()).containsExactly(AgentType.ORCHESTRATOR);
        assertThat(response.getMetadata().getFailedAgents()).containsExactly(AgentType.CONVERSATION);
    }

    private static AgentContribution contribution(AgentType type, String text, Double confidence) {
        return AgentContribution.builder().agentType(type).text(text).confidence(confidence).build();
    }
}

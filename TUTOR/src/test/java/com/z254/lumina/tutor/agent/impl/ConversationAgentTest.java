package com.z254.lumina.tutor.agent.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.lumina.tutor.agent.AgentException;
import com.z254.lumina.tutor.client.McpServiceLayer;
import com.z254.lumina.tutor.config.TutorProperties;
import com.z254.lumina.tutor.domain.model.ConversationContext;
import com.z254.lumina.tutor.domain.model.ErrorCode;
import com.z254.lumina.tutor.domain.model.Modality;
import com.z254.lumina.tutor.domain.payload.ProcessedQuery;
import com.z254.lumina.tutor.observability.StructuredLogger;
import com.z254.lumina.tutor.observability.TutorEventPublisher;
import com.z254.lumina.tutor.orchestration.MessageBus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class ConversationAgentTest {

    private ConversationAgent agent;

    @BeforeEach
    void setUp() {
        TutorProperties properties = new TutorProperties();
        TutorEventPublisher events = new TutorEventPublisher(new StructuredLogger(new ObjectMapper()),
                new SimpleMeterRegistry());
        agent = new ConversationAgent(new MessageBus(events, properties), mock(McpServiceLayer.class), events,
                properties, new ConceptGraph());
    }

    @Test
    void shouldRecognizeExplanationQuery() {
        // When
        ProcessedQuery query = agent.analyse("How does SN2 substitution work?", null);

        // Then
        assertThat(query.intent()).isEqualTo("explanation");
        assertThat(query.concepts()).containsExactly("sn2", "substitution");
        assertThat(query.needsExplanation()).isTrue();
        assertThat(query.needsVisualization()).isFalse();
        assertThat(query.needsAssessment()).isFalse();
        assertThat(query.originalQuery()).isEqualTo("How does SN2 substitution work?");
    }

    @Test
    void shouldRecognizeVisualRequestAndModality() {
        // When
        ProcessedQuery query = agent.analyse("Show me a 3D model of an alkene", null);

        // Then
        assertThat(query.intent()).isEqualTo("visualization");
        assertThat(query.requestsVisualContent()).isTrue();
        assertThat(query.preferredModality()).isEqualTo(Modality.THREE_D);
    }

    @Test
    void shouldRecognizePracticeRequest() {
        // When
        ProcessedQuery query = agent.analyse("Quiz me on sn1, something challenging", null);

        // Then
        assertThat(query.intent()).isEqualTo("practice");
        assertThat(query.requestsPractice()).isTrue();
        assertThat(query.requestsAssessment()).isTrue();
        assertThat(query.requestedDifficulty()).isEqualTo(5);
        assertThat(query.concepts()).containsExactly("sn1");
    }

    @Test
    void shouldMatchMultiWordConcepts() {
        // When
        ProcessedQuery query = agent.analyse("Give me a study plan for chemical bonding", null);

        // Then
        assertThat(query.intent()).isEqualTo("study_plan");
        assertThat(query.concepts()).containsExactly("chemical bonding");
        assertThat(query.needsLearningPath()).isTrue();
    }

    @Test
    void shouldUseContextForTopicModalityAndGoals() {
        // Given
        ConversationContext context = ConversationContext.builder()
                .currentTopic("elimination")
                .preferences(Map.of("preferredModality", "diagram", "learningGoals", List.of("synthesis")))
                .build();

        // When
        ProcessedQuery query = agent.analyse("Can you go over that again?", context);

        // Then
        assertThat(query.concepts()).containsExactly("elimination");
        assertThat(query.preferredModality()).isEqualTo(Modality.DIAGRAM);
        assertThat(query.learningGoals()).containsExactly("synthesis");
        assertThat(query.context()).isSameAs(context);
    }

    @Test
    void shouldRejectBlankQuery() {
        // When / Then
        assertThatThrownBy(() -> agent.analyse("   ", null))
                .isInstanceOf(AgentException.class)
                .satisfies(e -> assertThat(((AgentException) e).getCode()).isEqualTo(ErrorCode.INVALID_MESSAGE));
    }
}

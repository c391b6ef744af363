package com.z254.lumina.tutor.agent.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.lumina.tutor.client.McpServiceLayer;
import com.z254.lumina.tutor.config.TutorProperties;
import com.z254.lumina.tutor.domain.model.AgentType;
import com.z254.lumina.tutor.domain.model.ConversationContext;
import com.z254.lumina.tutor.domain.model.DifficultyLevel;
import com.z254.lumina.tutor.domain.payload.AgentContribution;
import com.z254.lumina.tutor.domain.payload.CreateLearningPathRequest;
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
import static org.mockito.Mockito.mock;

class PedagogyAgentTest {

    private PedagogyAgent agent;

    @BeforeEach
    void setUp() {
        TutorProperties properties = new TutorProperties();
        TutorEventPublisher events = new TutorEventPublisher(new StructuredLogger(new ObjectMapper()),
                new SimpleMeterRegistry());
        agent = new PedagogyAgent(new MessageBus(events, properties), mock(McpServiceLayer.class), events,
                properties, new ConceptGraph());
    }

    @Test
    void shouldOrderPrerequisitesBeforeTargetForBeginner() {
        // When
        AgentContribution path = agent.plan(request(DifficultyLevel.BEGINNER, Map.of()));

        // Then
        assertThat(path.text()).startsWith("Suggested path: atomic structure → chemical bonding");
        assertThat(path.nextSteps()).first().isEqualTo("Study atomic structure (~30 min)");
        assertThat(path.nextSteps()).contains("Study sn2 (~60 min)");
    }

    @Test
    void shouldSkipFoundationsForAdvancedStudent() {
        // When
        AgentContribution path = agent.plan(request(DifficultyLevel.ADVANCED, Map.of()));

        // Then
        assertThat(path.nextSteps()).containsExactly(
                "Study stereochemistry (~34 min)",
                "Study sn2 (~30 min)",
                "Then move on to elimination",
                "Then move on to sn1");
        assertThat(path.relatedTopics()).containsExactly("elimination", "sn1");
        assertThat(path.sources()).containsExactly("curriculum_graph");
    }

    @Test
    void shouldInsertPracticeStepWhenAssessmentRan() {
        // Given
        Map<AgentType, AgentContribution> previous = Map.of(AgentType.ASSESSMENT,
                AgentContribution.builder().agentType(AgentType.ASSESSMENT).build());

        // When
        AgentContribution path = agent.plan(request(DifficultyLevel.ADVANCED, previous));

        // Then
        assertThat(path.nextSteps()).containsExactly(
                "Study stereochemistry (~34 min)",
                "Study sn2 (~30 min)",
                "Work through the practice questions",
                "Then move on to elimination",
                "Then move on to sn1");
    }

    private static CreateLearningPathRequest request(DifficultyLevel level,
                                                     Map<AgentType, AgentContribution> previous) {
        ConversationContext context = ConversationContext.builder().studentLevel(level).build();
        ProcessedQuery query = ProcessedQuery.builder().concepts(List.of("sn2")).build();
        return new CreateLearningPathRequest("Give me a study plan for sn2", query, context, previous, List.of());
    }
}

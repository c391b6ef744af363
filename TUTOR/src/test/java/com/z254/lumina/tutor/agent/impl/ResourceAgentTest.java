package com.z254.lumina.tutor.agent.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.lumina.tutor.client.McpServiceLayer;
import com.z254.lumina.tutor.config.TutorProperties;
import com.z254.lumina.tutor.domain.model.AgentMessage;
import com.z254.lumina.tutor.domain.model.AgentType;
import com.z254.lumina.tutor.domain.payload.AgentContribution;
import com.z254.lumina.tutor.domain.payload.FindResourcesRequest;
import com.z254.lumina.tutor.observability.StructuredLogger;
import com.z254.lumina.tutor.observability.TutorEventPublisher;
import com.z254.lumina.tutor.orchestration.MessageBus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ResourceAgentTest {

    private McpServiceLayer mcpService;
    private ResourceAgent agent;

    @BeforeEach
    void setUp() {
        TutorProperties properties = new TutorProperties();
        TutorEventPublisher events = new TutorEventPublisher(new StructuredLogger(new ObjectMapper()),
                new SimpleMeterRegistry());
        mcpService = mock(McpServiceLayer.class);
        agent = new ResourceAgent(new MessageBus(events, properties), mcpService, events, properties);
    }

    @Test
    void shouldReturnVideosAndReading() {
        // Given
        when(mcpService.searchVideos(eq("sn2"), anyString(), eq(5))).thenReturn(Mono.just(List.of(
                new McpServiceLayer.VideoResult("v1", "SN2 in 5 minutes", null, "https://video/v1", "5:00",
                        "Chem Channel", null))));

        // When / Then
        StepVerifier.create(agent.processMessage(request(List.of("sn2"), List.of())))
                .assertNext(response -> {
                    AgentContribution contribution = (AgentContribution) response.getPayload();
                    assertThat(contribution.confidence()).isEqualTo(0.8);
                    assertThat(contribution.videos()).hasSize(1);
                    assertThat(contribution.videos().get(0))
                            .containsEntry("title", "SN2 in 5 minutes")
                            .doesNotContainKey("thumbnail");
                    assertThat(contribution.resources()).hasSize(1);
                    assertThat(contribution.resources().get(0).get("url").toString()).endsWith("query=sn2");
                    assertThat(contribution.sources()).containsExactly("video_search", "reference_library");
                })
                .verifyComplete();
    }

    @Test
    void shouldLowerConfidenceWhenNoVideosFound() {
        // Given
        when(mcpService.searchVideos(anyString(), anyString(), anyInt())).thenReturn(Mono.just(List.of()));

        // When / Then
        StepVerifier.create(agent.processMessage(request(List.of(), List.of())))
                .assertNext(response -> {
                    AgentContribution contribution = (AgentContribution) response.getPayload();
                    assertThat(contribution.confidence()).isEqualTo(0.6);
                    assertThat(contribution.text()).isEqualTo("Here is some reading on gravity.");
                })
                .verifyComplete();
    }

    @Test
    void shouldSkipVideoSearchWhenOnlyArticlesRequested() {
        // When / Then
        StepVerifier.create(agent.processMessage(request(List.of("sn1"), List.of("article"))))
                .assertNext(response -> {
                    AgentContribution contribution = (AgentContribution) response.getPayload();
                    assertThat(contribution.videos()).isEmpty();
                    assertThat(contribution.resources()).hasSize(1);
                })
                .verifyComplete();

        verify(mcpService, never()).searchVideos(anyString(), anyString(), anyInt());
    }

    private static AgentMessage request(List<String> topics, List<String> resourceTypes) {
        FindResourcesRequest payload = new FindResourcesRequest("gravity", null, null, Map.of(), topics,
                resourceTypes);
        return AgentMessage.request(AgentType.ORCHESTRATOR, AgentType.RESOURCE, payload, "req-1:RESOURCE:find_resources",
                null);
    }
}

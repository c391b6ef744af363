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
import com.z254.lumina.tutor.domain.payload.FindResourcesRequest;
import com.z254.lumina.tutor.domain.payload.Operation;
import com.z254.lumina.tutor.observability.TutorEventPublisher;
import com.z254.lumina.tutor.orchestration.MessageBus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds videos and reading material for the query topics.
 */
@Component
@Slf4j
public class ResourceAgent extends Agent {

    private static final int MAX_VIDEOS = 5;
    private static final String READING_SEARCH_URL = "https://chem.libretexts.org/Special:Search?query=";

    private final String subject;

    public ResourceAgent(MessageBus messageBus, McpServiceLayer mcpService, TutorEventPublisher events,
                         TutorProperties properties) {
        super(AgentType.RESOURCE, configFrom(properties, McpServiceLayer.TOOL_VIDEO_SEARCH), messageBus,
                mcpService, events, properties.getAgent().getLatencyWindow());
        this.subject = properties.getMcp().getDefaultSubject();
    }

    @Override
    public AgentCapabilities getCapabilities() {
        return new AgentCapabilities(Set.of(Operation.FIND_RESOURCES), Set.of(), Set.of("video", "text"));
    }

    @Override
    public Mono<AgentMessage> processMessage(AgentMessage message) {
        if (!(message.getPayload() instanceof FindResourcesRequest request)) {
            return Mono.error(new AgentException(ErrorCode.UNSUPPORTED_OPERATION, agentType, message.getId(),
                    "Unexpected payload " + message.getPayload().operation()));
        }
        return findResources(request).map(contribution -> respond(message, contribution));
    }

    private Mono<AgentContribution> findResources(FindResourcesRequest request) {
        List<String> topics = request.topics().isEmpty() ? List.of(request.query()) : request.topics();
        boolean wantsVideos = request.resourceTypes().isEmpty() || request.resourceTypes().contains("video");
        boolean wantsReading = request.resourceTypes().isEmpty() || request.resourceTypes().contains("article");

        Mono<List<Map<String, Object>>> videos = wantsVideos
                ? mcpService.searchVideos(String.join(" ", topics), subject, MAX_VIDEOS)
                        .map(results -> results.stream().map(ResourceAgent::toVideo).toList())
                : Mono.just(List.of());

        return videos.map(videoList -> AgentContribution.builder()
                .agentType(agentType)
                .text(videoList.isEmpty()
                        ? "Here is some reading on " + String.join(", ", topics) + "."
                        : "I found " + videoList.size() + " videos on " + String.join(", ", topics) + ".")
                .confidence(videoList.isEmpty() ? 0.6 : 0.8)
                .videos(videoList)
                .resources(wantsReading ? topics.stream().map(ResourceAgent::reading).toList() : List.of())
                .sources(List.of("video_search", "reference_library"))
                .build());
    }

    private static Map<String, Object> toVideo(McpServiceLayer.VideoResult video) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", video.id());
        map.put("title", video.title());
        map.put("url", video.url());
        map.put("duration", video.duration());
        map.put("channel", video.channel());
        map.put("thumbnail", video.thumbnail());
        map.values().removeIf(value -> value == null);
        return map;
    }

    private static Map<String, Object> reading(String topic) {
        return Map.of(
                "type", "article",
                "title", topic + " overview",
                "url", READING_SEARCH_URL + URLEncoder.encode(topic, StandardCharsets.UTF_8));
    }
}

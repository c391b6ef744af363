package com.z254.lumina.tutor.client;

import com.z254.lumina.tutor.domain.model.AgentType;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Client interface for the MCP service layer.
 * The service layer fronts AI providers, video search, project files and analytics.
 */
public interface McpServiceLayer {

    String TOOL_AI_CLAUDE = "ai_query_claude";
    String TOOL_AI_OPENAI = "ai_query_openai";
    String TOOL_VIDEO_SEARCH = "video_search_youtube";
    String TOOL_FILE_READ = "fs_read_file";
    String TOOL_FILE_WRITE = "fs_write_file";
    String TOOL_ANALYTICS = "analytics_track";

    /**
     * Ask an AI provider.
     *
     * @param provider       which provider to use
     * @param prompt         the prompt text
     * @param context        extra context serialised alongside the prompt
     * @param conversationId conversation to attach the exchange to, may be null
     * @param agentType      calling agent, recorded as metadata
     * @return the provider's answer
     */
    Mono<AiResponse> queryAI(AiProvider provider, String prompt, Map<String, Object> context,
                             String conversationId, AgentType agentType);

    /**
     * Search educational videos.
     *
     * @param query      search text
     * @param subject    subject filter
     * @param maxResults maximum number of results
     * @return matching videos, possibly empty
     */
    Mono<List<VideoResult>> searchVideos(String query, String subject, int maxResults);

    Mono<String> readFile(String path);

    Mono<Void> writeFile(String path, String content);

    /**
     * Record an analytics event. Fire-and-forget: failures are logged, never signalled.
     */
    Mono<Void> trackEvent(String event, Map<String, Object> data);

    /**
     * Fetch service health and refresh the per-service status used by {@link #isServiceHealthy}.
     */
    Mono<ServiceHealth> getHealth();

    /**
     * Last known status of a service, {@code false} when unknown.
     */
    boolean isServiceHealthy(String service);

    enum AiProvider {
        CLAUDE("/api/claude"),
        OPENAI("/api/openai");

        private final String path;

        AiProvider(String path) {
            this.path = path;
        }

        public String getPath() {
            return path;
        }
    }

    record AiResponse(String response, String model, Double confidence) {
    }

    record VideoResult(String id, String title, String description, String url, String duration,
                       String channel, String thumbnail) {
    }

    record ServiceHealth(String status, Map<String, Boolean> services) {

        public boolean isHealthy() {
            return "healthy".equalsIgnoreCase(status) || "up".equalsIgnoreCase(status);
        }

        public boolean isServiceUp(String service) {
            return services != null && Boolean.TRUE.equals(services.get(service));
        }
    }
}

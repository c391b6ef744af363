package com.z254.lumina.tutor.client.impl;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.z254.lumina.tutor.client.McpServiceException;
import com.z254.lumina.tutor.client.McpServiceLayer;
import com.z254.lumina.tutor.config.TutorProperties;
import com.z254.lumina.tutor.domain.model.AgentType;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebClient-based implementation of McpServiceLayer.
 * Uses circuit breaker and retry for resilience, and Caffeine caches for AI and video lookups.
 */
@Component
@Slf4j
public class WebClientMcpServiceLayer implements McpServiceLayer {

    private static final ParameterizedTypeReference<Map<String, Object>> MAP_TYPE =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final TutorProperties.McpProperties config;
    private final boolean stubMode;

    private final Cache<AiCacheKey, AiResponse> aiCache;
    private final Cache<String, List<VideoResult>> videoCache;
    private final Map<String, Boolean> serviceStatus = new ConcurrentHashMap<>();

    public WebClientMcpServiceLayer(TutorProperties tutorProperties) {
        this.config = tutorProperties.getMcp();
        this.stubMode = config.getBaseUrl() == null || config.getBaseUrl().isEmpty();

        if (!stubMode) {
            WebClient.Builder builder = WebClient.builder()
                    .baseUrl(config.getBaseUrl())
                    .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
            if (config.getApiKey() != null && !config.getApiKey().isEmpty()) {
                builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey());
            }
            this.webClient = builder.build();
        } else {
            this.webClient = null;
            log.warn("MCP service layer running in stub mode - no actual service connection");
        }

        this.aiCache = Caffeine.newBuilder()
                .expireAfterWrite(config.getAiCacheTtl())
                .maximumSize(config.getMaxCacheSize())
                .build();
        this.videoCache = Caffeine.newBuilder()
                .expireAfterWrite(config.getVideoCacheTtl())
                .maximumSize(config.getMaxCacheSize())
                .build();
    }

    @Override
    @CircuitBreaker(name = "mcp")
    @Retry(name = "mcp")
    public Mono<AiResponse> queryAI(AiProvider provider, String prompt, Map<String, Object> context,
                                    String conversationId, AgentType agentType) {
        AiCacheKey cacheKey = AiCacheKey.of(provider, prompt, context, conversationId);
        AiResponse cached = aiCache.getIfPresent(cacheKey);
        if (cached != null) {
            return Mono.just(cached);
        }

        if (stubMode) {
            return Mono.just(new AiResponse(stubAnswer(prompt), "stub", 0.75));
        }

        Map<String, Object> body = new HashMap<>();
        body.put("message", prompt);
        if (context != null) body.put("context", context);
        if (conversationId != null) body.put("conversationId", conversationId);
        body.put("agentMetadata", Map.of(
                "agentType", agentType != null ? agentType.name() : "UNKNOWN",
                "timestamp", Instant.now().toString()));

        return webClient.post()
                .uri(provider.getPath())
                .bodyValue(body)
                .retrieve()
                .bodyToMono(AiResponse.class)
                .timeout(config.getTimeout())
                .doOnNext(response -> aiCache.put(cacheKey, response))
                .onErrorMap(e -> !(e instanceof McpServiceException),
                        e -> new McpServiceException("AI query failed for " + provider, "AI_QUERY_FAILED", e))
                .doOnError(e -> log.error("AI query to {} failed: {}", provider, e.getMessage()));
    }

    @Override
    @CircuitBreaker(name = "mcp")
    @Retry(name = "mcp")
    public Mono<List<VideoResult>> searchVideos(String query, String subject, int maxResults) {
        String effectiveSubject = subject != null ? subject : config.getDefaultSubject();
        String cacheKey = query + "|" + effectiveSubject + "|" + maxResults;
        List<VideoResult> cached = videoCache.getIfPresent(cacheKey);
        if (cached != null) {
            return Mono.just(cached);
        }

        if (stubMode) {
            return Mono.just(List.of());
        }

        return webClient.post()
                .uri("/api/youtube")
                .bodyValue(Map.of(
                        "query", query,
                        "subject", effectiveSubject,
                        "maxResults", maxResults,
                        "filter", Map.of("educational", true)))
                .retrieve()
                .bodyToMono(VideoSearchResponse.class)
                .timeout(config.getTimeout())
                .map(response -> response.videos() != null ? List.copyOf(response.videos()) : List.<VideoResult>of())
                .doOnNext(videos -> videoCache.put(cacheKey, videos))
                .onErrorMap(e -> !(e instanceof McpServiceException),
                        e -> new McpServiceException("Video search failed", "VIDEO_SEARCH_FAILED", e))
                .doOnError(e -> log.error("Video search failed: {}", e.getMessage()));
    }

    @Override
    @CircuitBreaker(name = "mcp")
    public Mono<String> readFile(String path) {
        if (stubMode) {
            return Mono.error(new McpServiceException("File access unavailable in stub mode: " + path,
                    "FILE_READ_FAILED", null));
        }

        return webClient.post()
                .uri("/filesystem/read")
                .bodyValue(Map.of("path", path))
                .retrieve()
                .bodyToMono(MAP_TYPE)
                .timeout(config.getTimeout())
                .map(response -> String.valueOf(response.getOrDefault("content", "")))
                .onErrorMap(e -> !(e instanceof McpServiceException),
                        e -> new McpServiceException("Failed to read file: " + path, "FILE_READ_FAILED", e))
                .doOnError(e -> log.error("Failed to read {}: {}", path, e.getMessage()));
    }

    @Override
    @CircuitBreaker(name = "mcp")
    public Mono<Void> writeFile(String path, String content) {
        if (stubMode) {
            return Mono.error(new McpServiceException("File access unavailable in stub mode: " + path,
                    "FILE_WRITE_FAILED", null));
        }

        return webClient.post()
                .uri("/filesystem/write")
                .bodyValue(Map.of("path", path, "content", content))
                .retrieve()
                .toBodilessEntity()
                .timeout(config.getTimeout())
                .then()
                .onErrorMap(e -> !(e instanceof McpServiceException),
                        e -> new McpServiceException("Failed to write file: " + path, "FILE_WRITE_FAILED", e))
                .doOnError(e -> log.error("Failed to write {}: {}", path, e.getMessage()));
    }

    @Override
    public Mono<Void> trackEvent(String event, Map<String, Object> data) {
        if (stubMode) {
            log.debug("Analytics event (stub): {} {}", event, data);
            return Mono.empty();
        }

        Map<String, Object> body = new HashMap<>();
        body.put("event", event);
        body.put("data", data != null ? data : Map.of());
        body.put("timestamp", Instant.now().toString());

        return webClient.post()
                .uri("/analytics/track")
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .timeout(config.getTimeout())
                .then()
                .onErrorResume(e -> {
                    log.warn("Analytics tracking failed for {}: {}", event, e.getMessage());
                    return Mono.empty();
                });
    }

    @Override
    public Mono<ServiceHealth> getHealth() {
        if (stubMode) {
            ServiceHealth health = new ServiceHealth("healthy", Map.of(
                    TOOL_AI_CLAUDE, true,
                    TOOL_AI_OPENAI, true,
                    TOOL_VIDEO_SEARCH, true,
                    TOOL_FILE_READ, true,
                    TOOL_FILE_WRITE, true,
                    TOOL_ANALYTICS, true));
            serviceStatus.putAll(health.services());
            return Mono.just(health);
        }

        return webClient.get()
                .uri("/health")
                .retrieve()
                .bodyToMono(ServiceHealth.class)
                .timeout(config.getTimeout())
                .doOnNext(health -> {
                    if (health.services() != null) {
                        serviceStatus.putAll(health.services());
                    }
                })
                .onErrorMap(e -> new McpServiceException("Health check failed", "HEALTH_CHECK_FAILED", e))
                .doOnError(e -> log.warn("MCP health check failed: {}", e.getMessage()));
    }

    @Override
    public boolean isServiceHealthy(String service) {
        return serviceStatus.getOrDefault(service, false);
    }

    public boolean isStubMode() {
        return stubMode;
    }

    private static String stubAnswer(String prompt) {
        String subject = prompt.length() > 80 ? prompt.substring(0, 80) + "..." : prompt;
        return "Here is an overview based on: " + subject;
    }

    record VideoSearchResponse(List<VideoResult> videos) {
    }

    /**
     * AI cache key. Compares the full context, so distinct contexts never share an answer.
     */
    record AiCacheKey(AiProvider provider, String prompt, Map<String, Object> context, String conversationId) {

        static AiCacheKey of(AiProvider provider, String prompt, Map<String, Object> context, String conversationId) {
            return new AiCacheKey(provider, prompt, context != null ? new HashMap<>(context) : null, conversationId);
        }
    }
}

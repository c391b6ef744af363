package com.z254.lumina.tutor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the TUTOR service.
 */
@Data
@Component
@ConfigurationProperties(prefix = "tutor")
public class TutorProperties {

    private BusProperties bus = new BusProperties();
    private AgentProperties agent = new AgentProperties();
    private OrchestratorProperties orchestrator = new OrchestratorProperties();
    private AdaptiveProperties adaptive = new AdaptiveProperties();
    private McpProperties mcp = new McpProperties();

    @Data
    public static class BusProperties {
        private int maxDeadLetters = 1000;
    }

    @Data
    public static class AgentProperties {
        private Duration defaultTimeout = Duration.ofSeconds(30);
        /**
         * Messages an agent processes at once. Further messages wait for a free slot.
         */
        private int maxConcurrentTasks = 10;
        private Duration healthCheckInterval = Duration.ofSeconds(30);
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private int latencyWindow = 100;
    }

    @Data
    public static class OrchestratorProperties {
        private Duration conversationTimeout = Duration.ofSeconds(30);
        private Duration agentTimeout = Duration.ofSeconds(60);
        private Duration healthSweepInterval = Duration.ofSeconds(30);
        private int queryTimeWindow = 1000;
        private boolean autoStart = true;
    }

    @Data
    public static class AdaptiveProperties {
        private Duration generationTimeout = Duration.ofSeconds(30);
        private Duration confusionThreshold = Duration.ofSeconds(45);
        private int maxCandidates = 4;
        /**
         * Delivered content kept for go-deeper and go-simpler requests. Older or idle entries are evicted.
         */
        private int maxDeliveredContent = 10_000;
        private Duration deliveredContentTtl = Duration.ofHours(2);
    }

    @Data
    public static class McpProperties {
        /**
         * Service layer base URL. Empty runs the client in stub mode.
         */
        private String baseUrl = "";
        private String apiKey;
        private Duration timeout = Duration.ofSeconds(30);
        private Duration aiCacheTtl = Duration.ofMinutes(5);
        private Duration videoCacheTtl = Duration.ofMinutes(30);
        private int maxCacheSize = 1000;
        private String defaultSubject = "organic chemistry";
    }
}

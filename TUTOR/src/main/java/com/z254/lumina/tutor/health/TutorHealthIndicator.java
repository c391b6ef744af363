package com.z254.lumina.tutor.health;

import com.z254.lumina.tutor.client.McpServiceLayer;
import com.z254.lumina.tutor.domain.model.AgentState;
import com.z254.lumina.tutor.domain.model.AgentType;
import com.z254.lumina.tutor.orchestration.TutorOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicator for TUTOR service.
 * Reports the orchestrator state, each agent's state and the MCP service layer status.
 * The service is down while the orchestrator is stopped or the conversation agent is not healthy.
 */
@Component
@Slf4j
public class TutorHealthIndicator implements ReactiveHealthIndicator {

    private static final Duration SERVICE_CHECK_TIMEOUT = Duration.ofSeconds(5);

    private final TutorOrchestrator orchestrator;
    private final McpServiceLayer mcpService;

    public TutorHealthIndicator(TutorOrchestrator orchestrator, McpServiceLayer mcpService) {
        this.orchestrator = orchestrator;
        this.mcpService = mcpService;
    }

    @Override
    public Mono<Health> health() {
        return checkServiceLayer()
                .map(serviceStatus -> {
                    List<TutorOrchestrator.AgentStatus> statuses = orchestrator.getAgentStatuses();
                    boolean conversationHealthy = statuses.stream()
                            .anyMatch(status -> status.agentType() == AgentType.CONVERSATION
                                    && status.state() == AgentState.HEALTHY);

                    Health.Builder builder = orchestrator.isStarted() && conversationHealthy
                            ? Health.up()
                            : Health.down();

                    Map<String, String> agents = new LinkedHashMap<>();
                    statuses.forEach(status -> agents.put(status.agentType().name(), status.state().name()));

                    builder.withDetail("orchestrator", orchestrator.isStarted() ? "STARTED" : "STOPPED");
                    builder.withDetail("agents", agents);
                    builder.withDetail("mcp", serviceStatus);
                    builder.withDetail("stats", orchestrator.getStats());
                    return builder.build();
                })
                .onErrorResume(e -> {
                    log.error("Health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }

    private Mono<String> checkServiceLayer() {
        return mcpService.getHealth()
                .map(health -> health.isHealthy() ? "UP" : "DEGRADED")
                .timeout(SERVICE_CHECK_TIMEOUT)
                .onErrorReturn("DOWN");
    }
}

package com.z254.lumina.tutor.config;

import com.z254.lumina.tutor.agent.Agent;
import com.z254.lumina.tutor.agent.AgentRegistry;
import com.z254.lumina.tutor.domain.model.AgentState;
import com.z254.lumina.tutor.orchestration.MessageBus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Metrics configuration for TUTOR service.
 * Query counters and latency live in the orchestrator; this adds gauges over bus and agent state.
 */
@Configuration
public class MetricsConfig {

    // ==================== Bus Metrics ====================

    @Bean
    public MeterBinder messageBusMetrics(MessageBus messageBus) {
        return registry -> Gauge.builder("tutor.bus.dead_letters", messageBus, bus -> bus.getDeadLetters().size())
                .description("Messages currently held in the dead-letter queue")
                .register(registry);
    }

    // ==================== Agent Metrics ====================

    @Bean
    public MeterBinder agentMetrics(AgentRegistry agentRegistry) {
        return registry -> {
            for (Agent agent : agentRegistry.getAll()) {
                String type = agent.getAgentType().name().toLowerCase(Locale.ROOT);
                Gauge.builder("tutor.agent.healthy", agent, a -> a.getState() == AgentState.HEALTHY ? 1 : 0)
                        .description("1 when the agent is healthy")
                        .tag("agent", type)
                        .register(registry);
                Gauge.builder("tutor.agent.messages", agent, a -> a.getMetrics().messageCount())
                        .description("Messages handled by the agent")
                        .tag("agent", type)
                        .register(registry);
                Gauge.builder("tutor.agent.error_rate", agent, a -> a.getMetrics().errorRate())
                        .description("Share of messages the agent failed to handle")
                        .tag("agent", type)
                        .register(registry);
            }
        };
    }
}

package com.z254.lumina.tutor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runtime configuration of a single agent.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentConfig {

    @Builder.Default
    private int maxConcurrentTasks = 10;

    /**
     * Default processing deadline when the message carries no override.
     */
    @Builder.Default
    private Duration timeout = Duration.ofSeconds(30);

    @Builder.Default
    private int retryAttempts = 3;

    @Builder.Default
    private MessagePriority priority = MessagePriority.MEDIUM;

    /**
     * External services that must report healthy before the agent is usable.
     */
    @Builder.Default
    private List<String> requiredTools = new ArrayList<>();

    @Builder.Default
    private Duration healthCheckInterval = Duration.ofSeconds(30);

    @Builder.Default
    private Duration heartbeatInterval = Duration.ofSeconds(30);
}

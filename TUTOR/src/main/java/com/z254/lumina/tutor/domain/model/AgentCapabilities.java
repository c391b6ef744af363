package com.z254.lumina.tutor.domain.model;

import com.z254.lumina.tutor.domain.payload.Operation;

import java.util.Set;

/**
 * What an agent can do.
 *
 * @param operations        payload operations the agent accepts
 * @param supportedTopics   subject areas it is tuned for, empty for any
 * @param supportedModalities output forms it can produce
 */
public record AgentCapabilities(Set<Operation> operations, Set<String> supportedTopics,
                                Set<String> supportedModalities) {

    public AgentCapabilities {
        operations = Set.copyOf(operations);
        supportedTopics = Set.copyOf(supportedTopics);
        supportedModalities = Set.copyOf(supportedModalities);
    }

    public static AgentCapabilities of(Set<Operation> operations) {
        return new AgentCapabilities(operations, Set.of(), Set.of("text"));
    }

    public boolean supports(Operation operation) {
        return operations.contains(operation);
    }
}

package com.z254.lumina.tutor.agent;

import com.z254.lumina.tutor.domain.model.AgentType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of the agents known to the orchestrator, one per agent type.
 */
@Component
@Slf4j
public class AgentRegistry {

    private final Map<AgentType, Agent> agents = new EnumMap<>(AgentType.class);

    public AgentRegistry(List<Agent> agentList) {
        for (Agent agent : agentList) {
            register(agent);
        }
    }

    public synchronized void register(Agent agent) {
        Agent previous = agents.put(agent.getAgentType(), agent);
        if (previous != null && previous != agent) {
            log.warn("Replaced {} agent {} with {}", agent.getAgentType(),
                    previous.getClass().getSimpleName(), agent.getClass().getSimpleName());
        } else {
            log.info("Registered agent: {} ({})", agent.getAgentType(), agent.getClass().getSimpleName());
        }
    }

    public synchronized Optional<Agent> get(AgentType type) {
        return Optional.ofNullable(agents.get(type));
    }

    public synchronized boolean isRegistered(AgentType type) {
        return agents.containsKey(type);
    }

    public synchronized List<Agent> getAll() {
        return new ArrayList<>(agents.values());
    }
}

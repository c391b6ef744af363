package com.z254.lumina.tutor.domain.payload;

import com.z254.lumina.tutor.domain.model.AgentType;

/**
 * Tag of every payload variant carried on the bus.
 */
public enum Operation {
    PROCESS_QUERY,
    COMPOSE_REPLY,
    EXPLAIN_CONCEPT,
    CREATE_VISUALIZATION,
    GENERATE_QUESTION,
    CREATE_LEARNING_PATH,
    FIND_RESOURCES,
    QUERY_ANALYSIS,
    AGENT_RESULT,
    AGENT_ERROR,
    LEARNING_EVENT,
    HEARTBEAT;

    /**
     * Agent type that serves this operation, or {@code null} for replies and signals.
     */
    public AgentType servedBy() {
        return switch (this) {
            case PROCESS_QUERY, COMPOSE_REPLY -> AgentType.CONVERSATION;
            case EXPLAIN_CONCEPT -> AgentType.CONTENT_SPECIALIST;
            case CREATE_VISUALIZATION -> AgentType.VISUAL_LEARNING;
            case GENERATE_QUESTION -> AgentType.ASSESSMENT;
            case CREATE_LEARNING_PATH -> AgentType.PEDAGOGY;
            case FIND_RESOURCES -> AgentType.RESOURCE;
            case QUERY_ANALYSIS, AGENT_RESULT, AGENT_ERROR, LEARNING_EVENT, HEARTBEAT -> null;
        };
    }
}

package com.z254.lumina.tutor.domain.payload;

/**
 * Body of an {@link com.z254.lumina.tutor.domain.model.AgentMessage}. Each variant reports its
 * operation tag.
 */
public interface AgentPayload {

    Operation operation();
}

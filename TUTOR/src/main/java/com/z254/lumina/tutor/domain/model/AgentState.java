package com.z254.lumina.tutor.domain.model;

/**
 * Lifecycle state of an agent.
 * UNINITIALIZED → INITIALIZING → HEALTHY ⇄ UNHEALTHY → SHUTDOWN.
 */
public enum AgentState {
    UNINITIALIZED,
    INITIALIZING,
    HEALTHY,
    UNHEALTHY,
    SHUTDOWN;

    public boolean isInitialized() {
        return this == HEALTHY || this == UNHEALTHY;
    }
}

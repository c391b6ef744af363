package com.z254.lumina.tutor.domain.model;

/**
 * Types of messages exchanged over the tutoring message bus.
 */
public enum MessageType {

    /**
     * Request for an agent to perform an operation. Carries a correlation id when a reply is expected.
     */
    REQUEST,

    /**
     * Reply to a request, echoing the request's correlation id.
     */
    RESPONSE,

    /**
     * One-way informational message (learning milestones, mastered concepts).
     */
    NOTIFICATION,

    /**
     * Error report sent to the orchestrator when an agent fails to handle a message.
     */
    ERROR,

    /**
     * Periodic liveness signal from an agent.
     */
    HEARTBEAT,

    /**
     * Work handed to an agent without an expected reply.
     */
    TASK_ASSIGNMENT
}

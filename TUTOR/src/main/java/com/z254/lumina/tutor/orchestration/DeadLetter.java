package com.z254.lumina.tutor.orchestration;

import com.z254.lumina.tutor.domain.model.AgentMessage;

import java.time.Instant;

/**
 * Undeliverable message set aside by the bus.
 *
 * @param message  the message
 * @param reason   why it could not be delivered
 * @param error    handler error message, if a handler rejected it
 * @param occurredAt when delivery was abandoned
 */
public record DeadLetter(AgentMessage message, Reason reason, String error, Instant occurredAt) {

    public enum Reason {
        NO_SUBSCRIBER,
        INVALID_MESSAGE,
        ROUTE_NOT_ALLOWED,
        HANDLER_FAILED
    }
}

package com.z254.lumina.tutor.orchestration;

import lombok.Getter;

/**
 * Raised to the caller of {@link MessageBus#route} when a message could not be delivered.
 */
@Getter
public class MessageDeliveryException extends RuntimeException {

    private final String messageId;
    private final DeadLetter.Reason reason;

    public MessageDeliveryException(String messageId, DeadLetter.Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.messageId = messageId;
        this.reason = reason;
    }
}

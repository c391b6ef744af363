package com.z254.lumina.tutor.domain.model;

import com.z254.lumina.tutor.domain.payload.AgentErrorPayload;
import com.z254.lumina.tutor.domain.payload.AgentPayload;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Envelope routed over the message bus.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentMessage {

    /**
     * Unique identifier for this message.
     */
    private String id;

    /**
     * When the message was created.
     */
    private Instant timestamp;

    /**
     * Sending endpoint.
     */
    private AgentType sender;

    /**
     * Receiving endpoint. Null for broadcast messages.
     */
    private AgentType recipient;

    /**
     * Type of message.
     */
    private MessageType type;

    /**
     * Typed body, tagged by operation.
     */
    private AgentPayload payload;

    @Builder.Default
    private MessagePriority priority = MessagePriority.MEDIUM;

    /**
     * Links a request to its response. Set on requests, echoed on responses.
     */
    private String correlationId;

    /**
     * Processing deadline overriding the recipient's default.
     */
    private Duration timeout;

    public boolean isBroadcast() {
        return recipient == null;
    }

    // --------------------------------------------------------------------------------------------
    // Factory methods
    // --------------------------------------------------------------------------------------------

    public static AgentMessage request(AgentType sender, AgentType recipient, AgentPayload payload,
                                       String correlationId, MessagePriority priority) {
        return AgentMessage.builder()
                .id(newId())
                .timestamp(Instant.now())
                .sender(sender)
                .recipient(recipient)
                .type(MessageType.REQUEST)
                .payload(payload)
                .correlationId(correlationId)
                .priority(priority != null ? priority : MessagePriority.MEDIUM)
                .build();
    }

    /**
     * Reply to a request, swapping sender and recipient and echoing the correlation id.
     */
    public static AgentMessage response(AgentMessage request, AgentPayload payload) {
        return AgentMessage.builder()
                .id(newId())
                .timestamp(Instant.now())
                .sender(request.getRecipient())
                .recipient(request.getSender())
                .type(MessageType.RESPONSE)
                .payload(payload)
                .correlationId(request.getCorrelationId())
                .priority(request.getPriority())
                .build();
    }

    public static AgentMessage error(AgentType sender, AgentType recipient, AgentErrorPayload error,
                                     String correlationId) {
        return AgentMessage.builder()
                .id(newId())
                .timestamp(Instant.now())
                .sender(sender)
                .recipient(recipient)
                .type(MessageType.ERROR)
                .payload(error)
                .correlationId(correlationId)
                .priority(MessagePriority.HIGH)
                .build();
    }

    public static AgentMessage notification(AgentType sender, AgentType recipient, AgentPayload payload) {
        return AgentMessage.builder()
                .id(newId())
                .timestamp(Instant.now())
                .sender(sender)
                .recipient(recipient)
                .type(MessageType.NOTIFICATION)
                .payload(payload)
                .priority(MessagePriority.LOW)
                .build();
    }

    public static AgentMessage heartbeat(AgentType sender, AgentPayload payload) {
        return AgentMessage.builder()
                .id(newId())
                .timestamp(Instant.now())
                .sender(sender)
                .recipient(AgentType.ORCHESTRATOR)
                .type(MessageType.HEARTBEAT)
                .payload(payload)
                .priority(MessagePriority.LOW)
                .build();
    }

    private static String newId() {
        return "msg_" + UUID.randomUUID();
    }
}

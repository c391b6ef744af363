package com.z254.lumina.tutor.orchestration;

import com.z254.lumina.tutor.config.TutorProperties;
import com.z254.lumina.tutor.domain.model.AgentMessage;
import com.z254.lumina.tutor.domain.model.AgentType;
import com.z254.lumina.tutor.domain.model.MessageType;
import com.z254.lumina.tutor.observability.TutorEventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Typed pub/sub router between agent types.
 *
 * <p>Every {@link #route} call ends in exactly one of: delivery to the recipient's handler
 * ({@code message_delivered}), a dead letter for an undeliverable message
 * ({@code message_dead_lettered}), or a dead letter for a handler failure
 * ({@code message_delivery_failed}). Delivery is never retried here. Successive messages to the
 * same recipient reach its handler in call order.
 */
@Service
@Slf4j
public class MessageBus {

    private final Map<AgentType, CopyOnWriteArrayList<MessageHandler>> subscribers = new ConcurrentHashMap<>();
    private final Map<MessageType, Set<AgentType>> routingTable = new ConcurrentHashMap<>();
    private final Deque<DeadLetter> deadLetters = new ArrayDeque<>();

    private final TutorEventPublisher events;
    private final int maxDeadLetters;

    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();
    private final AtomicLong deliveryFailures = new AtomicLong();

    public MessageBus(TutorEventPublisher events, TutorProperties properties) {
        this.events = events;
        this.maxDeadLetters = properties.getBus().getMaxDeadLetters();
        log.info("Initialized MessageBus (maxDeadLetters={})", maxDeadLetters);
    }

    // --------------------------------------------------------------------------------------------
    // Subscriptions
    // --------------------------------------------------------------------------------------------

    /**
     * Register a handler for an agent type. Registering the same pair twice has no effect.
     */
    public void subscribe(AgentType agentType, MessageHandler handler) {
        CopyOnWriteArrayList<MessageHandler> handlers =
                subscribers.computeIfAbsent(agentType, k -> new CopyOnWriteArrayList<>());
        if (handlers.addIfAbsent(handler)) {
            log.debug("Subscribed handler for {}", agentType);
        }
    }

    /**
     * Remove a handler. Unknown pairs are ignored.
     */
    public void unsubscribe(AgentType agentType, MessageHandler handler) {
        List<MessageHandler> handlers = subscribers.get(agentType);
        if (handlers != null && handlers.remove(handler)) {
            log.debug("Unsubscribed handler for {}", agentType);
        }
    }

    public boolean hasSubscriber(AgentType agentType) {
        List<MessageHandler> handlers = subscribers.get(agentType);
        return handlers != null && !handlers.isEmpty();
    }

    // --------------------------------------------------------------------------------------------
    // Delivery
    // --------------------------------------------------------------------------------------------

    /**
     * Deliver a message to the first handler subscribed for its recipient.
     *
     * @return completes once the handler completes; errors with {@link MessageDeliveryException}
     *         when the message was dead-lettered
     */
    public Mono<Void> route(AgentMessage message) {
        return Mono.defer(() -> {
            String invalid = validateEnvelope(message);
            if (invalid != null) {
                return reject(message, DeadLetter.Reason.INVALID_MESSAGE, invalid, null);
            }
            if (!isRouteAllowed(message.getType(), message.getRecipient())) {
                return reject(message, DeadLetter.Reason.ROUTE_NOT_ALLOWED,
                        message.getType() + " may not be sent to " + message.getRecipient(), null);
            }

            MessageHandler handler = firstHandler(message.getRecipient());
            if (handler == null) {
                return reject(message, DeadLetter.Reason.NO_SUBSCRIBER,
                        "No subscriber for " + message.getRecipient(), null);
            }

            return invoke(handler, message)
                    .doOnSuccess(v -> onDelivered(message, message.getRecipient()))
                    .onErrorResume(e -> reject(message, DeadLetter.Reason.HANDLER_FAILED, e.getMessage(), e));
        });
    }

    /**
     * Deliver a message to every subscribed handler except those of the sender's type.
     * A failing handler is dead-lettered without affecting the others.
     */
    public Mono<Void> broadcast(AgentMessage message) {
        return Flux.fromIterable(new ArrayList<>(subscribers.entrySet()))
                .filter(entry -> entry.getKey() != message.getSender())
                .concatMap(entry -> Flux.fromIterable(entry.getValue())
                        .concatMap(handler -> invoke(handler, message)
                                .doOnSuccess(v -> onDelivered(message, entry.getKey()))
                                .onErrorResume(e -> {
                                    recordDeadLetter(message, DeadLetter.Reason.HANDLER_FAILED, e.getMessage());
                                    deliveryFailures.incrementAndGet();
                                    events.publish(TutorEventPublisher.MESSAGE_DELIVERY_FAILED,
                                            "messageId", message.getId(),
                                            "recipient", entry.getKey(),
                                            "type", message.getType(),
                                            "error", e.getMessage());
                                    return Mono.empty();
                                })))
                .then();
    }

    // --------------------------------------------------------------------------------------------
    // Routing table
    // --------------------------------------------------------------------------------------------

    /**
     * Declare which agent types may receive a message type. Types without a rule are unrestricted.
     */
    public void setupRouting(MessageType messageType, Set<AgentType> allowedRecipients) {
        Set<AgentType> allowed = allowedRecipients.isEmpty()
                ? EnumSet.noneOf(AgentType.class)
                : EnumSet.copyOf(allowedRecipients);
        routingTable.put(messageType, allowed);
        log.debug("Routing rule {} -> {}", messageType, allowed);
    }

    public boolean isRouteAllowed(MessageType messageType, AgentType recipient) {
        Set<AgentType> allowed = routingTable.get(messageType);
        return allowed == null || allowed.contains(recipient);
    }

    /**
     * Report gaps in the routing table: message types without a rule, and allowed recipients
     * nobody has subscribed for.
     */
    public List<String> validateRoutingTable() {
        List<String> issues = new ArrayList<>();
        for (MessageType type : MessageType.values()) {
            Set<AgentType> allowed = routingTable.get(type);
            if (allowed == null) {
                issues.add("No routing rule for " + type);
                continue;
            }
            for (AgentType recipient : allowed) {
                if (!hasSubscriber(recipient)) {
                    issues.add(type + " allows " + recipient + " but it has no subscriber");
                }
            }
        }
        return issues;
    }

    // --------------------------------------------------------------------------------------------
    // Inspection
    // --------------------------------------------------------------------------------------------

    public List<DeadLetter> getDeadLetters() {
        synchronized (deadLetters) {
            return List.copyOf(deadLetters);
        }
    }

    public Map<String, Object> getStats() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("delivered", delivered.get());
        stats.put("deadLettered", deadLettered.get());
        stats.put("deliveryFailures", deliveryFailures.get());
        stats.put("subscribedAgentTypes", subscribers.entrySet().stream()
                .filter(e -> !e.getValue().isEmpty())
                .count());
        synchronized (deadLetters) {
            stats.put("storedDeadLetters", deadLetters.size());
        }
        return stats;
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private Mono<Void> invoke(MessageHandler handler, AgentMessage message) {
        return Mono.defer(() -> {
            Mono<Void> result = handler.handle(message);
            return result != null ? result : Mono.<Void>empty();
        });
    }

    private MessageHandler firstHandler(AgentType recipient) {
        if (recipient == null) {
            return null;
        }
        List<MessageHandler> handlers = subscribers.get(recipient);
        if (handlers == null) {
            return null;
        }
        Iterator<MessageHandler> iterator = handlers.iterator();
        return iterator.hasNext() ? iterator.next() : null;
    }

    private void onDelivered(AgentMessage message, AgentType recipient) {
        delivered.incrementAndGet();
        events.publish(TutorEventPublisher.MESSAGE_DELIVERED,
                "messageId", message.getId(),
                "recipient", recipient,
                "type", message.getType());
    }

    private Mono<Void> reject(AgentMessage message, DeadLetter.Reason reason, String detail, Throwable cause) {
        recordDeadLetter(message, reason, detail);
        String messageId = message != null ? message.getId() : null;

        if (reason == DeadLetter.Reason.HANDLER_FAILED) {
            deliveryFailures.incrementAndGet();
            log.warn("Delivery of {} to {} failed: {}", messageId, message.getRecipient(), detail);
            events.publish(TutorEventPublisher.MESSAGE_DELIVERY_FAILED,
                    "messageId", messageId,
                    "recipient", message.getRecipient(),
                    "type", message.getType(),
                    "error", detail);
        } else {
            deadLettered.incrementAndGet();
            log.warn("Dead-lettered message {}: {}", messageId, detail);
            events.publish(TutorEventPublisher.MESSAGE_DEAD_LETTERED,
                    "messageId", messageId,
                    "recipient", message != null ? message.getRecipient() : null,
                    "type", message != null ? message.getType() : null,
                    "reason", reason,
                    "error", detail);
        }
        return Mono.error(new MessageDeliveryException(messageId, reason, detail, cause));
    }

    private void recordDeadLetter(AgentMessage message, DeadLetter.Reason reason, String detail) {
        synchronized (deadLetters) {
            deadLetters.addLast(new DeadLetter(message, reason, detail, Instant.now()));
            while (deadLetters.size() > maxDeadLetters) {
                deadLetters.pollFirst();
            }
        }
    }

    private static String validateEnvelope(AgentMessage message) {
        if (message == null) {
            return "Message is null";
        }
        if (message.getId() == null || message.getId().isBlank()) {
            return "Message id is missing";
        }
        if (message.getTimestamp() == null) {
            return "Message timestamp is missing";
        }
        if (message.getSender() == null) {
            return "Message sender is missing";
        }
        if (message.getType() == null) {
            return "Message type is missing";
        }
        if (message.getPayload() == null) {
            return "Message payload is missing";
        }
        if (message.getRecipient() == null) {
            return "Message recipient is missing; use broadcast for undirected messages";
        }
        return null;
    }
}

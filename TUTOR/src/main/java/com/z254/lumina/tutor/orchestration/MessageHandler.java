package com.z254.lumina.tutor.orchestration;

import com.z254.lumina.tutor.domain.model.AgentMessage;
import reactor.core.publisher.Mono;

/**
 * Consumer of messages delivered by the {@link MessageBus}. A handler signals rejection by
 * returning an error or by throwing.
 */
@FunctionalInterface
public interface MessageHandler {

    Mono<Void> handle(AgentMessage message);
}

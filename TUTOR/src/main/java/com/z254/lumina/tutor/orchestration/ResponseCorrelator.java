package com.z254.lumina.tutor.orchestration;

import com.z254.lumina.tutor.domain.model.AgentMessage;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Matches responses to outstanding requests by correlation id.
 *
 * <p>The listener for a request is registered before the request is sent and removed on the
 * first matching response or when the wait times out. A response that finds no listener is
 * discarded and counted as late.
 */
@Slf4j
public class ResponseCorrelator {

    private final Map<String, Sinks.One<AgentMessage>> pending = new ConcurrentHashMap<>();
    private final AtomicLong lateResponses = new AtomicLong();

    /**
     * Register a listener for {@code correlationId}, run {@code send} and wait for the response.
     *
     * @return the response, a {@link TimeoutException} when none arrives in time, or the send failure
     */
    public Mono<AgentMessage> sendAndAwait(String correlationId, Duration timeout, Mono<Void> send) {
        return Mono.defer(() -> {
            Sinks.One<AgentMessage> sink = Sinks.one();
            if (pending.putIfAbsent(correlationId, sink) != null) {
                return Mono.error(new IllegalStateException("Correlation id already in flight: " + correlationId));
            }
            send.subscribe(null, error -> sink.tryEmitError(error));

            return sink.asMono()
                    .timeout(timeout, Mono.error(() -> new TimeoutException(
                            "No response for " + correlationId + " within " + timeout.toMillis() + "ms")))
                    .doFinally(signal -> pending.remove(correlationId, sink));
        });
    }

    /**
     * Deliver a response to its listener.
     *
     * @return {@code false} when nobody was waiting
     */
    public boolean complete(AgentMessage response) {
        String correlationId = response.getCorrelationId();
        Sinks.One<AgentMessage> sink = correlationId != null ? pending.remove(correlationId) : null;
        if (sink == null) {
            lateResponses.incrementAndGet();
            log.debug("Discarding late or unsolicited response {} from {} (correlation {})",
                    response.getId(), response.getSender(), correlationId);
            return false;
        }
        return sink.tryEmitValue(response).isSuccess();
    }

    public boolean isPending(String correlationId) {
        return pending.containsKey(correlationId);
    }

    public int pendingCount() {
        return pending.size();
    }

    public long getLateResponses() {
        return lateResponses.get();
    }
}

package com.z254.lumina.tutor.observability;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fan-out point for outbound events. Every event is logged, counted and pushed to
 * {@link #events()} subscribers; no ordering guarantee is made across subscribers.
 */
@Component
@Slf4j
public class TutorEventPublisher {

    // Event names
    public static final String AGENT_INITIALIZED = "agent_initialized";
    public static final String AGENT_INIT_FAILED = "agent_init_failed";
    public static final String AGENT_ERROR = "agent_error";
    public static final String AGENT_UNHEALTHY = "agent_unhealthy";
    public static final String HEALTH_CHECK_FAILED = "health_check_failed";
    public static final String MESSAGE_DELIVERED = "message_delivered";
    public static final String MESSAGE_DEAD_LETTERED = "message_dead_lettered";
    public static final String MESSAGE_DELIVERY_FAILED = "message_delivery_failed";
    public static final String QUERY_PROCESSED = "query_processed";
    public static final String QUERY_FAILED = "query_failed";
    public static final String LEARNING_MILESTONE = "learning_milestone";
    public static final String CONCEPT_MASTERED = "concept_mastered";
    public static final String CONFUSION_DETECTED = "confusion_detected";

    private final Sinks.Many<TutorEvent> sink = Sinks.many().multicast().directBestEffort();
    private final StructuredLogger structuredLogger;
    private final MeterRegistry meterRegistry;

    public TutorEventPublisher(StructuredLogger structuredLogger, MeterRegistry meterRegistry) {
        this.structuredLogger = structuredLogger;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Stream of all events emitted after subscription.
     */
    public Flux<TutorEvent> events() {
        return sink.asFlux();
    }

    public Flux<TutorEvent> events(String name) {
        return sink.asFlux().filter(event -> event.name().equals(name));
    }

    /**
     * Publish with alternating key / value arguments. Null values are dropped.
     */
    public void publish(String name, Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs for event " + name);
        }
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            data.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        publish(name, data);
    }

    public void publish(String name, Map<String, Object> data) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        data.forEach((key, value) -> {
            if (value != null) {
                attributes.put(key, value);
            }
        });
        TutorEvent event = new TutorEvent(name, Collections.unmodifiableMap(attributes), Instant.now());

        meterRegistry.counter("tutor.events", "event", name).increment();
        if (MESSAGE_DELIVERED.equals(name)) {
            log.debug("event={} data={}", name, attributes);
        } else {
            structuredLogger.logEvent(name, attributes);
        }
        emit(event);
    }

    private synchronized void emit(TutorEvent event) {
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("Failed to emit event {}: {}", event.name(), result);
        }
    }
}

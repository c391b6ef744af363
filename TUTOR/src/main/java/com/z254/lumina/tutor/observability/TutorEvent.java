package com.z254.lumina.tutor.observability;

import java.time.Instant;
import java.util.Map;

/**
 * Outbound event observable by collaborators and telemetry.
 *
 * @param name      event name, e.g. {@code message_dead_lettered}
 * @param data      event attributes
 * @param timestamp emission time
 */
public record TutorEvent(String name, Map<String, Object> data, Instant timestamp) {

    public Object get(String key) {
        return data.get(key);
    }
}

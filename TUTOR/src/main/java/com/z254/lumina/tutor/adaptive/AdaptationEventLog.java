package com.z254.lumina.tutor.adaptive;

import com.z254.lumina.tutor.domain.model.AdaptationEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only log of modality changes.
 */
@Slf4j
public class AdaptationEventLog {

    private final List<AdaptationEvent> events = new CopyOnWriteArrayList<>();

    public void append(AdaptationEvent event) {
        events.add(event);
        log.debug("Recorded adaptation event: {} {} -> {} (successful={})",
                event.trigger(), event.fromModality(), event.toModality(), event.successful());
    }

    public List<AdaptationEvent> getAll() {
        return List.copyOf(events);
    }

    public List<AdaptationEvent> forUser(String userId) {
        return events.stream()
                .filter(event -> Objects.equals(event.userId(), userId))
                .toList();
    }

    public List<AdaptationEvent> forConcept(String concept) {
        return events.stream()
                .filter(event -> Objects.equals(event.concept(), concept))
                .toList();
    }

    public int size() {
        return events.size();
    }
}

package com.z254.lumina.tutor.domain.model;

import java.time.Instant;

/**
 * Immutable record of a modality change.
 *
 * @param timestamp    when the change happened
 * @param trigger      what caused it
 * @param fromModality modality being left
 * @param toModality   modality being tried or recommended
 * @param concept      concept the content was about
 * @param userId       learner, or {@code null} for anonymous generation
 * @param successful   whether the target modality worked out
 */
public record AdaptationEvent(
        Instant timestamp,
        AdaptationTrigger trigger,
        Modality fromModality,
        Modality toModality,
        String concept,
        String userId,
        boolean successful) {

    public static AdaptationEvent of(AdaptationTrigger trigger, Modality from, Modality to,
                                     String concept, String userId, boolean successful) {
        return new AdaptationEvent(Instant.now(), trigger, from, to, concept, userId, successful);
    }
}

package com.z254.lumina.tutor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A learner's request for content about a concept.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LearningQuery {

    @Builder.Default
    private String id = UUID.randomUUID().toString();

    private String text;

    @Builder.Default
    private Instant timestamp = Instant.now();

    private String userId;

    public static LearningQuery of(String text, String userId) {
        return LearningQuery.builder().text(text).userId(userId).build();
    }
}

package com.z254.lumina.tutor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Observed learner behaviour on a piece of content.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserInteraction {

    private String userId;

    private String sessionId;

    private String contentId;

    @Builder.Default
    private Instant timestamp = Instant.now();

    @Builder.Default
    private InteractionType type = InteractionType.VIEW;

    /**
     * Seconds spent on the content.
     */
    private double timeSpent;

    private Modality modality;

    /**
     * Concept the content covered.
     */
    private String concept;

    private boolean understood;

    /**
     * Whether the learner switched away from this modality manually.
     */
    private boolean switchedModality;

    /**
     * Depth level the learner was at (1 = overview).
     */
    @Builder.Default
    private int depth = 1;
}

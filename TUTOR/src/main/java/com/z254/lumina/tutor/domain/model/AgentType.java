package com.z254.lumina.tutor.domain.model;

import java.util.Arrays;
import java.util.List;

/**
 * Named endpoints on the message bus.
 */
public enum AgentType {

    /**
     * Subject-matter explanations, prerequisites and next steps.
     */
    CONTENT_SPECIALIST,

    /**
     * Learning paths and study plans.
     */
    PEDAGOGY,

    /**
     * Visual content through the adaptive modality engine.
     */
    VISUAL_LEARNING,

    /**
     * Practice questions.
     */
    ASSESSMENT,

    /**
     * Query understanding and the conversational reply.
     */
    CONVERSATION,

    /**
     * Videos and additional materials.
     */
    RESOURCE,

    /**
     * The query coordinator itself.
     */
    ORCHESTRATOR;

    /**
     * Agent types that do work on behalf of the orchestrator.
     */
    public static List<AgentType> workers() {
        return Arrays.stream(values())
                .filter(type -> type != ORCHESTRATOR)
                .toList();
    }
}

package com.z254.lumina.tutor.domain.model;

/**
 * Kinds of learner interaction with delivered content.
 */
public enum InteractionType {
    VIEW,
    PAUSE,
    REPLAY,
    SWITCH_MODALITY,
    GO_DEEPER,
    SIMPLIFY,
    FEEDBACK
}

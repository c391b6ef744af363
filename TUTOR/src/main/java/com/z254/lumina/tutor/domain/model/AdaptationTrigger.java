package com.z254.lumina.tutor.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Why the system (or the learner) moved from one modality to another.
 */
public enum AdaptationTrigger {
    TIME_THRESHOLD,
    CONFUSION_DETECTED,
    MANUAL_SWITCH,
    SYSTEM_SUGGESTION,
    GO_DEEPER,
    SIMPLIFY;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}

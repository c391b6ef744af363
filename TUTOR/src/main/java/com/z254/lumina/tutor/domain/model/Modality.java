package com.z254.lumina.tutor.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Presentation modality for generated learning content.
 */
public enum Modality {
    ANIMATION("animation", 45),
    SIMULATION("simulation", 120),
    THREE_D("3d", 90),
    CONCEPT_MAP("concept-map", 180),
    DIAGRAM("diagram", 30),
    INTERACTIVE("interactive", 90),
    TEXT("text", 15);

    private final String value;
    private final int baseSeconds;

    Modality(String value, int baseSeconds) {
        this.value = value;
        this.baseSeconds = baseSeconds;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Typical time in seconds a learner spends on content of this modality.
     */
    public int getBaseSeconds() {
        return baseSeconds;
    }

    @JsonCreator
    public static Modality fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (Modality modality : values()) {
            if (modality.value.equalsIgnoreCase(value) || modality.name().equalsIgnoreCase(value)) {
                return modality;
            }
        }
        throw new IllegalArgumentException("Unknown modality: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}

package com.z254.lumina.tutor.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Difficulty on the beginner / intermediate / advanced scale, used both for student proficiency
 * and for concept complexity.
 */
public enum DifficultyLevel {
    BEGINNER("beginner", 3),
    INTERMEDIATE("intermediate", 6),
    ADVANCED("advanced", 9);

    private final String value;
    private final int conceptLevel;

    DifficultyLevel(String value, int conceptLevel) {
        this.value = value;
        this.conceptLevel = conceptLevel;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Position of this level on the 1-10 complexity scale.
     */
    public int getConceptLevel() {
        return conceptLevel;
    }

    public DifficultyLevel harder() {
        return this == BEGINNER ? INTERMEDIATE : ADVANCED;
    }

    public DifficultyLevel easier() {
        return this == ADVANCED ? INTERMEDIATE : BEGINNER;
    }

    @JsonCreator
    public static DifficultyLevel fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (DifficultyLevel level : values()) {
            if (level.value.equalsIgnoreCase(value) || level.name().equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown difficulty level: " + value);
    }
}

package com.z254.lumina.tutor.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of reply returned to the student.
 */
public enum ResponseType {
    EXPLANATION,
    QUESTION,
    FEEDBACK,
    ENCOURAGEMENT,
    RESOURCES;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}

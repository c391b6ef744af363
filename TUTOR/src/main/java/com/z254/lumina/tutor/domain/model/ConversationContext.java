package com.z254.lumina.tutor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Context sent with a student query.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationContext {

    /**
     * Conversation session identifier.
     */
    private String sessionId;

    /**
     * Student identifier. Optional; anonymous queries skip per-user adaptation.
     */
    private String userId;

    /**
     * Proficiency of the student.
     */
    @Builder.Default
    private DifficultyLevel studentLevel = DifficultyLevel.INTERMEDIATE;

    /**
     * Learning preferences (preferred modality, detail level, ...).
     */
    @Builder.Default
    private Map<String, Object> preferences = new HashMap<>();

    /**
     * Current topic of the conversation, if known.
     */
    private String currentTopic;

    public DifficultyLevel getStudentLevelOrDefault() {
        return studentLevel != null ? studentLevel : DifficultyLevel.INTERMEDIATE;
    }
}

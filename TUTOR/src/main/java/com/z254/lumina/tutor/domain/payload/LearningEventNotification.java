package com.z254.lumina.tutor.domain.payload;

import java.util.Map;

/**
 * Learning progress signal such as {@code learning_milestone_reached} or {@code concept_mastered}.
 */
public record LearningEventNotification(String event, String userId, Map<String, Object> data)
        implements AgentPayload {

    public LearningEventNotification {
        data = data != null ? Map.copyOf(data) : Map.of();
    }

    @Override
    public Operation operation() {
        return Operation.LEARNING_EVENT;
    }
}

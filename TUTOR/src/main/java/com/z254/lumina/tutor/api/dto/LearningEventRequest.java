package com.z254.lumina.tutor.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Request DTO for learning progress events such as {@code concept_mastered}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LearningEventRequest {

    @NotBlank(message = "Event name is required")
    private String event;

    @Builder.Default
    private Map<String, Object> data = new HashMap<>();
}

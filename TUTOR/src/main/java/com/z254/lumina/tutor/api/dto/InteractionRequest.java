package com.z254.lumina.tutor.api.dto;

import com.z254.lumina.tutor.domain.model.InteractionType;
import com.z254.lumina.tutor.domain.model.Modality;
import com.z254.lumina.tutor.domain.model.UserInteraction;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for recording a learner interaction.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InteractionRequest {

    private String sessionId;

    @NotBlank(message = "Content id is required")
    private String contentId;

    @NotNull(message = "Interaction type is required")
    private InteractionType type;

    @PositiveOrZero(message = "Time spent cannot be negative")
    private double timeSpent;

    @NotNull(message = "Modality is required")
    private Modality modality;

    private String concept;

    private boolean understood;

    private boolean switchedModality;

    @Builder.Default
    @Min(value = 1, message = "Depth starts at 1")
    private int depth = 1;

    public UserInteraction toInteraction(String userId) {
        return UserInteraction.builder()
                .userId(userId)
                .sessionId(sessionId)
                .contentId(contentId)
                .type(type)
                .timeSpent(timeSpent)
                .modality(modality)
                .concept(concept)
                .understood(understood)
                .switchedModality(switchedModality)
                .depth(depth)
                .build();
    }
}

package com.z254.lumina.tutor.api.dto;

import com.z254.lumina.tutor.domain.model.ConceptAnalysis;
import com.z254.lumina.tutor.domain.model.DifficultyLevel;
import com.z254.lumina.tutor.domain.model.LearningQuery;
import com.z254.lumina.tutor.domain.model.Modality;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for adaptive content generation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentRequest {

    @NotBlank(message = "Topic is required")
    @Size(max = 500, message = "Topic must be less than 500 characters")
    private String topic;

    /**
     * Learner wording of the request. Defaults to the topic.
     */
    private String query;

    @Builder.Default
    private DifficultyLevel complexity = DifficultyLevel.INTERMEDIATE;

    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    private Modality suggestedModality;

    @Builder.Default
    private List<String> prerequisites = new ArrayList<>();

    public ConceptAnalysis toAnalysis() {
        return ConceptAnalysis.builder()
                .topic(topic)
                .complexity(complexity != null ? complexity : DifficultyLevel.INTERMEDIATE)
                .keywords(keywords != null ? keywords : new ArrayList<>())
                .suggestedModality(suggestedModality)
                .prerequisites(prerequisites != null ? prerequisites : new ArrayList<>())
                .build();
    }

    public LearningQuery toQuery(String userId) {
        return LearningQuery.of(query != null && !query.isBlank() ? query : topic, userId);
    }
}

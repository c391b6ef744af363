package com.z254.lumina.tutor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of analysing a learning query: the topic and how hard it is.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConceptAnalysis {

    private String topic;

    @Builder.Default
    private DifficultyLevel complexity = DifficultyLevel.INTERMEDIATE;

    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    /**
     * Modality suggested by the analyser, if any. Advisory only.
     */
    private Modality suggestedModality;

    @Builder.Default
    private List<String> prerequisites = new ArrayList<>();
}

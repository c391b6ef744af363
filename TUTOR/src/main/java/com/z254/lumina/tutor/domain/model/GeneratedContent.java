package com.z254.lumina.tutor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Content delivered to the learner after adaptive modality selection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneratedContent {

    private String id;

    private String queryId;

    private Modality modality;

    private Map<String, Object> data;

    private Metadata metadata;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Metadata {
        private String title;
        private String description;
        private int estimatedDurationSeconds;
        private int difficulty;
        @Builder.Default
        private List<String> tags = new ArrayList<>();
    }
}

package com.z254.lumina.tutor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Final answer to a student query, merged from the contributing agents.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TutorResponse {

    private String id;

    @Builder.Default
    private Instant timestamp = Instant.now();

    private ResponseType type;

    private String text;

    @Builder.Default
    private List<Map<String, Object>> visualizations = new ArrayList<>();

    @Builder.Default
    private List<Map<String, Object>> videos = new ArrayList<>();

    @Builder.Default
    private List<Map<String, Object>> assessments = new ArrayList<>();

    @Builder.Default
    private List<Map<String, Object>> resources = new ArrayList<>();

    @Builder.Default
    private List<Map<String, Object>> interactiveElements = new ArrayList<>();

    @Builder.Default
    private List<String> followUpSuggestions = new ArrayList<>();

    @Builder.Default
    private List<String> relatedTopics = new ArrayList<>();

    private Metadata metadata;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Metadata {

        private String requestId;

        @Builder.Default
        private List<AgentType> agentsInvolved = new ArrayList<>();

        /**
         * Agents that were planned but failed or timed out.
         */
        @Builder.Default
        private List<AgentType> failedAgents = new ArrayList<>();

        private double confidence;

        private long processingTimeMs;

        @Builder.Default
        private List<String> sources = new ArrayList<>();

        private boolean degraded;
    }
}

package com.z254.lumina.tutor.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Learner-facing summary of one user's model.
 *
 * @param userId              learner
 * @param totalInteractions   interactions recorded so far
 * @param beliefs             current belief snapshot
 * @param confidenceIntervals Wilson interval on the success rate of each modality
 * @param patterns            observed learning habits
 * @param recentAdaptations   latest adaptation events, newest last
 */
public record UserAnalytics(
        String userId,
        int totalInteractions,
        BayesianBeliefs beliefs,
        Map<Modality, ConfidenceInterval> confidenceIntervals,
        List<LearningPattern> patterns,
        List<AdaptationEvent> recentAdaptations) {
}

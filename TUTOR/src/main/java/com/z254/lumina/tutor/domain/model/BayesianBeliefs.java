package com.z254.lumina.tutor.domain.model;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time copy of one learner's belief state.
 *
 * @param userId               owner of the beliefs
 * @param modalityPreferences  preference weight per modality, each in [0, 1]
 * @param complexityPreference preferred complexity on a 1-10 scale
 * @param successRates         understood / shown per modality, 0.5 when there is no data
 * @param averageTimes         mean seconds to understand per modality
 * @param learningSpeed        pace derived from average times
 * @param lastUpdated          time of the last mutation
 */
public record BayesianBeliefs(
        String userId,
        Map<Modality, Double> modalityPreferences,
        double complexityPreference,
        Map<Modality, Double> successRates,
        Map<Modality, Double> averageTimes,
        LearningSpeed learningSpeed,
        Instant lastUpdated) {

    public BayesianBeliefs {
        modalityPreferences = Map.copyOf(modalityPreferences);
        successRates = Map.copyOf(successRates);
        averageTimes = Map.copyOf(averageTimes);
    }

    public double preference(Modality modality) {
        return modalityPreferences.getOrDefault(modality, 0.0);
    }

    public double successRate(Modality modality) {
        return successRates.getOrDefault(modality, 0.5);
    }

    public double averageTime(Modality modality) {
        return averageTimes.getOrDefault(modality, 60.0);
    }
}

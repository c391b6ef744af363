package com.z254.lumina.tutor.domain.model;

/**
 * Expected result of presenting a concept in a given modality.
 *
 * @param modality            modality being evaluated
 * @param successProbability  chance the learner understands the content
 * @param expectedTimeSeconds expected time to understand
 * @param confidenceLevel     high, medium or low depending on how much data backs the estimate
 */
public record LearningOutcomePrediction(
        Modality modality,
        double successProbability,
        double expectedTimeSeconds,
        String confidenceLevel) {
}

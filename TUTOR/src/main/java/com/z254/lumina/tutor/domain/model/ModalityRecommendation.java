package com.z254.lumina.tutor.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Ranked modality choice for a concept.
 *
 * @param concept             concept the recommendation is for
 * @param recommendedModality highest scoring modality
 * @param confidence          normalised probability of the recommended modality
 * @param reasoning           human readable justification
 * @param fallbacks           next best modalities in order, never containing the recommendation
 * @param probabilities       normalised probability of every modality, summing to 1
 */
public record ModalityRecommendation(
        String concept,
        Modality recommendedModality,
        double confidence,
        String reasoning,
        List<Modality> fallbacks,
        Map<Modality, Double> probabilities) {

    public ModalityRecommendation {
        fallbacks = List.copyOf(fallbacks);
        probabilities = Map.copyOf(probabilities);
    }
}

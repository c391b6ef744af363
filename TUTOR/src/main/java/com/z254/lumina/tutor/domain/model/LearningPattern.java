package com.z254.lumina.tutor.domain.model;

import java.util.List;

/**
 * Observed learner habit with a suggested adjustment.
 */
public record LearningPattern(String pattern, double confidence, List<String> examples, String recommendation) {
}

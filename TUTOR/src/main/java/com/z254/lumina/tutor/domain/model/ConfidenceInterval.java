package com.z254.lumina.tutor.domain.model;

/**
 * Wilson score interval on a modality's success rate.
 */
public record ConfidenceInterval(double lower, double upper) {
}

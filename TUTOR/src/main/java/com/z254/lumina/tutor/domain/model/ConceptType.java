package com.z254.lumina.tutor.domain.model;

/**
 * Coarse shape of a concept, used to weight modalities.
 */
public enum ConceptType {
    PROCESS,
    STRUCTURE,
    SYSTEM,
    RELATIONSHIP
}

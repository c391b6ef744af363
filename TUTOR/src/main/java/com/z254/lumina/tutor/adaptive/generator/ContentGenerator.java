package com.z254.lumina.tutor.adaptive.generator;

import com.z254.lumina.tutor.domain.model.ConceptAnalysis;
import com.z254.lumina.tutor.domain.model.Modality;
import com.z254.lumina.tutor.domain.model.ModalityContent;
import reactor.core.publisher.Mono;

/**
 * Produces content for a single modality. Implementations may fail; the adaptive engine treats
 * a failure as a reason to try the next candidate modality.
 */
public interface ContentGenerator {

    /**
     * @return the modality this generator renders
     */
    Modality modality();

    /**
     * Generate content for the analysed concept.
     *
     * @param analysis topic, complexity and keywords of the concept
     * @return the generated content
     */
    Mono<ModalityContent> generate(ConceptAnalysis analysis);
}

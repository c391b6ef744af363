package com.z254.lumina.tutor.adaptive;

import com.z254.lumina.tutor.domain.model.Modality;
import lombok.Getter;

import java.util.List;

/**
 * Every candidate modality failed for a concept.
 */
@Getter
public class AdaptiveContentException extends RuntimeException {

    private final String concept;
    private final List<Modality> attempted;

    public AdaptiveContentException(String concept, List<Modality> attempted, Throwable lastError) {
        super("Failed to generate content for '" + concept + "' after trying " + attempted, lastError);
        this.concept = concept;
        this.attempted = List.copyOf(attempted);
    }
}

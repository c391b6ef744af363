package com.z254.lumina.tutor.domain.model;

import java.util.Map;

/**
 * Raw output of a content generator for one modality.
 *
 * @param modality modality the content was generated for
 * @param data     renderer-specific content body
 */
public record ModalityContent(Modality modality, Map<String, Object> data) {
}

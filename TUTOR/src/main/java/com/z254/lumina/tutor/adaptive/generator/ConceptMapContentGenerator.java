package com.z254.lumina.tutor.adaptive.generator;

import com.z254.lumina.tutor.domain.model.ConceptAnalysis;
import com.z254.lumina.tutor.domain.model.Modality;
import com.z254.lumina.tutor.domain.model.ModalityContent;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a concept map locally: the topic in the centre, prerequisites pointing in, keywords
 * hanging off it.
 */
@Component
public class ConceptMapContentGenerator implements ContentGenerator {

    @Override
    public Modality modality() {
        return Modality.CONCEPT_MAP;
    }

    @Override
    public Mono<ModalityContent> generate(ConceptAnalysis analysis) {
        return Mono.fromCallable(() -> {
            String topic = analysis.getTopic();
            if (topic == null || topic.isBlank()) {
                throw new IllegalArgumentException("Concept map needs a topic");
            }

            List<Map<String, Object>> nodes = new ArrayList<>();
            List<Map<String, Object>> edges = new ArrayList<>();
            nodes.add(node(topic, "central"));

            for (String prerequisite : analysis.getPrerequisites()) {
                nodes.add(node(prerequisite, "prerequisite"));
                edges.add(edge(prerequisite, topic, "required for"));
            }
            for (String keyword : analysis.getKeywords()) {
                if (keyword.equalsIgnoreCase(topic)) {
                    continue;
                }
                nodes.add(node(keyword, "related"));
                edges.add(edge(topic, keyword, "involves"));
            }

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("nodes", nodes);
            data.put("edges", edges);
            data.put("layout", "radial");
            return new ModalityContent(Modality.CONCEPT_MAP, data);
        });
    }

    private static Map<String, Object> node(String label, String role) {
        return Map.of("id", label.toLowerCase().replace(' ', '-'), "label", label, "role", role);
    }

    private static Map<String, Object> edge(String from, String to, String label) {
        return Map.of("from", from, "to", to, "label", label);
    }
}

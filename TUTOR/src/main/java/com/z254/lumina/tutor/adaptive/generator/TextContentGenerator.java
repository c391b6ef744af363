package com.z254.lumina.tutor.adaptive.generator;

import com.z254.lumina.tutor.client.McpServiceLayer;
import com.z254.lumina.tutor.domain.model.ConceptAnalysis;
import com.z254.lumina.tutor.domain.model.Modality;
import com.z254.lumina.tutor.domain.model.ModalityContent;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plain text explanation. Falls back to an outline built from the analysis when the AI
 * provider fails, so the last link of most fallback chains rarely breaks.
 */
@Component
public class TextContentGenerator implements ContentGenerator {

    private final McpServiceLayer mcpServiceLayer;

    public TextContentGenerator(McpServiceLayer mcpServiceLayer) {
        this.mcpServiceLayer = mcpServiceLayer;
    }

    @Override
    public Modality modality() {
        return Modality.TEXT;
    }

    @Override
    public Mono<ModalityContent> generate(ConceptAnalysis analysis) {
        String prompt = "Explain " + analysis.getTopic() + " to a " + analysis.getComplexity().getValue()
                + " student in a few short paragraphs.";
        return mcpServiceLayer.queryAI(McpServiceLayer.AiProvider.CLAUDE, prompt, Map.of(), null, null)
                .map(answer -> answer.response())
                .onErrorResume(e -> Mono.just(outline(analysis)))
                .map(body -> {
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("body", body);
                    data.put("keywords", analysis.getKeywords());
                    return new ModalityContent(Modality.TEXT, data);
                });
    }

    private static String outline(ConceptAnalysis analysis) {
        StringBuilder text = new StringBuilder(analysis.getTopic());
        if (!analysis.getPrerequisites().isEmpty()) {
            text.append("\nBuilds on: ").append(String.join(", ", analysis.getPrerequisites()));
        }
        if (!analysis.getKeywords().isEmpty()) {
            text.append("\nKey terms: ").append(String.join(", ", analysis.getKeywords()));
        }
        return text.toString();
    }
}

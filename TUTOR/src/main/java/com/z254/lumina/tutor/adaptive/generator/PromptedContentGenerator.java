package com.z254.lumina.tutor.adaptive.generator;

import com.z254.lumina.tutor.client.McpServiceLayer;
import com.z254.lumina.tutor.domain.model.ConceptAnalysis;
import com.z254.lumina.tutor.domain.model.Modality;
import com.z254.lumina.tutor.domain.model.ModalityContent;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generator for modalities without a dedicated renderer. Asks the AI provider for a
 * modality-specific script and hands it to the client as-is.
 */
@Slf4j
public class PromptedContentGenerator implements ContentGenerator {

    private final Modality modality;
    private final McpServiceLayer mcpServiceLayer;

    public PromptedContentGenerator(Modality modality, McpServiceLayer mcpServiceLayer) {
        this.modality = modality;
        this.mcpServiceLayer = mcpServiceLayer;
    }

    @Override
    public Modality modality() {
        return modality;
    }

    @Override
    public Mono<ModalityContent> generate(ConceptAnalysis analysis) {
        String prompt = buildPrompt(analysis);
        Map<String, Object> context = Map.of(
                "modality", modality.getValue(),
                "complexity", analysis.getComplexity().getValue());

        return mcpServiceLayer.queryAI(McpServiceLayer.AiProvider.CLAUDE, prompt, context, null, null)
                .map(answer -> {
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("topic", analysis.getTopic());
                    data.put("script", answer.response());
                    data.put("model", answer.model());
                    return new ModalityContent(modality, data);
                })
                .doOnError(e -> log.debug("Prompted {} generation failed for '{}': {}",
                        modality, analysis.getTopic(), e.getMessage()));
    }

    private String buildPrompt(ConceptAnalysis analysis) {
        String instruction = switch (modality) {
            case ANIMATION -> "Write a step-by-step animation storyboard";
            case SIMULATION -> "Describe an interactive simulation with adjustable parameters";
            case THREE_D -> "Describe a 3D model with labelled parts and camera positions";
            case CONCEPT_MAP -> "List the nodes and labelled relationships of a concept map";
            case DIAGRAM -> "Describe a labelled diagram";
            case INTERACTIVE -> "Design a short interactive exercise";
            case TEXT -> "Write a clear written explanation";
        };
        return instruction + " for a " + analysis.getComplexity().getValue() + " learner about: "
                + analysis.getTopic();
    }
}

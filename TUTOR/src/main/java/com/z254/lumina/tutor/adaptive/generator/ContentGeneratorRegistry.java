package com.z254.lumina.tutor.adaptive.generator;

import com.z254.lumina.tutor.client.McpServiceLayer;
import com.z254.lumina.tutor.domain.model.Modality;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One generator per modality. Modalities without a registered generator get an AI-prompted one.
 */
@Component
@Slf4j
public class ContentGeneratorRegistry {

    private final Map<Modality, ContentGenerator> generators = new EnumMap<>(Modality.class);

    public ContentGeneratorRegistry(List<ContentGenerator> generatorList, McpServiceLayer mcpServiceLayer) {
        for (ContentGenerator generator : generatorList) {
            ContentGenerator previous = generators.put(generator.modality(), generator);
            if (previous != null) {
                throw new IllegalStateException("Duplicate content generator for " + generator.modality());
            }
            log.info("Registered content generator: {}", generator.modality());
        }
        for (Modality modality : Modality.values()) {
            generators.computeIfAbsent(modality, m -> new PromptedContentGenerator(m, mcpServiceLayer));
        }
    }

    public ContentGenerator getGenerator(Modality modality) {
        return generators.get(modality);
    }

    public boolean hasDedicatedGenerator(Modality modality) {
        return !(generators.get(modality) instanceof PromptedContentGenerator);
    }
}

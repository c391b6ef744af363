package com.z254.lumina.tutor.adaptive.generator;

import com.z254.lumina.tutor.client.McpServiceLayer;
import com.z254.lumina.tutor.client.McpServiceLayer.AiProvider;
import com.z254.lumina.tutor.client.McpServiceLayer.AiResponse;
import com.z254.lumina.tutor.domain.model.ConceptAnalysis;
import com.z254.lumina.tutor.domain.model.Modality;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContentGeneratorRegistryTest {

    @Mock
    private McpServiceLayer mcpService;

    @Test
    void shouldCoverEveryModality() {
        // Given
        ContentGeneratorRegistry registry = new ContentGeneratorRegistry(
                List.of(new TextContentGenerator(mcpService), new ConceptMapContentGenerator()), mcpService);

        // When / Then
        for (Modality modality : Modality.values()) {
            assertThat(registry.getGenerator(modality).modality()).isEqualTo(modality);
        }
        assertThat(registry.hasDedicatedGenerator(Modality.TEXT)).isTrue();
        assertThat(registry.hasDedicatedGenerator(Modality.CONCEPT_MAP)).isTrue();
        assertThat(registry.hasDedicatedGenerator(Modality.SIMULATION)).isFalse();
    }

    @Test
    void shouldRejectDuplicateGenerators() {
        // When / Then
        assertThatThrownBy(() -> new ContentGeneratorRegistry(
                List.of(new ConceptMapContentGenerator(), new ConceptMapContentGenerator()), mcpService))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("CONCEPT_MAP");
    }

    @Test
    void shouldPromptForModalitySpecificScript() {
        // Given
        when(mcpService.queryAI(eq(AiProvider.CLAUDE), contains("simulation"), anyMap(), isNull(), isNull()))
                .thenReturn(Mono.just(new AiResponse("Drop two balls of different mass", "claude", 0.9)));
        PromptedContentGenerator generator = new PromptedContentGenerator(Modality.SIMULATION, mcpService);

        // When / Then
        StepVerifier.create(generator.generate(ConceptAnalysis.builder().topic("gravity").build()))
                .assertNext(content -> {
                    assertThat(content.modality()).isEqualTo(Modality.SIMULATION);
                    assertThat(content.data()).containsEntry("topic", "gravity")
                            .containsEntry("script", "Drop two balls of different mass");
                })
                .verifyComplete();
    }

    @Test
    void shouldFallBackToOutlineWhenTextPromptFails() {
        // Given
        when(mcpService.queryAI(any(), anyString(), anyMap(), isNull(), isNull()))
                .thenReturn(Mono.error(new IllegalStateException("provider down")));
        ConceptAnalysis analysis = ConceptAnalysis.builder()
                .topic("sn2")
                .prerequisites(List.of("nucleophile"))
                .keywords(List.of("backside attack"))
                .build();

        // When / Then
        StepVerifier.create(new TextContentGenerator(mcpService).generate(analysis))
                .assertNext(content -> assertThat(content.data().get("body"))
                        .isEqualTo("sn2\nBuilds on: nucleophile\nKey terms: backside attack"))
                .verifyComplete();
    }

    @Test
    void shouldBuildConceptMapLocally() {
        // Given
        ConceptAnalysis analysis = ConceptAnalysis.builder()
                .topic("sn2")
                .prerequisites(List.of("nucleophile"))
                .keywords(List.of("sn2", "inversion"))
                .build();

        // When / Then
        StepVerifier.create(new ConceptMapContentGenerator().generate(analysis))
                .assertNext(content -> {
                    assertThat((List<?>) content.data().get("nodes")).hasSize(3);
                    assertThat(content.data().get("edges"))
                            .asInstanceOf(InstanceOfAssertFactories.LIST)
                            .containsExactly(
                                    Map.of("from", "nucleophile", "to", "sn2", "label", "required for"),
                                    Map.of("from", "sn2", "to", "inversion", "label", "involves"));
                })
                .verifyComplete();
    }

    @Test
    void shouldFailConceptMapWithoutTopic() {
        // When / Then
        StepVerifier.create(new ConceptMapContentGenerator().generate(ConceptAnalysis.builder().build()))
                .expectError(IllegalArgumentException.class)
                .verify();
    }
}

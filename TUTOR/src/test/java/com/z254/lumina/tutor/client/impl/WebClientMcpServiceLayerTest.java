package com.z254.lumina.tutor.client.impl;

import com.z254.lumina.tutor.client.McpServiceLayer;
import com.z254.lumina.tutor.client.McpServiceLayer.AiProvider;
import com.z254.lumina.tutor.client.impl.WebClientMcpServiceLayer.AiCacheKey;
import com.z254.lumina.tutor.config.TutorProperties;
import com.z254.lumina.tutor.domain.model.AgentType;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WebClientMcpServiceLayerTest {

    @Test
    void shouldNotShareCacheKeyBetweenContextsWithEqualHashCodes() {
        // Given
        Map<String, Object> first = Map.of("concept", "Aa");
        Map<String, Object> second = Map.of("concept", "BB");
        assertThat(first.hashCode()).isEqualTo(second.hashCode());

        // When
        AiCacheKey firstKey = AiCacheKey.of(AiProvider.CLAUDE, "Explain", first, "session-1");
        AiCacheKey secondKey = AiCacheKey.of(AiProvider.CLAUDE, "Explain", second, "session-1");

        // Then
        assertThat(firstKey).isNotEqualTo(secondKey);
    }

    @Test
    void shouldKeyOnProviderPromptContextAndConversation() {
        // Given
        Map<String, Object> context = Map.of("concepts", "sn2");

        // When / Then
        assertThat(AiCacheKey.of(AiProvider.CLAUDE, "Explain", context, "session-1"))
                .isEqualTo(AiCacheKey.of(AiProvider.CLAUDE, "Explain", Map.of("concepts", "sn2"), "session-1"))
                .isNotEqualTo(AiCacheKey.of(AiProvider.OPENAI, "Explain", context, "session-1"))
                .isNotEqualTo(AiCacheKey.of(AiProvider.CLAUDE, "Explain", context, "session-2"));
    }

    @Test
    void shouldCopyContextIntoCacheKey() {
        // Given
        Map<String, Object> context = new HashMap<>(Map.of("concepts", "sn2"));
        AiCacheKey key = AiCacheKey.of(AiProvider.CLAUDE, "Explain", context, null);

        // When
        context.put("concepts", "sn1");

        // Then
        assertThat(key.context()).containsEntry("concepts", "sn2");
    }

    @Test
    void shouldAnswerFromStubWithoutBaseUrl() {
        // Given
        WebClientMcpServiceLayer serviceLayer = new WebClientMcpServiceLayer(new TutorProperties());

        // When / Then
        assertThat(serviceLayer.isStubMode()).isTrue();
        StepVerifier.create(serviceLayer.queryAI(AiProvider.CLAUDE, "Explain SN2", Map.of(), null,
                        AgentType.CONVERSATION))
                .assertNext(response -> {
                    assertThat(response.model()).isEqualTo("stub");
                    assertThat(response.confidence()).isEqualTo(0.75);
                })
                .verifyComplete();
        StepVerifier.create(serviceLayer.getHealth())
                .assertNext(health -> assertThat(health.isServiceUp(McpServiceLayer.TOOL_AI_CLAUDE)).isTrue())
                .verifyComplete();
    }
}

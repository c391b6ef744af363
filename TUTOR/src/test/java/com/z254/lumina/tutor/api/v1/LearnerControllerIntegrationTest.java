package com.z254.lumina.tutor.api.v1;

import com.z254.lumina.tutor.api.dto.ApiError;
import com.z254.lumina.tutor.api.dto.ContentRequest;
import com.z254.lumina.tutor.api.dto.InteractionRequest;
import com.z254.lumina.tutor.api.dto.LearningEventRequest;
import com.z254.lumina.tutor.domain.model.GeneratedContent;
import com.z254.lumina.tutor.domain.model.InteractionType;
import com.z254.lumina.tutor.domain.model.Modality;
import com.z254.lumina.tutor.orchestration.TutorOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for {@link LearnerController}.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class LearnerControllerIntegrationTest {

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private TutorOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator.start().block();
    }

    @Nested
    @DisplayName("Adaptive content")
    class ContentTests {

        @Test
        @DisplayName("should generate content and go deeper")
        void generateContentAndGoDeeper() {
            ContentRequest request = ContentRequest.builder().topic("gravity").build();

            GeneratedContent content = webTestClient.post()
                    .uri("/api/v1/learners/{userId}/content", "learner-1")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .exchange()
                    .expectStatus().isCreated()
                    .expectBody(GeneratedContent.class)
                    .returnResult()
                    .getResponseBody();

            assertThat(content).isNotNull();
            assertThat(content.getId()).isNotBlank();
            assertThat(content.getModality()).isNotNull();

            webTestClient.post()
                    .uri("/api/v1/learners/{userId}/content/{contentId}/deeper", "learner-1", content.getId())
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody(GeneratedContent.class)
                    .value(deeper -> {
                        assertThat(deeper.getModality()).isEqualTo(content.getModality());
                        assertThat(deeper.getMetadata().getDifficulty())
                                .isGreaterThan(content.getMetadata().getDifficulty());
                    });

            webTestClient.delete()
                    .uri("/api/v1/learners/{userId}/content/{contentId}/session", "learner-1", content.getId())
                    .exchange()
                    .expectStatus().isNoContent();
        }

        @Test
        @DisplayName("should return 404 for unknown content")
        void unknownContent() {
            webTestClient.post()
                    .uri("/api/v1/learners/{userId}/content/{contentId}/simpler", "learner-1", "missing")
                    .exchange()
                    .expectStatus().isNotFound()
                    .expectBody(ApiError.class)
                    .value(error -> assertThat(error.status()).isEqualTo(404));
        }

        @Test
        @DisplayName("should reject content request without topic")
        void rejectMissingTopic() {
            webTestClient.post()
                    .uri("/api/v1/learners/{userId}/content", "learner-1")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("query", "tell me about gravity"))
                    .exchange()
                    .expectStatus().isBadRequest();
        }
    }

    @Nested
    @DisplayName("Learner model")
    class ModelTests {

        @Test
        @DisplayName("should recommend a modality for a new learner")
        void recommendForNewLearner() {
            webTestClient.get()
                    .uri("/api/v1/learners/{userId}/recommendation?concept=gravity", "learner-2")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.concept").isEqualTo("gravity")
                    .jsonPath("$.recommendedModality").exists()
                    .jsonPath("$.fallbacks").isArray();
        }

        @Test
        @DisplayName("should record interaction and expose analytics")
        void recordInteractionAndAnalytics() {
            InteractionRequest request = InteractionRequest.builder()
                    .contentId("content-1")
                    .type(InteractionType.VIEW)
                    .timeSpent(40)
                    .modality(Modality.DIAGRAM)
                    .concept("sn2")
                    .understood(true)
                    .build();

            webTestClient.post()
                    .uri("/api/v1/learners/{userId}/interactions", "learner-3")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.userId").isEqualTo("learner-3");

            webTestClient.get()
                    .uri("/api/v1/learners/{userId}/analytics", "learner-3")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.totalInteractions").isEqualTo(1)
                    .jsonPath("$.confidenceIntervals").exists();
        }

        @Test
        @DisplayName("should reject negative time spent")
        void rejectNegativeTime() {
            InteractionRequest request = InteractionRequest.builder()
                    .contentId("content-1")
                    .type(InteractionType.VIEW)
                    .timeSpent(-1)
                    .modality(Modality.DIAGRAM)
                    .build();

            webTestClient.post()
                    .uri("/api/v1/learners/{userId}/interactions", "learner-3")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody(ApiError.class)
                    .value(error -> assertThat(error.message()).contains("Time spent cannot be negative"));
        }
    }

    @Test
    @DisplayName("should accept learning events")
    void acceptLearningEvent() {
        LearningEventRequest request = new LearningEventRequest();
        request.setEvent("concept_mastered");
        request.setData(Map.of("concept", "sn2"));

        webTestClient.post()
                .uri("/api/v1/learners/{userId}/events", "learner-4")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .exchange()
                .expectStatus().isAccepted();
    }
}

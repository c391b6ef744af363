package com.z254.lumina.tutor.api.v1;

import com.z254.lumina.tutor.api.dto.ApiError;
import com.z254.lumina.tutor.api.dto.QueryRequest;
import com.z254.lumina.tutor.domain.model.AgentType;
import com.z254.lumina.tutor.domain.model.ConversationContext;
import com.z254.lumina.tutor.domain.model.ResponseType;
import com.z254.lumina.tutor.domain.model.TutorResponse;
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

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for {@link TutorController} with every agent running against the stub service layer.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class TutorControllerIntegrationTest {

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private TutorOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator.start().block();
    }

    @Nested
    @DisplayName("POST /api/v1/tutor/query")
    class QueryTests {

        @Test
        @DisplayName("should answer an explanation question")
        void answerExplanationQuestion() {
            QueryRequest request = QueryRequest.builder()
                    .query("How does SN2 substitution work?")
                    .context(ConversationContext.builder().sessionId("s-1").userId("u-1").build())
                    .build();

            webTestClient.post()
                    .uri("/api/v1/tutor/query")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody(TutorResponse.class)
                    .value(response -> {
                        assertThat(response.getType()).isEqualTo(ResponseType.EXPLANATION);
                        assertThat(response.getText()).isNotBlank();
                        assertThat(response.getMetadata().isDegraded()).isFalse();
                        assertThat(response.getMetadata().getAgentsInvolved())
                                .contains(AgentType.CONVERSATION, AgentType.CONTENT_SPECIALIST);
                        assertThat(response.getMetadata().getRequestId()).startsWith("req_");
                    });
        }

        @Test
        @DisplayName("should reject a blank query")
        void rejectBlankQuery() {
            webTestClient.post()
                    .uri("/api/v1/tutor/query")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(QueryRequest.builder().query(" ").build())
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody(ApiError.class)
                    .value(error -> {
                        assertThat(error.status()).isEqualTo(400);
                        assertThat(error.message()).contains("Query is required");
                        assertThat(error.path()).isEqualTo("/api/v1/tutor/query");
                    });
        }
    }

    @Nested
    @DisplayName("Status endpoints")
    class StatusTests {

        @Test
        @DisplayName("should list every agent")
        void listAgents() {
            webTestClient.get()
                    .uri("/api/v1/tutor/agents")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.length()").isEqualTo(6)
                    .jsonPath("$[0].agentType").isEqualTo("CONTENT_SPECIALIST");
        }

        @Test
        @DisplayName("should report orchestrator statistics")
        void reportStats() {
            webTestClient.get()
                    .uri("/api/v1/tutor/stats")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.started").isEqualTo(true)
                    .jsonPath("$.registeredAgents").isEqualTo(6)
                    .jsonPath("$.bus").exists();
        }

        @Test
        @DisplayName("should list dead letters")
        void listDeadLetters() {
            webTestClient.get()
                    .uri("/api/v1/tutor/dead-letters")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$").isArray();
        }
    }
}

package com.z254.lumina.tutor.orchestration;

import com.z254.lumina.tutor.domain.model.AgentMessage;
import com.z254.lumina.tutor.domain.model.AgentType;
import com.z254.lumina.tutor.domain.model.MessagePriority;
import com.z254.lumina.tutor.domain.payload.ProcessQueryRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseCorrelatorTest {

    private ResponseCorrelator correlator;

    @BeforeEach
    void setUp() {
        correlator = new ResponseCorrelator();
    }

    @Test
    void shouldCompleteWithFirstMatchingResponse() {
        // Given
        AgentMessage first = response("req_1:CONVERSATION:process_query");
        AgentMessage second = response("req_1:CONVERSATION:process_query");

        // When
        Mono<AgentMessage> awaited = correlator.sendAndAwait("req_1:CONVERSATION:process_query",
                Duration.ofSeconds(1),
                Mono.fromRunnable(() -> {
                    correlator.complete(first);
                    correlator.complete(second);
                }));

        // Then
        StepVerifier.create(awaited)
                .expectNext(first)
                .verifyComplete();
        assertThat(correlator.getLateResponses()).isEqualTo(1);
        assertThat(correlator.pendingCount()).isZero();
    }

    @Test
    void shouldTimeOutAndDiscardLateResponse() {
        // Given
        String correlationId = "req_2:ASSESSMENT:generate_question";

        // When
        StepVerifier.create(correlator.sendAndAwait(correlationId, Duration.ofMillis(50), Mono.empty()))
                .expectError(TimeoutException.class)
                .verify();

        // Then
        assertThat(correlator.isPending(correlationId)).isFalse();
        assertThat(correlator.complete(response(correlationId))).isFalse();
        assertThat(correlator.getLateResponses()).isEqualTo(1);
    }

    @Test
    void shouldPropagateSendFailure() {
        // When / Then
        StepVerifier.create(correlator.sendAndAwait("req_3:RESOURCE:find_resources", Duration.ofSeconds(1),
                        Mono.error(new IllegalStateException("no subscriber"))))
                .expectErrorMessage("no subscriber")
                .verify();
        assertThat(correlator.pendingCount()).isZero();
    }

    @Test
    void shouldKeepWaitersWithDifferentIdsApart() {
        // Given
        String explain = "req_4:CONTENT_SPECIALIST:explain_concept";
        String reply = "req_4:CONVERSATION:compose_reply";

        AtomicReference<AgentMessage> explained = new AtomicReference<>();
        correlator.sendAndAwait(explain, Duration.ofSeconds(5), Mono.empty()).subscribe(explained::set);

        // When
        Mono<AgentMessage> replied = correlator.sendAndAwait(reply, Duration.ofSeconds(1),
                Mono.fromRunnable(() -> correlator.complete(response(reply))));

        // Then
        StepVerifier.create(replied)
                .assertNext(message -> assertThat(message.getCorrelationId()).isEqualTo(reply))
                .verifyComplete();
        assertThat(explained.get()).isNull();
        assertThat(correlator.isPending(explain)).isTrue();

        assertThat(correlator.complete(response(explain))).isTrue();
        assertThat(explained.get().getCorrelationId()).isEqualTo(explain);
    }

    private static AgentMessage response(String correlationId) {
        AgentMessage request = AgentMessage.request(AgentType.ORCHESTRATOR, AgentType.CONVERSATION,
                new ProcessQueryRequest("q", null), correlationId, MessagePriority.HIGH);
        return AgentMessage.response(request, new ProcessQueryRequest("q", null));
    }
}

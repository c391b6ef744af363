package com.z254.lumina.tutor.agent;

import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConcurrencyLimiterTest {

    @Test
    void shouldRunWaitingTaskWhenPermitFrees() {
        // Given
        ConcurrencyLimiter limiter = new ConcurrencyLimiter(1);
        Sinks.One<String> first = Sinks.one();
        List<String> started = new CopyOnWriteArrayList<>();
        limiter.run(() -> {
            started.add("first");
            return first.asMono();
        }).subscribe();

        // When
        Mono<String> second = limiter.run(() -> {
            started.add("second");
            return Mono.just("second done");
        });

        // Then
        StepVerifier.create(second)
                .then(() -> {
                    assertThat(started).containsExactly("first");
                    assertThat(limiter.waiting()).isEqualTo(1);
                    first.tryEmitValue("first done");
                })
                .expectNext("second done")
                .verifyComplete();
        assertThat(started).containsExactly("first", "second");
        assertThat(limiter.active()).isZero();
    }

    @Test
    void shouldReleasePermitWhenTaskFails() {
        // Given
        ConcurrencyLimiter limiter = new ConcurrencyLimiter(1);

        // When
        StepVerifier.create(limiter.run(() -> Mono.error(new IllegalStateException("boom"))))
                .expectError(IllegalStateException.class)
                .verify();

        // Then
        assertThat(limiter.active()).isZero();
        StepVerifier.create(limiter.run(() -> Mono.just(1))).expectNext(1).verifyComplete();
    }

    @Test
    void shouldDropCancelledWaiterFromQueue() {
        // Given
        ConcurrencyLimiter limiter = new ConcurrencyLimiter(1);
        Sinks.One<String> first = Sinks.one();
        limiter.run(first::asMono).subscribe();
        List<String> started = new CopyOnWriteArrayList<>();
        Disposable cancelled = limiter.run(() -> {
            started.add("cancelled");
            return Mono.just("never");
        }).subscribe();

        // When
        cancelled.dispose();
        first.tryEmitValue("first done");

        // Then
        assertThat(started).isEmpty();
        assertThat(limiter.waiting()).isZero();
        assertThat(limiter.active()).isZero();
    }

    @Test
    void shouldRejectNonPositiveLimit() {
        assertThatThrownBy(() -> new ConcurrencyLimiter(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

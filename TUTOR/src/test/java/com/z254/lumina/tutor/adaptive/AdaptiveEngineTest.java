package com.z254.lumina.tutor.adaptive;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.lumina.tutor.adaptive.generator.ContentGenerator;
import com.z254.lumina.tutor.adaptive.generator.ContentGeneratorRegistry;
import com.z254.lumina.tutor.client.McpServiceLayer;
import com.z254.lumina.tutor.config.TutorProperties;
import com.z254.lumina.tutor.domain.model.AdaptationEvent;
import com.z254.lumina.tutor.domain.model.AdaptationTrigger;
import com.z254.lumina.tutor.domain.model.ConceptAnalysis;
import com.z254.lumina.tutor.domain.model.DifficultyLevel;
import com.z254.lumina.tutor.domain.model.GeneratedContent;
import com.z254.lumina.tutor.domain.model.InteractionType;
import com.z254.lumina.tutor.domain.model.LearningQuery;
import com.z254.lumina.tutor.domain.model.Modality;
import com.z254.lumina.tutor.domain.model.ModalityContent;
import com.z254.lumina.tutor.domain.model.UserAnalytics;
import com.z254.lumina.tutor.domain.model.UserInteraction;
import com.z254.lumina.tutor.observability.StructuredLogger;
import com.z254.lumina.tutor.observability.TutorEvent;
import com.z254.lumina.tutor.observability.TutorEventPublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class AdaptiveEngineTest {

    private final List<ContentGenerator> generators = new ArrayList<>();
    private TutorProperties properties;
    private TutorEventPublisher events;
    private AdaptiveEngine engine;

    @BeforeEach
    void setUp() {
        properties = new TutorProperties();
        properties.getAdaptive().setGenerationTimeout(Duration.ofMillis(200));
        properties.getAdaptive().setConfusionThreshold(Duration.ofMillis(100));
        events = new TutorEventPublisher(new StructuredLogger(new ObjectMapper().findAndRegisterModules()),
                new SimpleMeterRegistry());
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.shutdown();
        }
    }

    @Test
    void shouldFallBackToAnimationWhenSimulationFails() {
        // Given
        generators.add(new StubGenerator(Modality.SIMULATION, Mono.error(new IllegalStateException("engine down"))));
        generators.add(StubGenerator.succeeding(Modality.ANIMATION));
        engine = newEngine();

        // When
        Mono<GeneratedContent> result = engine.generateAdaptiveContent(
                LearningQuery.of("show me gravity", null), analysis("gravity simulation"), null);

        // Then
        StepVerifier.create(result)
                .assertNext(content -> {
                    assertThat(content.getModality()).isEqualTo(Modality.ANIMATION);
                    assertThat(content.getId()).startsWith("content_");
                    assertThat(content.getMetadata().getTitle()).isEqualTo("Understanding gravity simulation");
                })
                .verifyComplete();

        List<AdaptationEvent> recovered = engine.getAdaptationEvents().stream()
                .filter(AdaptationEvent::successful)
                .toList();
        assertThat(recovered).singleElement().satisfies(event -> {
            assertThat(event.trigger()).isEqualTo(AdaptationTrigger.SYSTEM_SUGGESTION);
            assertThat(event.fromModality()).isEqualTo(Modality.SIMULATION);
            assertThat(event.toModality()).isEqualTo(Modality.ANIMATION);
        });
    }

    @Test
    void shouldTreatSlowGeneratorAsFailure() {
        // Given
        generators.add(new StubGenerator(Modality.SIMULATION, Mono.never()));
        generators.add(StubGenerator.succeeding(Modality.ANIMATION));
        engine = newEngine();

        // When / Then
        StepVerifier.create(engine.generateAdaptiveContent(
                        LearningQuery.of("gravity", null), analysis("gravity"), null))
                .assertNext(content -> assertThat(content.getModality()).isEqualTo(Modality.ANIMATION))
                .verifyComplete();
    }

    @Test
    void shouldAttemptEachCandidateOnceAndFailWhenAllFail() {
        // Given
        AtomicInteger attempts = new AtomicInteger();
        for (Modality modality : List.of(Modality.SIMULATION, Modality.ANIMATION, Modality.THREE_D,
                Modality.DIAGRAM)) {
            generators.add(new StubGenerator(modality, Mono.defer(() -> {
                attempts.incrementAndGet();
                return Mono.error(new IllegalStateException(modality + " down"));
            })));
        }
        engine = newEngine();

        // When / Then
        StepVerifier.create(engine.generateAdaptiveContent(
                        LearningQuery.of("gravity", null), analysis("gravity"), null))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(AdaptiveContentException.class);
                    assertThat(((AdaptiveContentException) e).getAttempted())
                            .containsExactly(Modality.SIMULATION, Modality.ANIMATION, Modality.THREE_D,
                                    Modality.DIAGRAM);
                })
                .verify();
        assertThat(attempts.get()).isEqualTo(4);
        assertThat(engine.getAdaptationEvents()).hasSize(4).noneMatch(AdaptationEvent::successful);
    }

    @Test
    void shouldUsePredictorRankingForKnownUser() {
        // Given
        for (Modality modality : Modality.values()) {
            generators.add(StubGenerator.succeeding(modality));
        }
        engine = newEngine();

        // When / Then
        StepVerifier.create(engine.generateAdaptiveContent(
                        LearningQuery.of("alkenes", "u1"), analysis("alkenes"), "u1"))
                .assertNext(content -> assertThat(content.getModality()).isEqualTo(Modality.ANIMATION))
                .verifyComplete();
        assertThat(engine.getAdaptationEvents()).isEmpty();
    }

    @Test
    void shouldRegenerateDeeperInSameModality() {
        // Given
        generators.add(StubGenerator.succeeding(Modality.ANIMATION));
        engine = newEngine();
        GeneratedContent original = engine.generateAdaptiveContent(
                LearningQuery.of("alkanes", "u1"), analysis("alkane process"), null).block();

        // When / Then
        StepVerifier.create(engine.progressDeeper("u1", original.getId()))
                .assertNext(deeper -> {
                    assertThat(deeper.getModality()).isEqualTo(Modality.ANIMATION);
                    assertThat(deeper.getId()).isNotEqualTo(original.getId());
                    assertThat(deeper.getMetadata().getDifficulty())
                            .isEqualTo(DifficultyLevel.ADVANCED.getConceptLevel());
                })
                .verifyComplete();
        assertThat(engine.getAdaptationEvents())
                .anyMatch(event -> event.trigger() == AdaptationTrigger.GO_DEEPER && event.successful());
    }

    @Test
    void shouldRejectUnknownContent() {
        // Given
        engine = newEngine();

        // When / Then
        StepVerifier.create(engine.goSimpler("u1", "content_missing"))
                .expectError(NoSuchElementException.class)
                .verify();
    }

    @Test
    void shouldBoundDeliveredContent() {
        // Given
        properties.getAdaptive().setMaxDeliveredContent(2);
        generators.add(StubGenerator.succeeding(Modality.ANIMATION));
        engine = newEngine();

        // When
        for (int i = 0; i < 5; i++) {
            engine.generateAdaptiveContent(LearningQuery.of("alkanes", null), analysis("alkane process"), null)
                    .block();
        }

        // Then
        assertThat(engine.deliveredContentCount()).isLessThanOrEqualTo(2);
    }

    @Test
    void shouldRejectRegenerationOfExpiredContent() throws InterruptedException {
        // Given
        properties.getAdaptive().setDeliveredContentTtl(Duration.ofMillis(50));
        generators.add(StubGenerator.succeeding(Modality.ANIMATION));
        engine = newEngine();
        GeneratedContent original = engine.generateAdaptiveContent(
                LearningQuery.of("alkanes", "u1"), analysis("alkane process"), null).block();

        // When
        Thread.sleep(200);

        // Then
        assertThat(engine.getDeliveredContent(original.getId())).isEmpty();
        StepVerifier.create(engine.progressDeeper("u1", original.getId()))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(NoSuchElementException.class)
                        .hasMessageContaining(original.getId()))
                .verify();
    }

    @Test
    void shouldIgnoreReplacedConfusionTimer() {
        // Given
        properties.getAdaptive().setConfusionThreshold(Duration.ofSeconds(30));
        engine = newEngine();
        List<TutorEvent> confusion = new CopyOnWriteArrayList<>();
        events.events(TutorEventPublisher.CONFUSION_DETECTED).subscribe(confusion::add);
        engine.startAdaptiveSession("u1", "content_1");
        Disposable replaced = engine.confusionTimer("u1", "content_1");
        engine.startAdaptiveSession("u1", "content_1");

        // When
        engine.onConfusionTimeout("u1", "content_1", replaced);

        // Then
        assertThat(replaced.isDisposed()).isTrue();
        assertThat(engine.hasActiveSession("u1", "content_1")).isTrue();
        assertThat(confusion).isEmpty();

        engine.stopAdaptiveSession("u1", "content_1");
        assertThat(engine.hasActiveSession("u1", "content_1")).isFalse();
    }

    @Test
    void shouldDetectConfusionWhenTimerExpires() {
        // Given
        generators.add(StubGenerator.succeeding(Modality.ANIMATION));
        engine = newEngine();
        GeneratedContent content = engine.generateAdaptiveContent(
                LearningQuery.of("alkanes", "u1"), analysis("alkane process"), null).block();

        // When / Then
        StepVerifier.create(events.events(TutorEventPublisher.CONFUSION_DETECTED).next())
                .then(() -> engine.startAdaptiveSession("u1", content.getId()))
                .assertNext(event -> {
                    assertThat(event.data()).containsEntry("userId", "u1");
                    assertThat(event.data()).containsEntry("contentId", content.getId());
                    assertThat(event.data()).containsEntry("currentModality", Modality.ANIMATION);
                    assertThat(event.data().get("suggestedModality")).isNotEqualTo(Modality.ANIMATION);
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));
        assertThat(engine.hasActiveSession("u1", content.getId())).isFalse();
    }

    @Test
    void shouldStopTimerWhenContentUnderstood() {
        // Given
        properties.getAdaptive().setConfusionThreshold(Duration.ofSeconds(30));
        engine = newEngine();
        engine.startAdaptiveSession("u1", "content_1");

        // When
        engine.recordUserInteraction(UserInteraction.builder()
                .userId("u1")
                .contentId("content_1")
                .type(InteractionType.VIEW)
                .modality(Modality.DIAGRAM)
                .timeSpent(20)
                .understood(true)
                .build());

        // Then
        assertThat(engine.hasActiveSession("u1", "content_1")).isFalse();
    }

    @Test
    void shouldKeepUserModelsSeparate() {
        // Given
        engine = newEngine();
        engine.recordUserInteraction(UserInteraction.builder()
                .userId("u1")
                .modality(Modality.DIAGRAM)
                .timeSpent(20)
                .understood(true)
                .build());

        // When
        UserAnalytics first = engine.getUserAnalytics("u1");
        UserAnalytics second = engine.getUserAnalytics("u2");

        // Then
        assertThat(first.totalInteractions()).isEqualTo(1);
        assertThat(first.beliefs().preference(Modality.DIAGRAM)).isGreaterThan(0);
        assertThat(second.totalInteractions()).isZero();
        assertThat(second.beliefs().preference(Modality.DIAGRAM)).isZero();
        assertThat(first.confidenceIntervals()).hasSize(Modality.values().length);
    }

    private AdaptiveEngine newEngine() {
        ContentGeneratorRegistry registry = new ContentGeneratorRegistry(generators, mock(McpServiceLayer.class));
        return new AdaptiveEngine(registry, events, properties);
    }

    private static ConceptAnalysis analysis(String topic) {
        return ConceptAnalysis.builder()
                .topic(topic)
                .keywords(List.of(topic))
                .build();
    }

    private record StubGenerator(Modality modality, Mono<ModalityContent> result) implements ContentGenerator {

        static StubGenerator succeeding(Modality modality) {
            return new StubGenerator(modality, Mono.just(new ModalityContent(modality, Map.of("script", "ok"))));
        }

        @Override
        public Mono<ModalityContent> generate(ConceptAnalysis analysis) {
            return result;
        }
    }
}

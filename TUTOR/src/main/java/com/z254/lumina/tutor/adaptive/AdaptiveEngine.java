package com.z254.lumina.tutor.adaptive;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.z254.lumina.tutor.adaptive.generator.ContentGeneratorRegistry;
import com.z254.lumina.tutor.config.TutorProperties;
import com.z254.lumina.tutor.domain.model.AdaptationEvent;
import com.z254.lumina.tutor.domain.model.AdaptationTrigger;
import com.z254.lumina.tutor.domain.model.BayesianBeliefs;
import com.z254.lumina.tutor.domain.model.ConceptAnalysis;
import com.z254.lumina.tutor.domain.model.ConfidenceInterval;
import com.z254.lumina.tutor.domain.model.DifficultyLevel;
import com.z254.lumina.tutor.domain.model.GeneratedContent;
import com.z254.lumina.tutor.domain.model.LearningQuery;
import com.z254.lumina.tutor.domain.model.Modality;
import com.z254.lumina.tutor.domain.model.ModalityContent;
import com.z254.lumina.tutor.domain.model.ModalityRecommendation;
import com.z254.lumina.tutor.domain.model.UserAnalytics;
import com.z254.lumina.tutor.domain.model.UserInteraction;
import com.z254.lumina.tutor.observability.TutorEventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

import static com.z254.lumina.tutor.domain.model.Modality.ANIMATION;
import static com.z254.lumina.tutor.domain.model.Modality.CONCEPT_MAP;
import static com.z254.lumina.tutor.domain.model.Modality.DIAGRAM;
import static com.z254.lumina.tutor.domain.model.Modality.INTERACTIVE;
import static com.z254.lumina.tutor.domain.model.Modality.SIMULATION;
import static com.z254.lumina.tutor.domain.model.Modality.TEXT;
import static com.z254.lumina.tutor.domain.model.Modality.THREE_D;

/**
 * Adaptive content delivery: picks a modality per learner, walks the fallback chain when
 * generation fails, and keeps per-learner models and confusion timers.
 *
 * <p>Each generation attempt moves PENDING → SUCCESS (terminal) or PENDING → ERROR/TIMEOUT → next
 * candidate. A modality is never attempted twice within one call.
 */
@Service
@Slf4j
public class AdaptiveEngine {

    private static final int RECENT_ADAPTATIONS = 20;

    private static final Map<Modality, List<Modality>> STATIC_CHAINS = new EnumMap<>(Modality.class);

    static {
        STATIC_CHAINS.put(ANIMATION, List.of(ANIMATION, SIMULATION, DIAGRAM, TEXT));
        STATIC_CHAINS.put(SIMULATION, List.of(SIMULATION, ANIMATION, THREE_D, DIAGRAM));
        STATIC_CHAINS.put(THREE_D, List.of(THREE_D, ANIMATION, SIMULATION, DIAGRAM));
        STATIC_CHAINS.put(CONCEPT_MAP, List.of(CONCEPT_MAP, DIAGRAM, ANIMATION, TEXT));
        STATIC_CHAINS.put(DIAGRAM, List.of(DIAGRAM, ANIMATION, TEXT));
        STATIC_CHAINS.put(INTERACTIVE, List.of(SIMULATION, ANIMATION, THREE_D, DIAGRAM));
        STATIC_CHAINS.put(TEXT, List.of(TEXT, DIAGRAM));
    }

    private final ContentGeneratorRegistry generatorRegistry;
    private final TutorEventPublisher eventPublisher;
    private final TutorProperties.AdaptiveProperties properties;

    private final Map<String, UserModel> userModels = new ConcurrentHashMap<>();
    private final Map<String, BayesianPredictor> predictors = new ConcurrentHashMap<>();
    private final Cache<String, DeliveredContent> deliveredContent;
    private final Map<String, Disposable> confusionTimers = new ConcurrentHashMap<>();
    private final AdaptationEventLog eventLog = new AdaptationEventLog();

    public AdaptiveEngine(ContentGeneratorRegistry generatorRegistry,
                          TutorEventPublisher eventPublisher,
                          TutorProperties tutorProperties) {
        this.generatorRegistry = generatorRegistry;
        this.eventPublisher = eventPublisher;
        this.properties = tutorProperties.getAdaptive();
        this.deliveredContent = Caffeine.newBuilder()
                .expireAfterAccess(properties.getDeliveredContentTtl())
                .maximumSize(properties.getMaxDeliveredContent())
                .build();
    }

    /**
     * Generate content in the best modality for the learner, falling back through the
     * candidate chain.
     *
     * @param query    the learning query
     * @param analysis concept analysis of the query
     * @param userId   learner, or {@code null} for the static keyword-based choice
     * @return content from the first candidate that succeeded, or
     *         {@link AdaptiveContentException} once every candidate failed
     */
    public Mono<GeneratedContent> generateAdaptiveContent(LearningQuery query, ConceptAnalysis analysis,
                                                          String userId) {
        return Mono.defer(() -> {
            List<Modality> candidates = candidateChain(analysis, userId);
            log.debug("Candidate modalities for '{}': {}", conceptOf(query, analysis), candidates);
            return attempt(query, analysis, userId, candidates, 0, null);
        });
    }

    /**
     * Start the confusion timer for a piece of content. Restarting replaces the previous timer.
     */
    public void startAdaptiveSession(String userId, String contentId) {
        String key = sessionKey(userId, contentId);
        Disposable.Swap timer = Disposables.swap();
        Disposable previous = confusionTimers.put(key, timer);
        if (previous != null) {
            previous.dispose();
        }
        // a timer stopped before this point disposes the subscription straight away
        timer.update(Mono.delay(properties.getConfusionThreshold())
                .subscribe(tick -> onConfusionTimeout(userId, contentId, timer)));
        log.debug("Started adaptive session {} ({}s confusion threshold)", key,
                properties.getConfusionThreshold().toSeconds());
    }

    /**
     * Cancel the confusion timer. Unknown sessions are ignored.
     */
    public void stopAdaptiveSession(String userId, String contentId) {
        Disposable timer = confusionTimers.remove(sessionKey(userId, contentId));
        if (timer != null) {
            timer.dispose();
        }
    }

    public boolean hasActiveSession(String userId, String contentId) {
        return confusionTimers.containsKey(sessionKey(userId, contentId));
    }

    /**
     * Feed an interaction into the learner's model. Understanding the content ends its
     * confusion timer.
     */
    public BayesianBeliefs recordUserInteraction(UserInteraction interaction) {
        String userId = interaction.getUserId();
        Optional<AdaptationEvent> switchEvent = predictorFor(userId).updateBeliefsAfterInteraction(interaction);
        switchEvent.ifPresent(event -> log.debug("User {} switched {} -> {}", userId,
                event.fromModality(), event.toModality()));

        if (interaction.isUnderstood() && interaction.getContentId() != null) {
            stopAdaptiveSession(userId, interaction.getContentId());
        }
        return userModelFor(userId).getBeliefs();
    }

    /**
     * Best-ranked modality other than the one the learner is on.
     */
    public Modality suggestAlternativeModality(String userId, String concept, Modality current) {
        ConceptAnalysis analysis = ConceptAnalysis.builder().topic(concept).build();
        return predictorFor(userId).getRankedRecommendations(concept, analysis).stream()
                .map(ModalityRecommendation::recommendedModality)
                .filter(modality -> modality != current)
                .findFirst()
                .orElse(TEXT);
    }

    /**
     * Regenerate delivered content one complexity step up, in the same modality.
     */
    public Mono<GeneratedContent> progressDeeper(String userId, String contentId) {
        return regenerate(userId, contentId, AdaptationTrigger.GO_DEEPER);
    }

    /**
     * Regenerate delivered content one complexity step down, in the same modality.
     */
    public Mono<GeneratedContent> goSimpler(String userId, String contentId) {
        return regenerate(userId, contentId, AdaptationTrigger.SIMPLIFY);
    }

    public ModalityRecommendation getRecommendation(String userId, String concept, ConceptAnalysis analysis) {
        return predictorFor(userId).predictBestModality(concept, analysis);
    }

    public UserAnalytics getUserAnalytics(String userId) {
        UserModel model = userModelFor(userId);
        BayesianPredictor predictor = predictorFor(userId);

        Map<Modality, ConfidenceInterval> intervals = new EnumMap<>(Modality.class);
        for (Modality modality : Modality.values()) {
            intervals.put(modality, predictor.getConfidenceInterval(modality));
        }
        List<AdaptationEvent> events = eventLog.forUser(userId);
        List<AdaptationEvent> recent = events.subList(Math.max(0, events.size() - RECENT_ADAPTATIONS), events.size());

        return new UserAnalytics(userId, model.getInteractionCount(), model.getBeliefs(), intervals,
                model.getLearningPatterns(), List.copyOf(recent));
    }

    public Optional<GeneratedContent> getDeliveredContent(String contentId) {
        return Optional.ofNullable(deliveredContent.getIfPresent(contentId)).map(DeliveredContent::content);
    }

    public List<AdaptationEvent> getAdaptationEvents() {
        return eventLog.getAll();
    }

    long deliveredContentCount() {
        deliveredContent.cleanUp();
        return deliveredContent.estimatedSize();
    }

    Disposable confusionTimer(String userId, String contentId) {
        return confusionTimers.get(sessionKey(userId, contentId));
    }

    @PreDestroy
    public void shutdown() {
        confusionTimers.values().forEach(Disposable::dispose);
        confusionTimers.clear();
    }

    // ========== Private Methods ==========

    private Mono<GeneratedContent> attempt(LearningQuery query, ConceptAnalysis analysis, String userId,
                                           List<Modality> candidates, int index, Throwable lastError) {
        String concept = conceptOf(query, analysis);
        if (index >= candidates.size()) {
            log.error("All {} candidate modalities failed for '{}'", candidates.size(), concept);
            return Mono.error(new AdaptiveContentException(concept, candidates, lastError));
        }

        Modality primary = candidates.get(0);
        Modality candidate = candidates.get(index);
        Duration timeout = properties.getGenerationTimeout();

        return Mono.defer(() -> generatorRegistry.getGenerator(candidate).generate(analysis))
                .timeout(timeout)
                .map(content -> {
                    if (index > 0) {
                        eventLog.append(AdaptationEvent.of(AdaptationTrigger.SYSTEM_SUGGESTION, primary,
                                candidate, concept, userId, true));
                        log.info("Recovered '{}' with fallback {} after {} failed", concept, candidate, primary);
                    }
                    GeneratedContent generated = toGeneratedContent(query, analysis, content, candidate);
                    deliveredContent.put(generated.getId(), new DeliveredContent(query, analysis, generated, userId));
                    return generated;
                })
                .onErrorResume(e -> {
                    log.warn("Generation with {} failed for '{}': {}", candidate, concept, describe(e, timeout));
                    eventLog.append(AdaptationEvent.of(AdaptationTrigger.SYSTEM_SUGGESTION, primary, candidate,
                            concept, userId, false));
                    return attempt(query, analysis, userId, candidates, index + 1, e);
                });
    }

    private Mono<GeneratedContent> regenerate(String userId, String contentId, AdaptationTrigger trigger) {
        return Mono.defer(() -> {
            DeliveredContent delivered = deliveredContent.getIfPresent(contentId);
            if (delivered == null) {
                return Mono.error(new NoSuchElementException("Unknown content: " + contentId));
            }

            DifficultyLevel current = delivered.analysis().getComplexity();
            DifficultyLevel target = trigger == AdaptationTrigger.GO_DEEPER ? current.harder() : current.easier();
            ConceptAnalysis adjusted = delivered.analysis().toBuilder().complexity(target).build();
            Modality modality = delivered.content().getModality();
            String concept = conceptOf(delivered.query(), adjusted);

            return generatorRegistry.getGenerator(modality).generate(adjusted)
                    .timeout(properties.getGenerationTimeout())
                    .map(content -> {
                        GeneratedContent generated = toGeneratedContent(delivered.query(), adjusted, content, modality);
                        deliveredContent.put(generated.getId(),
                                new DeliveredContent(delivered.query(), adjusted, generated, userId));
                        eventLog.append(AdaptationEvent.of(trigger, modality, modality, concept, userId, true));
                        log.debug("{} on '{}': {} -> {}", trigger, concept, current, target);
                        return generated;
                    })
                    .doOnError(e -> eventLog.append(
                            AdaptationEvent.of(trigger, modality, modality, concept, userId, false)));
        });
    }

    private List<Modality> candidateChain(ConceptAnalysis analysis, String userId) {
        List<Modality> chain;
        if (userId != null) {
            String concept = analysis.getTopic();
            ModalityRecommendation recommendation = predictorFor(userId).predictBestModality(concept, analysis);
            chain = new ArrayList<>();
            chain.add(recommendation.recommendedModality());
            chain.addAll(recommendation.fallbacks());
        } else {
            chain = STATIC_CHAINS.get(staticModality(analysis));
        }

        Set<Modality> distinct = new LinkedHashSet<>(chain);
        return distinct.stream().limit(properties.getMaxCandidates()).toList();
    }

    /**
     * Keyword rules for anonymous queries.
     */
    static Modality staticModality(ConceptAnalysis analysis) {
        String topic = analysis.getTopic() == null ? "" : analysis.getTopic().toLowerCase(Locale.ROOT);
        if (topic.contains("network") || topic.contains("system")) {
            return CONCEPT_MAP;
        }
        if (topic.contains("structure") || topic.contains("dna")) {
            return THREE_D;
        }
        if (topic.contains("process") || topic.contains("cycle")) {
            return ANIMATION;
        }
        if (topic.contains("gravity") || topic.contains("simulation")) {
            return SIMULATION;
        }
        return ANIMATION;
    }

    private GeneratedContent toGeneratedContent(LearningQuery query, ConceptAnalysis analysis,
                                                ModalityContent content, Modality modality) {
        String topic = conceptOf(query, analysis);
        int durationSeconds = (int) Math.round(modality.getBaseSeconds()
                * analysis.getComplexity().getConceptLevel() / (double) DifficultyLevel.INTERMEDIATE.getConceptLevel());

        return GeneratedContent.builder()
                .id("content_" + UUID.randomUUID())
                .queryId(query.getId())
                .modality(modality)
                .data(content.data())
                .metadata(GeneratedContent.Metadata.builder()
                        .title("Understanding " + topic)
                        .description(modality.getValue() + " explanation of " + topic)
                        .estimatedDurationSeconds(durationSeconds)
                        .difficulty(analysis.getComplexity().getConceptLevel())
                        .tags(new ArrayList<>(analysis.getKeywords()))
                        .build())
                .build();
    }

    void onConfusionTimeout(String userId, String contentId, Disposable timer) {
        // only the timer still registered for the session may end it
        if (!confusionTimers.remove(sessionKey(userId, contentId), timer)) {
            log.debug("Ignoring replaced confusion timer for user {} on content {}", userId, contentId);
            return;
        }
        DeliveredContent delivered = deliveredContent.getIfPresent(contentId);
        Modality current = delivered != null ? delivered.content().getModality() : null;
        String concept = delivered != null ? conceptOf(delivered.query(), delivered.analysis()) : null;
        Modality suggested = concept != null ? suggestAlternativeModality(userId, concept, current) : null;

        log.info("Confusion threshold reached for user {} on content {}", userId, contentId);
        eventPublisher.publish(TutorEventPublisher.CONFUSION_DETECTED,
                "userId", userId,
                "contentId", contentId,
                "currentModality", current,
                "suggestedModality", suggested);
    }

    private UserModel userModelFor(String userId) {
        return userModels.computeIfAbsent(userId, UserModel::new);
    }

    private BayesianPredictor predictorFor(String userId) {
        return predictors.computeIfAbsent(userId, id -> new BayesianPredictor(userModelFor(id), eventLog));
    }

    private static String conceptOf(LearningQuery query, ConceptAnalysis analysis) {
        if (analysis.getTopic() != null && !analysis.getTopic().isBlank()) {
            return analysis.getTopic();
        }
        return query.getText();
    }

    private static String sessionKey(String userId, String contentId) {
        return userId + ":" + contentId;
    }

    private static String describe(Throwable e, Duration timeout) {
        if (e instanceof TimeoutException) {
            return "timed out after " + timeout.toMillis() + "ms";
        }
        return e.getMessage();
    }

    private record DeliveredContent(LearningQuery query, ConceptAnalysis analysis, GeneratedContent content,
                                    String userId) {
    }
}

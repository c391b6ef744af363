package com.z254.lumina.tutor.adaptive;

import com.z254.lumina.tutor.domain.model.AdaptationEvent;
import com.z254.lumina.tutor.domain.model.AdaptationTrigger;
import com.z254.lumina.tutor.domain.model.ConceptAnalysis;
import com.z254.lumina.tutor.domain.model.ConceptType;
import com.z254.lumina.tutor.domain.model.ConfidenceInterval;
import com.z254.lumina.tutor.domain.model.DifficultyLevel;
import com.z254.lumina.tutor.domain.model.LearningOutcomePrediction;
import com.z254.lumina.tutor.domain.model.LearningSpeed;
import com.z254.lumina.tutor.domain.model.Modality;
import com.z254.lumina.tutor.domain.model.ModalityRecommendation;
import com.z254.lumina.tutor.domain.model.UserInteraction;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.z254.lumina.tutor.domain.model.Modality.ANIMATION;
import static com.z254.lumina.tutor.domain.model.Modality.CONCEPT_MAP;
import static com.z254.lumina.tutor.domain.model.Modality.DIAGRAM;
import static com.z254.lumina.tutor.domain.model.Modality.INTERACTIVE;
import static com.z254.lumina.tutor.domain.model.Modality.SIMULATION;
import static com.z254.lumina.tutor.domain.model.Modality.TEXT;
import static com.z254.lumina.tutor.domain.model.Modality.THREE_D;

/**
 * Weighted scoring of modalities for one learner.
 *
 * <p>score = prior × (1 + preference) × (1 + conceptTypeWeight) × complexityMatch
 * × (0.5 + successRate) × timeEfficiency, normalised over all modalities. Equal scores keep
 * {@link Modality} declaration order.
 */
@Slf4j
public class BayesianPredictor {

    private static final double Z = 1.96;
    private static final int FALLBACK_COUNT = 3;

    private static final Map<Modality, Double> PRIORS = weights(0.25, 0.20, 0.15, 0.15, 0.15, 0.05, 0.05);

    private static final Map<ConceptType, Map<Modality, Double>> CONCEPT_TYPE_WEIGHTS = Map.of(
            ConceptType.PROCESS, weights(0.40, 0.30, 0.10, 0.10, 0.05, 0.03, 0.02),
            ConceptType.STRUCTURE, weights(0.20, 0.03, 0.40, 0.10, 0.25, 0.01, 0.01),
            ConceptType.SYSTEM, weights(0.10, 0.30, 0.03, 0.40, 0.15, 0.01, 0.01),
            ConceptType.RELATIONSHIP, weights(0.15, 0.10, 0.03, 0.45, 0.25, 0.01, 0.01));

    private static final Map<Modality, Double> COMPLEXITY_BONUS = weights(1.0, 1.1, 1.05, 1.15, 0.95, 1.0, 0.9);

    private static final List<String> PROCESS_KEYWORDS = List.of("process", "flow", "cycle", "reaction", "synthesis");
    private static final List<String> STRUCTURE_KEYWORDS = List.of("structure", "anatomy", "molecule", "dna", "cell", "organ");
    private static final List<String> SYSTEM_KEYWORDS = List.of("system", "network", "organization", "framework");
    private static final List<String> RELATIONSHIP_KEYWORDS = List.of("relationship", "connection", "cause", "effect", "correlation");

    private final UserModel userModel;
    private final AdaptationEventLog eventLog;

    public BayesianPredictor(UserModel userModel, AdaptationEventLog eventLog) {
        this.userModel = userModel;
        this.eventLog = eventLog;
    }

    /**
     * Rank all modalities for a concept and pick the best one plus up to three fallbacks.
     */
    public ModalityRecommendation predictBestModality(String concept, ConceptAnalysis analysis) {
        Map<Modality, Double> probabilities = calculateProbabilities(analysis);
        List<Modality> ranked = rank(probabilities);

        Modality best = ranked.get(0);
        List<Modality> fallbacks = ranked.subList(1, Math.min(ranked.size(), 1 + FALLBACK_COUNT));
        ModalityRecommendation recommendation = new ModalityRecommendation(concept, best, probabilities.get(best),
                generateReasoning(best, analysis), fallbacks, probabilities);

        log.debug("Recommended {} ({}) for '{}' and user {}", best,
                String.format(Locale.ROOT, "%.3f", recommendation.confidence()), concept, userModel.getUserId());
        return recommendation;
    }

    /**
     * Every modality as its own recommendation, best first.
     */
    public List<ModalityRecommendation> getRankedRecommendations(String concept, ConceptAnalysis analysis) {
        Map<Modality, Double> probabilities = calculateProbabilities(analysis);
        return rank(probabilities).stream()
                .map(modality -> new ModalityRecommendation(concept, modality, probabilities.get(modality),
                        generateReasoning(modality, analysis), List.of(), probabilities))
                .toList();
    }

    /**
     * Fold an observed interaction into the learner's beliefs. A manual modality switch is
     * appended to the adaptation log.
     */
    public Optional<AdaptationEvent> updateBeliefsAfterInteraction(UserInteraction interaction) {
        Modality previous = userModel.recordInteraction(interaction);
        if (!interaction.isSwitchedModality()) {
            return Optional.empty();
        }

        Modality to = interaction.getModality();
        AdaptationEvent event = new AdaptationEvent(interaction.getTimestamp(), AdaptationTrigger.MANUAL_SWITCH,
                previous != null ? previous : to, to, interaction.getConcept(), userModel.getUserId(),
                interaction.isUnderstood());
        eventLog.append(event);
        return Optional.of(event);
    }

    /**
     * Wilson score interval on the modality's success rate. [0.2, 0.8] without data.
     */
    public ConfidenceInterval getConfidenceInterval(Modality modality) {
        int n = userModel.getInteractionCount(modality);
        if (n == 0) {
            return new ConfidenceInterval(0.2, 0.8);
        }
        double p = userModel.getSuccessRate(modality);
        double center = p + (Z * Z) / (2 * n);
        double margin = Z * Math.sqrt((p * (1 - p) + (Z * Z) / (4.0 * n)) / n);
        double denominator = 1 + (Z * Z) / n;
        return new ConfidenceInterval(
                Math.max(0, (center - margin) / denominator),
                Math.min(1, (center + margin) / denominator));
    }

    /**
     * @param complexityLevel concept complexity on the 1-10 scale
     */
    public LearningOutcomePrediction predictLearningOutcome(String concept, Modality modality, int complexityLevel) {
        double preference = userModel.getPreference(modality);
        double successRate = userModel.getSuccessRate(modality);
        double averageTime = userModel.getAverageTimeToUnderstand(modality);

        double complexityFactor = Math.max(0.1,
                1 - Math.abs(complexityLevel - userModel.getComplexityPreference()) / 10);
        double successProbability = (preference * 0.4 + successRate * 0.6) * complexityFactor;
        double expectedTime = averageTime * (1 + (complexityLevel - 5) / 10.0);

        int count = userModel.getInteractionCount(modality);
        String confidenceLevel = count >= 10 ? "high" : count >= 3 ? "medium" : "low";
        return new LearningOutcomePrediction(modality, successProbability, expectedTime, confidenceLevel);
    }

    /**
     * Coarse concept type from keywords and topic wording. Defaults to process.
     */
    public static ConceptType inferConceptType(ConceptAnalysis analysis) {
        List<String> keywords = analysis.getKeywords() == null ? List.of() : analysis.getKeywords().stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .toList();
        String topic = analysis.getTopic() == null ? "" : analysis.getTopic().toLowerCase(Locale.ROOT);

        if (matches(keywords, PROCESS_KEYWORDS) || topic.contains("how") || topic.contains("work")) {
            return ConceptType.PROCESS;
        }
        if (matches(keywords, STRUCTURE_KEYWORDS) || topic.contains("structure")) {
            return ConceptType.STRUCTURE;
        }
        if (matches(keywords, SYSTEM_KEYWORDS) || topic.contains("system") || topic.contains("network")) {
            return ConceptType.SYSTEM;
        }
        if (matches(keywords, RELATIONSHIP_KEYWORDS)) {
            return ConceptType.RELATIONSHIP;
        }
        return ConceptType.PROCESS;
    }

    // ========== Private Methods ==========

    private Map<Modality, Double> calculateProbabilities(ConceptAnalysis analysis) {
        ConceptType conceptType = inferConceptType(analysis);
        Map<Modality, Double> conceptWeights = CONCEPT_TYPE_WEIGHTS.get(conceptType);
        double complexityPreference = userModel.getComplexityPreference();
        LearningSpeed speed = userModel.getLearningSpeed();
        DifficultyLevel complexity = analysis.getComplexity() != null
                ? analysis.getComplexity()
                : DifficultyLevel.INTERMEDIATE;

        Map<Modality, Double> scores = new EnumMap<>(Modality.class);
        double total = 0;
        for (Modality modality : Modality.values()) {
            double score = PRIORS.get(modality)
                    * (1 + userModel.getPreference(modality))
                    * (1 + conceptWeights.get(modality))
                    * complexityMatch(complexity, complexityPreference, modality)
                    * (0.5 + userModel.getSuccessRate(modality))
                    * timeEfficiency(modality, speed.getFactor());
            scores.put(modality, score);
            total += score;
        }

        Map<Modality, Double> probabilities = new EnumMap<>(Modality.class);
        for (Map.Entry<Modality, Double> entry : scores.entrySet()) {
            probabilities.put(entry.getKey(), entry.getValue() / total);
        }
        return probabilities;
    }

    private static double complexityMatch(DifficultyLevel complexity, double preference, Modality modality) {
        double levelDifference = Math.abs(complexity.getConceptLevel() - preference);
        double match = Math.max(0.3, 1 - levelDifference / 10);
        return match * COMPLEXITY_BONUS.get(modality);
    }

    private static double timeEfficiency(Modality modality, double learningSpeed) {
        double seconds = modality.getBaseSeconds();
        if (learningSpeed > 1.2) {
            return Math.max(0.5, 2 - seconds / 60);
        }
        if (learningSpeed < 0.8) {
            return Math.min(1.5, 0.5 + seconds / 120);
        }
        return 1.0;
    }

    private String generateReasoning(Modality modality, ConceptAnalysis analysis) {
        double successRate = userModel.getSuccessRate(modality);
        double averageTime = userModel.getAverageTimeToUnderstand(modality);
        double preference = userModel.getPreference(modality);

        List<String> reasons = new ArrayList<>();
        if (successRate > 0.7) {
            reasons.add(String.format(Locale.ROOT, "High success rate (%.0f%%)", successRate * 100));
        }
        if (preference > 0.2) {
            reasons.add(String.format(Locale.ROOT, "Strong user preference (%.0f%%)", preference * 100));
        }
        if (averageTime < 60) {
            reasons.add(String.format(Locale.ROOT, "Quick understanding (avg %.0fs)", averageTime));
        }
        if (analysis.getComplexity() == DifficultyLevel.ADVANCED && (modality == CONCEPT_MAP || modality == SIMULATION)) {
            reasons.add("Handles complex concepts well");
        }
        if (analysis.getComplexity() == DifficultyLevel.BEGINNER && (modality == ANIMATION || modality == DIAGRAM)) {
            reasons.add("Good for introductory concepts");
        }
        if (reasons.isEmpty()) {
            reasons.add("Based on general effectiveness for this concept type");
        }
        return String.join(", ", reasons);
    }

    private static List<Modality> rank(Map<Modality, Double> probabilities) {
        return Arrays.stream(Modality.values())
                .sorted(Comparator.comparing((Modality m) -> probabilities.get(m)).reversed())
                .toList();
    }

    private static boolean matches(List<String> keywords, List<String> indicators) {
        return keywords.stream().anyMatch(k -> indicators.stream().anyMatch(k::contains));
    }

    /**
     * Values in order: animation, simulation, 3d, concept-map, diagram, interactive, text.
     */
    private static Map<Modality, Double> weights(double animation, double simulation, double threeD,
                                                 double conceptMap, double diagram, double interactive,
                                                 double text) {
        Map<Modality, Double> map = new EnumMap<>(Modality.class);
        map.put(ANIMATION, animation);
        map.put(SIMULATION, simulation);
        map.put(THREE_D, threeD);
        map.put(CONCEPT_MAP, conceptMap);
        map.put(DIAGRAM, diagram);
        map.put(INTERACTIVE, interactive);
        map.put(TEXT, text);
        return map;
    }
}

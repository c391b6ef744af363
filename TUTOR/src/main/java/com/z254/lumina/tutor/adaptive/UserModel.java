package com.z254.lumina.tutor.adaptive;

import com.z254.lumina.tutor.domain.model.BayesianBeliefs;
import com.z254.lumina.tutor.domain.model.LearningPattern;
import com.z254.lumina.tutor.domain.model.LearningSpeed;
import com.z254.lumina.tutor.domain.model.Modality;
import com.z254.lumina.tutor.domain.model.UserInteraction;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Belief state of a single learner. All mutation goes through {@link #recordInteraction}, so a
 * model is only ever changed by its own learner's interaction stream.
 */
public class UserModel {

    static final double LEARNING_RATE = 0.1;
    static final double COMPLEXITY_STEP = 0.1;
    static final double DEFAULT_SUCCESS_RATE = 0.5;
    static final double DEFAULT_AVERAGE_TIME = 60.0;
    static final double QUICK_UNDERSTANDING_SECONDS = 60.0;

    private final String userId;
    private final List<UserInteraction> interactions = new ArrayList<>();
    private final Map<Modality, Double> preferences = new EnumMap<>(Modality.class);
    private final Map<Modality, ModalityStats> stats = new EnumMap<>(Modality.class);
    private double complexityPreference = 5.0;
    private Modality lastModality;
    private Instant lastUpdated = Instant.now();

    public UserModel(String userId) {
        this.userId = userId;
        for (Modality modality : Modality.values()) {
            preferences.put(modality, 0.0);
            stats.put(modality, new ModalityStats());
        }
    }

    public String getUserId() {
        return userId;
    }

    /**
     * Record an interaction and update statistics and beliefs.
     *
     * @return the modality the learner was on before this interaction, or {@code null}
     */
    public synchronized Modality recordInteraction(UserInteraction interaction) {
        Modality previous = lastModality;
        Modality modality = interaction.getModality();
        interactions.add(interaction);

        if (modality != null) {
            ModalityStats modalityStats = stats.get(modality);
            modalityStats.count++;
            if (interaction.isUnderstood()) {
                modalityStats.understood++;
                modalityStats.understoodSeconds += interaction.getTimeSpent();
            }
            updatePreference(modality, interaction.isUnderstood());
            lastModality = modality;
        }

        if (interaction.isUnderstood() && interaction.getTimeSpent() < QUICK_UNDERSTANDING_SECONDS) {
            complexityPreference = Math.min(complexityPreference + COMPLEXITY_STEP, 10.0);
        } else if (!interaction.isUnderstood() || interaction.isSwitchedModality()) {
            complexityPreference = Math.max(complexityPreference - COMPLEXITY_STEP, 1.0);
        }

        lastUpdated = Instant.now();
        return previous;
    }

    /**
     * Understood / shown for the modality, 0.5 without data.
     */
    public synchronized double getSuccessRate(Modality modality) {
        ModalityStats modalityStats = stats.get(modality);
        if (modalityStats.count == 0) {
            return DEFAULT_SUCCESS_RATE;
        }
        return (double) modalityStats.understood / modalityStats.count;
    }

    /**
     * Mean seconds over understood interactions, 60 without data.
     */
    public synchronized double getAverageTimeToUnderstand(Modality modality) {
        ModalityStats modalityStats = stats.get(modality);
        if (modalityStats.understood == 0) {
            return DEFAULT_AVERAGE_TIME;
        }
        return modalityStats.understoodSeconds / modalityStats.understood;
    }

    public synchronized int getInteractionCount(Modality modality) {
        return stats.get(modality).count;
    }

    public synchronized int getInteractionCount() {
        return interactions.size();
    }

    public synchronized double getPreference(Modality modality) {
        return preferences.get(modality);
    }

    public synchronized double getComplexityPreference() {
        return complexityPreference;
    }

    public synchronized Modality getLastModality() {
        return lastModality;
    }

    public synchronized LearningSpeed getLearningSpeed() {
        double total = 0;
        int modalitiesWithData = 0;
        for (Modality modality : Modality.values()) {
            if (stats.get(modality).understood > 0) {
                total += getAverageTimeToUnderstand(modality);
                modalitiesWithData++;
            }
        }
        if (modalitiesWithData == 0) {
            return LearningSpeed.NORMAL;
        }
        return LearningSpeed.fromAverageSeconds(total / modalitiesWithData);
    }

    public synchronized BayesianBeliefs getBeliefs() {
        Map<Modality, Double> successRates = new EnumMap<>(Modality.class);
        Map<Modality, Double> averageTimes = new EnumMap<>(Modality.class);
        for (Modality modality : Modality.values()) {
            successRates.put(modality, getSuccessRate(modality));
            averageTimes.put(modality, getAverageTimeToUnderstand(modality));
        }
        return new BayesianBeliefs(userId, preferences, complexityPreference, successRates, averageTimes,
                getLearningSpeed(), lastUpdated);
    }

    /**
     * Difficulty of a concept for this learner on a 1-10 scale: slower understanding, modality
     * switches and never understanding all push it up. 5 without data.
     */
    public synchronized double getConceptDifficultyRating(String concept) {
        String key = concept.toLowerCase(Locale.ROOT);
        List<UserInteraction> related = interactions.stream()
                .filter(i -> i.getConcept() != null && i.getConcept().toLowerCase(Locale.ROOT).contains(key))
                .toList();
        if (related.isEmpty()) {
            return 5.0;
        }

        double averageTime = related.stream().mapToDouble(UserInteraction::getTimeSpent).average().orElse(0);
        double difficulty = Math.min(Math.max(averageTime / 30, 1), 10);
        if (related.stream().anyMatch(UserInteraction::isSwitchedModality)) {
            difficulty += 2;
        }
        if (related.stream().noneMatch(UserInteraction::isUnderstood)) {
            difficulty += 3;
        }
        return Math.min(difficulty, 10);
    }

    public synchronized List<LearningPattern> getLearningPatterns() {
        List<LearningPattern> patterns = new ArrayList<>();

        Modality preferred = null;
        double bestRate = -1;
        int bestCount = 0;
        for (Modality modality : Modality.values()) {
            ModalityStats modalityStats = stats.get(modality);
            if (modalityStats.count >= 2 && getSuccessRate(modality) > bestRate) {
                preferred = modality;
                bestRate = getSuccessRate(modality);
                bestCount = modalityStats.count;
            }
        }
        if (preferred != null && bestRate > 0.7) {
            patterns.add(new LearningPattern(
                    "Prefers " + preferred + " modality",
                    bestRate,
                    List.of(String.format(Locale.ROOT, "Success rate: %.0f%%", bestRate * 100),
                            "Used " + bestCount + " times"),
                    "Continue using " + preferred + " as primary modality"));
        }

        double averageTime = interactions.stream().mapToDouble(UserInteraction::getTimeSpent).average()
                .orElse(DEFAULT_AVERAGE_TIME);
        long level = Math.round(Math.max(1, Math.min(10, complexityPreference)));
        patterns.add(new LearningPattern(
                "Works best with complexity level " + level,
                0.8,
                List.of(String.format(Locale.ROOT, "Average time per concept: %.0fs", averageTime)),
                "Start with complexity " + level + " and adapt based on performance"));

        LearningSpeed speed = LearningSpeed.fromAverageSeconds(averageTime);
        String recommendation = switch (speed) {
            case FAST -> "Can handle more complex concepts and faster pacing";
            case SLOW -> "Benefit from more detailed explanations and practice time";
            case NORMAL -> "Current pacing works well, continue with balanced approach";
        };
        patterns.add(new LearningPattern(
                speed.name().toLowerCase(Locale.ROOT) + " learner",
                0.8,
                List.of(String.format(Locale.ROOT, "Average time per concept: %.0fs", averageTime)),
                recommendation));

        return patterns;
    }

    private void updatePreference(Modality modality, boolean understood) {
        double current = preferences.get(modality);
        double updated = understood
                ? current + LEARNING_RATE * (1 - current)
                : current - LEARNING_RATE * current;
        preferences.put(modality, Math.max(0.0, Math.min(1.0, updated)));
    }

    private static final class ModalityStats {
        private int count;
        private int understood;
        private double understoodSeconds;
    }
}

package com.z254.lumina.tutor.domain.model;

/**
 * Learning pace derived from the average time a learner needs to understand content.
 */
public enum LearningSpeed {
    FAST(1.5),
    NORMAL(1.0),
    SLOW(0.6);

    private final double factor;

    LearningSpeed(double factor) {
        this.factor = factor;
    }

    /**
     * Speed as a multiplier; above 1.2 is fast, below 0.8 is slow.
     */
    public double getFactor() {
        return factor;
    }

    public static LearningSpeed fromAverageSeconds(double averageSeconds) {
        if (averageSeconds < 45) {
            return FAST;
        }
        if (averageSeconds > 90) {
            return SLOW;
        }
        return NORMAL;
    }
}

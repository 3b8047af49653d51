package com.crowdsentinel.core.model;

/**
 * Discrete crowd alert levels, totally ordered from {@link #GREEN} to
 * {@link #RED}.
 *
 * @since 1.0.0
 */
public enum AlertLevel {

    /** Normal operations. */
    GREEN,

    /** Elevated risk. Increase monitoring. */
    YELLOW,

    /** High risk. Prepare crowd-control measures. */
    ORANGE,

    /** Critical risk. Intervene immediately. */
    RED;

    /**
     * @param other level to compare against
     * @return {@code true} if this level is strictly above {@code other}
     */
    public boolean isAbove(AlertLevel other) {
        return compareTo(other) > 0;
    }

    /**
     * Raw target level for a score: the highest level whose rising threshold
     * is less than or equal to {@code score}.
     *
     * @param score            risk score in [0,1]
     * @param risingThresholds enter-Yellow, enter-Orange and enter-Red
     *                         thresholds, in that order
     * @return the target level, {@link #GREEN} if no threshold is reached
     * @throws IllegalArgumentException if three thresholds are not supplied
     */
    public static AlertLevel fromScore(double score, double[] risingThresholds) {
        if (risingThresholds == null || risingThresholds.length != 3) {
            throw new IllegalArgumentException("Exactly three rising thresholds are required");
        }
        AlertLevel level = GREEN;
        for (int i = 0; i < risingThresholds.length; i++) {
            if (score >= risingThresholds[i]) {
                level = values()[i + 1];
            }
        }
        return level;
    }
}

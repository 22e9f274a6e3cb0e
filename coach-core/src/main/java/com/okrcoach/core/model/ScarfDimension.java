package com.okrcoach.core.model;

/**
 * Level of a single SCARF dimension (status, certainty, autonomy, relatedness, fairness).
 * Each level carries the score it contributes to learning capacity.
 */
public enum ScarfDimension {
    ELEVATED(1.0),
    MAINTAINED(0.8),
    NEUTRAL(0.5),
    THREATENED(0.2);

    private final double score;

    ScarfDimension(double score) {
        this.score = score;
    }

    public double score() {
        return score;
    }
}

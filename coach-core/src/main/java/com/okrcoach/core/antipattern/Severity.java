package com.okrcoach.core.antipattern;

/**
 * Anti-pattern severity. {@code rank} orders patterns; {@code confidenceBonus} is added
 * to every detection of a pattern at this severity.
 */
public enum Severity {
    LOW(1, 0.0),
    MEDIUM(2, 0.05),
    HIGH(3, 0.10),
    CRITICAL(4, 0.15);

    private final int rank;
    private final double confidenceBonus;

    Severity(int rank, double confidenceBonus) {
        this.rank = rank;
        this.confidenceBonus = confidenceBonus;
    }

    public int rank() {
        return rank;
    }

    public double confidenceBonus() {
        return confidenceBonus;
    }

    public static Severity max(Severity a, Severity b) {
        return a.rank >= b.rank ? a : b;
    }
}

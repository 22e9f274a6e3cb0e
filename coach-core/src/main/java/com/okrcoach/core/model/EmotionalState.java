package com.okrcoach.core.model;

/**
 * Coarse affective state of the user, derived from SCARF signals.
 *
 * <ul>
 *   <li>{@link #REWARD}: engaged, open to stretch and challenge.</li>
 *   <li>{@link #NEUTRAL}: default working state.</li>
 *   <li>{@link #THREAT}: defensive; interventions must be immediate and safe.</li>
 * </ul>
 */
public enum EmotionalState {
    REWARD,
    NEUTRAL,
    THREAT
}

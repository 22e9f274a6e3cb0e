package com.okrcoach.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * User readiness for the current turn: affective state, SCARF levels and the
 * learning capacity derived from them.
 *
 * <h3>Derivation ({@link #fromScarf})</h3>
 * <ul>
 *   <li>two or more threatened dimensions → {@link EmotionalState#THREAT}</li>
 *   <li>three or more elevated dimensions → {@link EmotionalState#REWARD}</li>
 *   <li>otherwise → {@link EmotionalState#NEUTRAL}</li>
 * </ul>
 * Learning capacity is the weighted mean of the dimension scores scaled to 0–100.
 */
public record NeuralReadinessState(
    @JsonProperty("currentState")     EmotionalState currentState,
    @JsonProperty("scarfState")       ScarfState scarfState,
    @JsonProperty("learningCapacity") int learningCapacity
) {

    public static final double STATUS_WEIGHT      = 0.20;
    public static final double CERTAINTY_WEIGHT   = 0.30;
    public static final double AUTONOMY_WEIGHT    = 0.25;
    public static final double RELATEDNESS_WEIGHT = 0.15;
    public static final double FAIRNESS_WEIGHT    = 0.10;

    public NeuralReadinessState {
        currentState = currentState != null ? currentState : EmotionalState.NEUTRAL;
        scarfState   = scarfState   != null ? scarfState   : ScarfState.neutral();
    }

    public static NeuralReadinessState neutral() {
        return fromScarf(ScarfState.neutral());
    }

    public static NeuralReadinessState fromScarf(ScarfState scarf) {
        ScarfState s = scarf != null ? scarf : ScarfState.neutral();
        return new NeuralReadinessState(deriveEmotionalState(s), s, learningCapacity(s));
    }

    static EmotionalState deriveEmotionalState(ScarfState s) {
        long threatened = s.dimensions().stream().filter(d -> d == ScarfDimension.THREATENED).count();
        long elevated   = s.dimensions().stream().filter(d -> d == ScarfDimension.ELEVATED).count();
        if (threatened >= 2) return EmotionalState.THREAT;
        if (elevated >= 3)   return EmotionalState.REWARD;
        return EmotionalState.NEUTRAL;
    }

    static int learningCapacity(ScarfState s) {
        double weighted = s.status().score()      * STATUS_WEIGHT
                        + s.certainty().score()   * CERTAINTY_WEIGHT
                        + s.autonomy().score()    * AUTONOMY_WEIGHT
                        + s.relatedness().score() * RELATEDNESS_WEIGHT
                        + s.fairness().score()    * FAIRNESS_WEIGHT;
        return (int) Math.round(weighted * 100);
    }
}

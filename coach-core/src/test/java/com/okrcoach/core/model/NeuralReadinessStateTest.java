package com.okrcoach.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link NeuralReadinessState#fromScarf}.
 */
class NeuralReadinessStateTest {

    private static ScarfState scarf(ScarfDimension s, ScarfDimension c, ScarfDimension a,
                                    ScarfDimension r, ScarfDimension f) {
        return new ScarfState(s, c, a, r, f);
    }

    @Test
    @DisplayName("null SCARF → neutral state, capacity 50")
    void nullScarf_isNeutral() {
        NeuralReadinessState state = NeuralReadinessState.fromScarf(null);
        assertEquals(EmotionalState.NEUTRAL, state.currentState());
        assertEquals(50, state.learningCapacity());
    }

    @Test
    @DisplayName("all dimensions elevated → REWARD, capacity 100")
    void allElevated_isReward() {
        NeuralReadinessState state = NeuralReadinessState.fromScarf(scarf(
            ScarfDimension.ELEVATED, ScarfDimension.ELEVATED, ScarfDimension.ELEVATED,
            ScarfDimension.ELEVATED, ScarfDimension.ELEVATED));
        assertEquals(EmotionalState.REWARD, state.currentState());
        assertEquals(100, state.learningCapacity());
    }

    @Test
    @DisplayName("two threatened dimensions → THREAT even with three elevated")
    void twoThreatened_winsOverElevated() {
        NeuralReadinessState state = NeuralReadinessState.fromScarf(scarf(
            ScarfDimension.THREATENED, ScarfDimension.THREATENED, ScarfDimension.ELEVATED,
            ScarfDimension.ELEVATED, ScarfDimension.ELEVATED));
        assertEquals(EmotionalState.THREAT, state.currentState());
    }

    @Test
    @DisplayName("one threatened dimension → NEUTRAL")
    void oneThreatened_isNeutral() {
        NeuralReadinessState state = NeuralReadinessState.fromScarf(scarf(
            ScarfDimension.THREATENED, null, null, null, null));
        assertEquals(EmotionalState.NEUTRAL, state.currentState());
        // 0.2*0.2 + 0.5*0.8 = 0.44
        assertEquals(44, state.learningCapacity());
    }
}

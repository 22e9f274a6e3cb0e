package com.okrcoach.core.habit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link HabitReinforcementEngine}.
 */
class HabitReinforcementEngineTest {

    private static final Instant NOW = Instant.parse("2026-01-05T10:00:00Z");
    private final HabitReinforcementEngine engine = new HabitReinforcementEngine(Clock.fixed(NOW, ZoneOffset.UTC));

    private HabitTracker performed(CoreHabit habit, int times) {
        HabitTracker t = HabitTracker.start(habit);
        for (int i = 0; i < times; i++) {
            t = engine.recordPerformance(t, true);
        }
        return t;
    }

    @Nested
    @DisplayName("initializeHabit() — ids and concept aliases")
    class InitializeTests {

        @Test
        @DisplayName("concept alias → mapped core habit")
        void conceptAlias() {
            assertEquals(CoreHabit.MEASURABILITY_CHECK, engine.initializeHabit("baseline_and_target").orElseThrow().habit());
            assertEquals(CoreHabit.OUTCOME_THINKING, engine.initializeHabit("outcome_thinking").orElseThrow().habit());
        }

        @Test
        @DisplayName("unknown concept → empty")
        void unknown() {
            assertTrue(engine.initializeHabit("juggling").isEmpty());
            assertTrue(engine.initializeHabit(null).isEmpty());
        }

        @Test
        @DisplayName("core habits → five fresh trackers")
        void coreHabits() {
            List<HabitTracker> all = engine.initializeCoreHabits();
            assertEquals(5, all.size());
            all.forEach(h -> {
                assertEquals(0, h.repetitionCount());
                assertEquals(ReinforcementSchedule.CONTINUOUS, h.schedule());
            });
        }
    }

    @Nested
    @DisplayName("detectPerformance() — habit signals in user text")
    class DetectTests {

        @Test
        @DisplayName("baseline and target → measurability performed")
        void measurability() {
            HabitTracker h = HabitTracker.start(CoreHabit.MEASURABILITY_CHECK);
            assertTrue(engine.detectPerformance("Currently 20%, target 35%", h));
            assertFalse(engine.detectPerformance("We'll measure it", h));
        }

        @Test
        @DisplayName("stakeholder plus alignment verb → stakeholder thinking")
        void stakeholder() {
            HabitTracker h = HabitTracker.start(CoreHabit.STAKEHOLDER_THINKING);
            assertTrue(engine.detectPerformance("I'll align with leadership before sharing", h));
            assertFalse(engine.detectPerformance("Leadership is busy", h));
        }

        @Test
        @DisplayName("blank text → not performed")
        void blank() {
            assertFalse(engine.detectPerformance("", HabitTracker.start(CoreHabit.OUTCOME_THINKING)));
        }
    }

    @Nested
    @DisplayName("recordPerformance() — repetitions, automaticity, schedule")
    class RecordTests {

        @Test
        @DisplayName("nine repetitions → still conscious effort")
        void nineReps() {
            HabitTracker h = performed(CoreHabit.OUTCOME_THINKING, 9);
            assertEquals(0.9, h.consistencyScore(), 1e-9);
            assertEquals(Automaticity.CONSCIOUS_EFFORT, h.automaticity());
            assertEquals(NOW, h.lastPerformed());
        }

        @Test
        @DisplayName("ten repetitions → occasionally automatic")
        void tenReps() {
            HabitTracker h = performed(CoreHabit.OUTCOME_THINKING, 10);
            assertEquals(1.0, h.consistencyScore(), 1e-9);
            assertEquals(Automaticity.OCCASIONAL_AUTOMATIC, h.automaticity());
        }

        @Test
        @DisplayName("not performed → repetitions unchanged")
        void notPerformed() {
            HabitTracker h = engine.recordPerformance(HabitTracker.start(CoreHabit.OUTCOME_THINKING), false);
            assertEquals(0, h.repetitionCount());
            assertNull(h.lastPerformed());
        }

        @Test
        @DisplayName("21 repetitions → intermittent, every third celebrated")
        void intermittent() {
            HabitTracker h21 = performed(CoreHabit.ALTITUDE_AWARENESS, 21);
            assertEquals(ReinforcementSchedule.INTERMITTENT, h21.schedule());
            assertEquals(HabitReinforcementEngine.INTERMITTENT_FREQUENCY, h21.celebrationFrequency());
            assertTrue(engine.shouldCelebrate(h21));

            HabitTracker h22 = engine.recordPerformance(h21, true);
            assertFalse(engine.shouldCelebrate(h22));
        }

        @Test
        @DisplayName("continuous schedule → always celebrate")
        void continuous() {
            assertTrue(engine.shouldCelebrate(performed(CoreHabit.ALTITUDE_AWARENESS, 5)));
        }
    }

    @Nested
    @DisplayName("generateCelebration() / progressSummary()")
    class PresentationTests {

        @Test
        @DisplayName("first performance → first-time message with reward")
        void firstTime() {
            String text = engine.generateCelebration(performed(CoreHabit.MEASURABILITY_CHECK, 1));
            assertTrue(text.startsWith("🎯 Measurability Check! First time!"), text);
            assertTrue(text.contains("Perfectly measurable!"), text);
        }

        @Test
        @DisplayName("tenth performance → milestone and automaticity line")
        void tenth() {
            String text = engine.generateCelebration(performed(CoreHabit.MEASURABILITY_CHECK, 10));
            assertTrue(text.contains("10 times! Keep going!"), text);
            assertTrue(text.contains("Starting to become automatic!"), text);
        }

        @Test
        @DisplayName("summary lists every habit with its bar")
        void summary() {
            String text = engine.progressSummary(List.of(
                performed(CoreHabit.OUTCOME_THINKING, 20), HabitTracker.start(CoreHabit.ANTIPATTERN_SCAN)));
            assertTrue(text.startsWith("**Habit Formation Progress:**"), text);
            assertTrue(text.contains("Outcome-Focused Thinking: ▓▓▒▒ (Developing) (20 times)"), text);
            assertTrue(text.contains("Anti-Pattern Scanning: ▓▒▒▒ (Forming) (0 times)"), text);
            assertTrue(text.contains("Great progress!"), text);
            assertEquals("", engine.progressSummary(List.of()));
        }
    }
}

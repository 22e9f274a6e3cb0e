package com.okrcoach.core.habit;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Repetition and automaticity bookkeeping for one core habit.
 */
public record HabitTracker(
    @JsonProperty("habit")                CoreHabit habit,
    @JsonProperty("repetitionCount")      int repetitionCount,
    @JsonProperty("consistencyScore")     double consistencyScore,
    @JsonProperty("automaticity")         Automaticity automaticity,
    @JsonProperty("lastPerformed")        Instant lastPerformed,
    @JsonProperty("schedule")             ReinforcementSchedule schedule,
    @JsonProperty("celebrationFrequency") int celebrationFrequency
) {

    public static HabitTracker start(CoreHabit habit) {
        return new HabitTracker(habit, 0, 0.0, Automaticity.CONSCIOUS_EFFORT, null,
            ReinforcementSchedule.CONTINUOUS, 1);
    }

    public String habitId() {
        return habit.id();
    }
}

package com.okrcoach.core.habit;

import com.okrcoach.core.text.TextSignals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.okrcoach.core.text.TextSignals.containsAny;

/**
 * Detects and reinforces the five core OKR-writing habits.
 *
 * <p>Consistency is the share of a ten-performance window that has been filled. Reinforcement
 * is continuous until {@value #INTERMITTENT_AFTER} repetitions, then every
 * {@value #INTERMITTENT_FREQUENCY}rd performance is celebrated.
 */
public class HabitReinforcementEngine {

    private static final Logger log = LoggerFactory.getLogger(HabitReinforcementEngine.class);

    public static final int CONSISTENCY_WINDOW     = 10;
    public static final int INTERMITTENT_AFTER     = 21;
    public static final int INTERMITTENT_FREQUENCY = 3;
    public static final int FORMATION_TARGET       = 66;

    private final Clock clock;

    public HabitReinforcementEngine(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Optional<HabitTracker> initializeHabit(String conceptOrId) {
        return CoreHabit.resolve(conceptOrId).map(HabitTracker::start);
    }

    public List<HabitTracker> initializeCoreHabits() {
        return Arrays.stream(CoreHabit.values()).map(HabitTracker::start).toList();
    }

    public boolean detectPerformance(String message, HabitTracker habit) {
        String m = TextSignals.normalize(message);
        if (m.isBlank()) return false;
        return switch (habit.habit()) {
            case OUTCOME_THINKING -> containsAny(m,
                "achieve", "reach", "become", "improve", "increase", "decrease", "transform", "enable");
            case ALTITUDE_AWARENESS -> containsAny(m,
                "team", "initiative", "project", "department", "my role", "my level",
                "appropriate for", "right scope", "my influence", "can control", "responsible for");
            case MEASURABILITY_CHECK -> {
                int elements = (containsAny(m, "currently", "baseline", "from", "starting at") ? 1 : 0)
                    + (containsAny(m, "target", "to", "reach", "goal") ? 1 : 0)
                    + (containsAny(m, "measure", "track", "metric") ? 1 : 0);
                yield elements >= 2;
            }
            case ANTIPATTERN_SCAN -> containsAny(m,
                "not a project", "not an activity", "not too vague", "not too specific",
                "within my control", "in my influence", "not business as usual", "not bau");
            case STAKEHOLDER_THINKING -> containsAny(m, "stakeholder", "leadership", "partner", "customer", "team")
                && containsAny(m, "align", "buy-in", "support", "communicate", "share with");
        };
    }

    public HabitTracker recordPerformance(HabitTracker habit, boolean performed) {
        int reps = performed ? habit.repetitionCount() + 1 : habit.repetitionCount();
        double consistency = (double) Math.min(reps, CONSISTENCY_WINDOW) / CONSISTENCY_WINDOW;
        ReinforcementSchedule schedule = habit.schedule();
        int frequency = habit.celebrationFrequency();
        if (reps >= INTERMITTENT_AFTER && schedule == ReinforcementSchedule.CONTINUOUS) {
            schedule = ReinforcementSchedule.INTERMITTENT;
            frequency = INTERMITTENT_FREQUENCY;
            log.info("[HabitReinforcementEngine] Switched to intermittent reinforcement. habit={} reps={}",
                habit.habitId(), reps);
        }
        return new HabitTracker(habit.habit(), reps, consistency, Automaticity.of(reps, consistency),
            performed ? clock.instant() : habit.lastPerformed(), schedule, frequency);
    }

    public boolean shouldCelebrate(HabitTracker habit) {
        if (habit.schedule() == ReinforcementSchedule.CONTINUOUS) return true;
        return habit.celebrationFrequency() > 0 && habit.repetitionCount() % habit.celebrationFrequency() == 0;
    }

    public String generateCelebration(HabitTracker habit) {
        int reps = habit.repetitionCount();
        StringBuilder sb = new StringBuilder("🎯 ").append(habit.habit().habitName()).append("! ");
        if (reps == 1) {
            sb.append("First time! ").append(habit.habit().reward());
        } else if (reps == 7) {
            sb.append("One week streak! 🔥 You're building this habit.");
        } else if (reps == 21) {
            sb.append("21 days! 🌟 This habit is forming. Becoming automatic!");
        } else if (reps == FORMATION_TARGET) {
            sb.append("66 days! 🏆 This habit is fully formed! You've mastered ")
              .append(habit.habit().habitName()).append('.');
        } else if (reps > 0 && reps % 10 == 0) {
            sb.append(reps).append(" times! Keep going! 💪");
        } else {
            sb.append(habit.habit().reward());
        }
        switch (habit.automaticity()) {
            case OCCASIONAL_AUTOMATIC -> sb.append("\n✨ Starting to become automatic!");
            case MOSTLY_AUTOMATIC     -> sb.append("\n🌟 Mostly automatic now!");
            case FULLY_AUTOMATIC      -> sb.append("\n🏆 Fully automatic - you've mastered this!");
            default -> { }
        }
        return sb.toString();
    }

    public String progressSummary(List<HabitTracker> habits) {
        if (habits == null || habits.isEmpty()) return "";
        StringBuilder sb = new StringBuilder("**Habit Formation Progress:**");
        int total = 0;
        for (HabitTracker h : habits) {
            sb.append('\n').append(h.habit().habitName()).append(": ").append(progressBar(h))
              .append(" (").append(h.repetitionCount()).append(" times)");
            total += h.repetitionCount();
        }
        if (total >= 20) {
            sb.append("\n\n🌟 Great progress! You're building sustainable OKR skills.");
        }
        return sb.toString();
    }

    private static String progressBar(HabitTracker habit) {
        double pct = Math.min(100.0 * habit.repetitionCount() / FORMATION_TARGET, 100.0);
        if (pct < 25)  return "▓▒▒▒ (Forming)";
        if (pct < 50)  return "▓▓▒▒ (Developing)";
        if (pct < 75)  return "▓▓▓▒ (Strengthening)";
        if (pct < 100) return "▓▓▓▓ (Almost Automatic)";
        return "▓▓▓▓ (Automatic) ✅";
    }
}

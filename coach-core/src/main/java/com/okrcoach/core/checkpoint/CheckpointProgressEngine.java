package com.okrcoach.core.checkpoint;

import com.okrcoach.core.model.ConversationPhase;
import com.okrcoach.core.model.EmotionalState;
import com.okrcoach.core.model.NeuralReadinessState;
import com.okrcoach.core.text.TextSignals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Checkpoint state machine for a coaching phase.
 *
 * <p>Each phase owns a fixed list of checkpoints ({@link CheckpointCatalog}). A user message
 * is evaluated against the open checkpoints in sequence order and completes <b>at most one</b>
 * of them: the first satisfied checkpoint wins and later ones are not evaluated.
 *
 * <h3>Completion rule</h3>
 * <ul>
 *   <li>matched criteria ≥ {@link CheckpointDefinition#completionThreshold()}</li>
 *   <li>confidence = matched / total, multiplied by {@value #SUBOPTIMAL_STATE_FACTOR}
 *       when the user's brain state is not optimal for the checkpoint</li>
 *   <li>confidence ≥ {@value #MIN_COMPLETION_CONFIDENCE}</li>
 * </ul>
 *
 * <p>Stateless apart from the injected {@link Clock}; safe to share between sessions.
 */
public class CheckpointProgressEngine {

    private static final Logger log = LoggerFactory.getLogger(CheckpointProgressEngine.class);

    /** Minimum confidence for a text-detected completion. */
    public static final double MIN_COMPLETION_CONFIDENCE = 0.5;

    /** Confidence multiplier when the brain state does not favour the checkpoint. */
    public static final double SUBOPTIMAL_STATE_FACTOR = 0.8;

    /** Streak length from which celebrations and summaries mention the streak. */
    public static final int STREAK_ANNOUNCE_THRESHOLD = 3;

    private final Clock clock;

    public CheckpointProgressEngine(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public CheckpointProgressTracker initialize(String sessionId, ConversationPhase phase) {
        List<Checkpoint> checkpoints = CheckpointCatalog.forPhase(phase).stream()
            .map(Checkpoint::fresh)
            .toList();
        return new CheckpointProgressTracker(sessionId, phase, checkpoints, 0, checkpoints.size(),
            0.0, 0, 0, 0, List.of());
    }

    /**
     * Evaluates {@code message} against the open checkpoints of the tracker's phase.
     *
     * @return the tracker (updated if a checkpoint completed) and the completed checkpoint, if any
     */
    public CompletionResult detectCompletion(String message, CheckpointProgressTracker tracker,
                                             NeuralReadinessState neuralState) {
        if (message == null || message.isBlank()) {
            return CompletionResult.unchanged(tracker);
        }
        String lower = TextSignals.normalize(message);
        NeuralReadinessState state = neuralState != null ? neuralState : NeuralReadinessState.neutral();

        for (Checkpoint checkpoint : tracker.checkpoints()) {
            if (checkpoint.complete()) continue;
            Optional<CheckpointDefinition> def = CheckpointCatalog.definition(checkpoint.id());
            if (def.isEmpty()) continue;

            Evaluation eval = evaluate(lower, def.get(), state);
            if (eval.complete()) {
                log.debug("[CheckpointProgressEngine] Completed. session={} checkpoint={} confidence={} evidence={}",
                    tracker.sessionId(), checkpoint.id(), String.format("%.2f", eval.confidence()), eval.evidence());
                return markComplete(tracker, checkpoint, eval.confidence(), eval.evidence());
            }
        }
        return CompletionResult.unchanged(tracker);
    }

    /**
     * Marks a checkpoint complete on the assistant's judgement.
     * Unknown ids and already-complete checkpoints return empty.
     */
    public Optional<CompletionResult> completeCheckpoint(CheckpointProgressTracker tracker, String checkpointId,
                                                         double confidence, List<String> evidence) {
        Optional<Checkpoint> checkpoint = tracker.find(checkpointId);
        if (checkpoint.isEmpty() || checkpoint.get().complete()) {
            return Optional.empty();
        }
        return Optional.of(markComplete(tracker, checkpoint.get(), clamp(confidence),
            evidence != null ? evidence : List.of()));
    }

    /**
     * Fresh tracker for {@code newPhase}. Completion state resets; streaks and the
     * backtracking history carry over as session momentum.
     */
    public CheckpointProgressTracker transitionToPhase(CheckpointProgressTracker tracker, ConversationPhase newPhase) {
        CheckpointProgressTracker fresh = initialize(tracker.sessionId(), newPhase);
        log.info("[CheckpointProgressEngine] Phase transition. session={} from={} to={}",
            tracker.sessionId(), tracker.currentPhase(), newPhase);
        return new CheckpointProgressTracker(fresh.sessionId(), newPhase, fresh.checkpoints(), 0,
            fresh.totalCheckpoints(), 0.0, tracker.currentStreak(), tracker.longestStreak(),
            tracker.backtrackingCount(), tracker.backtrackingHistory());
    }

    public boolean isPhaseComplete(CheckpointProgressTracker tracker) {
        return tracker.allComplete();
    }

    /**
     * Returns to an earlier checkpoint. {@code fromCheckpointId} is unmarked, the streak
     * resets and a backtrack event is recorded.
     *
     * @return empty when either id is unknown or {@code fromCheckpointId} is not complete
     */
    public Optional<BacktrackResult> handleBacktracking(CheckpointProgressTracker tracker, String fromCheckpointId,
                                                        String toCheckpointId, BacktrackReason reason,
                                                        NeuralReadinessState neuralState) {
        Optional<Checkpoint> from = tracker.find(fromCheckpointId);
        Optional<CheckpointDefinition> to = CheckpointCatalog.definition(toCheckpointId)
            .filter(d -> tracker.find(d.id()).isPresent());
        if (from.isEmpty() || to.isEmpty() || !from.get().complete()) {
            return Optional.empty();
        }
        BacktrackReason why = reason != null ? reason : BacktrackReason.USER_REQUEST;
        boolean threatened = neuralState != null && neuralState.currentState() == EmotionalState.THREAT;

        String reframe = why.positiveReframe()
            + "\n\n" + "Revisiting \"" + to.get().name() + "\" will help us "
            + to.get().description().toLowerCase(Locale.ROOT) + "."
            + "\n\n" + (threatened
                ? "There's no wrong answer here - would you like to revisit this, or should we continue forward?"
                : "Would you like to revisit this, or should we continue forward?");

        BacktrackEvent event = new BacktrackEvent(fromCheckpointId, toCheckpointId, why, clock.instant(), reframe);
        List<BacktrackEvent> history = new ArrayList<>(tracker.backtrackingHistory());
        history.add(event);

        CheckpointProgressTracker updated = tracker.withCheckpoint(from.get().unmark(), 0,
            tracker.longestStreak(), tracker.backtrackingCount() + 1, history);

        log.info("[CheckpointProgressEngine] Backtrack. session={} from={} to={} reason={}",
            tracker.sessionId(), fromCheckpointId, toCheckpointId, why);
        return Optional.of(new BacktrackResult(updated, event, reframe,
            "New insight emerged that could strengthen your OKR",
            "Taking time to refine this will result in a higher-quality outcome"));
    }

    /** Celebration text: message, progress bar, streak line when applicable, next step. */
    public String generateCelebration(Checkpoint checkpoint, CheckpointProgressTracker tracker) {
        Optional<CheckpointDefinition> def = CheckpointCatalog.definition(checkpoint.id());
        if (def.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder()
            .append(def.get().celebrationMessage())
            .append("\n\n")
            .append(def.get().progressVisualization());
        if (tracker.currentStreak() >= STREAK_ANNOUNCE_THRESHOLD) {
            sb.append("\n🔥 ").append(tracker.currentStreak()).append("-checkpoint streak!");
        }
        sb.append("\n\n").append(def.get().nextStepPreview());
        return sb.toString();
    }

    public String progressSummary(CheckpointProgressTracker tracker) {
        StringBuilder sb = new StringBuilder()
            .append("**").append(tracker.currentPhase().label().toUpperCase(Locale.ROOT)).append("** Progress: ")
            .append(Math.round(tracker.completionPercentage())).append('%');
        tracker.nextOpen().ifPresent(cp -> {
            sb.append("\n📍 Current: ").append(cp.name());
            CheckpointCatalog.definition(cp.id())
                .ifPresent(def -> sb.append('\n').append(def.progressIndicator()));
        });
        if (tracker.currentStreak() >= STREAK_ANNOUNCE_THRESHOLD) {
            sb.append("\n🔥 ").append(tracker.currentStreak()).append("-checkpoint streak!");
        }
        return sb.toString();
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    private CompletionResult markComplete(CheckpointProgressTracker tracker, Checkpoint checkpoint,
                                          double confidence, List<String> evidence) {
        Checkpoint done = checkpoint.markComplete(confidence, evidence, clock.instant());
        int streak = tracker.currentStreak() + 1;
        CheckpointProgressTracker updated = tracker.withCheckpoint(done, streak,
            Math.max(streak, tracker.longestStreak()), tracker.backtrackingCount(), tracker.backtrackingHistory());
        return new CompletionResult(updated, done);
    }

    static Evaluation evaluate(String lowerMessage, CheckpointDefinition def, NeuralReadinessState state) {
        List<String> evidence = new ArrayList<>();
        int matched = 0;
        for (CompletionCriterion criterion : def.criteria()) {
            if (criterion.test(lowerMessage)) {
                matched++;
                evidence.add(criterion.evidence());
            }
        }
        int total = def.criteria().size();
        double confidence = total == 0 ? 0.0 : (double) matched / total;
        if (!isBrainStateOptimal(state, def.optimalBrainState())) {
            confidence *= SUBOPTIMAL_STATE_FACTOR;
        }
        boolean complete = total > 0
            && matched >= def.completionThreshold()
            && confidence >= MIN_COMPLETION_CONFIDENCE;
        return new Evaluation(complete, confidence, List.copyOf(evidence));
    }

    static boolean isBrainStateOptimal(NeuralReadinessState state, EmotionalState optimal) {
        if (optimal == EmotionalState.REWARD) {
            return state.currentState() == EmotionalState.REWARD;
        }
        return state.currentState() != EmotionalState.THREAT;
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }

    record Evaluation(boolean complete, double confidence, List<String> evidence) {}
}

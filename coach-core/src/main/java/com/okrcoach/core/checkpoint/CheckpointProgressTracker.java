package com.okrcoach.core.checkpoint;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.okrcoach.core.model.ConversationPhase;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Checkpoint progress for one session within one phase.
 *
 * <p>{@code completedCheckpoints} always equals the number of complete entries in
 * {@code checkpoints}, and {@code completionPercentage} is {@code 100 * completed / total}
 * (zero for an empty list). Instances are immutable; the engine returns new trackers.
 */
public record CheckpointProgressTracker(
    @JsonProperty("sessionId")            String sessionId,
    @JsonProperty("currentPhase")         ConversationPhase currentPhase,
    @JsonProperty("checkpoints")          List<Checkpoint> checkpoints,
    @JsonProperty("completedCheckpoints") int completedCheckpoints,
    @JsonProperty("totalCheckpoints")     int totalCheckpoints,
    @JsonProperty("completionPercentage") double completionPercentage,
    @JsonProperty("currentStreak")        int currentStreak,
    @JsonProperty("longestStreak")        int longestStreak,
    @JsonProperty("backtrackingCount")    int backtrackingCount,
    @JsonProperty("backtrackingHistory")  List<BacktrackEvent> backtrackingHistory
) {

    public CheckpointProgressTracker {
        checkpoints = checkpoints != null
            ? checkpoints.stream().sorted(Comparator.comparingInt(Checkpoint::sequenceOrder)).toList()
            : List.of();
        backtrackingHistory = backtrackingHistory != null ? List.copyOf(backtrackingHistory) : List.of();
    }

    public Optional<Checkpoint> find(String checkpointId) {
        return checkpoints.stream().filter(c -> c.id().equals(checkpointId)).findFirst();
    }

    /** First incomplete checkpoint in sequence order. */
    public Optional<Checkpoint> nextOpen() {
        return checkpoints.stream().filter(c -> !c.complete()).findFirst();
    }

    public boolean allComplete() {
        return totalCheckpoints > 0 && completedCheckpoints == totalCheckpoints;
    }

    static double percentage(int completed, int total) {
        return total == 0 ? 0.0 : 100.0 * completed / total;
    }

    /** Copy with {@code updated} replacing the checkpoint of the same id; counters recomputed. */
    CheckpointProgressTracker withCheckpoint(Checkpoint updated, int streak, int longest,
                                             int backtracks, List<BacktrackEvent> history) {
        List<Checkpoint> next = checkpoints.stream()
            .map(c -> c.id().equals(updated.id()) ? updated : c)
            .toList();
        int completed = (int) next.stream().filter(Checkpoint::complete).count();
        return new CheckpointProgressTracker(sessionId, currentPhase, next, completed, next.size(),
            percentage(completed, next.size()), streak, longest, backtracks, history);
    }
}

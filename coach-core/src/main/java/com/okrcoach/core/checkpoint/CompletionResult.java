package com.okrcoach.core.checkpoint;

import java.util.Optional;

/**
 * Tracker after evaluating a message, plus the checkpoint completed by it (at most one).
 */
public record CompletionResult(
    CheckpointProgressTracker tracker,
    Checkpoint newlyCompleted
) {

    public static CompletionResult unchanged(CheckpointProgressTracker tracker) {
        return new CompletionResult(tracker, null);
    }

    public Optional<Checkpoint> completed() {
        return Optional.ofNullable(newlyCompleted);
    }
}

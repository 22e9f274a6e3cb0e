package com.okrcoach.core.checkpoint;

import com.okrcoach.core.model.ConversationPhase;
import com.okrcoach.core.model.EmotionalState;

import java.util.List;

/**
 * Static description of a checkpoint: its criteria, the brain state in which completion
 * is recognised at full confidence, and the scripted celebration lines.
 */
public record CheckpointDefinition(
    String id,
    String name,
    String description,
    ConversationPhase phase,
    int sequenceOrder,
    List<CompletionCriterion> criteria,
    EmotionalState optimalBrainState,
    String celebrationMessage,
    String progressVisualization,
    String nextStepPreview,
    String progressIndicator
) {

    public CheckpointDefinition {
        criteria = List.copyOf(criteria);
    }

    /** Criteria needed: all of a single criterion, otherwise two thirds rounded down (min 1). */
    public int completionThreshold() {
        int n = criteria.size();
        return n == 1 ? 1 : Math.max(1, (int) Math.floor(n * 0.67));
    }
}

package com.okrcoach.orchestrator.pipeline;

import com.okrcoach.core.altitude.InterventionTiming;
import com.okrcoach.core.model.ConversationPhase;
import com.okrcoach.orchestrator.generation.ResponseStrategy;

import java.util.List;

/**
 * Outcome of one coaching turn.
 *
 * @param response             text for the user, holding at most one question
 * @param completedCheckpoint  id of the checkpoint completed this turn, null when none
 * @param interventionTiming   timing of an altitude intervention raised this turn, null when none
 * @param queuedQuestions      questions still waiting to be asked
 */
public record TurnResult(
    String sessionId,
    int turnNumber,
    String response,
    ResponseStrategy strategy,
    ConversationPhase phase,
    String completedCheckpoint,
    boolean phaseAdvanced,
    List<String> detectedPatterns,
    boolean driftDetected,
    InterventionTiming interventionTiming,
    int queuedQuestions
) {

    public TurnResult {
        detectedPatterns = detectedPatterns != null ? List.copyOf(detectedPatterns) : List.of();
    }
}

package com.okrcoach.orchestrator.generation;

import com.okrcoach.core.altitude.InterventionTiming;
import com.okrcoach.core.altitude.ScarfIntervention;
import com.okrcoach.core.antipattern.ReframingResult;
import com.okrcoach.core.model.ConversationPhase;

import java.util.List;

/**
 * Structured facts handed to a {@link ResponseGenerator} for one turn. Optional parts are null
 * when they do not apply.
 *
 * @param detectedPatterns       ids of the anti-patterns found in the user message, most severe first
 * @param reframing              reframing question and examples for the top pattern
 * @param altitudeIntervention   SCARF intervention for a drift that warrants one
 * @param checkpointCelebration  celebration for a checkpoint completed this turn
 * @param phaseTransition        phase entered this turn
 * @param questionContext        answered / current / pending questions, formatted
 */
public record CoachingPrompt(
    String sessionId,
    ConversationPhase phase,
    int turnNumber,
    String userMessage,
    ResponseStrategy strategy,
    List<String> detectedPatterns,
    ReframingResult reframing,
    ScarfIntervention altitudeIntervention,
    InterventionTiming interventionTiming,
    String checkpointCelebration,
    ConversationPhase phaseTransition,
    String progressSummary,
    List<String> habitCelebrations,
    String questionContext
) {

    public CoachingPrompt {
        detectedPatterns = detectedPatterns != null ? List.copyOf(detectedPatterns) : List.of();
        habitCelebrations = habitCelebrations != null ? List.copyOf(habitCelebrations) : List.of();
    }
}

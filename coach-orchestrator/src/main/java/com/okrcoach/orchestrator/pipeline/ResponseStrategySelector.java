package com.okrcoach.orchestrator.pipeline;

import com.okrcoach.core.altitude.InterventionTiming;
import com.okrcoach.core.antipattern.DetectedPattern;
import com.okrcoach.core.antipattern.DetectionResult;
import com.okrcoach.core.model.ConversationPhase;
import com.okrcoach.orchestrator.generation.ResponseStrategy;

import java.util.Set;

/**
 * Picks the response strategy for a turn.
 *
 * <h3>Precedence</h3>
 * <ol>
 *   <li>altitude intervention due now → {@link ResponseStrategy#ALTITUDE_INTERVENTION}</li>
 *   <li>fewer than {@value #DISCOVERY_TURNS} turns so far → {@link ResponseStrategy#DISCOVERY_EXPLORATION}</li>
 *   <li>strong activity framing (confidence &gt; {@value #STRONG_PATTERN_CONFIDENCE}) → {@link ResponseStrategy#REFRAMING_INTENSIVE}</li>
 *   <li>any other detected pattern → {@link ResponseStrategy#GENTLE_GUIDANCE}</li>
 *   <li>otherwise by phase: discovery questioning, refinement guidance, KR examples, validation review</li>
 * </ol>
 */
public final class ResponseStrategySelector {

    public static final int DISCOVERY_TURNS = 3;
    public static final double STRONG_PATTERN_CONFIDENCE = 0.8;

    private static final Set<String> RESISTANT_PATTERNS = Set.of("activity_focused");

    private ResponseStrategySelector() {}

    /**
     * @param turnsSoFar       user turns processed before this one
     * @param altitudeTiming   timing of an altitude intervention raised this turn, null when none
     */
    public static ResponseStrategy select(ConversationPhase phase, DetectionResult detection, int turnsSoFar,
                                          InterventionTiming altitudeTiming) {
        if (altitudeTiming == InterventionTiming.IMMEDIATE) {
            return ResponseStrategy.ALTITUDE_INTERVENTION;
        }
        if (turnsSoFar < DISCOVERY_TURNS) {
            return ResponseStrategy.DISCOVERY_EXPLORATION;
        }
        if (detection != null && detection.detected()) {
            boolean strongResistance = detection.patterns().stream().anyMatch(ResponseStrategySelector::isResistant);
            return strongResistance ? ResponseStrategy.REFRAMING_INTENSIVE : ResponseStrategy.GENTLE_GUIDANCE;
        }
        if (phase == null) {
            return ResponseStrategy.QUESTION_BASED;
        }
        return switch (phase) {
            case DISCOVERY    -> ResponseStrategy.QUESTION_BASED;
            case REFINEMENT   -> ResponseStrategy.GENTLE_GUIDANCE;
            case KR_DISCOVERY -> ResponseStrategy.EXAMPLE_DRIVEN;
            case VALIDATION   -> ResponseStrategy.VALIDATION_FOCUSED;
        };
    }

    private static boolean isResistant(DetectedPattern p) {
        return p.confidence() > STRONG_PATTERN_CONFIDENCE && RESISTANT_PATTERNS.contains(p.id());
    }
}

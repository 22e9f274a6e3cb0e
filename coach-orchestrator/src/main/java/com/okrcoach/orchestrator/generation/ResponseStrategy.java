package com.okrcoach.orchestrator.generation;

/**
 * Kind of assistant turn the pipeline asks the generator for.
 */
public enum ResponseStrategy {
    /** Open, context-gathering questions for the first turns of a session. */
    DISCOVERY_EXPLORATION,
    /** Phase-driven questioning toward the next open checkpoint. */
    QUESTION_BASED,
    /** Soft nudge with a single reframing question. */
    GENTLE_GUIDANCE,
    /** Full reframing with a before/after example. */
    REFRAMING_INTENSIVE,
    /** Teaching through a worked example. */
    EXAMPLE_DRIVEN,
    /** Review of the assembled OKR. */
    VALIDATION_FOCUSED,
    /** SCARF-framed altitude correction. */
    ALTITUDE_INTERVENTION
}

package com.okrcoach.core.habit;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

/**
 * The five OKR-writing habits reinforced across sessions, with their cue, routine and reward.
 */
public enum CoreHabit {
    OUTCOME_THINKING("outcome_thinking", "Outcome-Focused Thinking",
        "Frame objectives as outcomes, not activities",
        "When writing an objective...",
        "Convert activity language to outcome language",
        "AI recognition: \"Great outcome focus!\""),
    ALTITUDE_AWARENESS("altitude_awareness", "Altitude Awareness",
        "Check organizational scope before finalizing objectives",
        "Before finalizing an objective...",
        "Validate scope matches role and influence",
        "AI validation: \"Perfect altitude for your role!\""),
    MEASURABILITY_CHECK("measurability_check", "Measurability Check",
        "Ensure every key result has baseline, target, and measurement method",
        "When writing a key result...",
        "Define complete measurement specification",
        "AI confirmation: \"Perfectly measurable!\""),
    ANTIPATTERN_SCAN("antipattern_scan", "Anti-Pattern Scanning",
        "Check for common OKR mistakes before finalizing",
        "Before finalizing OKRs...",
        "Systematic anti-pattern review",
        "AI recognition: \"No anti-patterns detected!\""),
    STAKEHOLDER_THINKING("stakeholder_thinking", "Stakeholder Alignment Thinking",
        "Consider stakeholder alignment before sharing OKRs",
        "Before sharing OKRs...",
        "Identify stakeholders and potential objections",
        "AI support: \"You're well-prepared for alignment!\"");

    /** Coaching concepts that are practised through one of the core habits. */
    private static final Map<String, CoreHabit> CONCEPT_ALIASES = Map.of(
        "outcome_vs_activity", OUTCOME_THINKING,
        "scope_appropriateness", ALTITUDE_AWARENESS,
        "measurability", MEASURABILITY_CHECK,
        "baseline_and_target", MEASURABILITY_CHECK,
        "quantification_techniques", MEASURABILITY_CHECK);

    private final String id;
    private final String habitName;
    private final String targetBehavior;
    private final String cue;
    private final String routine;
    private final String reward;

    CoreHabit(String id, String habitName, String targetBehavior, String cue, String routine, String reward) {
        this.id = id;
        this.habitName = habitName;
        this.targetBehavior = targetBehavior;
        this.cue = cue;
        this.routine = routine;
        this.reward = reward;
    }

    public String id()             { return id; }
    public String habitName()      { return habitName; }
    public String targetBehavior() { return targetBehavior; }
    public String cue()            { return cue; }
    public String routine()        { return routine; }
    public String reward()         { return reward; }

    /** Resolves a habit id or a concept alias. */
    public static Optional<CoreHabit> resolve(String conceptOrId) {
        if (conceptOrId == null) return Optional.empty();
        CoreHabit aliased = CONCEPT_ALIASES.get(conceptOrId);
        if (aliased != null) return Optional.of(aliased);
        return Arrays.stream(values()).filter(h -> h.id.equals(conceptOrId)).findFirst();
    }
}

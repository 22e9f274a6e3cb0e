package com.okrcoach.core.antipattern;

import java.util.List;

/**
 * Kind of coaching move a detected anti-pattern calls for. Each type carries the
 * follow-up questions and the user behaviour the intervention aims to produce.
 */
public enum InterventionType {
    ACTIVITY_TO_OUTCOME(
        "User shifts from describing tasks to describing results and changes",
        List.of("What will be different when this is done?",
                "Who benefits from this change?",
                "How will you know it's working?")),
    METRIC_EDUCATION(
        "User connects metrics to business value and customer impact",
        List.of("What business result does this metric indicate?",
                "How does this connect to revenue or customer value?")),
    AMBITION_CALIBRATION(
        "User raises ambition level with challenging but achievable targets",
        List.of("How could you exceed normal expectations here?",
                "What would make this feel like a real achievement?")),
    CLARITY_IMPROVEMENT(
        "User provides specific, measurable definitions of success",
        List.of("Can you be more specific about what success looks like?",
                "What exact numbers would represent success?")),
    INSPIRATION_BOOST(
        "User articulates more inspiring and motivational objectives",
        List.of()),
    ALIGNMENT_CHECK(
        "User demonstrates clear connection to organizational goals",
        List.of()),
    FEASIBILITY_REALITY_CHECK(
        "User balances ambition with realistic constraints",
        List.of()),
    ALTITUDE_CORRECTION(
        "User adjusts objective to appropriate organizational level",
        List.of()),
    SCARF_SAFETY_BUILDING(
        "User demonstrates increased psychological safety and comfort",
        List.of());

    private final String expectedOutcome;
    private final List<String> followUpQuestions;

    InterventionType(String expectedOutcome, List<String> followUpQuestions) {
        this.expectedOutcome = expectedOutcome;
        this.followUpQuestions = followUpQuestions;
    }

    public String expectedOutcome() {
        return expectedOutcome;
    }

    public List<String> followUpQuestions() {
        return followUpQuestions;
    }
}

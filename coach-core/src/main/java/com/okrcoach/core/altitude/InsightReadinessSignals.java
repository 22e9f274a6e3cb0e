package com.okrcoach.core.altitude;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Language markers that the user is working toward an insight of their own.
 * {@code overallReadiness} is the weighted sum of the flags, in [0, 1].
 */
public record InsightReadinessSignals(
    @JsonProperty("openQuestioning")          boolean openQuestioning,
    @JsonProperty("pausesForThinking")        boolean pausesForThinking,
    @JsonProperty("tentativeLanguage")        boolean tentativeLanguage,
    @JsonProperty("reframingAttempts")        boolean reframingAttempts,
    @JsonProperty("pausingToThink")           boolean pausingToThink,
    @JsonProperty("questioningAssumptions")   boolean questioningAssumptions,
    @JsonProperty("connectingDots")           boolean connectingDots,
    @JsonProperty("verbalizingUnderstanding") boolean verbalizingUnderstanding,
    @JsonProperty("overallReadiness")         double overallReadiness
) {

    public static InsightReadinessSignals none() {
        return new InsightReadinessSignals(false, false, false, false, false, false, false, false, 0.0);
    }

    /** Any of the four reflection markers: pausing, questioning, connecting, verbalizing. */
    public boolean anyReflectionSignal() {
        return pausingToThink || questioningAssumptions || connectingDots || verbalizingUnderstanding;
    }
}

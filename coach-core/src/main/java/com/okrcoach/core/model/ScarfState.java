package com.okrcoach.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Snapshot of the five SCARF dimensions for the current turn.
 */
public record ScarfState(
    @JsonProperty("status")      ScarfDimension status,
    @JsonProperty("certainty")   ScarfDimension certainty,
    @JsonProperty("autonomy")    ScarfDimension autonomy,
    @JsonProperty("relatedness") ScarfDimension relatedness,
    @JsonProperty("fairness")    ScarfDimension fairness
) {

    public ScarfState {
        status      = status      != null ? status      : ScarfDimension.NEUTRAL;
        certainty   = certainty   != null ? certainty   : ScarfDimension.NEUTRAL;
        autonomy    = autonomy    != null ? autonomy    : ScarfDimension.NEUTRAL;
        relatedness = relatedness != null ? relatedness : ScarfDimension.NEUTRAL;
        fairness    = fairness    != null ? fairness    : ScarfDimension.NEUTRAL;
    }

    public static ScarfState neutral() {
        return new ScarfState(ScarfDimension.NEUTRAL, ScarfDimension.NEUTRAL, ScarfDimension.NEUTRAL,
            ScarfDimension.NEUTRAL, ScarfDimension.NEUTRAL);
    }

    List<ScarfDimension> dimensions() {
        return List.of(status, certainty, autonomy, relatedness, fairness);
    }
}

package com.okrcoach.core.altitude;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ScopeDriftEvent(
    @JsonProperty("timestamp")             Instant timestamp,
    @JsonProperty("fromScope")             ObjectiveScope fromScope,
    @JsonProperty("toScope")               ObjectiveScope toScope,
    @JsonProperty("driftMagnitude")        double driftMagnitude,
    @JsonProperty("detectionMethod")       DetectionMethod detectionMethod,
    @JsonProperty("triggerText")           String triggerText,
    @JsonProperty("triggeredIntervention") boolean triggeredIntervention
) {

    /** True when the drift moved to a coarser altitude than it came from. */
    public boolean driftingUp() {
        return fromScope.isBelow(toScope);
    }
}

package com.okrcoach.core.altitude;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A delivered altitude intervention. {@code userResponse} and {@code effectivenessScore}
 * stay null until the user's reaction is recorded.
 */
public record AltitudeIntervention(
    @JsonProperty("timestamp")          Instant timestamp,
    @JsonProperty("driftMagnitude")     double driftMagnitude,
    @JsonProperty("intervention")       ScarfIntervention intervention,
    @JsonProperty("timing")             InterventionTiming timing,
    @JsonProperty("overallReadiness")   double overallReadiness,
    @JsonProperty("userResponse")       InterventionResponse userResponse,
    @JsonProperty("effectivenessScore") Double effectivenessScore
) {

    AltitudeIntervention withOutcome(InterventionResponse response, double effectiveness) {
        return new AltitudeIntervention(timestamp, driftMagnitude, intervention, timing, overallReadiness,
            response, effectiveness);
    }
}

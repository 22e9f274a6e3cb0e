package com.okrcoach.core.altitude;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Altitude state for one session.
 *
 * <p>{@code currentScope} always equals the {@code toScope} of the last drift event, or
 * {@code initialScope} when there is none. {@code stabilityScore} starts at 1.0 and never
 * drops below 0.3.
 */
public record AltitudeTracker(
    @JsonProperty("initialScope")        ObjectiveScope initialScope,
    @JsonProperty("currentScope")        ObjectiveScope currentScope,
    @JsonProperty("roleLabel")           String roleLabel,
    @JsonProperty("confidenceLevel")     double confidenceLevel,
    @JsonProperty("scopeDriftHistory")   List<ScopeDriftEvent> scopeDriftHistory,
    @JsonProperty("stabilityScore")      double stabilityScore,
    @JsonProperty("interventionHistory") List<AltitudeIntervention> interventionHistory
) {

    public AltitudeTracker {
        scopeDriftHistory   = scopeDriftHistory   != null ? List.copyOf(scopeDriftHistory)   : List.of();
        interventionHistory = interventionHistory != null ? List.copyOf(interventionHistory) : List.of();
    }
}

package com.okrcoach.core.checkpoint;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Per-session completion state of a single checkpoint.
 */
public record Checkpoint(
    @JsonProperty("id")                   String id,
    @JsonProperty("name")                 String name,
    @JsonProperty("sequenceOrder")        int sequenceOrder,
    @JsonProperty("complete")             boolean complete,
    @JsonProperty("completionConfidence") double completionConfidence,
    @JsonProperty("evidenceCollected")    List<String> evidenceCollected,
    @JsonProperty("completedAt")          Instant completedAt
) {

    public Checkpoint {
        evidenceCollected = evidenceCollected != null ? List.copyOf(evidenceCollected) : List.of();
    }

    static Checkpoint fresh(CheckpointDefinition def) {
        return new Checkpoint(def.id(), def.name(), def.sequenceOrder(), false, 0.0, List.of(), null);
    }

    Checkpoint markComplete(double confidence, List<String> evidence, Instant at) {
        return new Checkpoint(id, name, sequenceOrder, true, confidence, evidence, at);
    }

    Checkpoint unmark() {
        return new Checkpoint(id, name, sequenceOrder, false, 0.0, List.of(), null);
    }
}

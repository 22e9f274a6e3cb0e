package com.okrcoach.core.checkpoint;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record BacktrackEvent(
    @JsonProperty("fromCheckpointId") String fromCheckpointId,
    @JsonProperty("toCheckpointId")   String toCheckpointId,
    @JsonProperty("reason")           BacktrackReason reason,
    @JsonProperty("timestamp")        Instant timestamp,
    @JsonProperty("reframe")          String reframe
) {}

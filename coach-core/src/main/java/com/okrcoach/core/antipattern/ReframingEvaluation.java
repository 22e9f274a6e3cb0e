package com.okrcoach.core.antipattern;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Whether a user's rewrite took the reframe on board.
 * {@code userResponse} is "positive" on success, "neutral" otherwise.
 */
public record ReframingEvaluation(
    @JsonProperty("type")         InterventionType type,
    @JsonProperty("triggered")    boolean triggered,
    @JsonProperty("success")      boolean success,
    @JsonProperty("beforeScore")  int beforeScore,
    @JsonProperty("afterScore")   int afterScore,
    @JsonProperty("technique")    String technique,
    @JsonProperty("userResponse") String userResponse
) {}

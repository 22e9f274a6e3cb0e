package com.okrcoach.core.antipattern;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A before/after rewrite shown alongside a reframing question.
 * {@code context} names the industry or team the example comes from.
 */
public record ReframingExample(
    @JsonProperty("before")      String before,
    @JsonProperty("after")       String after,
    @JsonProperty("context")     String context,
    @JsonProperty("explanation") String explanation
) {}

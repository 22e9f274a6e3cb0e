package com.okrcoach.core.antipattern;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structured reframing facts handed to response generation.
 */
public record ReframingResult(
    @JsonProperty("question")          String question,
    @JsonProperty("suggestion")        String suggestion,
    @JsonProperty("examples")          List<ReframingExample> examples,
    @JsonProperty("followUpQuestions") List<String> followUpQuestions,
    @JsonProperty("expectedOutcome")   String expectedOutcome,
    @JsonProperty("technique")         ReframingTechnique technique,
    @JsonProperty("confidence")        double confidence
) {}

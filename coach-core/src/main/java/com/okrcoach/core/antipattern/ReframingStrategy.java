package com.okrcoach.core.antipattern;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Scripted reframing plan for an anti-pattern.
 *
 * <ul>
 *   <li>{@code questions}       – templates asked in order, one per attempt; may contain
 *       {@code {activity}}, {@code {industry}}, {@code {function}} and {@code {user_name}}.</li>
 *   <li>{@code examples}        – before/after rewrites, filtered by the user's industry.</li>
 *   <li>{@code successCriteria} – signs the user has taken the reframe on board.</li>
 *   <li>{@code maxAttempts}     – attempts before the strategy is considered exhausted.</li>
 * </ul>
 */
public record ReframingStrategy(
    @JsonProperty("name")            String name,
    @JsonProperty("technique")       ReframingTechnique technique,
    @JsonProperty("questions")       List<String> questions,
    @JsonProperty("examples")        List<ReframingExample> examples,
    @JsonProperty("successCriteria") List<String> successCriteria,
    @JsonProperty("maxAttempts")     int maxAttempts
) {

    public ReframingStrategy {
        questions       = questions       != null ? List.copyOf(questions)       : List.of();
        examples        = examples        != null ? List.copyOf(examples)        : List.of();
        successCriteria = successCriteria != null ? List.copyOf(successCriteria) : List.of();
    }
}

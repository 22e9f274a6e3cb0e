package com.okrcoach.core.antipattern;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of scanning one message.
 *
 * <ul>
 *   <li>{@code patterns}               – detected patterns, most severe first, then by confidence.</li>
 *   <li>{@code severity}               – highest severity among them ({@code LOW} when none).</li>
 *   <li>{@code confidence}             – mean confidence of the detected patterns.</li>
 *   <li>{@code suggestedInterventions} – distinct intervention types, first-seen order.</li>
 *   <li>{@code strategy}               – strategy of the top pattern, null when nothing is detected.</li>
 * </ul>
 */
public record DetectionResult(
    @JsonProperty("detected")               boolean detected,
    @JsonProperty("patterns")               List<DetectedPattern> patterns,
    @JsonProperty("severity")               Severity severity,
    @JsonProperty("confidence")             double confidence,
    @JsonProperty("suggestedInterventions") List<InterventionType> suggestedInterventions,
    @JsonProperty("strategy")               ReframingStrategy strategy
) {

    public static DetectionResult none() {
        return new DetectionResult(false, List.of(), Severity.LOW, 0.0, List.of(), null);
    }
}

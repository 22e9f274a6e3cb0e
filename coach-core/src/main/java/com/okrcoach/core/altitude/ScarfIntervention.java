package com.okrcoach.core.altitude;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Five-part, threat-minimising altitude intervention. The parts are structured facts
 * for response generation; {@link #compose()} joins them for rule-based delivery.
 */
public record ScarfIntervention(
    @JsonProperty("status")      StatusPreservation status,
    @JsonProperty("certainty")   CertaintyBuilding certainty,
    @JsonProperty("autonomy")    AutonomyChoice autonomy,
    @JsonProperty("relatedness") Relatedness relatedness,
    @JsonProperty("fairness")    Fairness fairness
) {

    public record StatusPreservation(
        @JsonProperty("acknowledgement") String acknowledgement,
        @JsonProperty("reframing")       String reframing
    ) {}

    /** {@code nextSteps} always holds exactly three steps. */
    public record CertaintyBuilding(
        @JsonProperty("nextSteps")          List<String> nextSteps,
        @JsonProperty("predictableOutcome") String predictableOutcome
    ) {
        public CertaintyBuilding {
            nextSteps = List.copyOf(nextSteps);
        }
    }

    public record AutonomyChoice(
        @JsonProperty("optionA") String optionA,
        @JsonProperty("optionB") String optionB
    ) {}

    public record Relatedness(
        @JsonProperty("collaborativeLanguage") String collaborativeLanguage,
        @JsonProperty("sharedGoal")            String sharedGoal
    ) {}

    public record Fairness(
        @JsonProperty("reasoning")        String reasoning,
        @JsonProperty("equitableProcess") String equitableProcess
    ) {}

    public String compose() {
        StringBuilder sb = new StringBuilder()
            .append(status.acknowledgement()).append(' ').append(status.reframing())
            .append("\n\n").append(fairness.reasoning())
            .append("\n\n").append(relatedness.collaborativeLanguage())
            .append("\n\nNext steps:");
        for (String step : certainty.nextSteps()) {
            sb.append("\n- ").append(step);
        }
        sb.append("\n\n").append(certainty.predictableOutcome())
          .append("\n\n").append(autonomy.optionA()).append(' ').append(autonomy.optionB());
        return sb.toString();
    }
}

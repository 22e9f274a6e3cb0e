package com.okrcoach.core.altitude;

import java.util.List;

/**
 * Tell / ask / problem / solution prompts for one discovery stage.
 */
public record DiscoveryQuestions(
    AriaStage stage,
    String tell,
    List<String> ask,
    String problem,
    String solution
) {

    public DiscoveryQuestions {
        ask = List.copyOf(ask);
    }
}

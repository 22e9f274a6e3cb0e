package com.okrcoach.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Set;

/**
 * Known facts about the user that personalise detection and reframing.
 *
 * <ul>
 *   <li>{@code version}            – schema version of this structure.</li>
 *   <li>{@code industry}           – e.g. "Technology"; used to pick reframing examples.</li>
 *   <li>{@code function}           – the user's role or function; substituted into question templates.</li>
 *   <li>{@code companySize}        – free-form size band.</li>
 *   <li>{@code resistancePatterns} – anti-pattern ids the user has already pushed back on.</li>
 * </ul>
 */
public record UserContext(
    @JsonProperty("version")            int version,
    @JsonProperty("industry")           String industry,
    @JsonProperty("function")           String function,
    @JsonProperty("companySize")        String companySize,
    @JsonProperty("resistancePatterns") Set<String> resistancePatterns
) {

    public static final int CURRENT_VERSION = 1;

    public UserContext {
        resistancePatterns = resistancePatterns != null ? Set.copyOf(resistancePatterns) : Set.of();
    }

    public static UserContext empty() {
        return new UserContext(CURRENT_VERSION, null, null, null, Set.of());
    }

    public static UserContext of(String industry, String function) {
        return new UserContext(CURRENT_VERSION, industry, function, null, Set.of());
    }

    public boolean hasResisted(String patternId) {
        return resistancePatterns.contains(patternId);
    }
}

package com.okrcoach.core.antipattern;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Something an objective relies on that sits outside the user's sphere of influence.
 */
public record Dependency(
    @JsonProperty("type")            DependencyType type,
    @JsonProperty("description")     String description,
    @JsonProperty("controllability") Controllability controllability
) {}

package com.okrcoach.core.antipattern;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DetectedPattern(
    @JsonProperty("id")               String id,
    @JsonProperty("name")             String name,
    @JsonProperty("description")      String description,
    @JsonProperty("confidence")       double confidence,
    @JsonProperty("severity")         Severity severity,
    @JsonProperty("interventionType") InterventionType interventionType,
    @JsonProperty("strategy")         ReframingStrategy strategy
) {}

package com.okrcoach.core.antipattern;

public enum ReframingTechnique {
    FIVE_WHYS,
    OUTCOME_TRANSFORMATION,
    EXAMPLE_DRIVEN,
    QUESTION_CASCADE,
    VALUE_EXPLORATION
}

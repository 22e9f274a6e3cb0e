package com.okrcoach.core.antipattern;

/** How far the user's team can steer a dependency. */
public enum Controllability {
    NONE,
    LOW,
    MEDIUM
}

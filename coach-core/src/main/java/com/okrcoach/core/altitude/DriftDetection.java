package com.okrcoach.core.altitude;

/**
 * Result of classifying a message's altitude against the tracker's current scope.
 * {@code newScope} equals the current scope when nothing was detected.
 */
public record DriftDetection(
    boolean detected,
    ObjectiveScope newScope,
    double confidence
) {}

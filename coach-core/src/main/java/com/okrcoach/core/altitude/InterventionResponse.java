package com.okrcoach.core.altitude;

/** How the user reacted to an altitude intervention. */
public enum InterventionResponse {
    POSITIVE,
    NEUTRAL,
    RESISTANT
}

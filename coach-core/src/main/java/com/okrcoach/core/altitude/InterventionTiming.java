package com.okrcoach.core.altitude;

/**
 * When an altitude intervention should be delivered.
 *
 * <ul>
 *   <li>{@link #IMMEDIATE}: in this turn's response.</li>
 *   <li>{@link #AFTER_REFLECTION}: once the user has finished the thought they are working through.</li>
 *   <li>{@link #NEXT_TURN}: deferred; let readiness build first.</li>
 * </ul>
 */
public enum InterventionTiming {
    IMMEDIATE,
    AFTER_REFLECTION,
    NEXT_TURN
}

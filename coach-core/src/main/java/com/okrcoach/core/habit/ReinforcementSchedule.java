package com.okrcoach.core.habit;

/** Continuous: celebrate every performance. Intermittent: every Nth. */
public enum ReinforcementSchedule {
    CONTINUOUS,
    INTERMITTENT
}

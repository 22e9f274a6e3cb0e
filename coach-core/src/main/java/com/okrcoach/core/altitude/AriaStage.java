package com.okrcoach.core.altitude;

/** Discovery stage used to shape altitude questions: awareness, then reflection, then illumination. */
public enum AriaStage {
    AWARENESS,
    REFLECTION,
    ILLUMINATION
}

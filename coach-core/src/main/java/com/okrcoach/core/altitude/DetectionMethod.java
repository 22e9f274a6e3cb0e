package com.okrcoach.core.altitude;

public enum DetectionMethod {
    KEYWORD,
    CONTEXT,
    EXPLICIT
}

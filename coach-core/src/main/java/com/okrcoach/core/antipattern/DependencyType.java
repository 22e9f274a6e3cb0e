package com.okrcoach.core.antipattern;

public enum DependencyType {
    CUSTOMER_BEHAVIOR,
    OTHER_TEAM,
    MARKET_DYNAMICS,
    EXTERNAL_FACTOR
}

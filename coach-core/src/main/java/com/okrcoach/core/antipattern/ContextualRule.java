package com.okrcoach.core.antipattern;

import com.okrcoach.core.model.UserContext;

/**
 * Extra condition an anti-pattern must satisfy once lexical evidence is found.
 * Implementations are pure and null-tolerant for {@code context}.
 */
@FunctionalInterface
public interface ContextualRule {

    boolean test(String text, UserContext context);
}

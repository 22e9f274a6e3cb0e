package com.okrcoach.core.checkpoint;

import java.util.function.Predicate;

/**
 * One named sub-condition of a checkpoint.
 *
 * <p>{@code matcher} receives the lower-cased user message. Criteria that can only be
 * judged by the assistant use {@link #assistantOnly(String)} and never match user text.
 */
public record CompletionCriterion(
    String description,
    Predicate<String> matcher,
    String evidence
) {

    public static CompletionCriterion of(String description, String evidence, Predicate<String> matcher) {
        return new CompletionCriterion(description, matcher, evidence);
    }

    public static CompletionCriterion assistantOnly(String description) {
        return new CompletionCriterion(description, msg -> false, "Requires assistant evaluation");
    }

    public boolean test(String lowerMessage) {
        return matcher.test(lowerMessage);
    }
}

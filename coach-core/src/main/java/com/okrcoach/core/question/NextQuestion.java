package com.okrcoach.core.question;

/**
 * A question drawn from the queue. {@code question} is null when the queue was empty.
 */
public record NextQuestion(
    QuestionState updatedState,
    String question,
    boolean hasMore
) {}

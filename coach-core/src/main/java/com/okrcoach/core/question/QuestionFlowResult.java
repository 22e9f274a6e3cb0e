package com.okrcoach.core.question;

/**
 * Post-processed assistant turn.
 *
 * @param updatedState   state to persist
 * @param responseToUser text to show, carrying at most one question
 * @param hasQueued      whether questions remain queued for later turns
 */
public record QuestionFlowResult(
    QuestionState updatedState,
    String responseToUser,
    boolean hasQueued
) {}

package com.okrcoach.orchestrator.generation;

/**
 * Turns a structured {@link CoachingPrompt} into assistant text. The text may contain several
 * questions; the pipeline reduces it to one.
 */
@FunctionalInterface
public interface ResponseGenerator {

    String generate(CoachingPrompt prompt);
}

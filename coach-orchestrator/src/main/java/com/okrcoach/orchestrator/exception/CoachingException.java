package com.okrcoach.orchestrator.exception;

/**
 * Unchecked failure of an orchestrator collaborator (session store, response generator).
 * The message is prefixed with the failing component's name.
 */
public class CoachingException extends RuntimeException {
    private final String component;

    public CoachingException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public CoachingException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}

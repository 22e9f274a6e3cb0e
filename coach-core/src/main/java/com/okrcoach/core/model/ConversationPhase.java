package com.okrcoach.core.model;

import java.util.Optional;

/**
 * Ordered phases of a coaching session. Each phase owns its own checkpoint list.
 */
public enum ConversationPhase {
    DISCOVERY("Discovery"),
    REFINEMENT("Refinement"),
    KR_DISCOVERY("KR Discovery"),
    VALIDATION("Validation");

    private final String label;

    ConversationPhase(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** The phase that follows this one, or empty after {@link #VALIDATION}. */
    public Optional<ConversationPhase> next() {
        int idx = ordinal() + 1;
        ConversationPhase[] all = values();
        return idx < all.length ? Optional.of(all[idx]) : Optional.empty();
    }
}

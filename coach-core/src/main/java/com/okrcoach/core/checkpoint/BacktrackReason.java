package com.okrcoach.core.checkpoint;

/**
 * Why the conversation returns to an earlier checkpoint. Each reason carries the
 * positive framing shown to the user.
 */
public enum BacktrackReason {
    NEW_INSIGHT("💡 Great insight! This shows you're thinking deeply about your OKR."),
    MISSED_DETAIL("🔍 Good catch! Attention to detail like this leads to stronger OKRs."),
    SCOPE_CHANGE("🎯 Excellent - adjusting scope now will save time later."),
    USER_REQUEST("✅ Absolutely - let's revisit that to make sure it's exactly right.");

    private final String positiveReframe;

    BacktrackReason(String positiveReframe) {
        this.positiveReframe = positiveReframe;
    }

    public String positiveReframe() {
        return positiveReframe;
    }
}

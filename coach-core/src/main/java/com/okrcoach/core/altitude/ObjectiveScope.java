package com.okrcoach.core.altitude;

/**
 * Organizational altitude of an objective, ordered coarsest to finest.
 * {@link #rank()} is 0 for {@link #STRATEGIC} through 4 for {@link #PROJECT}.
 */
public enum ObjectiveScope {
    STRATEGIC("strategic/C-level"),
    DEPARTMENTAL("departmental/VP-Director"),
    TEAM("team/manager"),
    INITIATIVE("initiative/project manager"),
    PROJECT("project/individual contributor");

    private final String displayName;

    ObjectiveScope(String displayName) {
        this.displayName = displayName;
    }

    public int rank() {
        return ordinal();
    }

    public String displayName() {
        return displayName;
    }

    /** True when {@code other} sits at a coarser (higher) altitude than this scope. */
    public boolean isBelow(ObjectiveScope other) {
        return other.rank() < rank();
    }
}

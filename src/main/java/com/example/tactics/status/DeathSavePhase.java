package com.example.tactics.status;

/**
 * Where a creature stands with respect to dying.
 */
public enum DeathSavePhase {
    /** Above 0 HP, or revived. */
    CONSCIOUS("Conscious"),
    /** At 0 HP and rolling death saves. */
    DYING("Dying"),
    /** At 0 HP, unconscious, no longer rolling. */
    STABLE("Stable"),
    /** Terminal. */
    DEAD("Dead");

    private final String displayName;

    DeathSavePhase(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}

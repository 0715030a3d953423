package com.example.tactics.combat;

/**
 * Lifecycle of a combat encounter.
 */
public enum CombatState {

    /** Combatants are being placed; initiative not yet rolled */
    INITIALIZING("Initializing"),

    /** Turns are being taken */
    ACTIVE("Active"),

    /** Combat is over and every combatant has been released */
    ENDED("Ended");

    private final String displayName;

    CombatState(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}

package com.example.tactics.status;

/**
 * Before and after of an exhaustion transition.
 *
 * @param previous level before the change
 * @param state level after the change
 * @param died true if this change reached level 6
 * @param message short text for the combat log
 */
public record ExhaustionChange(ExhaustionState previous, ExhaustionState state, boolean died, String message) {

    public int levelsChanged() {
        return state.getLevel() - previous.getLevel();
    }

    public boolean fullyRecovered() {
        return !state.isExhausted();
    }
}

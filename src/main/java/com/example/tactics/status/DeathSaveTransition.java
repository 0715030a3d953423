package com.example.tactics.status;

/**
 * The state after a death-save event, paired with what happened.
 */
public record DeathSaveTransition(DeathSaveState state, DeathSaveResult result) {

    public DeathSaveOutcome outcome() {
        return result.getOutcome();
    }
}

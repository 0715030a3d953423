package com.example.tactics.status;

import com.example.tactics.dice.D20Outcome;

import java.util.Optional;

/**
 * Record of one death-save event: a roll, damage taken while down, or healing.
 */
public class DeathSaveResult {

    private final DeathSaveOutcome outcome;
    private final D20Outcome roll;
    private final int failuresAdded;
    private final String description;

    DeathSaveResult(DeathSaveOutcome outcome, D20Outcome roll, int failuresAdded, String description) {
        this.outcome = outcome;
        this.roll = roll;
        this.failuresAdded = failuresAdded;
        this.description = description;
    }

    public DeathSaveOutcome getOutcome() { return outcome; }

    /** The d20 roll, present only for actual death saving throws. */
    public Optional<D20Outcome> getRoll() { return Optional.ofNullable(roll); }

    public int getFailuresAdded() { return failuresAdded; }
    public String getDescription() { return description; }

    public boolean isDeath() {
        return outcome == DeathSaveOutcome.DEAD;
    }

    @Override
    public String toString() {
        return "DeathSaveResult[" + outcome + ", " + description + "]";
    }
}

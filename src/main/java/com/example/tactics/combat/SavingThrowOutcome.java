package com.example.tactics.combat;

import com.example.tactics.dice.D20Outcome;

/**
 * Result of a saving throw against a DC.
 */
public class SavingThrowOutcome {

    private final boolean success;
    private final D20Outcome roll;
    private final int dc;
    private final boolean automatic;

    SavingThrowOutcome(boolean success, D20Outcome roll, int dc, boolean automatic) {
        this.success = success;
        this.roll = roll;
        this.dc = dc;
        this.automatic = automatic;
    }

    public boolean isSuccess() { return success; }
    public D20Outcome getRoll() { return roll; }
    public int getDc() { return dc; }

    /** True when the result was forced by a condition rather than rolled. */
    public boolean isAutomatic() { return automatic; }

    @Override
    public String toString() {
        return "SavingThrowOutcome[" + (success ? "success" : "failure") + ", " + roll + " vs DC " + dc
                + (automatic ? ", automatic" : "") + "]";
    }
}

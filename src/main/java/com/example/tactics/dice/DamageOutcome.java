package com.example.tactics.dice;

import java.util.List;

/**
 * Result of a damage roll. The total is never below 1.
 */
public class DamageOutcome {

    private final List<Integer> rolls;
    private final int modifier;
    private final int total;
    private final String notation;
    private final boolean critical;

    DamageOutcome(List<Integer> rolls, int modifier, int total, String notation, boolean critical) {
        this.rolls = List.copyOf(rolls);
        this.modifier = modifier;
        this.total = total;
        this.notation = notation;
        this.critical = critical;
    }

    /** Individual die faces, signed for subtracted dice. */
    public List<Integer> getRolls() { return rolls; }

    /** Flat modifiers from the notation plus the extra modifier. */
    public int getModifier() { return modifier; }

    public int getTotal() { return total; }
    public String getNotation() { return notation; }
    public boolean isCritical() { return critical; }

    @Override
    public String toString() {
        return notation + (critical ? " (crit)" : "") + " " + rolls + " = " + total;
    }
}

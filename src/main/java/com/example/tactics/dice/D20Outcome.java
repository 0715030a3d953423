package com.example.tactics.dice;

import java.util.List;

/**
 * Result of a d20 roll, possibly with advantage or disadvantage.
 * <p>
 * {@code baseRoll} is the die that counts (the higher die for advantage, the
 * lower for disadvantage). Natural 20 and natural 1 are judged on it before
 * the modifier is applied.
 */
public class D20Outcome {

    private final List<Integer> rolls;
    private final int modifier;
    private final int baseRoll;
    private final int total;
    private final boolean natural20;
    private final boolean natural1;
    private final boolean advantage;
    private final boolean disadvantage;

    D20Outcome(List<Integer> rolls, int baseRoll, int modifier, boolean natural20, boolean natural1,
               boolean advantage, boolean disadvantage) {
        this.rolls = List.copyOf(rolls);
        this.baseRoll = baseRoll;
        this.modifier = modifier;
        this.total = baseRoll + modifier;
        this.natural20 = natural20;
        this.natural1 = natural1;
        this.advantage = advantage;
        this.disadvantage = disadvantage;
    }

    /**
     * A fixed result that was never rolled, used when a save automatically
     * fails or succeeds. Natural flags are not set on a forced result.
     *
     * @param value the face to report (1 or 20 in practice)
     * @param modifier modifier to add to the total
     */
    public static D20Outcome forced(int value, int modifier) {
        return new D20Outcome(List.of(value), value, modifier, false, false, false, false);
    }

    public List<Integer> getRolls() { return rolls; }
    public int getModifier() { return modifier; }
    public int getBaseRoll() { return baseRoll; }
    public int getTotal() { return total; }
    public boolean isNatural20() { return natural20; }
    public boolean isNatural1() { return natural1; }
    public boolean hadAdvantage() { return advantage; }
    public boolean hadDisadvantage() { return disadvantage; }

    @Override
    public String toString() {
        String sign = modifier >= 0 ? "+" : "";
        return "d20" + rolls + sign + modifier + "=" + total;
    }
}

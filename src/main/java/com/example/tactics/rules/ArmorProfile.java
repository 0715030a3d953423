package com.example.tactics.rules;

/**
 * Numeric armor class contribution of a piece of armor or a shield.
 *
 * @param baseAc base armor class, or the flat bonus for a shield
 * @param maxDexBonus cap on the Dexterity modifier; null for no cap, 0 for none allowed
 * @param shield true if {@code baseAc} is a bonus stacked on top of armor
 */
public record ArmorProfile(int baseAc, Integer maxDexBonus, boolean shield) {

    public static final ArmorProfile UNARMORED = new ArmorProfile(10, null, false);

    public boolean allowsDexterity() {
        return maxDexBonus == null || maxDexBonus > 0;
    }

    /**
     * Dexterity modifier after this armor's cap.
     */
    public int effectiveDex(int dexModifier) {
        if (maxDexBonus == null) return dexModifier;
        return Math.min(dexModifier, maxDexBonus);
    }
}

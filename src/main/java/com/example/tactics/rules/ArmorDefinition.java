package com.example.tactics.rules;

/**
 * Armor or shield entry from the rule tables.
 *
 * @param name armor name
 * @param category "light", "medium", "heavy" or "shield"
 * @param armorClass the raw armor class text, e.g. "14 + Dex modifier (max 2)"
 * @param profile {@code armorClass} parsed into numbers
 * @param strengthRequirement minimum Strength score, 0 if none
 * @param stealthDisadvantage whether the armor imposes disadvantage on Stealth
 */
public record ArmorDefinition(String name, String category, String armorClass, ArmorProfile profile,
                              int strengthRequirement, boolean stealthDisadvantage) {

    public boolean isShield() {
        return profile.shield();
    }
}

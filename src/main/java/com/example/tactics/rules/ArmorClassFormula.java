package com.example.tactics.rules;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the armor class text used in rule tables.
 * <ul>
 *   <li>Shield: "+2"</li>
 *   <li>Heavy armor: "16" (no Dexterity)</li>
 *   <li>Medium armor: "14 + Dex modifier (max 2)"</li>
 *   <li>Light armor: "11 + Dex modifier"</li>
 * </ul>
 * Anything else falls back to its first number, or AC 10.
 */
public final class ArmorClassFormula {

    private static final Pattern MEDIUM = Pattern.compile(
            "^(\\d+)\\s*\\+\\s*dex\\s+modifier\\s*\\(max\\s*(\\d+)\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern LIGHT = Pattern.compile(
            "^(\\d+)\\s*\\+\\s*dex\\s+modifier", Pattern.CASE_INSENSITIVE);
    private static final Pattern ANY_NUMBER = Pattern.compile("\\d+");
    private static final int DEFAULT_SHIELD_BONUS = 2;

    private ArmorClassFormula() {}

    public static ArmorProfile parse(String text) {
        if (text == null || text.isBlank()) {
            return ArmorProfile.UNARMORED;
        }
        String s = text.trim();

        if (s.startsWith("+")) {
            try {
                return new ArmorProfile(Integer.parseInt(s.substring(1).trim()), null, true);
            } catch (NumberFormatException e) {
                return new ArmorProfile(DEFAULT_SHIELD_BONUS, null, true);
            }
        }

        if (s.chars().allMatch(Character::isDigit)) {
            return new ArmorProfile(Integer.parseInt(s), 0, false);
        }

        Matcher m = MEDIUM.matcher(s);
        if (m.find()) {
            return new ArmorProfile(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), false);
        }

        m = LIGHT.matcher(s);
        if (m.find()) {
            return new ArmorProfile(Integer.parseInt(m.group(1)), null, false);
        }

        m = ANY_NUMBER.matcher(s);
        if (m.find()) {
            return new ArmorProfile(Integer.parseInt(m.group()), null, false);
        }
        return ArmorProfile.UNARMORED;
    }

    /**
     * Total armor class.
     *
     * @param armor worn armor, or {@link ArmorProfile#UNARMORED}
     * @param shieldBonus bonus from a shield, 0 if none
     * @param dexModifier the wearer's Dexterity modifier
     * @param otherBonuses magic items, spells and the like
     */
    public static int calculate(ArmorProfile armor, int shieldBonus, int dexModifier, int otherBonuses) {
        ArmorProfile worn = armor != null ? armor : ArmorProfile.UNARMORED;
        return worn.baseAc() + worn.effectiveDex(dexModifier) + shieldBonus + otherBonuses;
    }
}

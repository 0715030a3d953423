package com.example.tactics.rules;

import java.util.Set;

/**
 * A weapon as described in the rule tables.
 */
public class WeaponProfile {

    public static final int DEFAULT_REACH = 5;
    public static final int EXTENDED_REACH = 10;

    private final String name;
    private final String damage;
    private final DamageType damageType;
    private final Set<String> properties;
    private final int normalRange;
    private final int longRange;

    /**
     * @param name weapon name
     * @param damage dice notation, e.g. "1d8"
     * @param damageType type of damage dealt
     * @param properties lower-case property keywords such as "finesse" or "reach"
     * @param normalRange normal range in feet for ranged and thrown weapons, 0 otherwise
     * @param longRange long range in feet, 0 when the weapon has none
     */
    public WeaponProfile(String name, String damage, DamageType damageType, Set<String> properties,
                         int normalRange, int longRange) {
        this.name = name;
        this.damage = damage;
        this.damageType = damageType;
        this.properties = Set.copyOf(properties);
        this.normalRange = normalRange;
        this.longRange = longRange;
    }

    public String getName() { return name; }
    public String getDamage() { return damage; }
    public DamageType getDamageType() { return damageType; }
    public Set<String> getProperties() { return properties; }
    public int getNormalRange() { return normalRange; }
    public int getLongRange() { return longRange; }

    public boolean hasProperty(String property) {
        return property != null && properties.contains(property.toLowerCase());
    }

    public boolean isFinesse() {
        return hasProperty("finesse");
    }

    /** Ranged weapons attack with Dexterity; thrown melee weapons do not count. */
    public boolean isRanged() {
        return hasProperty("ammunition") || (normalRange > 0 && !hasProperty("thrown"));
    }

    /** Melee reach in feet. */
    public int getReach() {
        return hasProperty("reach") ? EXTENDED_REACH : DEFAULT_REACH;
    }

    @Override
    public String toString() {
        return name + " (" + damage + " " + (damageType != null ? damageType.getDisplayName() : "?") + ")";
    }
}

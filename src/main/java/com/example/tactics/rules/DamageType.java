package com.example.tactics.rules;

/**
 * Damage types, used to match resistances, vulnerabilities and immunities.
 */
public enum DamageType {
    ACID("Acid"),
    BLUDGEONING("Bludgeoning"),
    COLD("Cold"),
    FIRE("Fire"),
    FORCE("Force"),
    LIGHTNING("Lightning"),
    NECROTIC("Necrotic"),
    PIERCING("Piercing"),
    POISON("Poison"),
    PSYCHIC("Psychic"),
    RADIANT("Radiant"),
    SLASHING("Slashing"),
    THUNDER("Thunder");

    private final String displayName;

    DamageType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isPhysical() {
        return this == BLUDGEONING || this == PIERCING || this == SLASHING;
    }

    /** Acid, cold, fire, lightning and thunder. */
    public boolean isElemental() {
        return this == ACID || this == COLD || this == FIRE || this == LIGHTNING || this == THUNDER;
    }

    /**
     * Parse a damage type name (case-insensitive).
     * @return the type, or null if the name is not recognised
     */
    public static DamageType fromString(String s) {
        if (s == null || s.isBlank()) return null;
        String upper = s.trim().toUpperCase();
        for (DamageType t : values()) {
            if (t.name().equals(upper)) return t;
        }
        return null;
    }
}

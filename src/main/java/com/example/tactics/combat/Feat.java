package com.example.tactics.combat;

/**
 * Feats that change how opportunity attacks work.
 */
public enum Feat {

    /** Opportunity attacks ignore Disengage. */
    SENTINEL("Sentinel"),

    /** No opportunity attack from a creature this combatant attacked this turn. */
    MOBILE("Mobile"),

    /** Opportunity attack when a creature enters 10 ft reach. */
    POLEARM_MASTER("Polearm Master");

    private final String displayName;

    Feat(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Parse a feat name such as "polearm_master" or "Polearm Master".
     * @return the feat, or null if unknown
     */
    public static Feat fromString(String name) {
        if (name == null) return null;
        String normalized = name.trim().toUpperCase().replace(' ', '_').replace('-', '_');
        for (Feat feat : values()) {
            if (feat.name().equals(normalized)) {
                return feat;
            }
        }
        return null;
    }
}

package com.example.tactics.reaction;

/**
 * Events that can provoke a reaction.
 */
public enum ReactionTrigger {
    ENEMY_LEAVES_REACH("Enemy leaves reach"),
    BEING_HIT("Being hit"),
    BEING_ATTACKED("Being attacked"),
    BEING_MISSED("Being missed"),
    ENEMY_CASTS_SPELL("Enemy casts a spell"),
    TAKING_DAMAGE("Taking damage"),
    ALLY_ATTACKED("Ally attacked"),
    ENEMY_DISENGAGES("Enemy disengages"),
    ENEMY_ATTACKS_ALLY("Enemy attacks ally"),
    ENEMY_ENTERS_REACH("Enemy enters reach"),
    /** A condition named by a readied action. */
    CUSTOM("Custom");

    private final String displayName;

    ReactionTrigger(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Parse a trigger name such as "enemy_leaves_reach". Unknown names map to CUSTOM.
     */
    public static ReactionTrigger fromString(String s) {
        if (s == null || s.isBlank()) return CUSTOM;
        String upper = s.trim().toUpperCase().replace(' ', '_');
        for (ReactionTrigger t : values()) {
            if (t.name().equals(upper)) return t;
        }
        return CUSTOM;
    }
}

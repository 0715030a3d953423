package com.example.tactics.reaction;

import java.util.EnumSet;
import java.util.Set;

/**
 * Kinds of reaction a combatant may know, and the triggers each answers.
 */
public enum ReactionType {
    OPPORTUNITY_ATTACK("Opportunity Attack", EnumSet.of(ReactionTrigger.ENEMY_LEAVES_REACH)),
    SHIELD("Shield", EnumSet.of(ReactionTrigger.BEING_ATTACKED, ReactionTrigger.BEING_HIT)),
    COUNTERSPELL("Counterspell", EnumSet.of(ReactionTrigger.ENEMY_CASTS_SPELL)),
    ABSORB_ELEMENTS("Absorb Elements", EnumSet.of(ReactionTrigger.TAKING_DAMAGE)),
    HELLISH_REBUKE("Hellish Rebuke", EnumSet.of(ReactionTrigger.TAKING_DAMAGE)),
    UNCANNY_DODGE("Uncanny Dodge", EnumSet.of(ReactionTrigger.BEING_HIT)),
    PARRY("Parry", EnumSet.of(ReactionTrigger.BEING_ATTACKED)),
    RIPOSTE("Riposte", EnumSet.of(ReactionTrigger.BEING_MISSED)),
    SENTINEL("Sentinel", EnumSet.of(ReactionTrigger.ENEMY_DISENGAGES, ReactionTrigger.ENEMY_ATTACKS_ALLY)),
    POLEARM_MASTER("Polearm Master", EnumSet.of(ReactionTrigger.ENEMY_ENTERS_REACH)),
    READIED_ACTION("Readied Action", EnumSet.of(ReactionTrigger.CUSTOM));

    private final String displayName;
    private final Set<ReactionTrigger> triggers;

    ReactionType(String displayName, Set<ReactionTrigger> triggers) {
        this.displayName = displayName;
        this.triggers = triggers;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean answers(ReactionTrigger trigger) {
        return triggers.contains(trigger);
    }
}

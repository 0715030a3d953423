package com.example.tactics.reaction;

import java.util.Map;

/**
 * An action held back until a trigger occurs.
 *
 * @param action what the combatant will do, e.g. "attack" or "cast fire bolt"
 * @param trigger the event that releases it
 * @param description free text describing the trigger, e.g. "when the goblin opens the door"
 * @param extraData anything else the caller needs when the action fires
 */
public record ReadiedAction(String action, ReactionTrigger trigger, String description, Map<String, Object> extraData) {

    public ReadiedAction {
        trigger = trigger != null ? trigger : ReactionTrigger.CUSTOM;
        description = description != null ? description : "";
        extraData = extraData != null ? Map.copyOf(extraData) : Map.of();
    }

    public ReadiedAction(String action, ReactionTrigger trigger) {
        this(action, trigger, "", Map.of());
    }
}

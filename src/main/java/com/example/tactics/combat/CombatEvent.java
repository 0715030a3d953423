package com.example.tactics.combat;

/**
 * One line of the combat log.
 *
 * @param round round in which it happened, 0 before combat starts
 * @param type what kind of event it was
 * @param combatantId combatant the event is about, or null for session events
 * @param message readable description
 */
public record CombatEvent(int round, Type type, String combatantId, String message) {

    public enum Type {
        JOIN,
        LEAVE,
        ROUND,
        TURN,
        MOVE,
        ATTACK,
        DAMAGE,
        HEALING,
        DEATH_SAVE,
        STABILIZE,
        EXHAUSTION,
        REACTION,
        HAZARD,
        CHECK,
        SESSION
    }

    @Override
    public String toString() {
        return "[R" + round + "] " + message;
    }
}

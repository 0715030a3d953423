package com.example.tactics.status;

/**
 * Categories of d20 roll that conditions can impose disadvantage on.
 */
public enum RollType {
    ABILITY_CHECK,
    ATTACK_ROLL,
    SAVING_THROW
}

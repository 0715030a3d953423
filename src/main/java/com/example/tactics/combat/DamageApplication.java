package com.example.tactics.combat;

/**
 * Hit point change produced by applying damage.
 *
 * @param newHp hit points after the damage, never below 0
 * @param actualDamage damage after immunity, resistance and vulnerability
 * @param unconscious true when the creature is at 0 HP
 * @param overflow damage beyond what was needed to reach 0 HP, used for instant death
 */
public record DamageApplication(int newHp, int actualDamage, boolean unconscious, int overflow) {
}

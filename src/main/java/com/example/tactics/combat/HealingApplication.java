package com.example.tactics.combat;

/**
 * Hit point change produced by healing.
 *
 * @param newHp hit points after healing, never above max
 * @param actualHealing hit points actually restored
 */
public record HealingApplication(int newHp, int actualHealing) {
}

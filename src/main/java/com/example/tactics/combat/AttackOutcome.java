package com.example.tactics.combat;

import com.example.tactics.dice.D20Outcome;
import com.example.tactics.dice.DamageOutcome;
import com.example.tactics.rules.DamageType;

import java.util.Optional;

/**
 * Result of one attack roll and, on a hit, its damage.
 */
public class AttackOutcome {

    private final boolean hit;
    private final boolean criticalHit;
    private final boolean criticalMiss;
    private final D20Outcome attackRoll;
    private final int targetAc;
    private final DamageOutcome damage;
    private final DamageType damageType;

    private AttackOutcome(boolean hit, boolean criticalHit, boolean criticalMiss, D20Outcome attackRoll,
                          int targetAc, DamageOutcome damage, DamageType damageType) {
        this.hit = hit;
        this.criticalHit = criticalHit;
        this.criticalMiss = criticalMiss;
        this.attackRoll = attackRoll;
        this.targetAc = targetAc;
        this.damage = damage;
        this.damageType = damageType;
    }

    // Static factory methods

    public static AttackOutcome hit(D20Outcome roll, int targetAc, DamageOutcome damage, DamageType type,
                                    boolean critical) {
        return new AttackOutcome(true, critical, false, roll, targetAc, damage, type);
    }

    public static AttackOutcome miss(D20Outcome roll, int targetAc) {
        return new AttackOutcome(false, false, false, roll, targetAc, null, null);
    }

    public static AttackOutcome criticalMiss(D20Outcome roll, int targetAc) {
        return new AttackOutcome(false, false, true, roll, targetAc, null, null);
    }

    public boolean isHit() { return hit; }
    public boolean isCriticalHit() { return criticalHit; }
    public boolean isCriticalMiss() { return criticalMiss; }
    public D20Outcome getAttackRoll() { return attackRoll; }
    public int getTargetAc() { return targetAc; }
    public Optional<DamageOutcome> getDamage() { return Optional.ofNullable(damage); }
    public Optional<DamageType> getDamageType() { return Optional.ofNullable(damageType); }

    /** Damage rolled, 0 on a miss. */
    public int getDamageTotal() {
        return damage != null ? damage.getTotal() : 0;
    }

    @Override
    public String toString() {
        if (criticalMiss) return "AttackOutcome[critical miss, " + attackRoll + "]";
        if (!hit) return "AttackOutcome[miss, " + attackRoll + " vs AC " + targetAc + "]";
        return "AttackOutcome[" + (criticalHit ? "critical hit" : "hit") + ", " + attackRoll
                + " vs AC " + targetAc + ", " + damage + "]";
    }
}

package com.example.tactics.combat;

import com.example.tactics.rules.DamageType;
import com.example.tactics.status.DeathSaveResult;
import com.example.tactics.status.DeathSaveState;

import java.util.Optional;

/**
 * What happened when damage reached a combatant: hit point change plus any
 * death-save consequence.
 */
public class DamageReport {

    private final String targetId;
    private final int hpBefore;
    private final int hpAfter;
    private final int damageTaken;
    private final DamageType damageType;
    private final DeathSaveState deathState;
    private final DeathSaveResult deathSave;
    private final boolean killed;
    private final String description;

    DamageReport(String targetId, int hpBefore, int hpAfter, int damageTaken, DamageType damageType,
                 DeathSaveState deathState, DeathSaveResult deathSave, boolean killed, String description) {
        this.targetId = targetId;
        this.hpBefore = hpBefore;
        this.hpAfter = hpAfter;
        this.damageTaken = damageTaken;
        this.damageType = damageType;
        this.deathState = deathState;
        this.deathSave = deathSave;
        this.killed = killed;
        this.description = description;
    }

    public String getTargetId() { return targetId; }
    public int getHpBefore() { return hpBefore; }
    public int getHpAfter() { return hpAfter; }
    public int getDamageTaken() { return damageTaken; }
    public DamageType getDamageType() { return damageType; }

    /** Death-save state after the damage. */
    public DeathSaveState getDeathState() { return deathState; }

    /** Present when the target was already down and took failures. */
    public Optional<DeathSaveResult> getDeathSave() { return Optional.ofNullable(deathSave); }

    /** True if this damage killed the target. */
    public boolean isKilled() { return killed; }

    /** True if this damage dropped a conscious target to 0 HP. */
    public boolean isKnockedDown() {
        return hpBefore > 0 && hpAfter == 0;
    }

    public String getDescription() { return description; }

    @Override
    public String toString() {
        return "DamageReport[" + targetId + ", " + hpBefore + " -> " + hpAfter + ", " + description + "]";
    }
}

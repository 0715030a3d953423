package com.example.tactics.combat;

import com.example.tactics.grid.TerrainEffects;

import java.util.Optional;

/**
 * What a hazard or fall did to a combatant during a move.
 *
 * @param hazard the hazard that was triggered
 * @param damage damage report, null when the hazard was avoided
 * @param avoidedBy why a fall was avoided (e.g. "Flying"), null otherwise
 * @param landedProne whether the combatant ended up prone
 */
public record HazardOutcome(TerrainEffects.Hazard hazard, DamageReport damage, String avoidedBy,
                            boolean landedProne) {

    public Optional<DamageReport> getDamage() {
        return Optional.ofNullable(damage);
    }

    public Optional<String> getAvoidedBy() {
        return Optional.ofNullable(avoidedBy);
    }

    /** Damage taken, 0 when avoided. */
    public int getDamageTaken() {
        return damage != null ? damage.getDamageTaken() : 0;
    }
}

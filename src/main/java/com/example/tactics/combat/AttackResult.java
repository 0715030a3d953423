package com.example.tactics.combat;

import com.example.tactics.reaction.ReactionResult;

import java.util.Optional;

/**
 * Result of an attack made through a {@link Combat} session.
 * <p>
 * An attack that could not be made at all (out of range, total cover,
 * attacker down) is a failure with a reason and carries no roll. A
 * reaction the target took against the attack, and any damage it dealt
 * back to the attacker, are reported alongside the outcome.
 */
public class AttackResult {

    private final boolean attempted;
    private final String reason;
    private final AttackOutcome outcome;
    private final DamageReport damage;
    private final boolean advantage;
    private final boolean disadvantage;
    private final int cover;
    private final ReactionResult defenderReaction;
    private final DamageReport counterDamage;

    private AttackResult(boolean attempted, String reason, AttackOutcome outcome, DamageReport damage,
                         boolean advantage, boolean disadvantage, int cover, ReactionResult defenderReaction,
                         DamageReport counterDamage) {
        this.attempted = attempted;
        this.reason = reason;
        this.outcome = outcome;
        this.damage = damage;
        this.advantage = advantage;
        this.disadvantage = disadvantage;
        this.cover = cover;
        this.defenderReaction = defenderReaction;
        this.counterDamage = counterDamage;
    }

    // Static factory methods

    static AttackResult resolved(AttackOutcome outcome, DamageReport damage, boolean advantage,
                                 boolean disadvantage, int cover, ReactionResult defenderReaction,
                                 DamageReport counterDamage) {
        String reason = outcome.isHit() ? (outcome.isCriticalHit() ? "Critical hit" : "Hit")
                : (outcome.isCriticalMiss() ? "Critical miss" : "Miss");
        return new AttackResult(true, reason, outcome, damage, advantage, disadvantage, cover,
                defenderReaction, counterDamage);
    }

    static AttackResult failure(String reason) {
        return new AttackResult(false, reason, null, null, false, false, 0, null, null);
    }

    /** False if the attack could not be made. */
    public boolean wasAttempted() { return attempted; }

    public String getReason() { return reason; }

    public Optional<AttackOutcome> getOutcome() { return Optional.ofNullable(outcome); }

    public Optional<DamageReport> getDamage() { return Optional.ofNullable(damage); }

    public boolean isHit() {
        return outcome != null && outcome.isHit();
    }

    public boolean hadAdvantage() { return advantage; }
    public boolean hadDisadvantage() { return disadvantage; }

    /** Cover bonus added to the target's AC. */
    public int getCover() { return cover; }

    /** The reaction the target took, if it took one. */
    public Optional<ReactionResult> getDefenderReaction() { return Optional.ofNullable(defenderReaction); }

    /** Damage dealt back to the attacker by the target's reaction, e.g. a Riposte. */
    public Optional<DamageReport> getCounterDamage() { return Optional.ofNullable(counterDamage); }

    @Override
    public String toString() {
        return "AttackResult[" + reason + (damage != null ? ", " + damage.getDamageTaken() + " damage" : "") + "]";
    }
}

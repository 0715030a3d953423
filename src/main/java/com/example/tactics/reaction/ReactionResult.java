package com.example.tactics.reaction;

import com.example.tactics.dice.D20Outcome;

import java.util.Optional;

/**
 * Outcome of resolving one reaction.
 * <p>
 * A reaction that was not taken at all (wrong trigger, nothing to absorb)
 * is a failure and leaves the reactor's reaction unspent. A reaction that
 * was taken but did not work, such as a failed Counterspell check or a
 * missed Riposte, is still taken.
 */
public class ReactionResult {

    private final boolean taken;
    private final ReactionType type;
    private final String description;
    private final int armorClassBonus;
    private final int newArmorClass;
    private final boolean attackWouldMiss;
    private final int damagePrevented;
    private final int damageTaken;
    private final int damageDealt;
    private final boolean critical;
    private final boolean spellCountered;
    private final boolean saveSucceeded;
    private final String bonusDamageDice;
    private final D20Outcome roll;

    private ReactionResult(boolean taken, ReactionType type, String description, int armorClassBonus,
                           int newArmorClass, boolean attackWouldMiss, int damagePrevented, int damageTaken,
                           int damageDealt, boolean critical, boolean spellCountered, boolean saveSucceeded,
                           String bonusDamageDice, D20Outcome roll) {
        this.taken = taken;
        this.type = type;
        this.description = description;
        this.armorClassBonus = armorClassBonus;
        this.newArmorClass = newArmorClass;
        this.attackWouldMiss = attackWouldMiss;
        this.damagePrevented = damagePrevented;
        this.damageTaken = damageTaken;
        this.damageDealt = damageDealt;
        this.critical = critical;
        this.spellCountered = spellCountered;
        this.saveSucceeded = saveSucceeded;
        this.bonusDamageDice = bonusDamageDice;
        this.roll = roll;
    }

    // Static factory methods

    public static ReactionResult notTaken(ReactionType type, String reason) {
        return new ReactionResult(false, type, reason, 0, 0, false, 0, 0, 0, false, false, false, null, null);
    }

    static ReactionResult armorClassRaised(ReactionType type, String description, int bonus, int newAc,
                                           boolean attackWouldMiss) {
        return new ReactionResult(true, type, description, bonus, newAc, attackWouldMiss, 0, 0, 0,
                false, false, false, null, null);
    }

    static ReactionResult damageReduced(ReactionType type, String description, int prevented, int taken,
                                        String bonusDamageDice) {
        return new ReactionResult(true, type, description, 0, 0, false, prevented, taken, 0,
                false, false, false, bonusDamageDice, null);
    }

    static ReactionResult spellCheck(String description, boolean countered, D20Outcome check) {
        return new ReactionResult(true, ReactionType.COUNTERSPELL, description, 0, 0, false, 0, 0, 0,
                false, countered, false, null, check);
    }

    static ReactionResult damageDealt(ReactionType type, String description, int dealt, boolean critical,
                                      boolean saveSucceeded, D20Outcome roll) {
        return new ReactionResult(true, type, description, 0, 0, false, 0, 0, dealt,
                critical, false, saveSucceeded, null, roll);
    }

    /** False if the reaction was not taken; the reaction is then still available. */
    public boolean wasTaken() { return taken; }
    public ReactionType getType() { return type; }
    public String getDescription() { return description; }

    public int getArmorClassBonus() { return armorClassBonus; }
    public int getNewArmorClass() { return newArmorClass; }

    /** True when the raised armor class turns a hit into a miss. */
    public boolean attackWouldMiss() { return attackWouldMiss; }

    public int getDamagePrevented() { return damagePrevented; }

    /** Damage still taken after a damage-reducing reaction. */
    public int getDamageTaken() { return damageTaken; }

    /** Damage dealt back to another creature. */
    public int getDamageDealt() { return damageDealt; }

    public boolean isCritical() { return critical; }
    public boolean isSpellCountered() { return spellCountered; }

    /** Whether the target of a reaction that forces a save succeeded on it. */
    public boolean isSaveSucceeded() { return saveSucceeded; }

    /** Extra dice for the reactor's next melee hit, e.g. after Absorb Elements. */
    public Optional<String> getBonusDamageDice() { return Optional.ofNullable(bonusDamageDice); }

    /** The ability check, saving throw or attack roll made for the reaction, if any. */
    public Optional<D20Outcome> getRoll() { return Optional.ofNullable(roll); }

    @Override
    public String toString() {
        return "ReactionResult[" + type + (taken ? "" : " not taken") + ": " + description + "]";
    }
}

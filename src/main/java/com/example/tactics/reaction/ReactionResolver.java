package com.example.tactics.reaction;

import com.example.tactics.dice.D20Outcome;
import com.example.tactics.dice.DiceRoller;
import com.example.tactics.rules.DamageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the effect of a reaction once the reactor has decided to take it.
 * <p>
 * The resolver only does the rules arithmetic and rolls; whether the
 * reactor still has its reaction is checked by the caller against a
 * {@link ReactionRegistry}, and spending it is the caller's job too.
 */
public class ReactionResolver {

    private static final Logger logger = LoggerFactory.getLogger(ReactionResolver.class);

    public static final int SHIELD_AC_BONUS = 5;
    public static final int COUNTERSPELL_BASE_DC = 10;
    public static final String DEFAULT_SUPERIORITY_DIE = "1d8";

    private final DiceRoller dice;

    public ReactionResolver(DiceRoller dice) {
        this.dice = dice;
    }

    // ========== Armor class ==========

    /**
     * Shield: +5 AC until the start of the caster's next turn, cast after
     * seeing the attack roll. A critical hit still lands.
     */
    public ReactionResult shield(String casterName, int attackTotal, int currentAc, boolean criticalHit) {
        int newAc = currentAc + SHIELD_AC_BONUS;
        boolean wouldMiss = !criticalHit && attackTotal < newAc;
        String description = casterName + " casts Shield! AC becomes " + newAc
                + (wouldMiss ? " - the attack misses!" : " - but the attack still hits");
        return ReactionResult.armorClassRaised(ReactionType.SHIELD, description, SHIELD_AC_BONUS, newAc, wouldMiss);
    }

    /**
     * Parry: add the proficiency bonus to AC against one melee attack.
     */
    public ReactionResult parry(String defenderName, int proficiencyBonus, int attackTotal, int currentAc,
                                boolean criticalHit) {
        int bonus = Math.max(0, proficiencyBonus);
        int newAc = currentAc + bonus;
        boolean wouldMiss = !criticalHit && attackTotal < newAc;
        String description = wouldMiss
                ? defenderName + " parries! AC becomes " + newAc + " - the attack misses!"
                : defenderName + " parries, raising AC to " + newAc + ", but the attack still hits";
        return ReactionResult.armorClassRaised(ReactionType.PARRY, description, bonus, newAc, wouldMiss);
    }

    // ========== Damage reduction ==========

    /**
     * Uncanny Dodge: halve the damage of an attack, rounded down.
     */
    public ReactionResult uncannyDodge(String name, int damage) {
        int incoming = Math.max(0, damage);
        int halved = incoming / 2;
        return ReactionResult.damageReduced(ReactionType.UNCANNY_DODGE,
                name + " uses Uncanny Dodge! Takes " + halved + " damage instead of " + incoming,
                incoming - halved, halved, null);
    }

    /**
     * Absorb Elements: resistance to the triggering acid, cold, fire,
     * lightning or thunder damage, and 1d6 per slot level added to the
     * caster's next melee hit.
     */
    public ReactionResult absorbElements(String casterName, DamageType type, int damage, int slotLevel) {
        if (type == null || !type.isElemental()) {
            String typeName = type != null ? type.getDisplayName().toLowerCase() : "untyped";
            return ReactionResult.notTaken(ReactionType.ABSORB_ELEMENTS,
                    casterName + " cannot absorb " + typeName + " damage");
        }
        int incoming = Math.max(0, damage);
        int prevented = incoming / 2;
        int taken = incoming - prevented;
        String bonusDice = Math.max(1, slotLevel) + "d6";
        return ReactionResult.damageReduced(ReactionType.ABSORB_ELEMENTS,
                casterName + " absorbs " + type.getDisplayName().toLowerCase() + " damage! Takes " + taken
                        + " instead of " + incoming,
                prevented, taken, bonusDice);
    }

    // ========== Spells ==========

    /**
     * Counterspell: a spell of the slot level or lower is countered
     * outright; a higher one needs an ability check against 10 + its level.
     * A failed check still uses the reaction.
     */
    public ReactionResult counterspell(String casterName, int spellLevel, int slotLevel, int abilityModifier,
                                       String spellName) {
        String spell = spellName != null ? spellName : "a spell";
        if (slotLevel >= spellLevel) {
            return ReactionResult.spellCheck(casterName + " counters " + spell + "!", true, null);
        }
        int dc = COUNTERSPELL_BASE_DC + spellLevel;
        D20Outcome check = dice.rollD20(abilityModifier);
        boolean countered = check.getTotal() >= dc;
        String detail = " (Check: " + check.getTotal() + " vs DC " + dc + ")";
        logger.debug("Counterspell by {} against level {} spell: {} vs DC {}", casterName, spellLevel,
                check.getTotal(), dc);
        return ReactionResult.spellCheck(countered
                ? casterName + " counters " + spell + "!" + detail
                : casterName + " fails to counter " + spell + detail, countered, check);
    }

    /**
     * Hellish Rebuke: the target makes a Dexterity save or takes 2d10 fire
     * damage, plus 1d10 per slot level above 1st; half on a success.
     */
    public ReactionResult hellishRebuke(String casterName, String targetName, int targetDexModifier,
                                        int slotLevel, int spellDc) {
        D20Outcome save = dice.rollD20(targetDexModifier);
        boolean saved = save.getTotal() >= spellDc;
        int full = dice.rollDamage((1 + Math.max(1, slotLevel)) + "d10").getTotal();
        int damage = saved ? full / 2 : full;
        String description = casterName + " casts Hellish Rebuke! " + targetName
                + (saved ? " saves and takes " : " takes ") + damage + " fire damage";
        return ReactionResult.damageDealt(ReactionType.HELLISH_REBUKE, description, damage, false, saved, save);
    }

    // ========== Counterattacks ==========

    /**
     * Riposte: after being missed in melee, attack back and add a
     * superiority die to the damage on a hit. A natural 20 is a critical
     * and doubles the weapon dice; a natural 1 always misses.
     */
    public ReactionResult riposte(String name, String targetName, int attackBonus, int targetAc,
                                  String damageDice, int damageModifier, String superiorityDie) {
        D20Outcome roll = dice.rollD20(attackBonus);
        boolean critical = roll.isNatural20();
        boolean hit = critical || (!roll.isNatural1() && roll.getTotal() >= targetAc);
        if (!hit) {
            return ReactionResult.damageDealt(ReactionType.RIPOSTE,
                    name + "'s riposte against " + targetName + " misses (Superiority Die expended)",
                    0, false, false, roll);
        }

        int weaponDamage = dice.rollDamage(damageDice, damageModifier, critical).getTotal();
        int superiority = dice.rollTotal(superiorityDie != null ? superiorityDie : DEFAULT_SUPERIORITY_DIE);
        int total = weaponDamage + superiority;
        String description = name + " ripostes" + (critical ? " with a critical hit" : "") + " against "
                + targetName + " for " + total + " damage! (Superiority: +" + superiority + ")";
        return ReactionResult.damageDealt(ReactionType.RIPOSTE, description, total, critical, false, roll);
    }
}

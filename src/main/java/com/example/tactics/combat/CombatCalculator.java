package com.example.tactics.combat;

import com.example.tactics.dice.D20Outcome;
import com.example.tactics.dice.DamageOutcome;
import com.example.tactics.dice.DiceRoller;
import com.example.tactics.grid.GridPosition;
import com.example.tactics.rules.DamageType;
import com.example.tactics.rules.RulesConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolution engine for attacks, saving throws, damage and healing.
 * <p>
 * Attack roll: d20 + attack bonus against the target's armor class.
 * A kept die at or above the critical range always hits as a critical and a
 * natural 1 always misses. When {@link RulesConfig#isPlayerOnlyCriticals()}
 * is on, criticals by non-player attackers still hit but roll ordinary damage.
 * <p>
 * All randomness comes from the injected {@link DiceRoller}.
 */
public class CombatCalculator {

    private static final Logger logger = LoggerFactory.getLogger(CombatCalculator.class);

    /** Natural roll needed for a critical hit without class features. */
    public static final int DEFAULT_CRIT_RANGE = 20;

    /** Critical range can be widened, but a natural 1 never crits. */
    private static final int MIN_CRIT_RANGE = 2;

    /** Long range multiplier for weapons without an explicit long range. */
    private static final int LONG_RANGE_MULTIPLIER = 4;

    private final DiceRoller dice;
    private final RulesConfig rules;

    public CombatCalculator(DiceRoller dice, RulesConfig rules) {
        this.dice = dice;
        this.rules = rules != null ? rules : RulesConfig.defaults();
    }

    public DiceRoller getDice() {
        return dice;
    }

    public RulesConfig getRules() {
        return rules;
    }

    // ========== Attacks ==========

    /**
     * Resolve a player's plain attack with no advantage state and the default critical range.
     */
    public AttackOutcome resolveAttack(int attackBonus, int targetAc, String damageNotation,
                                       int damageModifier, DamageType damageType) {
        return resolveAttack(attackBonus, targetAc, damageNotation, damageModifier, damageType,
                false, false, DEFAULT_CRIT_RANGE, false, true);
    }

    /**
     * Resolve a complete attack.
     *
     * @param attackBonus total attack bonus (ability + proficiency + other)
     * @param targetAc target's armor class
     * @param damageNotation damage dice, e.g. "1d8" or "2d6+1d4"
     * @param damageModifier bonus damage, usually the ability modifier
     * @param damageType type of damage dealt on a hit
     * @param advantage attack with advantage
     * @param disadvantage attack with disadvantage
     * @param critRange lowest kept die that crits (20 normally, 19 or 18 with class features)
     * @param autoCrit any hit becomes a critical, e.g. against a paralyzed target in melee
     * @param attackerIsPlayer whether the attacker is player-controlled
     * @return the outcome; damage is present only on a hit
     * @throws com.example.tactics.dice.DiceNotationException if the damage notation is malformed
     */
    public AttackOutcome resolveAttack(int attackBonus, int targetAc, String damageNotation, int damageModifier,
                                       DamageType damageType, boolean advantage, boolean disadvantage,
                                       int critRange, boolean autoCrit, boolean attackerIsPlayer) {
        D20Outcome roll = dice.rollD20(attackBonus, advantage, disadvantage);
        int threshold = Math.max(MIN_CRIT_RANGE, Math.min(DEFAULT_CRIT_RANGE, critRange));

        boolean critRoll = roll.isNatural20() || roll.getBaseRoll() >= threshold;
        if (critRoll) {
            boolean fullCrit = critDamageAllowed(attackerIsPlayer);
            if (!fullCrit) {
                logger.debug("Critical roll {} by non-player downgraded to a normal hit", roll.getBaseRoll());
            }
            DamageOutcome damage = rollDamage(damageNotation, damageModifier, fullCrit);
            return AttackOutcome.hit(roll, targetAc, damage, damageType, fullCrit);
        }

        if (roll.isNatural1()) {
            return AttackOutcome.criticalMiss(roll, targetAc);
        }

        if (roll.getTotal() < targetAc) {
            return AttackOutcome.miss(roll, targetAc);
        }

        boolean critical = autoCrit && critDamageAllowed(attackerIsPlayer);
        DamageOutcome damage = rollDamage(damageNotation, damageModifier, critical);
        return AttackOutcome.hit(roll, targetAc, damage, damageType, critical);
    }

    private boolean critDamageAllowed(boolean attackerIsPlayer) {
        return attackerIsPlayer || !rules.isPlayerOnlyCriticals();
    }

    private DamageOutcome rollDamage(String notation, int modifier, boolean critical) {
        return dice.rollDamage(notation, modifier, critical, rules.isCriticalDamageMaxFirstDie());
    }

    // ========== Saving throws ==========

    public SavingThrowOutcome resolveSavingThrow(int modifier, int dc) {
        return resolveSavingThrow(modifier, dc, false, false, false, false);
    }

    /**
     * Resolve a saving throw. Automatic failure wins over automatic success;
     * either one skips the roll and reports a fixed 1 or 20.
     *
     * @param modifier total save modifier (ability + proficiency if proficient)
     * @param dc difficulty class to meet or beat
     * @param autoFail fail without rolling (e.g. a paralyzed creature's Dexterity save)
     * @param autoSucceed succeed without rolling
     */
    public SavingThrowOutcome resolveSavingThrow(int modifier, int dc, boolean advantage, boolean disadvantage,
                                                 boolean autoFail, boolean autoSucceed) {
        if (autoFail) {
            return new SavingThrowOutcome(false, D20Outcome.forced(1, modifier), dc, true);
        }
        if (autoSucceed) {
            return new SavingThrowOutcome(true, D20Outcome.forced(20, modifier), dc, true);
        }
        D20Outcome roll = dice.rollD20(modifier, advantage, disadvantage);
        return new SavingThrowOutcome(roll.getTotal() >= dc, roll, dc, false);
    }

    /**
     * Roll an ability check or skill check. The caller compares the total with its DC.
     */
    public D20Outcome rollAbilityCheck(int modifier, boolean advantage, boolean disadvantage) {
        return dice.rollD20(modifier, advantage, disadvantage);
    }

    /**
     * Initiative: d20 + Dexterity modifier.
     */
    public int rollInitiative(int dexModifier) {
        return dice.rollD20(dexModifier).getTotal();
    }

    // ========== Hit points ==========

    /**
     * Apply damage to a creature.
     * <p>
     * Immunity negates the damage. Resistance halves it (rounded down) and
     * vulnerability doubles it; having both cancels out.
     *
     * @param currentHp hit points before the damage
     * @param maxHp maximum hit points
     * @param damage incoming damage
     * @return the new hit points, damage taken, and whether the creature dropped to 0
     */
    public DamageApplication applyDamage(int currentHp, int maxHp, int damage,
                                         boolean resistance, boolean vulnerability, boolean immunity) {
        if (immunity) {
            return new DamageApplication(currentHp, 0, false, 0);
        }

        int actual = Math.max(0, damage);
        if (resistance && !vulnerability) {
            actual = actual / 2;
        } else if (vulnerability && !resistance) {
            actual = actual * 2;
        }

        int newHp = Math.max(0, currentHp - actual);
        int overflow = Math.max(0, actual - currentHp);
        return new DamageApplication(newHp, actual, newHp == 0, overflow);
    }

    /**
     * Apply healing, never exceeding maximum hit points.
     */
    public HealingApplication applyHealing(int currentHp, int maxHp, int healing) {
        int newHp = Math.min(maxHp, currentHp + Math.max(0, healing));
        newHp = Math.max(newHp, currentHp);
        return new HealingApplication(newHp, newHp - currentHp);
    }

    // ========== Derived numbers ==========

    /**
     * Ability modifier: (score - 10) / 2, rounded down. 10 gives +0, 8 gives -1, 20 gives +5.
     */
    public static int abilityModifier(int score) {
        return Math.floorDiv(score - 10, 2);
    }

    /**
     * Proficiency bonus by level: +2 at levels 1-4, rising by 1 every four levels.
     */
    public static int proficiencyBonus(int level) {
        if (level < 1) return 2;
        return 2 + (level - 1) / 4;
    }

    /** Spell save DC = 8 + proficiency + spellcasting modifier. */
    public static int spellSaveDc(int spellcastingModifier, int proficiencyBonus) {
        return 8 + proficiencyBonus + spellcastingModifier;
    }

    /** Spell attack bonus = proficiency + spellcasting modifier. */
    public static int spellAttackBonus(int spellcastingModifier, int proficiencyBonus) {
        return proficiencyBonus + spellcastingModifier;
    }

    /**
     * Melee attack bonus. Finesse weapons use the better of Strength and Dexterity.
     */
    public static int meleeAttackBonus(int strModifier, int dexModifier, int proficiencyBonus,
                                       boolean proficient, boolean finesse, int otherBonuses) {
        int ability = finesse ? Math.max(strModifier, dexModifier) : strModifier;
        return ability + (proficient ? proficiencyBonus : 0) + otherBonuses;
    }

    public static int rangedAttackBonus(int dexModifier, int proficiencyBonus, boolean proficient, int otherBonuses) {
        return dexModifier + (proficient ? proficiencyBonus : 0) + otherBonuses;
    }

    /**
     * Whether a target is within normal range and within long range.
     *
     * @param normalRange normal range in feet
     * @param longRange long range in feet, or 0 to use four times the normal range
     */
    public static RangeCheck checkRange(GridPosition attacker, GridPosition target, int normalRange,
                                        int longRange, int cellSize) {
        int distance = attacker.chebyshevDistance(target) * cellSize;
        int effectiveLong = longRange > 0 ? longRange : normalRange * LONG_RANGE_MULTIPLIER;
        return new RangeCheck(distance, distance <= normalRange, distance <= effectiveLong);
    }

    /**
     * Distance to a target and whether it is in normal or long range.
     */
    public record RangeCheck(int distance, boolean inNormalRange, boolean inLongRange) {
        /** In long range but beyond normal range: attack at disadvantage. */
        public boolean requiresDisadvantage() {
            return inLongRange && !inNormalRange;
        }
    }
}

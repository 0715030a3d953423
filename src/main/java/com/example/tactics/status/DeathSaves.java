package com.example.tactics.status;

import com.example.tactics.dice.D20Outcome;
import com.example.tactics.dice.DiceRoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transition functions for death saving throws.
 * <p>
 * Each function takes the current {@link DeathSaveState} and returns the next
 * state together with a result; nothing is mutated. DEAD is terminal for every
 * transition.
 * <ul>
 *   <li>d20 total of 10 or more: one success; the third stabilizes and clears the counters.</li>
 *   <li>Below 10: one failure; the third is death.</li>
 *   <li>Natural 20: conscious again with counters cleared. The caller restores 1 HP.</li>
 *   <li>Natural 1: two failures at once.</li>
 * </ul>
 */
public final class DeathSaves {

    private static final Logger logger = LoggerFactory.getLogger(DeathSaves.class);

    public static final int DC = 10;

    private DeathSaves() {}

    // ========== Rolling ==========

    /**
     * Roll a death save with the given roller.
     */
    public static DeathSaveTransition roll(DeathSaveState state, DiceRoller dice, int modifier,
                                           boolean advantage, boolean disadvantage) {
        if (!state.isDying()) {
            return unchanged(state);
        }
        return applyRoll(state, dice.rollD20(modifier, advantage, disadvantage));
    }

    /**
     * Apply an already-rolled death save.
     */
    public static DeathSaveTransition applyRoll(DeathSaveState state, D20Outcome roll) {
        if (!state.isDying()) {
            return unchanged(state);
        }

        if (roll.isNatural20()) {
            return new DeathSaveTransition(DeathSaveState.conscious(),
                    new DeathSaveResult(DeathSaveOutcome.REVIVED, roll, 0, "Natural 20! Regains 1 HP and consciousness"));
        }

        if (roll.isNatural1()) {
            return addFailures(state, 2, roll, "Natural 1! Two death save failures");
        }

        if (roll.getTotal() >= DC) {
            int successes = state.getSuccesses() + 1;
            if (successes >= DeathSaveState.MAX_MARKS) {
                return new DeathSaveTransition(DeathSaveState.of(DeathSavePhase.STABLE, 0, 0),
                        new DeathSaveResult(DeathSaveOutcome.STABILIZED, roll, 0, "Success! Now stable"));
            }
            DeathSaveState next = DeathSaveState.of(DeathSavePhase.DYING, successes, state.getFailures());
            return new DeathSaveTransition(next, new DeathSaveResult(DeathSaveOutcome.CONTINUE, roll, 0,
                    "Success! (" + next.getSuccesses() + "/3 successes, " + next.getFailures() + "/3 failures)"));
        }

        return addFailures(state, 1, roll, "Failure!");
    }

    // ========== Damage and healing ==========

    /**
     * Damage taken while at 0 HP: one failure, two on a critical hit.
     * A stable creature starts dying again with those failures.
     * Instant death from massive damage is checked separately with {@link #isMassiveDamage}.
     */
    public static DeathSaveTransition takeDamage(DeathSaveState state, boolean critical) {
        if (!state.isDown()) {
            return unchanged(state);
        }
        int failures = critical ? 2 : 1;
        DeathSaveState dying = state.isStable() ? DeathSaveState.dying() : state;
        return addFailures(dying, failures, null,
                critical ? "Critical hit while down! Two failures" : "Damage while down! One failure");
    }

    /**
     * Any healing brings a dying or stable creature back to consciousness.
     */
    public static DeathSaveTransition heal(DeathSaveState state) {
        if (state.isDead()) {
            return new DeathSaveTransition(state, new DeathSaveResult(DeathSaveOutcome.DEAD, null, 0,
                    "Cannot heal - creature is dead"));
        }
        if (!state.isDown()) {
            return unchanged(state);
        }
        return new DeathSaveTransition(DeathSaveState.conscious(),
                new DeathSaveResult(DeathSaveOutcome.REVIVED, null, 0, "Healed! Regains consciousness"));
    }

    /**
     * A single hit kills outright when the damage left over after reaching 0 HP
     * is at least the creature's hit point maximum.
     */
    public static boolean isMassiveDamage(int overflow, int maxHp) {
        return maxHp > 0 && overflow >= maxHp;
    }

    // ========== Stabilization ==========

    /**
     * Try to stabilize a dying creature.
     *
     * @param method how it is being stabilized
     * @param check the rolled Medicine check; required for {@link StabilizationMethod#MEDICINE}, ignored otherwise
     */
    public static StabilizationResult stabilize(DeathSaveState state, StabilizationMethod method, MedicineCheck check) {
        if (state.isDead()) {
            return new StabilizationResult(false, method, state, null, "Cannot stabilize - creature is already dead");
        }
        if (state.isStable()) {
            return new StabilizationResult(true, method, state, null, "Creature is already stable");
        }
        if (!state.isDying()) {
            return new StabilizationResult(false, method, state, null, "Creature is not dying");
        }

        DeathSaveState stable = DeathSaveState.of(DeathSavePhase.STABLE, 0, 0);
        if (method.isAutomatic()) {
            return new StabilizationResult(true, method, stable, null, method.getDisplayName() + " stabilizes the creature");
        }

        if (check == null) {
            return new StabilizationResult(false, method, state, null, "Medicine check required but not provided");
        }
        if (check.success()) {
            return new StabilizationResult(true, method, stable, check.roll(),
                    "Medicine check succeeded (" + check.total() + " vs DC " + DC + ")");
        }
        return new StabilizationResult(false, method, state, check.roll(),
                "Medicine check failed (" + check.total() + " vs DC " + DC + ")");
    }

    /**
     * Roll a Wisdom (Medicine) check: d20 + Wisdom modifier, plus proficiency if proficient.
     */
    public static MedicineCheck attemptMedicineCheck(DiceRoller dice, int wisdomModifier, int proficiencyBonus,
                                                     boolean proficient, boolean advantage, boolean disadvantage) {
        int bonus = wisdomModifier + (proficient ? proficiencyBonus : 0);
        D20Outcome roll = dice.rollD20(bonus, advantage, disadvantage);
        return MedicineCheck.of(roll.getBaseRoll(), roll.getTotal());
    }

    // ========== Helpers ==========

    private static DeathSaveTransition addFailures(DeathSaveState state, int count, D20Outcome roll, String prefix) {
        int failures = state.getFailures() + count;
        if (failures >= DeathSaveState.MAX_MARKS) {
            DeathSaveState dead = DeathSaveState.of(DeathSavePhase.DEAD, state.getSuccesses(), failures);
            logger.debug("Death save failures reached {} - dead", failures);
            return new DeathSaveTransition(dead, new DeathSaveResult(DeathSaveOutcome.DEAD, roll, count,
                    prefix + " (3/3 failures) - has died"));
        }
        DeathSaveState next = DeathSaveState.of(DeathSavePhase.DYING, state.getSuccesses(), failures);
        return new DeathSaveTransition(next, new DeathSaveResult(DeathSaveOutcome.CONTINUE, roll, count,
                prefix + " (" + next.getSuccesses() + "/3 successes, " + next.getFailures() + "/3 failures)"));
    }

    private static DeathSaveTransition unchanged(DeathSaveState state) {
        DeathSaveOutcome outcome = state.isDead() ? DeathSaveOutcome.DEAD : DeathSaveOutcome.NO_EFFECT;
        return new DeathSaveTransition(state, new DeathSaveResult(outcome, null, 0, state.describe()));
    }
}

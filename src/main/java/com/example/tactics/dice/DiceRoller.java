package com.example.tactics.dice;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Rolls dice from an injected random source.
 * <p>
 * Every roll in an encounter goes through one roller, so seeding the
 * {@link Random} handed to the constructor makes a whole encounter
 * reproducible. A roller is not thread-safe beyond what its {@code Random}
 * provides; one encounter is driven from one thread at a time.
 */
public class DiceRoller {

    private static final Logger logger = LoggerFactory.getLogger(DiceRoller.class);

    private final Random random;

    /** Roller backed by an unseeded {@link Random}. */
    public DiceRoller() {
        this(new Random());
    }

    public DiceRoller(Random random) {
        if (random == null) {
            throw new IllegalArgumentException("random source is required");
        }
        this.random = random;
    }

    /** Roller with a fixed seed, for replays and tests. */
    public static DiceRoller seeded(long seed) {
        return new DiceRoller(new Random(seed));
    }

    // ========== Single dice ==========

    /**
     * Roll one die.
     *
     * @param sides number of faces, at least 1
     * @return a value in [1, sides]
     */
    public int rollDie(int sides) {
        if (sides < 1) {
            throw new IllegalArgumentException("A die needs at least one face, got " + sides);
        }
        return random.nextInt(sides) + 1;
    }

    /**
     * Roll several dice of the same size.
     */
    public List<Integer> rollDice(int count, int sides) {
        List<Integer> results = new ArrayList<>(Math.max(0, count));
        for (int i = 0; i < count; i++) {
            results.add(rollDie(sides));
        }
        return results;
    }

    // ========== d20 ==========

    /**
     * Roll a d20 with no advantage state.
     */
    public D20Outcome rollD20(int modifier) {
        return rollD20(modifier, false, false);
    }

    /**
     * Roll a d20. Advantage takes the higher of two dice, disadvantage the lower;
     * when both apply they cancel and a single die is rolled.
     *
     * @param modifier flat bonus added to the kept die
     * @param advantage roll with advantage
     * @param disadvantage roll with disadvantage
     * @return the outcome, with natural flags judged on the kept die
     */
    public D20Outcome rollD20(int modifier, boolean advantage, boolean disadvantage) {
        boolean adv = advantage && !disadvantage;
        boolean dis = disadvantage && !advantage;

        List<Integer> rolls;
        int base;
        if (adv || dis) {
            int first = rollDie(20);
            int second = rollDie(20);
            rolls = List.of(first, second);
            base = adv ? Math.max(first, second) : Math.min(first, second);
        } else {
            base = rollDie(20);
            rolls = List.of(base);
        }

        return new D20Outcome(rolls, base, modifier, base == 20, base == 1, adv, dis);
    }

    // ========== Damage ==========

    /**
     * Roll damage from dice notation.
     *
     * @param notation dice expression, e.g. "2d6+3" or "1d8+1d6"
     * @param extraModifier bonus added on top of the notation's own modifiers
     * @param critical double the number of dice rolled (modifiers are not doubled)
     * @return outcome with a total of at least 1
     * @throws DiceNotationException if the notation is malformed
     */
    public DamageOutcome rollDamage(String notation, int extraModifier, boolean critical) {
        return rollDamage(notation, extraModifier, critical, false);
    }

    /**
     * Roll damage, optionally with the variant critical rule where the first
     * die of a critical counts as its maximum face and the rest are rolled.
     *
     * @param maxFirstDie only applies when {@code critical} is true
     */
    public DamageOutcome rollDamage(String notation, int extraModifier, boolean critical, boolean maxFirstDie) {
        List<DiceTerm> terms = DiceNotation.parse(notation);

        List<Integer> rolls = new ArrayList<>();
        int total = extraModifier;
        int modifierTotal = extraModifier;
        boolean maximizeNext = critical && maxFirstDie;

        for (DiceTerm term : terms) {
            DiceTerm effective = critical ? term.doubled() : term;
            int sign = effective.count() < 0 ? -1 : 1;
            for (int i = 0; i < Math.abs(effective.count()); i++) {
                int face;
                if (maximizeNext && sign > 0) {
                    face = effective.sides();
                    maximizeNext = false;
                } else {
                    face = rollDie(effective.sides()) * sign;
                }
                rolls.add(face);
                total += face;
            }
            total += effective.modifier();
            modifierTotal += effective.modifier();
        }

        int floored = Math.max(1, total);
        if (floored != total) {
            logger.debug("Damage {} rolled {} and was floored to 1", notation, total);
        }
        return new DamageOutcome(rolls, modifierTotal, floored, notation, critical);
    }

    public DamageOutcome rollDamage(String notation) {
        return rollDamage(notation, 0, false);
    }

    /**
     * Roll a plain sum of dice with no damage floor, e.g. for falling damage
     * or hit dice.
     */
    public int rollTotal(String notation) {
        int total = 0;
        for (DiceTerm term : DiceNotation.parse(notation)) {
            int sign = term.count() < 0 ? -1 : 1;
            for (int i = 0; i < Math.abs(term.count()); i++) {
                total += rollDie(term.sides()) * sign;
            }
            total += term.modifier();
        }
        return total;
    }
}

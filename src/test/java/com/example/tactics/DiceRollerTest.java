package com.example.tactics;

import com.example.tactics.dice.D20Outcome;
import com.example.tactics.dice.DamageOutcome;
import com.example.tactics.dice.DiceNotationException;
import com.example.tactics.dice.DiceRoller;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DiceRoller d20 and damage rolls.
 */
public class DiceRollerTest {

    // === d20 ===

    @Test
    void testRollD20_plain() {
        DiceRoller dice = new DiceRoller(new ScriptedRandom(12));
        D20Outcome roll = dice.rollD20(3);
        assertEquals(List.of(12), roll.getRolls());
        assertEquals(12, roll.getBaseRoll());
        assertEquals(15, roll.getTotal());
        assertFalse(roll.isNatural20());
        assertFalse(roll.isNatural1());
    }

    @Test
    void testRollD20_advantageKeepsHigher() {
        DiceRoller dice = new DiceRoller(new ScriptedRandom(4, 17));
        D20Outcome roll = dice.rollD20(0, true, false);
        assertEquals(List.of(4, 17), roll.getRolls());
        assertEquals(17, roll.getBaseRoll());
        assertTrue(roll.hadAdvantage());
    }

    @Test
    void testRollD20_disadvantageKeepsLower() {
        DiceRoller dice = new DiceRoller(new ScriptedRandom(20, 1));
        D20Outcome roll = dice.rollD20(5, false, true);
        assertEquals(1, roll.getBaseRoll());
        assertTrue(roll.isNatural1());
        assertFalse(roll.isNatural20());
        assertEquals(6, roll.getTotal());
    }

    @Test
    void testRollD20_naturalFlagsIgnoreModifier() {
        DiceRoller dice = new DiceRoller(new ScriptedRandom(20));
        D20Outcome roll = dice.rollD20(-10);
        assertTrue(roll.isNatural20());
        assertEquals(10, roll.getTotal());
    }

    @Test
    void testRollD20_advantageAndDisadvantageCancel() {
        for (int seed = 0; seed < 50; seed++) {
            D20Outcome roll = DiceRoller.seeded(seed).rollD20(0, true, true);
            assertEquals(1, roll.getRolls().size());
            assertFalse(roll.hadAdvantage());
            assertFalse(roll.hadDisadvantage());
        }
    }

    @Test
    void testRollD20_bothFlagsConsumeOneDie() {
        ScriptedRandom random = new ScriptedRandom(9, 15);
        new DiceRoller(random).rollD20(0, true, true);
        assertEquals(1, random.remaining());
    }

    // === Damage ===

    @Test
    void testRollDamage_addsNotationAndExtraModifier() {
        DiceRoller dice = new DiceRoller(new ScriptedRandom(2, 5));
        DamageOutcome damage = dice.rollDamage("2d6+3", 2, false);
        assertEquals(List.of(2, 5), damage.getRolls());
        assertEquals(5, damage.getModifier());
        assertEquals(12, damage.getTotal());
        assertFalse(damage.isCritical());
    }

    @Test
    void testRollDamage_criticalDoublesDiceNotModifier() {
        DiceRoller dice = new DiceRoller(new ScriptedRandom(1, 2, 3, 4));
        DamageOutcome damage = dice.rollDamage("2d6+3", 0, true);
        assertEquals(4, damage.getRolls().size());
        assertEquals(3, damage.getModifier());
        assertEquals(13, damage.getTotal());
        assertTrue(damage.isCritical());
    }

    @Test
    void testRollDamage_criticalRangeOverManySeeds() {
        for (int seed = 0; seed < 200; seed++) {
            DamageOutcome damage = DiceRoller.seeded(seed).rollDamage("2d6+3", 0, true);
            assertEquals(4, damage.getRolls().size());
            assertTrue(damage.getTotal() >= 7 && damage.getTotal() <= 27, "total " + damage.getTotal());
        }
    }

    @Test
    void testRollDamage_maxFirstDieOnCritical() {
        DiceRoller dice = new DiceRoller(new ScriptedRandom(3));
        DamageOutcome damage = dice.rollDamage("1d8", 0, true, true);
        assertEquals(List.of(8, 3), damage.getRolls());
        assertEquals(11, damage.getTotal());
    }

    @Test
    void testRollDamage_maxFirstDieIgnoredWithoutCritical() {
        DiceRoller dice = new DiceRoller(new ScriptedRandom(3));
        DamageOutcome damage = dice.rollDamage("1d8", 0, false, true);
        assertEquals(List.of(3), damage.getRolls());
    }

    @ParameterizedTest
    @CsvSource({
        "1d4-10, 0",
        "1d4, -20",
        "1, -5",
        "0, 0"
    })
    void testRollDamage_neverBelowOne(String notation, int modifier) {
        for (int seed = 0; seed < 20; seed++) {
            assertTrue(DiceRoller.seeded(seed).rollDamage(notation, modifier, false).getTotal() >= 1);
        }
    }

    @Test
    void testRollDamage_flatNotationHasNoDice() {
        DamageOutcome damage = new DiceRoller(new ScriptedRandom()).rollDamage("5");
        assertTrue(damage.getRolls().isEmpty());
        assertEquals(5, damage.getModifier());
        assertEquals(5, damage.getTotal());
    }

    @Test
    void testRollDamage_subtractedDice() {
        DiceRoller dice = new DiceRoller(new ScriptedRandom(7, 3));
        DamageOutcome damage = dice.rollDamage("1d10-1d4");
        assertEquals(List.of(7, -3), damage.getRolls());
        assertEquals(4, damage.getTotal());
    }

    @Test
    void testRollDamage_malformedThrows() {
        assertThrows(DiceNotationException.class, () -> new DiceRoller().rollDamage("2d"));
    }

    @Test
    void testRollDie_rejectsZeroFaces() {
        assertThrows(IllegalArgumentException.class, () -> new DiceRoller().rollDie(0));
    }

    @Test
    void testRollTotal_noFloor() {
        DiceRoller dice = new DiceRoller(new ScriptedRandom(1));
        assertEquals(-4, dice.rollTotal("1d4-5"));
    }

    @Test
    void testSeeded_isReproducible() {
        DiceRoller a = DiceRoller.seeded(42);
        DiceRoller b = DiceRoller.seeded(42);
        for (int i = 0; i < 20; i++) {
            assertEquals(a.rollDie(20), b.rollDie(20));
        }
    }
}

package com.example.tactics;

import com.example.tactics.status.Exhaustion;
import com.example.tactics.status.ExhaustionChange;
import com.example.tactics.status.ExhaustionState;
import com.example.tactics.status.RollType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for exhaustion levels and their cumulative effects.
 */
public class ExhaustionTest {

    // === Transitions ===

    @Test
    void testGain() {
        ExhaustionChange change = Exhaustion.gain(ExhaustionState.none(), 2);
        assertEquals(2, change.state().getLevel());
        assertEquals(2, change.levelsChanged());
        assertFalse(change.died());
    }

    @Test
    void testGainToSixKills() {
        ExhaustionChange change = Exhaustion.gain(ExhaustionState.of(4), 5);
        assertEquals(6, change.state().getLevel());
        assertTrue(change.died());
        assertTrue(change.state().isDead());
    }

    @ParameterizedTest
    @CsvSource({"0, 7", "0, 6", "3, 3", "5, 1"})
    void testGain_reachingSixKills(int startLevel, int gained) {
        ExhaustionChange change = Exhaustion.gain(ExhaustionState.of(startLevel), gained);
        assertEquals(6, change.state().getLevel());
        assertTrue(change.died());
        assertTrue(change.state().isDead());
        assertEquals(startLevel, change.previous().getLevel());
    }

    @Test
    void testDeathIsTerminal() {
        ExhaustionState dead = ExhaustionState.of(6);
        assertFalse(Exhaustion.gain(dead, 1).died());
        assertEquals(6, Exhaustion.reduce(dead, 3).state().getLevel());
        assertEquals(6, Exhaustion.recoverOnRest(dead, true).state().getLevel());
    }

    @Test
    void testReduceClampsAtZero() {
        ExhaustionChange change = Exhaustion.reduce(ExhaustionState.of(2), 5);
        assertEquals(0, change.state().getLevel());
        assertTrue(change.fullyRecovered());
        assertEquals(-2, change.levelsChanged());
    }

    @Test
    void testNegativeAmountsIgnored() {
        assertEquals(3, Exhaustion.gain(ExhaustionState.of(3), -2).state().getLevel());
        assertEquals(3, Exhaustion.reduce(ExhaustionState.of(3), -2).state().getLevel());
    }

    @Test
    void testLongRestNeedsFoodAndDrink() {
        assertEquals(3, Exhaustion.recoverOnRest(ExhaustionState.of(3), false).state().getLevel());
        assertEquals(2, Exhaustion.recoverOnRest(ExhaustionState.of(3), true).state().getLevel());
    }

    @Test
    void testOfClamps() {
        assertEquals(0, ExhaustionState.of(-4).getLevel());
        assertEquals(6, ExhaustionState.of(11).getLevel());
        assertSame(ExhaustionState.of(2), ExhaustionState.of(2));
    }

    // === Effects ===

    @ParameterizedTest
    @CsvSource({
        "0, false, false, false",
        "1, true, false, false",
        "2, true, false, false",
        "3, true, true, true",
        "5, true, true, true"
    })
    void testDisadvantageByLevel(int level, boolean checks, boolean attacks, boolean saves) {
        ExhaustionState state = ExhaustionState.of(level);
        assertEquals(checks, state.hasDisadvantageOn(RollType.ABILITY_CHECK));
        assertEquals(attacks, state.hasDisadvantageOn(RollType.ATTACK_ROLL));
        assertEquals(saves, state.hasDisadvantageOn(RollType.SAVING_THROW));
    }

    @ParameterizedTest
    @CsvSource({
        "0, 30, 30",
        "1, 30, 30",
        "2, 30, 15",
        "4, 25, 12",
        "5, 30, 0"
    })
    void testSpeed(int level, int base, int expected) {
        assertEquals(expected, ExhaustionState.of(level).speedFor(base));
    }

    @ParameterizedTest
    @CsvSource({
        "3, 21, 21",
        "4, 21, 10",
        "4, 1, 1"
    })
    void testMaxHp(int level, int base, int expected) {
        assertEquals(expected, ExhaustionState.of(level).maxHpFor(base));
    }

    @Test
    void testDescribe() {
        assertEquals("Not exhausted", ExhaustionState.none().describe());
        assertEquals("Death", ExhaustionState.of(6).describe());
    }
}

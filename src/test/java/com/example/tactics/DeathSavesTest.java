package com.example.tactics;

import com.example.tactics.dice.D20Outcome;
import com.example.tactics.dice.DiceRoller;
import com.example.tactics.status.DeathSaveOutcome;
import com.example.tactics.status.DeathSavePhase;
import com.example.tactics.status.DeathSaveState;
import com.example.tactics.status.DeathSaveTransition;
import com.example.tactics.status.DeathSaves;
import com.example.tactics.status.MedicineCheck;
import com.example.tactics.status.StabilizationMethod;
import com.example.tactics.status.StabilizationResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the death saving throw state machine.
 */
public class DeathSavesTest {

    private static DeathSaveTransition rollFace(DeathSaveState state, int face) {
        return DeathSaves.roll(state, new DiceRoller(new ScriptedRandom(face)), 0, false, false);
    }

    // === Rolling ===

    @Test
    void testSuccessAtDC() {
        DeathSaveTransition t = rollFace(DeathSaveState.dying(), 10);
        assertEquals(DeathSaveOutcome.CONTINUE, t.outcome());
        assertEquals(1, t.state().getSuccesses());
        assertEquals(0, t.state().getFailures());
        assertTrue(t.state().isDying());
    }

    @Test
    void testFailureBelowDC() {
        DeathSaveTransition t = rollFace(DeathSaveState.dying(), 9);
        assertEquals(1, t.state().getFailures());
        assertEquals(1, t.result().getFailuresAdded());
    }

    @Test
    void testThirdSuccessStabilizesAndClears() {
        DeathSaveState state = DeathSaveState.of(DeathSavePhase.DYING, 2, 2);
        DeathSaveTransition t = rollFace(state, 15);
        assertEquals(DeathSaveOutcome.STABILIZED, t.outcome());
        assertTrue(t.state().isStable());
        assertEquals(0, t.state().getSuccesses());
        assertEquals(0, t.state().getFailures());
    }

    @Test
    void testThirdFailureKills() {
        DeathSaveState state = DeathSaveState.of(DeathSavePhase.DYING, 2, 2);
        DeathSaveTransition t = rollFace(state, 5);
        assertEquals(DeathSaveOutcome.DEAD, t.outcome());
        assertTrue(t.state().isDead());
        assertTrue(t.result().isDeath());
    }

    @Test
    void testNatural20Revives() {
        DeathSaveState state = DeathSaveState.of(DeathSavePhase.DYING, 1, 2);
        DeathSaveTransition t = rollFace(state, 20);
        assertEquals(DeathSaveOutcome.REVIVED, t.outcome());
        assertEquals(DeathSaveState.conscious(), t.state());
    }

    @Test
    void testNatural1AddsTwoFailures() {
        DeathSaveTransition t = rollFace(DeathSaveState.dying(), 1);
        assertEquals(2, t.state().getFailures());
        assertEquals(2, t.result().getFailuresAdded());
        assertEquals(DeathSaveOutcome.CONTINUE, t.outcome());
    }

    @Test
    void testNatural1WithOneFailureKills() {
        DeathSaveState state = DeathSaveState.of(DeathSavePhase.DYING, 0, 1);
        assertTrue(rollFace(state, 1).state().isDead());
    }

    @ParameterizedTest
    @CsvSource({"0, 2", "2, 2", "1, 1"})
    void testNatural1_thirdFailureKills(int successes, int failures) {
        DeathSaveState state = DeathSaveState.of(DeathSavePhase.DYING, successes, failures);
        DeathSaveTransition t = rollFace(state, 1);
        assertEquals(DeathSaveOutcome.DEAD, t.outcome());
        assertTrue(t.state().isDead());
        assertEquals(DeathSaveState.MAX_MARKS, t.state().getFailures());
    }

    @Test
    void testModifierCountsTowardDC() {
        DiceRoller dice = new DiceRoller(new ScriptedRandom(8));
        DeathSaveTransition t = DeathSaves.roll(DeathSaveState.dying(), dice, 2, false, false);
        assertEquals(1, t.state().getSuccesses());
    }

    @Test
    void testApplyRoll_forcedValue() {
        DeathSaveTransition t = DeathSaves.applyRoll(DeathSaveState.dying(), D20Outcome.forced(12, 0));
        assertEquals(1, t.state().getSuccesses());
    }

    @ParameterizedTest
    @EnumSource(value = DeathSavePhase.class, names = {"CONSCIOUS", "STABLE", "DEAD"})
    void testRollOutsideDyingHasNoEffect(DeathSavePhase phase) {
        DeathSaveState state = DeathSaveState.of(phase, 0, 0);
        ScriptedRandom random = new ScriptedRandom(5);
        DeathSaveTransition t = DeathSaves.roll(state, new DiceRoller(random), 0, false, false);
        assertSame(state.getPhase(), t.state().getPhase());
        assertEquals(phase == DeathSavePhase.DEAD ? DeathSaveOutcome.DEAD : DeathSaveOutcome.NO_EFFECT, t.outcome());
        assertEquals(1, random.remaining());
    }

    // === Damage and healing ===

    @ParameterizedTest
    @CsvSource({
        "false, 1",
        "true, 2"
    })
    void testDamageWhileDying(boolean critical, int failures) {
        DeathSaveTransition t = DeathSaves.takeDamage(DeathSaveState.dying(), critical);
        assertEquals(failures, t.state().getFailures());
        assertTrue(t.state().isDying());
    }

    @Test
    void testDamageWhileStable_resumesDying() {
        DeathSaveState stable = DeathSaveState.of(DeathSavePhase.STABLE, 0, 0);
        DeathSaveTransition t = DeathSaves.takeDamage(stable, false);
        assertTrue(t.state().isDying());
        assertEquals(1, t.state().getFailures());
    }

    @Test
    void testCriticalDamageWithTwoFailuresKills() {
        DeathSaveState state = DeathSaveState.of(DeathSavePhase.DYING, 0, 2);
        assertTrue(DeathSaves.takeDamage(state, true).state().isDead());
    }

    @Test
    void testDamageWhileConsciousIgnored() {
        DeathSaveTransition t = DeathSaves.takeDamage(DeathSaveState.conscious(), true);
        assertEquals(DeathSaveOutcome.NO_EFFECT, t.outcome());
    }

    @Test
    void testHeal() {
        DeathSaveState dying = DeathSaveState.of(DeathSavePhase.DYING, 1, 2);
        DeathSaveTransition t = DeathSaves.heal(dying);
        assertEquals(DeathSaveOutcome.REVIVED, t.outcome());
        assertTrue(t.state().isConscious());
        assertEquals(0, t.state().getFailures());

        DeathSaveState dead = DeathSaveState.of(DeathSavePhase.DEAD, 0, 3);
        assertTrue(DeathSaves.heal(dead).state().isDead());
    }

    @ParameterizedTest
    @CsvSource({
        "10, 10, true",
        "9, 10, false",
        "25, 10, true",
        "0, 0, false"
    })
    void testMassiveDamage(int overflow, int maxHp, boolean expected) {
        assertEquals(expected, DeathSaves.isMassiveDamage(overflow, maxHp));
    }

    // === Stabilization ===

    @ParameterizedTest
    @EnumSource(value = StabilizationMethod.class, names = {"SPARE_THE_DYING", "HEALERS_KIT"})
    void testAutomaticStabilization(StabilizationMethod method) {
        DeathSaveState state = DeathSaveState.of(DeathSavePhase.DYING, 1, 2);
        StabilizationResult result = DeathSaves.stabilize(state, method, null);
        assertTrue(result.isSuccess());
        assertTrue(result.getState().isStable());
        assertEquals(0, result.getState().getFailures());
        assertTrue(result.getRoll().isEmpty());
    }

    @Test
    void testMedicineCheck() {
        DeathSaveState state = DeathSaveState.dying();

        StabilizationResult pass = DeathSaves.stabilize(state, StabilizationMethod.MEDICINE, MedicineCheck.of(8, 10));
        assertTrue(pass.isSuccess());
        assertEquals(8, pass.getRoll().orElseThrow());

        StabilizationResult fail = DeathSaves.stabilize(state, StabilizationMethod.MEDICINE, MedicineCheck.of(7, 9));
        assertFalse(fail.isSuccess());
        assertEquals(state, fail.getState());

        assertFalse(DeathSaves.stabilize(state, StabilizationMethod.MEDICINE, null).isSuccess());
    }

    @Test
    void testAttemptMedicineCheck_addsProficiency() {
        DiceRoller dice = new DiceRoller(new ScriptedRandom(6, 6));
        assertTrue(DeathSaves.attemptMedicineCheck(dice, 2, 2, true, false, false).success());
        assertFalse(DeathSaves.attemptMedicineCheck(dice, 2, 2, false, false, false).success());
    }

    @Test
    void testStabilizeOutsideDying() {
        assertFalse(DeathSaves.stabilize(DeathSaveState.conscious(), StabilizationMethod.HEALERS_KIT, null).isSuccess());
        assertFalse(DeathSaves.stabilize(DeathSaveState.of(DeathSavePhase.DEAD, 0, 3),
                StabilizationMethod.SPARE_THE_DYING, null).isSuccess());
        assertTrue(DeathSaves.stabilize(DeathSaveState.of(DeathSavePhase.STABLE, 0, 0),
                StabilizationMethod.MEDICINE, null).isSuccess());
    }

    // === State ===

    @Test
    void testCountersClamped() {
        DeathSaveState state = DeathSaveState.of(DeathSavePhase.DYING, 7, -2);
        assertEquals(3, state.getSuccesses());
        assertEquals(0, state.getFailures());
    }

    @Test
    void testDescribe() {
        assertEquals("Dying - no death saves yet", DeathSaveState.dying().describe());
        assertEquals("Dying - 1 successes, 2 failures", DeathSaveState.of(DeathSavePhase.DYING, 1, 2).describe());
        assertEquals("Unconscious but stable", DeathSaveState.of(DeathSavePhase.STABLE, 0, 0).describe());
    }
}

package com.example.tactics;

import com.example.tactics.combat.Combatant;
import com.example.tactics.combat.Feat;
import com.example.tactics.combat.OpportunityAttack;
import com.example.tactics.combat.OpportunityAttackDetector;
import com.example.tactics.grid.CombatGrid;
import com.example.tactics.grid.GridPosition;
import com.example.tactics.grid.Pathfinder;
import com.example.tactics.reaction.ReactionRegistry;
import com.example.tactics.reaction.ReactionTrigger;
import com.example.tactics.rules.DamageType;
import com.example.tactics.rules.WeaponProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for opportunity attack detection along a movement path.
 * Disengage and Mobile depend on turn state and are covered in CombatTest.
 */
public class OpportunityAttackDetectorTest {

    private static final WeaponProfile GLAIVE =
            new WeaponProfile("Glaive", "1d10", DamageType.SLASHING, Set.of("heavy", "reach", "two-handed"), 0, 0);

    private CombatGrid grid;
    private ReactionRegistry reactions;
    private OpportunityAttackDetector detector;

    private Combatant goblin;
    private Combatant fighter;

    @BeforeEach
    void setUp() {
        grid = new CombatGrid();
        reactions = new ReactionRegistry();
        detector = new OpportunityAttackDetector(new Pathfinder(grid), reactions);

        goblin = new Combatant("goblin", "Goblin", 2, false, 7, 15, 30);
        fighter = new Combatant("fighter", "Fighter", 1, true, 20, 16, 30);
        place(fighter, 2, 2);
        place(goblin, 3, 2);
    }

    private void place(Combatant c, int x, int y) {
        grid.setOccupant(x, y, c.getId());
        reactions.register(c.getId());
    }

    private static List<GridPosition> path(int... coords) {
        GridPosition[] positions = new GridPosition[coords.length / 2];
        for (int i = 0; i < positions.length; i++) {
            positions[i] = GridPosition.of(coords[2 * i], coords[2 * i + 1]);
        }
        return List.of(positions);
    }

    // === Leaving reach ===

    @Test
    void testLeavingReachProvokes() {
        List<OpportunityAttack> attacks = detector.detect(goblin, path(3, 2, 4, 2, 5, 2), List.of(fighter));
        assertEquals(1, attacks.size());
        OpportunityAttack attack = attacks.get(0);
        assertEquals("fighter", attack.reactorId());
        assertEquals(ReactionTrigger.ENEMY_LEAVES_REACH, attack.trigger());
        assertEquals(GridPosition.of(3, 2), attack.moverPosition());
    }

    @Test
    void testMovingWithinReachDoesNotProvoke() {
        assertTrue(detector.detect(goblin, path(3, 2, 3, 3), List.of(fighter)).isEmpty());
        assertTrue(detector.detect(goblin, path(3, 2, 3, 1, 2, 1), List.of(fighter)).isEmpty());
    }

    @Test
    void testLeavingTwiceProvokesOnce() {
        List<OpportunityAttack> attacks = detector.detect(goblin,
                path(3, 2, 4, 2, 3, 3, 4, 4), List.of(fighter));
        assertEquals(1, attacks.size());
        assertEquals(GridPosition.of(3, 2), attacks.get(0).moverPosition());
    }

    @Test
    void testReachWeaponExtendsThreat() {
        fighter.setWeapon(GLAIVE);
        List<OpportunityAttack> attacks = detector.detect(goblin, path(3, 2, 4, 2, 5, 2), List.of(fighter));
        assertEquals(1, attacks.size());
        assertEquals(GridPosition.of(4, 2), attacks.get(0).moverPosition());
    }

    @Test
    void testAllyDoesNotProvoke() {
        Combatant cleric = new Combatant("cleric", "Cleric", 1, true, 18, 18, 30);
        place(cleric, 2, 3);
        List<OpportunityAttack> attacks = detector.detect(fighter, path(2, 2, 1, 2, 0, 2), List.of(cleric, goblin));
        assertEquals(1, attacks.size());
        assertEquals("goblin", attacks.get(0).reactorId());
    }

    @Test
    void testSpentReactionDoesNotProvoke() {
        reactions.useReaction("fighter");
        assertTrue(detector.detect(goblin, path(3, 2, 4, 2, 5, 2), List.of(fighter)).isEmpty());
    }

    @Test
    void testSeveralEnemiesInPathOrder() {
        Combatant rogue = new Combatant("rogue", "Rogue", 1, true, 14, 14, 30);
        place(rogue, 5, 3);
        List<OpportunityAttack> attacks = detector.detect(goblin,
                path(3, 2, 4, 2, 5, 2, 6, 1, 7, 0), List.of(rogue, fighter));
        assertEquals(2, attacks.size());
        assertEquals("fighter", attacks.get(0).reactorId());
        assertEquals("rogue", attacks.get(1).reactorId());
        assertEquals(GridPosition.of(5, 2), attacks.get(1).moverPosition());
    }

    @Test
    void testEnemyOffGridIgnored() {
        grid.clearOccupant("fighter");
        assertTrue(detector.detect(goblin, path(3, 2, 4, 2, 5, 2), List.of(fighter)).isEmpty());
    }

    @Test
    void testTrivialPathsProvokeNothing() {
        assertTrue(detector.detect(goblin, path(3, 2), List.of(fighter)).isEmpty());
        assertTrue(detector.detect(goblin, path(3, 2, 4, 2), List.of()).isEmpty());
    }

    // === Polearm Master ===

    @Test
    void testPolearmMasterEnteringReach() {
        fighter.addFeat(Feat.POLEARM_MASTER);
        fighter.setWeapon(GLAIVE);
        grid.setOccupant(6, 2, "goblin");

        List<OpportunityAttack> attacks = detector.detect(goblin, path(6, 2, 5, 2, 4, 2), List.of(fighter));
        assertEquals(1, attacks.size());
        assertEquals(ReactionTrigger.ENEMY_ENTERS_REACH, attacks.get(0).trigger());
        assertEquals(GridPosition.of(4, 2), attacks.get(0).moverPosition());
    }

    @Test
    void testEnteringReachWithoutFeatDoesNotProvoke() {
        fighter.setWeapon(GLAIVE);
        grid.setOccupant(6, 2, "goblin");
        assertTrue(detector.detect(goblin, path(6, 2, 5, 2, 4, 2), List.of(fighter)).isEmpty());
    }
}

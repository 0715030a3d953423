package com.example.tactics.combat;

import com.example.tactics.grid.GridPosition;
import com.example.tactics.grid.Pathfinder;
import com.example.tactics.reaction.ReactionRegistry;
import com.example.tactics.reaction.ReactionTrigger;
import com.example.tactics.rules.WeaponProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Works out which enemies may take an opportunity attack against a move.
 * <p>
 * The path is walked one step at a time and each enemy provokes at most once:
 * <ul>
 *   <li>leaving an enemy's reach provokes, unless the mover has Disengaged
 *       (Sentinel ignores Disengage) or has Mobile and attacked that enemy this turn;</li>
 *   <li>entering the 10 ft reach of an enemy with Polearm Master provokes,
 *       with the same Disengage rule.</li>
 * </ul>
 * Enemies whose reaction is already spent are dropped.
 */
public class OpportunityAttackDetector {

    private static final Logger logger = LoggerFactory.getLogger(OpportunityAttackDetector.class);

    private final Pathfinder pathfinder;
    private final ReactionRegistry reactions;

    public OpportunityAttackDetector(Pathfinder pathfinder, ReactionRegistry reactions) {
        this.pathfinder = pathfinder;
        this.reactions = reactions;
    }

    /**
     * @param mover the moving combatant
     * @param path positions from start to destination, both included
     * @param enemies combatants able to react; allies and the mover are ignored
     * @return the provoked attacks, in the order the mover triggers them
     */
    public List<OpportunityAttack> detect(Combatant mover, List<GridPosition> path, Collection<Combatant> enemies) {
        if (path == null || path.size() < 2 || enemies == null || enemies.isEmpty()) {
            return List.of();
        }

        Map<String, OpportunityAttack> provoked = new LinkedHashMap<>();
        for (int step = 1; step < path.size(); step++) {
            GridPosition before = path.get(step - 1);
            GridPosition after = path.get(step);

            for (Combatant enemy : enemies) {
                if (!mover.isHostileTo(enemy) || provoked.containsKey(enemy.getId())) continue;
                Optional<GridPosition> enemyPos = pathfinder.getGrid().findCombatant(enemy.getId());
                if (enemyPos.isEmpty()) continue;

                checkStep(mover, enemy, enemyPos.get(), before, after)
                        .ifPresent(attack -> provoked.put(enemy.getId(), attack));
            }
        }

        List<String> eligible = reactions.filterAvailable(provoked.keySet());
        List<OpportunityAttack> result = new ArrayList<>();
        for (OpportunityAttack attack : provoked.values()) {
            if (eligible.contains(attack.reactorId())) {
                result.add(attack);
            } else {
                logger.debug("{} would provoke {} but its reaction is spent", mover.getId(), attack.reactorId());
            }
        }
        return result;
    }

    private Optional<OpportunityAttack> checkStep(Combatant mover, Combatant enemy, GridPosition enemyPos,
                                                  GridPosition before, GridPosition after) {
        boolean sentinel = enemy.hasFeat(Feat.SENTINEL);
        if (mover.isDisengaged() && !sentinel) {
            return Optional.empty();
        }

        int distBefore = before.chebyshevDistance(enemyPos);
        int distAfter = after.chebyshevDistance(enemyPos);

        int reach = pathfinder.reachInSquares(enemy.getReach());
        if (distBefore <= reach && distAfter > reach) {
            if (mover.hasFeat(Feat.MOBILE) && mover.hasAttackedThisTurn(enemy.getId())) {
                return Optional.empty();
            }
            ReactionTrigger trigger = mover.isDisengaged()
                    ? ReactionTrigger.ENEMY_DISENGAGES
                    : ReactionTrigger.ENEMY_LEAVES_REACH;
            return Optional.of(new OpportunityAttack(enemy.getId(), trigger, before));
        }

        if (enemy.hasFeat(Feat.POLEARM_MASTER)) {
            int polearmReach = pathfinder.reachInSquares(WeaponProfile.EXTENDED_REACH);
            if (distBefore > polearmReach && distAfter <= polearmReach) {
                return Optional.of(new OpportunityAttack(enemy.getId(), ReactionTrigger.ENEMY_ENTERS_REACH, after));
            }
        }
        return Optional.empty();
    }
}

package com.example.tactics.combat;

import com.example.tactics.grid.GridPosition;
import com.example.tactics.reaction.ReactionTrigger;

/**
 * An enemy entitled to an opportunity attack during a move.
 *
 * @param reactorId combatant who may react
 * @param trigger what provoked it
 * @param moverPosition where the mover stood when the attack would be made
 */
public record OpportunityAttack(String reactorId, ReactionTrigger trigger, GridPosition moverPosition) {
}

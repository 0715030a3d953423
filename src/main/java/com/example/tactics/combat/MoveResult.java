package com.example.tactics.combat;

import com.example.tactics.grid.GridPosition;
import com.example.tactics.grid.JumpResult;

import java.util.List;
import java.util.Optional;

/**
 * Result of moving or jumping a combatant through a {@link Combat} session.
 */
public class MoveResult {

    private final boolean success;
    private final String reason;
    private final List<GridPosition> path;
    private final int cost;
    private final int remainingMovement;
    private final List<OpportunityAttack> opportunityAttacks;
    private final List<HazardOutcome> hazards;
    private final JumpResult jump;

    private MoveResult(boolean success, String reason, List<GridPosition> path, int cost, int remainingMovement,
                       List<OpportunityAttack> opportunityAttacks, List<HazardOutcome> hazards, JumpResult jump) {
        this.success = success;
        this.reason = reason;
        this.path = List.copyOf(path);
        this.cost = cost;
        this.remainingMovement = remainingMovement;
        this.opportunityAttacks = List.copyOf(opportunityAttacks);
        this.hazards = List.copyOf(hazards);
        this.jump = jump;
    }

    static MoveResult moved(List<GridPosition> path, int cost, int remainingMovement,
                            List<OpportunityAttack> opportunityAttacks, List<HazardOutcome> hazards) {
        return new MoveResult(true, "Moved", path, cost, remainingMovement, opportunityAttacks, hazards, null);
    }

    static MoveResult jumped(List<GridPosition> path, int remainingMovement, List<OpportunityAttack> opportunityAttacks,
                             List<HazardOutcome> hazards, JumpResult jump) {
        return new MoveResult(true, jump.getDescription(), path, jump.getMovementCost(), remainingMovement,
                opportunityAttacks, hazards, jump);
    }

    static MoveResult failure(String reason, int remainingMovement) {
        return new MoveResult(false, reason, List.of(), 0, remainingMovement, List.of(), List.of(), null);
    }

    public boolean isSuccess() { return success; }
    public String getReason() { return reason; }
    public List<GridPosition> getPath() { return path; }
    public int getCost() { return cost; }
    public int getRemainingMovement() { return remainingMovement; }

    /** Enemies entitled to an opportunity attack; the caller decides whether they take it. */
    public List<OpportunityAttack> getOpportunityAttacks() { return opportunityAttacks; }

    /** Falls along the way, then the hazard of the final cell, in the order they happened. */
    public List<HazardOutcome> getHazards() { return hazards; }

    public int getHazardDamageTaken() {
        return hazards.stream().mapToInt(HazardOutcome::getDamageTaken).sum();
    }

    /** The jump made, empty for an ordinary move. */
    public Optional<JumpResult> getJump() { return Optional.ofNullable(jump); }

    @Override
    public String toString() {
        if (!success) return "MoveResult[failed: " + reason + "]";
        return "MoveResult[cost=" + cost + ", path=" + path + ", opportunity=" + opportunityAttacks.size()
                + (hazards.isEmpty() ? "" : ", hazards=" + hazards.size()) + "]";
    }
}

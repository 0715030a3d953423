package com.example.tactics.grid;

import java.util.List;

/**
 * Outcome of checking a jump between two cells.
 */
public class JumpResult {

    private final boolean success;
    private final String description;
    private final int distanceFeet;
    private final int movementCost;
    private final List<GridPosition> clearedHazards;

    private JumpResult(boolean success, String description, int distanceFeet, int movementCost,
                       List<GridPosition> clearedHazards) {
        this.success = success;
        this.description = description;
        this.distanceFeet = distanceFeet;
        this.movementCost = movementCost;
        this.clearedHazards = List.copyOf(clearedHazards);
    }

    // Static factory methods

    static JumpResult landed(int distanceFeet, int movementCost, List<GridPosition> clearedHazards) {
        String description = "Jumped " + distanceFeet + " ft";
        if (!clearedHazards.isEmpty()) {
            description += ", cleared " + clearedHazards.size() + " hazard" + (clearedHazards.size() == 1 ? "" : "s");
        }
        return new JumpResult(true, description, distanceFeet, movementCost, clearedHazards);
    }

    static JumpResult failure(String description) {
        return new JumpResult(false, description, 0, 0, List.of());
    }

    public boolean isSuccess() { return success; }
    public String getDescription() { return description; }

    /** Horizontal distance covered, in feet. */
    public int getDistanceFeet() { return distanceFeet; }

    /** Movement spent: the distance plus the running start, if one was taken. */
    public int getMovementCost() { return movementCost; }

    /** Hazard and pit cells passed over without touching them. */
    public List<GridPosition> getClearedHazards() { return clearedHazards; }

    @Override
    public String toString() {
        return "JumpResult[" + description + (success ? ", cost " + movementCost : "") + "]";
    }
}

package com.example.tactics.grid;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a path search. Failures are reported here, never thrown.
 */
public class PathfindingResult {

    public static final String NO_PATH = "No path found";

    private final boolean success;
    private final List<GridPosition> path;
    private final int totalCost;
    private final String blockedBy;
    private final String reason;

    private PathfindingResult(boolean success, List<GridPosition> path, int totalCost,
                              String blockedBy, String reason) {
        this.success = success;
        this.path = List.copyOf(path);
        this.totalCost = totalCost;
        this.blockedBy = blockedBy;
        this.reason = reason;
    }

    public static PathfindingResult success(List<GridPosition> path, int totalCost) {
        return new PathfindingResult(true, path, totalCost, null, "Path found");
    }

    public static PathfindingResult failure(String reason) {
        return new PathfindingResult(false, List.of(), 0, null, reason);
    }

    public static PathfindingResult blocked(String occupantId) {
        return new PathfindingResult(false, List.of(), 0, occupantId, "Destination is occupied");
    }

    public boolean isSuccess() { return success; }

    /** Positions from start to destination, both included. Empty on failure. */
    public List<GridPosition> getPath() { return path; }

    public int getTotalCost() { return totalCost; }

    public Optional<String> getBlockedBy() { return Optional.ofNullable(blockedBy); }

    public String getReason() { return reason; }

    /** Number of cells moved, not counting the start. */
    public int getSteps() {
        return path.isEmpty() ? 0 : path.size() - 1;
    }

    @Override
    public String toString() {
        if (success) {
            return "PathfindingResult[cost=" + totalCost + ", path=" + path + "]";
        }
        return "PathfindingResult[failed: " + reason + (blockedBy != null ? " (" + blockedBy + ")" : "") + "]";
    }
}

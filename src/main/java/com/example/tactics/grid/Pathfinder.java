package com.example.tactics.grid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Movement searches over a {@link CombatGrid}.
 * <p>
 * Searches run over (cell, diagonal parity) states so the alternating
 * diagonal rule prices every second diagonal of the whole move correctly.
 * Under the Chebyshev policy parity is always 0 and the state is just the cell.
 * <p>
 * Occupied and impassable cells are never expanded. Diagonal steps may pass
 * between two blocked orthogonal neighbours.
 */
public class Pathfinder {

    private static final Logger logger = LoggerFactory.getLogger(Pathfinder.class);

    private final CombatGrid grid;

    public Pathfinder(CombatGrid grid) {
        if (grid == null) {
            throw new IllegalArgumentException("grid is required");
        }
        this.grid = grid;
    }

    public CombatGrid getGrid() {
        return grid;
    }

    // ========== A* ==========

    /**
     * Find the cheapest path using the grid's own diagonal policy.
     */
    public PathfindingResult findPath(GridPosition from, GridPosition to, int maxMovement) {
        return findPath(from, to, maxMovement, grid.getDiagonalPolicy());
    }

    /**
     * Find the cheapest path between two cells.
     *
     * @param from starting cell (normally holding the mover itself)
     * @param to destination cell
     * @param maxMovement movement budget in length units
     * @param policy diagonal pricing to use for this search
     * @return a successful result with the full path, or a failure with its reason
     */
    public PathfindingResult findPath(GridPosition from, GridPosition to, int maxMovement, DiagonalPolicy policy) {
        if (!grid.isValidPosition(from)) {
            return PathfindingResult.failure("Invalid start position");
        }
        if (!grid.isValidPosition(to)) {
            return PathfindingResult.failure("Invalid end position");
        }
        if (from.equals(to)) {
            return PathfindingResult.success(List.of(from), 0);
        }

        GridCell goal = grid.cellAt(to);
        if (!goal.isPassable()) {
            return PathfindingResult.failure("Destination is impassable");
        }
        if (goal.isOccupied()) {
            return PathfindingResult.blocked(goal.getOccupantId());
        }

        DiagonalPolicy diagonals = policy != null ? policy : grid.getDiagonalPolicy();
        int cellSize = grid.getCellSize();

        PriorityQueue<PathNode> open = new PriorityQueue<>();
        Map<Long, Integer> bestG = new HashMap<>();
        Set<Long> closed = new HashSet<>();
        long sequence = 0;

        PathNode start = new PathNode(from, 0, 0, heuristic(from, to, 0, diagonals), null, sequence++);
        open.add(start);
        bestG.put(start.stateKey(), 0);

        int expanded = 0;
        while (!open.isEmpty()) {
            PathNode current = open.poll();
            long key = current.stateKey();
            if (!closed.add(key)) continue;
            expanded++;

            if (current.position.equals(to)) {
                logger.debug("Path {} -> {} found: cost {}, {} nodes expanded", from, to, current.g, expanded);
                return PathfindingResult.success(reconstruct(current), current.g);
            }

            for (GridCell next : grid.getNeighbors(current.position)) {
                if (!next.isEnterable()) continue;

                boolean diagonal = isDiagonal(current.position, next.getPosition());
                int g = current.g + stepCost(next, diagonal, current.diagonalParity, diagonals, cellSize);
                if (g > maxMovement) continue;

                int parity = nextParity(diagonal, current.diagonalParity, diagonals);
                long nextKey = PathNode.stateKey(next.getPosition(), parity);
                if (closed.contains(nextKey)) continue;

                Integer known = bestG.get(nextKey);
                if (known != null && known <= g) continue;
                bestG.put(nextKey, g);

                int h = heuristic(next.getPosition(), to, parity, diagonals);
                open.add(new PathNode(next.getPosition(), parity, g, h, current, sequence++));
            }
        }

        logger.debug("No path {} -> {} within {} ({} nodes expanded)", from, to, maxMovement, expanded);
        return PathfindingResult.failure(PathfindingResult.NO_PATH);
    }

    // ========== Flood fill ==========

    /**
     * Every cell reachable from {@code origin} within {@code budget}, with its cheapest cost.
     * The origin itself and occupied cells are not destinations.
     */
    public Set<ReachableCell> getReachableCells(GridPosition origin, int budget) {
        return getReachableCells(origin, budget, grid.getDiagonalPolicy());
    }

    public Set<ReachableCell> getReachableCells(GridPosition origin, int budget, DiagonalPolicy policy) {
        if (!grid.isValidPosition(origin) || budget <= 0) {
            return Collections.emptySet();
        }
        DiagonalPolicy diagonals = policy != null ? policy : grid.getDiagonalPolicy();
        int cellSize = grid.getCellSize();

        PriorityQueue<PathNode> queue = new PriorityQueue<>();
        Map<Long, Integer> bestG = new HashMap<>();
        Set<Long> settled = new HashSet<>();
        Map<GridPosition, Integer> cheapest = new HashMap<>();
        long sequence = 0;

        queue.add(new PathNode(origin, 0, 0, 0, null, sequence++));
        bestG.put(PathNode.stateKey(origin, 0), 0);

        while (!queue.isEmpty()) {
            PathNode current = queue.poll();
            if (!settled.add(current.stateKey())) continue;

            if (!current.position.equals(origin)) {
                cheapest.merge(current.position, current.g, Math::min);
            }

            for (GridCell next : grid.getNeighbors(current.position)) {
                if (!next.isEnterable()) continue;

                boolean diagonal = isDiagonal(current.position, next.getPosition());
                int g = current.g + stepCost(next, diagonal, current.diagonalParity, diagonals, cellSize);
                if (g > budget) continue;

                int parity = nextParity(diagonal, current.diagonalParity, diagonals);
                long nextKey = PathNode.stateKey(next.getPosition(), parity);
                Integer known = bestG.get(nextKey);
                if (known != null && known <= g) continue;
                bestG.put(nextKey, g);
                queue.add(new PathNode(next.getPosition(), parity, g, 0, current, sequence++));
            }
        }

        Set<ReachableCell> result = new LinkedHashSet<>();
        for (Map.Entry<GridPosition, Integer> e : cheapest.entrySet()) {
            result.add(new ReachableCell(e.getKey(), e.getValue()));
        }
        return result;
    }

    // ========== Threat ==========

    /**
     * Cells a combatant threatens with melee, its own cell included.
     *
     * @param combatantId the combatant's grid id
     * @param reach reach in length units; anything below one cell counts as one cell
     * @return the threatened positions, empty if the combatant is not on the grid
     */
    public Set<GridPosition> getThreatenedSquares(String combatantId, int reach) {
        Optional<GridPosition> pos = grid.findCombatant(combatantId);
        if (pos.isEmpty()) {
            return Collections.emptySet();
        }
        return new LinkedHashSet<>(grid.getPositionsInRadius(pos.get(), reachInSquares(reach)));
    }

    /**
     * Convert a reach in length units to whole cells, minimum one.
     */
    public int reachInSquares(int reach) {
        return Math.max(1, reach / grid.getCellSize());
    }

    // ========== Helpers ==========

    private static boolean isDiagonal(GridPosition a, GridPosition b) {
        return a.x() != b.x() && a.y() != b.y();
    }

    private static int stepCost(GridCell cell, boolean diagonal, int parity, DiagonalPolicy policy, int cellSize) {
        int cost = cell.getTerrain().getMoveCost(cellSize);
        if (diagonal && policy == DiagonalPolicy.ALTERNATING && parity == 1) {
            cost += cellSize;
        }
        return cost;
    }

    private static int nextParity(boolean diagonal, int parity, DiagonalPolicy policy) {
        if (diagonal && policy == DiagonalPolicy.ALTERNATING) {
            return parity ^ 1;
        }
        return parity;
    }

    private int heuristic(GridPosition from, GridPosition to, int parity, DiagonalPolicy policy) {
        return policy.distance(to.x() - from.x(), to.y() - from.y(), grid.getCellSize(), parity);
    }

    private static List<GridPosition> reconstruct(PathNode end) {
        List<GridPosition> path = new ArrayList<>();
        for (PathNode n = end; n != null; n = n.parent) {
            path.add(n.position);
        }
        Collections.reverse(path);
        return path;
    }
}

package com.example.tactics;

import com.example.tactics.grid.CombatGrid;
import com.example.tactics.grid.DiagonalPolicy;
import com.example.tactics.grid.GridCell;
import com.example.tactics.grid.GridPosition;
import com.example.tactics.grid.Pathfinder;
import com.example.tactics.grid.PathfindingResult;
import com.example.tactics.grid.ReachableCell;
import com.example.tactics.grid.TerrainType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for A* pathfinding, reachable cells and threatened squares.
 */
public class PathfinderTest {

    private static final int UNLIMITED = 100_000;

    // === Basic paths ===

    @Test
    void testFindPath_diagonalAcrossOpenGrid() {
        Pathfinder pathfinder = new Pathfinder(new CombatGrid());
        PathfindingResult result = pathfinder.findPath(GridPosition.of(0, 0), GridPosition.of(7, 7), UNLIMITED);

        assertTrue(result.isSuccess());
        assertEquals(35, result.getTotalCost());
        assertEquals(8, result.getPath().size());
        assertEquals(GridPosition.of(0, 0), result.getPath().get(0));
        assertEquals(GridPosition.of(7, 7), result.getPath().get(7));
        assertEquals(7, result.getSteps());
    }

    @Test
    void testFindPath_sameCellIsFree() {
        CombatGrid grid = new CombatGrid();
        grid.setOccupant(2, 2, "me");
        PathfindingResult result = new Pathfinder(grid).findPath(GridPosition.of(2, 2), GridPosition.of(2, 2), 0);
        assertTrue(result.isSuccess());
        assertEquals(0, result.getTotalCost());
        assertEquals(List.of(GridPosition.of(2, 2)), result.getPath());
    }

    @Test
    void testFindPath_occupiedDestinationReportsOccupant() {
        CombatGrid grid = new CombatGrid();
        grid.setOccupant(5, 5, "goblin");
        PathfindingResult result = new Pathfinder(grid).findPath(GridPosition.of(0, 0), GridPosition.of(5, 5), UNLIMITED);
        assertFalse(result.isSuccess());
        assertEquals("goblin", result.getBlockedBy().orElseThrow());
        assertEquals("Destination is occupied", result.getReason());
        assertTrue(result.getPath().isEmpty());
    }

    @Test
    void testFindPath_impassableDestination() {
        CombatGrid grid = new CombatGrid();
        grid.setTerrain(4, 4, TerrainType.IMPASSABLE);
        PathfindingResult result = new Pathfinder(grid).findPath(GridPosition.of(0, 0), GridPosition.of(4, 4), UNLIMITED);
        assertFalse(result.isSuccess());
        assertEquals("Destination is impassable", result.getReason());
    }

    @Test
    void testFindPath_invalidPositions() {
        Pathfinder pathfinder = new Pathfinder(new CombatGrid());
        assertEquals("Invalid start position",
                pathfinder.findPath(GridPosition.of(-1, 0), GridPosition.of(1, 1), UNLIMITED).getReason());
        assertEquals("Invalid end position",
                pathfinder.findPath(GridPosition.of(0, 0), GridPosition.of(8, 1), UNLIMITED).getReason());
    }

    @Test
    void testFindPath_budgetTooSmall() {
        PathfindingResult result = new Pathfinder(new CombatGrid())
                .findPath(GridPosition.of(0, 0), GridPosition.of(6, 0), 25);
        assertFalse(result.isSuccess());
        assertEquals(PathfindingResult.NO_PATH, result.getReason());
    }

    @Test
    void testFindPath_exactBudgetSucceeds() {
        PathfindingResult result = new Pathfinder(new CombatGrid())
                .findPath(GridPosition.of(0, 0), GridPosition.of(6, 0), 30);
        assertTrue(result.isSuccess());
        assertEquals(30, result.getTotalCost());
    }

    @Test
    void testFindPath_wallBlocksCompletely() {
        CombatGrid grid = new CombatGrid();
        for (int y = 0; y < 8; y++) {
            grid.setTerrain(4, y, TerrainType.IMPASSABLE);
        }
        PathfindingResult result = new Pathfinder(grid).findPath(GridPosition.of(0, 0), GridPosition.of(7, 0), UNLIMITED);
        assertFalse(result.isSuccess());
        assertEquals(PathfindingResult.NO_PATH, result.getReason());
    }

    @Test
    void testFindPath_routesAroundOccupiedCells() {
        CombatGrid grid = new CombatGrid();
        grid.setOccupant(1, 0, "ally");
        grid.setOccupant(1, 1, "ally2");
        PathfindingResult result = new Pathfinder(grid).findPath(GridPosition.of(0, 0), GridPosition.of(2, 0), UNLIMITED);
        assertTrue(result.isSuccess());
        assertFalse(result.getPath().contains(GridPosition.of(1, 0)));
        assertFalse(result.getPath().contains(GridPosition.of(1, 1)));
        assertEquals(20, result.getTotalCost());
    }

    @Test
    void testFindPath_difficultTerrainCostsDouble() {
        CombatGrid grid = new CombatGrid(3, 1);
        grid.setTerrain(1, 0, TerrainType.DIFFICULT);
        PathfindingResult result = new Pathfinder(grid).findPath(GridPosition.of(0, 0), GridPosition.of(2, 0), UNLIMITED);
        assertEquals(15, result.getTotalCost());
    }

    @Test
    void testFindPath_deterministic() {
        CombatGrid grid = new CombatGrid();
        grid.setTerrain(3, 3, TerrainType.IMPASSABLE);
        Pathfinder pathfinder = new Pathfinder(grid);
        List<GridPosition> first = pathfinder.findPath(GridPosition.of(0, 0), GridPosition.of(7, 5), UNLIMITED).getPath();
        for (int i = 0; i < 5; i++) {
            assertEquals(first, pathfinder.findPath(GridPosition.of(0, 0), GridPosition.of(7, 5), UNLIMITED).getPath());
        }
    }

    // === Alternating diagonals ===

    @Test
    void testAlternating_twoDiagonals() {
        Pathfinder pathfinder = new Pathfinder(new CombatGrid(8, 8, 5, DiagonalPolicy.ALTERNATING));
        PathfindingResult result = pathfinder.findPath(GridPosition.of(0, 0), GridPosition.of(2, 2), UNLIMITED);
        assertEquals(15, result.getTotalCost());
    }

    @Test
    void testAlternating_threeDiagonals() {
        Pathfinder pathfinder = new Pathfinder(new CombatGrid(8, 8, 5, DiagonalPolicy.ALTERNATING));
        PathfindingResult result = pathfinder.findPath(GridPosition.of(0, 0), GridPosition.of(3, 3), UNLIMITED);
        assertEquals(20, result.getTotalCost());
        assertEquals(4, result.getPath().size());
    }

    @Test
    void testAlternating_policyOverridePerCall() {
        Pathfinder pathfinder = new Pathfinder(new CombatGrid());
        assertEquals(15, pathfinder.findPath(GridPosition.of(0, 0), GridPosition.of(3, 3), UNLIMITED).getTotalCost());
        assertEquals(20, pathfinder.findPath(GridPosition.of(0, 0), GridPosition.of(3, 3), UNLIMITED,
                DiagonalPolicy.ALTERNATING).getTotalCost());
    }

    // === Optimality ===

    @ParameterizedTest
    @EnumSource(DiagonalPolicy.class)
    void testFindPath_matchesReferenceOnRandomMazes(DiagonalPolicy policy) {
        Random random = new Random(1234);
        for (int maze = 0; maze < 60; maze++) {
            CombatGrid grid = new CombatGrid(10, 10, 5, policy);
            for (int y = 0; y < 10; y++) {
                for (int x = 0; x < 10; x++) {
                    int r = random.nextInt(100);
                    if (r < 25) grid.setTerrain(x, y, TerrainType.IMPASSABLE);
                    else if (r < 40) grid.setTerrain(x, y, TerrainType.DIFFICULT);
                }
            }
            grid.setTerrain(0, 0, TerrainType.OPEN);
            grid.setTerrain(9, 9, TerrainType.OPEN);

            int expected = referenceCost(grid, GridPosition.of(0, 0), GridPosition.of(9, 9), policy);
            PathfindingResult result = new Pathfinder(grid).findPath(GridPosition.of(0, 0), GridPosition.of(9, 9), UNLIMITED);
            if (expected < 0) {
                assertFalse(result.isSuccess(), "maze " + maze + " should be unsolvable");
            } else {
                assertTrue(result.isSuccess(), "maze " + maze + " should be solvable");
                assertEquals(expected, result.getTotalCost(), "maze " + maze);
            }
        }
    }

    /**
     * Plain Dijkstra over (cell, diagonal parity) with the same step costs.
     */
    private static int referenceCost(CombatGrid grid, GridPosition from, GridPosition to, DiagonalPolicy policy) {
        int w = grid.getWidth();
        int h = grid.getHeight();
        int cell = grid.getCellSize();
        int[][][] dist = new int[h][w][2];
        for (int[][] row : dist) for (int[] d : row) Arrays.fill(d, Integer.MAX_VALUE);
        PriorityQueue<int[]> queue = new PriorityQueue<>((a, b) -> Integer.compare(a[0], b[0]));
        dist[from.y()][from.x()][0] = 0;
        queue.add(new int[] {0, from.x(), from.y(), 0});

        while (!queue.isEmpty()) {
            int[] cur = queue.poll();
            int g = cur[0], x = cur[1], y = cur[2], parity = cur[3];
            if (g > dist[y][x][parity]) continue;
            if (x == to.x() && y == to.y()) return g;
            for (int dy = -1; dy <= 1; dy++) {
                for (int dx = -1; dx <= 1; dx++) {
                    if (dx == 0 && dy == 0) continue;
                    int nx = x + dx, ny = y + dy;
                    GridCell next = grid.getCell(nx, ny).orElse(null);
                    if (next == null || !next.isEnterable()) continue;
                    boolean diagonal = dx != 0 && dy != 0;
                    int cost = next.getTerrain().getMoveCost(cell);
                    int np = parity;
                    if (diagonal && policy == DiagonalPolicy.ALTERNATING) {
                        if (parity == 1) cost += cell;
                        np = parity ^ 1;
                    }
                    int ng = g + cost;
                    if (ng < dist[ny][nx][np]) {
                        dist[ny][nx][np] = ng;
                        queue.add(new int[] {ng, nx, ny, np});
                    }
                }
            }
        }
        return -1;
    }

    // === Reachable cells ===

    @Test
    void testReachableCells_oneStep() {
        Pathfinder pathfinder = new Pathfinder(new CombatGrid());
        Set<ReachableCell> cells = pathfinder.getReachableCells(GridPosition.of(3, 3), 5);
        assertEquals(8, cells.size());
        for (ReachableCell c : cells) {
            assertEquals(5, c.cost());
            assertNotEquals(GridPosition.of(3, 3), c.position());
        }
    }

    @Test
    void testReachableCells_skipOccupiedAndMatchFindPath() {
        CombatGrid grid = new CombatGrid();
        grid.setOccupant(4, 4, "orc");
        grid.setTerrain(2, 2, TerrainType.DIFFICULT);
        grid.setTerrain(3, 1, TerrainType.IMPASSABLE);
        Pathfinder pathfinder = new Pathfinder(grid);

        Set<ReachableCell> cells = pathfinder.getReachableCells(GridPosition.of(3, 3), 15);
        assertFalse(cells.isEmpty());
        for (ReachableCell c : cells) {
            assertNotEquals(GridPosition.of(4, 4), c.position());
            assertNotEquals(GridPosition.of(3, 1), c.position());
            PathfindingResult path = pathfinder.findPath(GridPosition.of(3, 3), c.position(), 15);
            assertTrue(path.isSuccess());
            assertEquals(path.getTotalCost(), c.cost(), "cost to " + c.position());
        }
    }

    @Test
    void testReachableCells_zeroBudget() {
        assertTrue(new Pathfinder(new CombatGrid()).getReachableCells(GridPosition.of(0, 0), 0).isEmpty());
    }

    // === Threat ===

    @Test
    void testThreatenedSquares() {
        CombatGrid grid = new CombatGrid();
        grid.setOccupant(0, 0, "guard");
        grid.setOccupant(4, 4, "pikeman");
        Pathfinder pathfinder = new Pathfinder(grid);

        assertEquals(4, pathfinder.getThreatenedSquares("guard", 5).size());
        Set<GridPosition> pike = pathfinder.getThreatenedSquares("pikeman", 10);
        assertEquals(25, pike.size());
        assertTrue(pike.contains(GridPosition.of(2, 2)));
        assertTrue(pathfinder.getThreatenedSquares("nobody", 5).isEmpty());
    }

    @Test
    void testReachInSquares_minimumOne() {
        Pathfinder pathfinder = new Pathfinder(new CombatGrid());
        assertEquals(1, pathfinder.reachInSquares(0));
        assertEquals(1, pathfinder.reachInSquares(5));
        assertEquals(2, pathfinder.reachInSquares(10));
    }
}

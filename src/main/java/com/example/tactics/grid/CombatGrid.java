package com.example.tactics.grid;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rectangular battle map of {@link GridCell}s.
 * <p>
 * All coordinate access is bounds-checked: reads outside the grid return
 * {@link Optional#empty()} and writes return {@code false}, never an exception.
 * A combatant id occupies at most one cell; placing it again moves it.
 */
public class CombatGrid {

    private static final Logger logger = LoggerFactory.getLogger(CombatGrid.class);

    public static final int DEFAULT_WIDTH = 8;
    public static final int DEFAULT_HEIGHT = 8;
    public static final int DEFAULT_CELL_SIZE = 5;

    private final int width;
    private final int height;
    private final int cellSize;
    private final DiagonalPolicy diagonalPolicy;
    private final GridCell[][] cells;

    /** Reverse index of occupancy, kept in step with the cells. */
    private final Map<String, GridPosition> occupantPositions = new HashMap<>();

    public CombatGrid() {
        this(DEFAULT_WIDTH, DEFAULT_HEIGHT);
    }

    public CombatGrid(int width, int height) {
        this(width, height, DEFAULT_CELL_SIZE, DiagonalPolicy.CHEBYSHEV);
    }

    public CombatGrid(int width, int height, int cellSize, DiagonalPolicy diagonalPolicy) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Grid must be at least 1x1, got " + width + "x" + height);
        }
        if (cellSize < 1) {
            throw new IllegalArgumentException("Cell size must be positive, got " + cellSize);
        }
        this.width = width;
        this.height = height;
        this.cellSize = cellSize;
        this.diagonalPolicy = diagonalPolicy != null ? diagonalPolicy : DiagonalPolicy.CHEBYSHEV;
        this.cells = new GridCell[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                cells[y][x] = new GridCell(new GridPosition(x, y));
            }
        }
        logger.debug("Created {}x{} grid (cell size {}, diagonals {})", width, height, cellSize, this.diagonalPolicy);
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public int getCellSize() { return cellSize; }
    public DiagonalPolicy getDiagonalPolicy() { return diagonalPolicy; }

    // ========== Cell access ==========

    public boolean isValidPosition(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    public boolean isValidPosition(GridPosition pos) {
        return pos != null && isValidPosition(pos.x(), pos.y());
    }

    public Optional<GridCell> getCell(int x, int y) {
        if (!isValidPosition(x, y)) return Optional.empty();
        return Optional.of(cells[y][x]);
    }

    public Optional<GridCell> getCell(GridPosition pos) {
        if (pos == null) return Optional.empty();
        return getCell(pos.x(), pos.y());
    }

    /** Package-private unchecked access for the search code, which validates first. */
    GridCell cellAt(GridPosition pos) {
        return cells[pos.y()][pos.x()];
    }

    // ========== Mutation ==========

    public boolean setTerrain(int x, int y, TerrainType terrain) {
        if (!isValidPosition(x, y) || terrain == null) return false;
        cells[y][x].setTerrain(terrain);
        return true;
    }

    /**
     * Place a combatant in a cell, or clear the cell when {@code occupantId} is null.
     * A combatant already elsewhere on the grid is moved. A cell held by
     * someone else is never taken over; clear it with {@link #clearOccupant} first.
     *
     * @return false if the coordinates are outside the grid or another combatant holds the cell
     */
    public boolean setOccupant(int x, int y, String occupantId) {
        if (!isValidPosition(x, y)) return false;
        GridCell cell = cells[y][x];
        String previous = cell.getOccupantId();

        if (occupantId == null) {
            if (previous != null) clearOccupant(previous);
            return true;
        }
        if (previous != null && !previous.equals(occupantId)) {
            return false;
        }

        GridPosition old = occupantPositions.get(occupantId);
        if (old != null && !old.equals(cell.getPosition())) {
            cellAt(old).setOccupantId(null);
        }
        occupantPositions.put(occupantId, cell.getPosition());
        cell.setOccupantId(occupantId);
        return true;
    }

    public boolean setOccupant(GridPosition pos, String occupantId) {
        return pos != null && setOccupant(pos.x(), pos.y(), occupantId);
    }

    /**
     * Remove a combatant from whatever cell it holds.
     *
     * @return true if the combatant was on the grid
     */
    public boolean clearOccupant(String occupantId) {
        if (occupantId == null) return false;
        GridPosition pos = occupantPositions.remove(occupantId);
        if (pos == null) return false;
        cellAt(pos).setOccupantId(null);
        return true;
    }

    /**
     * Set the cover a cell grants to attacks passing through it.
     *
     * @param cover 0 (none), 2 (half) or 5 (three-quarters)
     * @return false for invalid coordinates or an unsupported cover value
     */
    public boolean setCover(int x, int y, int cover) {
        if (!isValidPosition(x, y) || !GridCell.isValidCover(cover)) return false;
        cells[y][x].setCoverValue(cover);
        return true;
    }

    public boolean setElevation(int x, int y, int elevation) {
        if (!isValidPosition(x, y)) return false;
        cells[y][x].setElevation(elevation);
        return true;
    }

    /**
     * Turn a cell into a pit of the given depth in feet.
     */
    public boolean setPitDepth(int x, int y, int depth) {
        if (!isValidPosition(x, y) || depth < 0) return false;
        GridCell cell = cells[y][x];
        cell.setPitDepth(depth);
        if (depth > 0) {
            cell.setTerrain(TerrainType.PIT);
        }
        return true;
    }

    /**
     * Declare damage dealt to anyone entering the cell, or clear it with a null notation.
     *
     * @param damage dice notation such as "1d10"
     * @param damageType damage type name, e.g. "fire"
     */
    public boolean setHazard(int x, int y, String damage, String damageType) {
        if (!isValidPosition(x, y)) return false;
        cells[y][x].setHazard(damage, damageType);
        return true;
    }

    // ========== Queries ==========

    public Optional<String> getOccupant(int x, int y) {
        return getCell(x, y).map(GridCell::getOccupantId);
    }

    public Optional<GridPosition> findCombatant(String occupantId) {
        if (occupantId == null) return Optional.empty();
        return Optional.ofNullable(occupantPositions.get(occupantId));
    }

    public Map<String, GridPosition> getOccupantPositions() {
        return Map.copyOf(occupantPositions);
    }

    /**
     * The in-bounds cells around a position, diagonals included.
     */
    public List<GridCell> getNeighbors(GridPosition pos) {
        List<GridCell> neighbors = new ArrayList<>(8);
        for (int dy = -1; dy <= 1; dy++) {
            for (int dx = -1; dx <= 1; dx++) {
                if (dx == 0 && dy == 0) continue;
                int nx = pos.x() + dx;
                int ny = pos.y() + dy;
                if (isValidPosition(nx, ny)) {
                    neighbors.add(cells[ny][nx]);
                }
            }
        }
        return neighbors;
    }

    /**
     * All in-bounds positions within {@code radius} king moves of a center, the center included.
     */
    public List<GridPosition> getPositionsInRadius(GridPosition center, int radius) {
        List<GridPosition> result = new ArrayList<>();
        if (center == null || radius < 0) return result;
        for (int y = center.y() - radius; y <= center.y() + radius; y++) {
            for (int x = center.x() - radius; x <= center.x() + radius; x++) {
                if (isValidPosition(x, y)) {
                    result.add(cells[y][x].getPosition());
                }
            }
        }
        return result;
    }

    /**
     * Distance in length units between two positions under this grid's diagonal policy.
     */
    public int distance(GridPosition from, GridPosition to) {
        return diagonalPolicy.distance(from, to, cellSize);
    }
}

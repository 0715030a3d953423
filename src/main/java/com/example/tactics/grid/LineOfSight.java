package com.example.tactics.grid;

import java.util.ArrayList;
import java.util.List;

/**
 * Sight lines and cover between grid cells.
 * <p>
 * Lines are traced with Bresenham's algorithm between cell centres. The
 * starting cell never blocks its own line, so a creature standing in
 * rubble can still see out.
 */
public class LineOfSight {

    /** Cover reported when the line is blocked outright. */
    public static final int TOTAL_COVER = 100;

    private final CombatGrid grid;

    public LineOfSight(CombatGrid grid) {
        this.grid = grid;
    }

    /**
     * The traced line and whether it is clear.
     *
     * @param clear false if any impassable cell after the start lies on the line
     * @param cells every cell on the line, both ends included
     */
    public record SightLine(boolean clear, List<GridPosition> cells) {
        public SightLine {
            cells = List.copyOf(cells);
        }
    }

    public SightLine trace(GridPosition from, GridPosition to) {
        List<GridPosition> cells = new ArrayList<>();
        boolean clear = true;

        int x = from.x();
        int y = from.y();
        int dx = Math.abs(to.x() - x);
        int dy = Math.abs(to.y() - y);
        int sx = x < to.x() ? 1 : -1;
        int sy = y < to.y() ? 1 : -1;
        int err = dx - dy;

        while (true) {
            GridPosition pos = new GridPosition(x, y);
            cells.add(pos);

            if (!pos.equals(from)) {
                boolean blocks = grid.getCell(pos).map(c -> !c.isPassable()).orElse(false);
                if (blocks) {
                    clear = false;
                }
            }

            if (x == to.x() && y == to.y()) break;

            int e2 = 2 * err;
            if (e2 > -dy) {
                err -= dy;
                x += sx;
            }
            if (e2 < dx) {
                err += dx;
                y += sy;
            }
        }
        return new SightLine(clear, cells);
    }

    public boolean hasLineOfSight(GridPosition from, GridPosition to) {
        return trace(from, to).clear();
    }

    /**
     * Cover the target enjoys against an attacker.
     *
     * @return 0 for a clear line, {@link #TOTAL_COVER} when blocked, otherwise
     *         the highest cover value of the cells strictly between the two
     */
    public int getCover(GridPosition attacker, GridPosition target) {
        SightLine line = trace(attacker, target);
        if (!line.clear()) {
            return TOTAL_COVER;
        }
        int cover = GridCell.NO_COVER;
        for (GridPosition pos : line.cells()) {
            if (pos.equals(attacker) || pos.equals(target)) continue;
            int value = grid.getCell(pos).map(GridCell::getCoverValue).orElse(0);
            cover = Math.max(cover, value);
        }
        return cover;
    }
}

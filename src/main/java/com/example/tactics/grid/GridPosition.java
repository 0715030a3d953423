package com.example.tactics.grid;

/**
 * An (x, y) coordinate on a combat grid. x grows to the east, y to the south.
 */
public record GridPosition(int x, int y) {

    public static GridPosition of(int x, int y) {
        return new GridPosition(x, y);
    }

    /** Number of king moves between two positions. */
    public int chebyshevDistance(GridPosition other) {
        return Math.max(Math.abs(x - other.x), Math.abs(y - other.y));
    }

    public boolean isAdjacentTo(GridPosition other) {
        return !equals(other) && chebyshevDistance(other) == 1;
    }

    public GridPosition offset(int dx, int dy) {
        return new GridPosition(x + dx, y + dy);
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}

package com.example.tactics.grid;

/**
 * A destination within a movement budget and the cheapest cost to get there.
 */
public record ReachableCell(GridPosition position, int cost) {

    public int x() {
        return position.x();
    }

    public int y() {
        return position.y();
    }
}

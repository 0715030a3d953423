package com.example.tactics.grid;

/**
 * How diagonal steps are priced on a grid.
 */
public enum DiagonalPolicy {

    /** Every diagonal step costs the same as an orthogonal one. */
    CHEBYSHEV("Chebyshev"),

    /** Diagonals alternate between one and two cells of cost (5, 10, 5, 10 on a 5 ft grid). */
    ALTERNATING("Alternating");

    private final String displayName;

    DiagonalPolicy(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Open-terrain movement cost between two positions under this policy.
     * This is also the pathfinding heuristic, so it never overestimates.
     *
     * @param dx horizontal offset
     * @param dy vertical offset
     * @param cellSize length of one cell edge
     * @param oddDiagonalsTaken 1 if the mover has already taken an odd number of diagonals
     */
    public int distance(int dx, int dy, int cellSize, int oddDiagonalsTaken) {
        int ax = Math.abs(dx);
        int ay = Math.abs(dy);
        int diagonals = Math.min(ax, ay);
        int straight = Math.max(ax, ay) - diagonals;
        if (this == CHEBYSHEV) {
            return (straight + diagonals) * cellSize;
        }
        // Diagonal number k (1-based across the whole move) costs double when k is even
        int surcharges = (diagonals + (oddDiagonalsTaken & 1)) / 2;
        return (straight + diagonals + surcharges) * cellSize;
    }

    public int distance(GridPosition from, GridPosition to, int cellSize) {
        return distance(to.x() - from.x(), to.y() - from.y(), cellSize, 0);
    }

    /**
     * Parse a policy name, falling back to CHEBYSHEV.
     */
    public static DiagonalPolicy fromString(String s) {
        if (s == null || s.isEmpty()) return CHEBYSHEV;
        String upper = s.toUpperCase().trim();
        for (DiagonalPolicy p : values()) {
            if (p.name().equals(upper)) return p;
        }
        return CHEBYSHEV;
    }
}

package com.example.tactics.grid;

/**
 * Terrain kinds determine the movement cost for entering a grid cell.
 * <p>
 * Costs are expressed as a multiple of the grid's cell size, so on a 5 ft grid
 * open ground costs 5 and difficult terrain 10.
 */
public enum TerrainType {
    OPEN(1, "Open"),
    DIFFICULT(2, "Difficult"),
    WATER(2, "Water"),
    // Entering a pit costs a normal move; the fall is resolved as a hazard
    PIT(1, "Pit"),
    IMPASSABLE(0, "Impassable");

    private final int costMultiplier;
    private final String displayName;

    TerrainType(int costMultiplier, String displayName) {
        this.costMultiplier = costMultiplier;
        this.displayName = displayName;
    }

    public boolean isPassable() {
        return this != IMPASSABLE;
    }

    /**
     * Movement cost of entering a cell of this terrain.
     *
     * @param cellSize length of one cell edge
     * @return the cost, or {@link Integer#MAX_VALUE} for impassable terrain
     */
    public int getMoveCost(int cellSize) {
        if (!isPassable()) return Integer.MAX_VALUE;
        return costMultiplier * cellSize;
    }

    /**
     * Get the human-readable name for this terrain.
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Parse a terrain kind from a string (case-insensitive).
     * Accepts "normal" as an alias for OPEN, and falls back to OPEN when unknown.
     */
    public static TerrainType fromString(String s) {
        if (s == null || s.isEmpty()) return OPEN;
        String upper = s.toUpperCase().trim();
        if ("NORMAL".equals(upper)) return OPEN;
        for (TerrainType t : values()) {
            if (t.name().equals(upper)) return t;
        }
        for (TerrainType t : values()) {
            if (t.displayName.equalsIgnoreCase(s.trim())) return t;
        }
        return OPEN;
    }
}

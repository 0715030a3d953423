package com.example.tactics.grid;

/**
 * The two kinds of jump a creature can make across the grid.
 */
public enum JumpType {
    /** Horizontal leap; distance limited by the Strength score. */
    LONG("Long jump"),
    /** Vertical leap; height limited by the Strength modifier. */
    HIGH("High jump");

    private final String displayName;

    JumpType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}

package com.example.tactics.grid;

/**
 * A single square of a combat grid.
 * <p>
 * Cells are owned by their {@link CombatGrid} and mutated only through it.
 * The occupant is held as an id, never as a combatant object, so the grid
 * does not keep combatants alive.
 */
public class GridCell {

    /** Cover values a cell may grant: none, half, three-quarters. */
    public static final int NO_COVER = 0;
    public static final int HALF_COVER = 2;
    public static final int THREE_QUARTERS_COVER = 5;

    private final GridPosition position;
    private TerrainType terrain = TerrainType.OPEN;
    private String occupantId;
    private int coverValue = NO_COVER;
    private int elevation;
    private int pitDepth;

    // Optional declared hazard (e.g. "2d6" fire) dealt on entering the cell
    private String hazardDamage;
    private String hazardDamageType;

    GridCell(GridPosition position) {
        this.position = position;
    }

    public GridPosition getPosition() { return position; }
    public int getX() { return position.x(); }
    public int getY() { return position.y(); }

    public TerrainType getTerrain() { return terrain; }
    void setTerrain(TerrainType terrain) { this.terrain = terrain; }

    public String getOccupantId() { return occupantId; }
    void setOccupantId(String occupantId) { this.occupantId = occupantId; }
    public boolean isOccupied() { return occupantId != null; }

    public int getCoverValue() { return coverValue; }
    void setCoverValue(int coverValue) { this.coverValue = coverValue; }

    public int getElevation() { return elevation; }
    void setElevation(int elevation) { this.elevation = elevation; }

    /** Depth of the pit in feet, 0 when the cell is not a pit. */
    public int getPitDepth() { return pitDepth; }
    void setPitDepth(int pitDepth) { this.pitDepth = pitDepth; }

    public String getHazardDamage() { return hazardDamage; }
    public String getHazardDamageType() { return hazardDamageType; }
    public boolean hasHazard() { return hazardDamage != null; }

    void setHazard(String damage, String damageType) {
        this.hazardDamage = damage;
        this.hazardDamageType = damage == null ? null : damageType;
    }

    public boolean isPassable() {
        return terrain.isPassable();
    }

    /** True when a mover may end or pass through this cell. */
    public boolean isEnterable() {
        return isPassable() && !isOccupied();
    }

    public static boolean isValidCover(int value) {
        return value == NO_COVER || value == HALF_COVER || value == THREE_QUARTERS_COVER;
    }

    @Override
    public String toString() {
        return "GridCell" + position + "[" + terrain + (occupantId != null ? ", " + occupantId : "") + "]";
    }
}

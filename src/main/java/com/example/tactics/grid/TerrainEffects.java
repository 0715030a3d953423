package com.example.tactics.grid;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Positional effects of the battlefield beyond movement cost: high ground,
 * cells that hurt whoever enters them, falls and jumps.
 * <p>
 * One elevation level is {@value #ELEVATION_STEP_FEET} ft high.
 */
public class TerrainEffects {

    public static final int HIGH_GROUND_BONUS = 2;
    public static final int MAX_FALL_DICE = 20;
    public static final int ELEVATION_STEP_FEET = 5;
    /** Shortest drop that counts as a fall. */
    public static final int MIN_FALL_FEET = 10;
    public static final int RUNNING_START_FEET = 10;

    private final CombatGrid grid;
    private final LineOfSight lineOfSight;

    public TerrainEffects(CombatGrid grid) {
        this.grid = grid;
        this.lineOfSight = new LineOfSight(grid);
    }

    /**
     * Damage a creature suffers on entering a cell, or on dropping into it.
     *
     * @param damageNotation dice to roll, e.g. "2d6"
     * @param damageType damage type name
     * @param description short text for the combat log
     * @param fallFeet height fallen, 0 for a hazard that is not a fall
     */
    public record Hazard(String damageNotation, String damageType, String description, int fallFeet) {

        public Hazard(String damageNotation, String damageType, String description) {
            this(damageNotation, damageType, description, 0);
        }

        public boolean isFall() {
            return fallFeet > 0;
        }
    }

    // ========== Elevation ==========

    /**
     * Attack roll modifier from elevation: +2 when the attacker stands higher.
     */
    public int getElevationAttackModifier(GridPosition attacker, GridPosition target) {
        int diff = elevationDifference(attacker, target);
        return diff >= 1 ? HIGH_GROUND_BONUS : 0;
    }

    /**
     * Extra range for ranged attacks from high ground: 5 ft per 10 ft (2 levels) of height.
     */
    public int getElevationRangeBonus(GridPosition attacker, GridPosition target) {
        int diff = elevationDifference(attacker, target);
        return diff > 0 ? (diff / 2) * 5 : 0;
    }

    // ========== Hazards and falls ==========

    /**
     * The hazard triggered by entering a cell, if any. A declared hazard
     * takes precedence over a pit fall.
     */
    public Optional<Hazard> checkHazard(GridPosition pos) {
        Optional<GridCell> found = grid.getCell(pos);
        if (found.isEmpty()) return Optional.empty();
        GridCell cell = found.get();

        if (cell.hasHazard()) {
            String type = cell.getHazardDamageType() != null ? cell.getHazardDamageType() : "";
            return Optional.of(new Hazard(cell.getHazardDamage(), type,
                    "Entered hazardous terrain (" + type + ")"));
        }
        if (cell.getTerrain() == TerrainType.PIT) {
            int depth = Math.max(MIN_FALL_FEET, cell.getPitDepth());
            return Optional.of(new Hazard(fallingDamage(cell.getPitDepth()), "bludgeoning",
                    "Fell " + depth + " ft into a pit", depth));
        }
        return Optional.empty();
    }

    /**
     * Feet dropped stepping from one cell to another; 0 when the drop is under {@value #MIN_FALL_FEET} ft.
     */
    public int getFallDistance(GridPosition from, GridPosition to) {
        int drop = elevationDifference(from, to) * ELEVATION_STEP_FEET;
        return drop >= MIN_FALL_FEET ? drop : 0;
    }

    /**
     * The fall caused by stepping off a ledge, if the drop is high enough.
     */
    public Optional<Hazard> checkFall(GridPosition from, GridPosition to) {
        int feet = getFallDistance(from, to);
        if (feet == 0) return Optional.empty();
        return Optional.of(new Hazard(fallingDamage(feet), "bludgeoning", "Fell " + feet + " ft", feet));
    }

    /**
     * Falling damage notation: 1d6 per 10 ft fallen, at least 1d6 and at most 20d6.
     */
    public static String fallingDamage(int feet) {
        int dice = Math.min(MAX_FALL_DICE, Math.max(1, feet / 10));
        return dice + "d6";
    }

    /**
     * Why a creature does not fall, if it does not. A flyer stays aloft
     * unless incapacitated; a hovering creature always does.
     */
    public static Optional<String> fallAvoidedBy(boolean flying, boolean hovering, boolean incapacitated) {
        if (flying && !incapacitated) return Optional.of("Flying");
        if (hovering) return Optional.of("Hover");
        return Optional.empty();
    }

    // ========== Jumps ==========

    /**
     * Long jump distance in feet: the Strength score with a running start, half that standing.
     */
    public static int longJumpDistance(int strengthScore, boolean runningStart) {
        int feet = Math.max(0, strengthScore);
        return runningStart ? feet : feet / 2;
    }

    /**
     * High jump height in feet: 3 + Strength modifier with a running start, half that standing.
     */
    public static int highJumpHeight(int strengthModifier, boolean runningStart) {
        int feet = Math.max(0, 3 + strengthModifier);
        return runningStart ? feet : feet / 2;
    }

    /**
     * Check whether a creature can jump from one cell to another.
     * <p>
     * The landing cell must be on the grid, passable and free. A long jump
     * onto higher ground must also clear the height. The movement cost is
     * the distance plus {@value #RUNNING_START_FEET} ft for a running start.
     */
    public JumpResult attemptJump(String jumperId, GridPosition from, GridPosition to, int strengthScore,
                                  int strengthModifier, boolean runningStart, JumpType type) {
        Optional<GridCell> start = grid.getCell(from);
        Optional<GridCell> end = grid.getCell(to);
        if (start.isEmpty() || end.isEmpty()) {
            return JumpResult.failure("Invalid destination");
        }
        GridCell landing = end.get();
        if (!landing.isPassable()) {
            return JumpResult.failure("Cannot land on impassable terrain");
        }
        if (landing.isOccupied() && !landing.getOccupantId().equals(jumperId)) {
            return JumpResult.failure("Cannot land on occupied space");
        }

        int distance = from.chebyshevDistance(to) * grid.getCellSize();
        int heightNeeded = Math.max(0, landing.getElevation() - start.get().getElevation()) * ELEVATION_STEP_FEET;
        int maxHeight = highJumpHeight(strengthModifier, runningStart);

        if (heightNeeded > maxHeight) {
            return JumpResult.failure("Cannot jump high enough (" + heightNeeded + " ft needed, "
                    + maxHeight + " ft max)");
        }
        if (type != JumpType.HIGH) {
            int maxDistance = longJumpDistance(strengthScore, runningStart);
            if (distance > maxDistance) {
                return JumpResult.failure("Distance too far (" + distance + " ft, max " + maxDistance + " ft)");
            }
        }

        List<GridPosition> cleared = new ArrayList<>();
        for (GridPosition pos : lineOfSight.trace(from, to).cells()) {
            if (pos.equals(from) || pos.equals(to)) continue;
            grid.getCell(pos)
                    .filter(c -> c.hasHazard() || c.getTerrain() == TerrainType.PIT)
                    .ifPresent(c -> cleared.add(pos));
        }

        int cost = distance + (runningStart ? RUNNING_START_FEET : 0);
        return JumpResult.landed(distance, cost, cleared);
    }

    private int elevationDifference(GridPosition attacker, GridPosition target) {
        Optional<GridCell> a = grid.getCell(attacker);
        Optional<GridCell> t = grid.getCell(target);
        if (a.isEmpty() || t.isEmpty()) return 0;
        return a.get().getElevation() - t.get().getElevation();
    }
}

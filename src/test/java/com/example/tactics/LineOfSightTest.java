package com.example.tactics;

import com.example.tactics.grid.CombatGrid;
import com.example.tactics.grid.GridCell;
import com.example.tactics.grid.GridPosition;
import com.example.tactics.grid.LineOfSight;
import com.example.tactics.grid.TerrainType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for sight lines and cover.
 */
public class LineOfSightTest {

    @Test
    void testClearLine() {
        LineOfSight los = new LineOfSight(new CombatGrid());
        LineOfSight.SightLine line = los.trace(GridPosition.of(0, 0), GridPosition.of(4, 0));
        assertTrue(line.clear());
        assertEquals(5, line.cells().size());
        assertEquals(0, los.getCover(GridPosition.of(0, 0), GridPosition.of(4, 0)));
    }

    @Test
    void testWallBlocks() {
        CombatGrid grid = new CombatGrid();
        grid.setTerrain(2, 2, TerrainType.IMPASSABLE);
        LineOfSight los = new LineOfSight(grid);
        assertFalse(los.hasLineOfSight(GridPosition.of(0, 0), GridPosition.of(4, 4)));
        assertEquals(LineOfSight.TOTAL_COVER, los.getCover(GridPosition.of(0, 0), GridPosition.of(4, 4)));
        assertTrue(los.hasLineOfSight(GridPosition.of(0, 0), GridPosition.of(4, 0)));
    }

    @Test
    void testStartCellNeverBlocks() {
        CombatGrid grid = new CombatGrid();
        grid.setTerrain(0, 0, TerrainType.IMPASSABLE);
        assertTrue(new LineOfSight(grid).hasLineOfSight(GridPosition.of(0, 0), GridPosition.of(5, 0)));
    }

    @Test
    void testCover_bestIntermediateValue() {
        CombatGrid grid = new CombatGrid();
        grid.setCover(1, 0, GridCell.HALF_COVER);
        grid.setCover(3, 0, GridCell.THREE_QUARTERS_COVER);
        LineOfSight los = new LineOfSight(grid);
        assertEquals(5, los.getCover(GridPosition.of(0, 0), GridPosition.of(5, 0)));
        assertEquals(2, los.getCover(GridPosition.of(0, 0), GridPosition.of(2, 0)));
    }

    @Test
    void testCover_endpointsIgnored() {
        CombatGrid grid = new CombatGrid();
        grid.setCover(0, 0, GridCell.HALF_COVER);
        grid.setCover(3, 0, GridCell.HALF_COVER);
        assertEquals(0, new LineOfSight(grid).getCover(GridPosition.of(0, 0), GridPosition.of(3, 0)));
    }

    @Test
    void testTrace_symmetricEndpoints() {
        LineOfSight los = new LineOfSight(new CombatGrid());
        LineOfSight.SightLine line = los.trace(GridPosition.of(6, 1), GridPosition.of(1, 3));
        assertEquals(GridPosition.of(6, 1), line.cells().get(0));
        assertEquals(GridPosition.of(1, 3), line.cells().get(line.cells().size() - 1));
    }
}

/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.tkmaterial.budget.grid;

import com.hellblazer.tkmaterial.budget.model.Material;
import com.hellblazer.tkmaterial.geometry.Pseudorapidity;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class CellGridTest {

    @Test
    public void testDimensions() {
        var grid = new CellGrid(10, 0, 100, 0, 2);
        assertEquals(10, grid.rows());
        assertEquals(5, grid.columns());
        assertEquals(0.2, grid.cell(1, 0).etaMin(), 1e-12);
        assertEquals(20, grid.cell(0, 1).rMin(), 1e-12);
        assertEquals(100, grid.cell(9, 4).rMax(), 1e-12);
        assertEquals(2, grid.cell(9, 4).etaMax(), 1e-12);

        var single = new CellGrid(1, 0, 100, 0, 2);
        assertEquals(1, single.rows());
        assertEquals(0, single.columns());
        assertFalse(single.fill(50, 1, new Material(1, 1)), "No radius bins, nothing to fill");

        var odd = new CellGrid(5, 0, 100, 0, 2);
        assertEquals(2, odd.columns());
        assertEquals(100, odd.cell(0, 1).rMax(), 1e-12, "Columns cover the full radius");
    }

    @Test
    public void testLookup() {
        var grid = new CellGrid(10, 0, 100, 0, 2);

        assertEquals(0, grid.rowIndex(0));
        assertEquals(0, grid.rowIndex(0.19));
        assertEquals(9, grid.rowIndex(2), "Upper edge belongs to the last row");
        assertEquals(Axis.NO_BIN, grid.rowIndex(2.01));
        assertEquals(Axis.NO_BIN, grid.rowIndex(-0.01));
        assertEquals(0, grid.columnIndex(0));
        assertEquals(2, grid.columnIndex(50));
        assertEquals(4, grid.columnIndex(100));
        assertEquals(Axis.NO_BIN, grid.columnIndex(100.5));
    }

    @Test
    public void testFillOutsideIsSkipped() {
        var grid = new CellGrid(10, 0, 100, 0, 2);

        assertTrue(grid.fill(30, 0.5, new Material(0.1, 0.2)));
        assertFalse(grid.fill(300, 0.5, new Material(1, 1)));
        assertFalse(grid.fill(30, 5, new Material(1, 1)));

        var cell = grid.cell(grid.rowIndex(0.5), grid.columnIndex(30));
        assertEquals(0.1, cell.rlength(), 1e-15);
        assertEquals(0.2, cell.ilength(), 1e-15);
    }

    @Test
    public void testRadialIntegration() {
        var grid = new CellGrid(4, 0, 100, 0, 2);
        grid.fill(10, 0.1, new Material(1, 2));
        grid.fill(60, 0.1, new Material(3, 4));
        grid.fill(60, 1.9, new Material(5, 6));

        grid.integrateRadially();

        assertEquals(1, grid.cell(0, 0).rlength());
        assertEquals(4, grid.cell(0, 1).rlength());
        assertEquals(6, grid.cell(0, 1).ilength());
        assertEquals(0, grid.cell(3, 0).rlength());
        assertEquals(5, grid.cell(3, 1).rlength());
    }

    @Test
    public void testRemapToZR() {
        var grid = new CellGrid(4, 0, 100, 0, 2);
        for (int i = 0; i < grid.rows(); i++) {
            for (int j = 0; j < grid.columns(); j++) {
                var cell = grid.cell(i, j);
                grid.fill((cell.rMin() + cell.rMax()) / 2, (cell.etaMin() + cell.etaMax()) / 2,
                          new Material(10 * i + j + 1, -(10 * i + j + 1)));
            }
        }
        var zAxis = new Axis(4, 0, 400);
        var rAxis = new Axis(2, 0, 100);
        var radiation = new Grid2D("isoRadiation", zAxis, rAxis);
        var interaction = new Grid2D("isoInteraction", zAxis, rAxis);

        grid.remapToZR(radiation, interaction);

        // z = 50, r = 25: eta = 1.44, row 2, column 0
        assertEquals(21, radiation.get(0, 0));
        assertEquals(-21, interaction.get(0, 0));
        // z = 350, r = 25: eta = 3.3 lies beyond the cells
        assertEquals(0, radiation.get(3, 0));
        for (int i = 0; i < zAxis.bins(); i++) {
            for (int j = 0; j < rAxis.bins(); j++) {
                var row = grid.rowIndex(Pseudorapidity.etaOf(rAxis.center(j), zAxis.center(i)));
                var expected = row == Axis.NO_BIN ? 0 : grid.cell(row, grid.columnIndex(rAxis.center(j))).rlength();
                assertEquals(expected, radiation.get(i, j), "bin " + i + ", " + j);
            }
        }
    }

    @Test
    public void testAdd() {
        var grid = new CellGrid(4, 0, 100, 0, 2);
        var other = grid.emptyCopy();
        grid.fill(10, 0.1, new Material(1, 2));
        other.fill(10, 0.1, new Material(3, 4));

        grid.add(other);

        assertEquals(4, grid.cell(0, 0).rlength());
        assertEquals(6, grid.cell(0, 0).ilength());
        assertThrows(IllegalArgumentException.class, () -> grid.add(new CellGrid(6, 0, 100, 0, 2)));
    }
}

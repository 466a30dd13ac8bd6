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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Material accumulated in (eta, r) cells. Rows are eta bins, columns radius bins; there are half as many radius bins
 * as eta bins. After the scan the cells can be integrated outward in radius ("shadow" integration), giving in each
 * cell the material seen from the origin up to that radius, and remapped to a (z, r) grid for contour plots.
 * <p>
 * Cell boundaries partition [etaMin, etaMax] x [rMin, rMax]; every bin is half open except the last of each axis.
 *
 * @author hal.hildebrand
 */
public final class CellGrid {
    private static final Logger log = LoggerFactory.getLogger(CellGrid.class);

    private final Cell[][] cells;
    private final double[] etaEdges;
    private final double[] rEdges;

    /**
     * @param bins   number of eta rows; the number of radius columns is bins / 2
     * @param minR   lower radius
     * @param maxR   upper radius
     * @param minEta lower pseudorapidity
     * @param maxEta upper pseudorapidity
     */
    public CellGrid(int bins, double minR, double maxR, double minEta, double maxEta) {
        if (bins < 1) {
            throw new IllegalArgumentException("Cell grid needs at least one eta bin: " + bins);
        }
        var columns = bins / 2;
        etaEdges = edges(bins, minEta, maxEta);
        rEdges = edges(columns, minR, maxR);
        cells = new Cell[bins][columns];
        for (int i = 0; i < bins; i++) {
            for (int j = 0; j < columns; j++) {
                cells[i][j] = new Cell(etaEdges[i], etaEdges[i + 1], rEdges[j], rEdges[j + 1]);
            }
        }
    }

    private static double[] edges(int bins, double min, double max) {
        var edges = new double[bins + 1];
        var step = bins == 0 ? 0 : (max - min) / bins;
        for (int i = 0; i < bins; i++) {
            edges[i] = min + i * step;
        }
        edges[bins] = max;
        return edges;
    }

    /**
     * Index of the bin holding x: the last i with edges[i] &lt;= x, the upper edge belonging to the last bin.
     */
    private static int find(double[] edges, double x) {
        var bins = edges.length - 1;
        if (bins == 0 || Double.isNaN(x) || x < edges[0] || x > edges[bins]) {
            return Axis.NO_BIN;
        }
        var low = 0;
        var high = bins - 1;
        while (low < high) {
            var mid = (low + high + 1) >>> 1;
            if (edges[mid] <= x) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }

    /**
     * @return the eta row holding eta, or {@link Axis#NO_BIN}
     */
    public int rowIndex(double eta) {
        return find(etaEdges, eta);
    }

    /**
     * @return the radius column holding r, or {@link Axis#NO_BIN}
     */
    public int columnIndex(double r) {
        return find(rEdges, r);
    }

    /**
     * Add material to the cell holding (eta, r).
     *
     * @return false if (eta, r) is outside the grid
     */
    public boolean fill(double r, double eta, Material material) {
        var column = columnIndex(r);
        if (column == Axis.NO_BIN) {
            return false;
        }
        var row = rowIndex(eta);
        if (row == Axis.NO_BIN) {
            return false;
        }
        cells[row][column].add(material.radiation(), material.interaction());
        return true;
    }

    /**
     * Replace each cell by the running sum of its row from the innermost radius outward.
     */
    public void integrateRadially() {
        for (var row : cells) {
            for (int j = 1; j < row.length; j++) {
                row[j].add(row[j - 1].rlength(), row[j - 1].ilength());
            }
        }
    }

    /**
     * Write the cells into (z, r) grids: every destination bin takes the value of the cell its center falls in.
     * Destination bins mapping outside the cells are not touched.
     *
     * @param radiation   destination for the radiation length, x = z and y = r
     * @param interaction destination for the interaction length, x = z and y = r
     */
    public void remapToZR(Grid2D radiation, Grid2D interaction) {
        remap(radiation, true);
        remap(interaction, false);
    }

    private void remap(Grid2D target, boolean radiation) {
        var zAxis = target.xAxis();
        var rAxis = target.yAxis();
        var written = 0;
        for (int i = 0; i < zAxis.bins(); i++) {
            var z = zAxis.center(i);
            for (int j = 0; j < rAxis.bins(); j++) {
                var r = rAxis.center(j);
                var column = columnIndex(r);
                if (column == Axis.NO_BIN) {
                    continue;
                }
                var row = rowIndex(Pseudorapidity.etaOf(r, z));
                if (row == Axis.NO_BIN) {
                    continue;
                }
                var cell = cells[row][column];
                target.set(i, j, radiation ? cell.rlength() : cell.ilength());
                written++;
            }
        }
        log.debug("Remapped {} of {} bins into {}", written, zAxis.bins() * rAxis.bins(), target.name());
    }

    public void add(CellGrid other) {
        if (other.rows() != rows() || other.columns() != columns()) {
            throw new IllegalArgumentException("Incompatible cell grids");
        }
        for (int i = 0; i < cells.length; i++) {
            for (int j = 0; j < cells[i].length; j++) {
                cells[i][j].add(other.cells[i][j].rlength(), other.cells[i][j].ilength());
            }
        }
    }

    public CellGrid emptyCopy() {
        return new CellGrid(rows(), rEdges[0], rEdges[rEdges.length - 1], etaEdges[0], etaEdges[etaEdges.length - 1]);
    }

    public Cell cell(int row, int column) {
        return cells[row][column];
    }

    public int rows() {
        return cells.length;
    }

    public int columns() {
        return rEdges.length - 1;
    }
}

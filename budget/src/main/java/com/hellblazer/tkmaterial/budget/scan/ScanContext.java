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
package com.hellblazer.tkmaterial.budget.scan;

import com.hellblazer.tkmaterial.budget.grid.Axis;
import com.hellblazer.tkmaterial.budget.grid.CellGrid;
import com.hellblazer.tkmaterial.budget.grid.MaterialHistograms;
import com.hellblazer.tkmaterial.budget.grid.PositionMap;
import com.hellblazer.tkmaterial.budget.model.DetectorGeometry;

import java.util.Objects;

/**
 * The accumulators shared by the trajectories of one scan. A context is confined to one thread; parallel scans give
 * every worker its own context and merge them afterwards.
 *
 * @author hal.hildebrand
 */
public final class ScanContext {

    private final CellGrid           cellGrid;
    private final PositionMap        positionMap;
    private final MaterialHistograms histograms;

    public ScanContext(CellGrid cellGrid, PositionMap positionMap, MaterialHistograms histograms) {
        this.cellGrid = Objects.requireNonNull(cellGrid, "cellGrid");
        this.positionMap = Objects.requireNonNull(positionMap, "positionMap");
        this.histograms = Objects.requireNonNull(histograms, "histograms");
    }

    /**
     * Accumulators sized for a fan of etaSteps trajectories over [0, etaMax] through the geometry
     */
    public static ScanContext forScan(DetectorGeometry geometry, int etaSteps, double etaMax) {
        return new ScanContext(new CellGrid(etaSteps, 0, geometry.maxRadius(), 0, etaMax),
                               PositionMap.forVolume(geometry.maxLength(), geometry.maxRadius()),
                               new MaterialHistograms(new Axis(etaSteps, 0, etaMax)));
    }

    /**
     * Add the content of another context with the same binning
     */
    public void merge(ScanContext other) {
        cellGrid.add(other.cellGrid);
        positionMap.add(other.positionMap);
        histograms.add(other.histograms);
    }

    public ScanContext emptyCopy() {
        return new ScanContext(cellGrid.emptyCopy(), positionMap.emptyCopy(), histograms.emptyCopy());
    }

    public CellGrid cellGrid() {
        return cellGrid;
    }

    public PositionMap positionMap() {
        return positionMap;
    }

    public MaterialHistograms histograms() {
        return histograms;
    }
}

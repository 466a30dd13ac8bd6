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

import com.hellblazer.tkmaterial.budget.grid.CellGrid;
import com.hellblazer.tkmaterial.budget.grid.Grid2D;
import com.hellblazer.tkmaterial.budget.grid.MaterialHistograms;
import com.hellblazer.tkmaterial.budget.grid.PositionMap;
import com.hellblazer.tkmaterial.budget.track.Track;

import java.util.List;

/**
 * Everything an eta scan produces.
 *
 * @param tracks         the tracks with hits, sorted by distance, in eta order
 * @param idealTracks    the same tracks without material
 * @param histograms     material versus eta for every summary
 * @param cellGrid       (eta, r) cells, radially integrated when shadow integration is enabled
 * @param isoRadiation   cells remapped to (z, r), radiation length
 * @param isoInteraction cells remapped to (z, r), interaction length
 * @param positionMap    material per (z, r) crossing position, calibrated
 * @author hal.hildebrand
 */
public record ScanResult(List<Track> tracks, List<Track> idealTracks, MaterialHistograms histograms, CellGrid cellGrid,
                         Grid2D isoRadiation, Grid2D isoInteraction, PositionMap positionMap) {

    public ScanResult {
        tracks = List.copyOf(tracks);
        idealTracks = List.copyOf(idealTracks);
    }
}

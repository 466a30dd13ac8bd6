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
package com.hellblazer.tkmaterial.budget.coverage;

import com.hellblazer.tkmaterial.budget.grid.EtaProfile;
import com.hellblazer.tkmaterial.budget.grid.Grid2D;
import com.hellblazer.tkmaterial.budget.model.ActiveElement;

import java.util.Map;

/**
 * Outcome of a {@link GeometryCoverageScan}.
 *
 * @param tracks       number of tracks shot
 * @param totalProfile mean number of modules hit per track versus |eta|
 * @param typeProfiles mean number of modules of each type hit per track versus |eta|
 * @param phiEtaMap    mean number of modules hit per track in (phi, eta) bins
 * @param hitFractions fraction of the tracks hitting each module
 * @author hal.hildebrand
 */
public record CoverageResult(int tracks, EtaProfile totalProfile, Map<String, EtaProfile> typeProfiles,
                             Grid2D phiEtaMap, Map<ActiveElement, Double> hitFractions) {

    public CoverageResult {
        typeProfiles = Map.copyOf(typeProfiles);
    }
}

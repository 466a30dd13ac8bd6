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

import com.hellblazer.tkmaterial.budget.model.ActiveElement;
import com.hellblazer.tkmaterial.budget.model.ActiveLayer;
import com.hellblazer.tkmaterial.budget.model.DetectorGeometry;
import com.hellblazer.tkmaterial.budget.model.InactiveInventory;
import com.hellblazer.tkmaterial.budget.model.Material;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class GeometryCoverageScanTest {

    private static final int SIDES = 16;

    /** Closed polygon of flat modules tangent to r = 100, slightly overlapping, z in [-300, 300] */
    private static DetectorGeometry closedBarrel() {
        var halfWidth = 100 * Math.tan(Math.PI / SIDES) * 1.05;
        var modules = new ArrayList<ActiveElement>();
        for (int i = 0; i < SIDES; i++) {
            var type = i % 2 == 0 ? "ptA" : "ptB";
            modules.add(ActiveElement.barrel(type, 100, 2 * Math.PI * i / SIDES, halfWidth, -300, 300,
                                             new Material(0.01, 0.01)));
        }
        return new DetectorGeometry("closed", List.of(new ActiveLayer("L1", modules)), List.of(),
                                    InactiveInventory.EMPTY, 200, 400, 1.0);
    }

    @Test
    public void testTrackCountIsSquare() {
        var result = new GeometryCoverageScan().analyze(closedBarrel(), 1000);

        assertEquals(961, result.tracks());
        assertEquals(15, result.phiEtaMap().xAxis().bins());
        assertEquals(15, result.phiEtaMap().yAxis().bins());
        assertEquals(961, result.totalProfile().totalEntries());
        assertEquals(2, result.typeProfiles().size());
    }

    @Test
    public void testClosedBarrelIsHermetic() {
        var result = new GeometryCoverageScan().analyze(closedBarrel(), 2500);

        var profile = result.totalProfile();
        var axis = profile.axis();
        var checked = 0;
        for (int bin = 0; bin < axis.bins(); bin++) {
            if (axis.center(bin) < 1.5 && profile.entries(bin) > 0) {
                assertTrue(profile.mean(bin) >= 1.0, "Central tracks hit at least one module, bin " + bin);
                checked++;
            }
        }
        assertTrue(checked > 0);
        var hits = 0.0;
        for (var fraction : result.hitFractions().values()) {
            assertTrue(fraction >= 0 && fraction <= 1);
            hits += fraction * result.tracks();
        }
        var profileHits = 0.0;
        for (int bin = 0; bin < axis.bins(); bin++) {
            profileHits += profile.mean(bin) * profile.entries(bin);
        }
        assertEquals(profileHits, hits, 1e-6, "Module counters agree with the per track counts");
    }

    @Test
    public void testSurveyIsReproducible() {
        var geometry = closedBarrel();
        var scan = new GeometryCoverageScan(42);

        var first = scan.analyze(geometry, 400);
        var firstFractions = new ArrayList<Double>();
        for (var module : geometry.allModules()) {
            firstFractions.add(first.hitFractions().get(module));
        }
        var second = scan.analyze(geometry, 400);

        for (int i = 0; i < geometry.allModules().size(); i++) {
            assertEquals(firstFractions.get(i), second.hitFractions().get(geometry.allModules().get(i)));
        }
        var axis = first.totalProfile().axis();
        for (int bin = 0; bin < axis.bins(); bin++) {
            assertEquals(first.totalProfile().mean(bin), second.totalProfile().mean(bin));
        }
    }

    @Test
    public void testNoTracksRejected() {
        assertThrows(IllegalArgumentException.class, () -> new GeometryCoverageScan().analyze(closedBarrel(), 0));
    }
}

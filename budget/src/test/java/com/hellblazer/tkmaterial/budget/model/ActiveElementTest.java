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
package com.hellblazer.tkmaterial.budget.model;

import com.hellblazer.tkmaterial.geometry.Ray;
import com.hellblazer.tkmaterial.geometry.TriangleIntersection;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3d;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class ActiveElementTest {

    private static final Material MATERIAL = new Material(0.02, 0.01);

    @Test
    public void testBarrelModuleGeometry() {
        var module = ActiveElement.barrel("pt", 100, Math.PI / 2, 10, -50, 50, MATERIAL);

        assertEquals(Subdetector.BARREL, module.subdetector());
        assertEquals(50, module.maxZ(), 1e-12);
        assertEquals(-50, module.minZ(), 1e-12);
        assertEquals(0, module.meanPoint().x, 1e-12);
        assertEquals(100, module.meanPoint().y, 1e-12);
        assertEquals(0, module.centerEta(), 1e-12);
        assertEquals(100, module.crossDistance(Ray.fromOrigin(0, Math.PI / 2)), 1e-9);
        assertEquals(TriangleIntersection.MISS, module.crossDistance(Ray.fromOrigin(0, -Math.PI / 2)));
    }

    @Test
    public void testEndcapModuleGeometry() {
        var module = ActiveElement.endcap("ec", 200, 20, 60, 0, 10, 20, MATERIAL);

        assertEquals(Subdetector.ENDCAP, module.subdetector());
        assertEquals(200, module.maxZ(), 1e-12);
        assertEquals(40, module.meanPoint().x, 1e-12);
        assertEquals(200, module.meanPoint().z, 1e-12);
    }

    @Test
    public void testDegenerateModuleIsAlwaysMissed() {
        var corners = new Point3d[] { new Point3d(0, 100, -50), new Point3d(0, 100, 0), new Point3d(0, 100, 50),
                                      new Point3d(0, 100, 25) };
        var module = new ActiveElement("flat", Subdetector.BARREL, corners, MATERIAL);

        assertTrue(module.isDegenerate());
        assertEquals(TriangleIntersection.MISS, module.crossDistance(Ray.fromOrigin(0, Math.PI / 2)));
    }

    @Test
    public void testCornerCountIsChecked() {
        assertThrows(IllegalArgumentException.class,
                     () -> new ActiveElement("bad", Subdetector.BARREL, new Point3d[3], MATERIAL));
    }

    @Test
    public void testCornersAreCopied() {
        var corners = new Point3d[] { new Point3d(-10, 100, -50), new Point3d(10, 100, -50), new Point3d(10, 100, 50),
                                      new Point3d(-10, 100, 50) };
        var module = new ActiveElement("pt", Subdetector.BARREL, corners, MATERIAL);
        corners[0].set(0, 0, 0);
        module.corners()[1].set(0, 0, 0);

        assertEquals(new Point3d(-10, 100, -50), module.corners()[0]);
        assertEquals(new Point3d(10, 100, -50), module.corners()[1]);
    }

    @Test
    public void testWindowPreCheck() {
        var module = ActiveElement.barrel("pt", 100, Math.PI / 2, 10, -50, 50, MATERIAL);
        assertTrue(module.couldHit(2.5, -Math.PI / 2), "Without boundaries every direction is a candidate");

        module.computeBoundaries(0);

        assertTrue(module.couldHit(0, Math.PI / 2));
        assertFalse(module.couldHit(0, -Math.PI / 2));
        assertFalse(module.couldHit(2.5, Math.PI / 2));
    }

    @Test
    public void testHitCounter() {
        var module = ActiveElement.barrel("pt", 100, 0, 10, -50, 50, MATERIAL);
        module.registerHit();
        module.registerHit();
        assertEquals(2, module.hitCount());
        module.resetHits();
        assertEquals(0, module.hitCount());
    }

    @Test
    public void testGeometryComputesWindowsAndEtaRange() {
        var barrel = ActiveElement.barrel("pt", 100, Math.PI / 2, 10, -50, 50, MATERIAL);
        var endcap = ActiveElement.endcap("ec", 200, 20, 60, Math.PI / 2, 10, 20, MATERIAL);
        var geometry = new DetectorGeometry("test", List.of(new ActiveLayer("L1", List.of(barrel))),
                                            List.of(new ActiveLayer("D1", List.of(endcap))), InactiveInventory.EMPTY,
                                            500, 1000, 0);

        assertNotNull(barrel.window());
        assertNotNull(endcap.window());
        assertEquals(List.of(barrel, endcap), geometry.allModules());
        var range = geometry.etaRange();
        assertTrue(range[0] < -0.4, "Barrel module reaches negative eta");
        assertTrue(range[1] > 1.8, "Endcap module reaches forward");
    }

    @Test
    public void testGeometryValidation() {
        assertThrows(IllegalArgumentException.class,
                     () -> new DetectorGeometry("bad", List.of(), List.of(), InactiveInventory.EMPTY, 0, 100, 0));
        assertThrows(IllegalArgumentException.class,
                     () -> new DetectorGeometry("bad", List.of(), List.of(), InactiveInventory.EMPTY, 100, 100, -1));
        var empty = new DetectorGeometry("empty", List.of(), List.of(), InactiveInventory.EMPTY, 100, 100, 0);
        assertArrayEquals(new double[] { 0, 0 }, empty.etaRange());
    }
}

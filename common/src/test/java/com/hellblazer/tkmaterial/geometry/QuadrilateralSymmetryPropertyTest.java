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
package com.hellblazer.tkmaterial.geometry;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Property tests: the crossing distance of a line through a module's centroid along its normal does not depend on
 * which corner the perimeter starts from.
 *
 * @author hal.hildebrand
 */
class QuadrilateralSymmetryPropertyTest {

    @Property(tries = 200)
    void rotatedCornerOrderGivesSameDistance(@ForAll @DoubleRange(min = 1, max = 200) double halfWidth,
                                             @ForAll @DoubleRange(min = 1, max = 200) double halfLength,
                                             @ForAll @DoubleRange(min = 0, max = 6.28) double yaw,
                                             @ForAll @DoubleRange(min = -1.5, max = 1.5) double pitch,
                                             @ForAll @DoubleRange(min = 1, max = 1000) double standoff) {
        // Orthonormal frame for the module plane
        var normal = new Vector3d(Math.cos(pitch) * Math.cos(yaw), Math.cos(pitch) * Math.sin(yaw), Math.sin(pitch));
        var helper = Math.abs(normal.z) < 0.9 ? new Vector3d(0, 0, 1) : new Vector3d(1, 0, 0);
        var u = new Vector3d();
        u.cross(normal, helper);
        u.normalize();
        var v = new Vector3d();
        v.cross(normal, u);

        var center = new Point3d(37, -12, 250);
        var corners = new Point3d[4];
        double[][] signs = { { -1, -1 }, { 1, -1 }, { 1, 1 }, { -1, 1 } };
        for (int i = 0; i < 4; i++) {
            var p = new Point3d(center);
            p.scaleAdd(signs[i][0] * halfWidth, u, p);
            p.scaleAdd(signs[i][1] * halfLength, v, p);
            corners[i] = p;
        }
        var rotated = new Point3d[] { corners[1], corners[2], corners[3], corners[0] };

        var origin = new Point3d(center);
        origin.scaleAdd(-standoff, normal, origin);
        var ray = new Ray(origin, normal);

        var distance = TriangleIntersection.quadrilateralCross(corners, ray);
        var rotatedDistance = TriangleIntersection.quadrilateralCross(rotated, ray);

        assertTrue(distance > 0, "Centroid line must cross the module");
        assertEquals(standoff, distance, 1e-6 * standoff);
        assertEquals(distance, rotatedDistance, 1e-9 * standoff);
    }

    @Property(tries = 200)
    void crossingDistanceIsNeverNegative(@ForAll @DoubleRange(min = 0, max = 3) double eta,
                                         @ForAll @DoubleRange(min = -3.14, max = 3.14) double phi) {
        var corners = new Point3d[] { new Point3d(-10, 100, -50), new Point3d(10, 100, -50),
                                      new Point3d(10, 100, 50), new Point3d(-10, 100, 50) };

        var distance = TriangleIntersection.quadrilateralCross(corners, Ray.fromOrigin(eta, phi));

        assertTrue(distance == TriangleIntersection.MISS || distance > 0);
    }
}

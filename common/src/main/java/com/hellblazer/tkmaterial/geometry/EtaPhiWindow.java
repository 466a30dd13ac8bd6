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

import javax.vecmath.Point3d;

/**
 * Cheap bounding check for a planar module: the pseudorapidity and azimuth ranges spanned by its corners and edge
 * midpoints, as seen from any vertex within the safety margin of the luminous region. Computed once per module; a
 * line outside the window cannot cross the module, a line inside it still needs the exact crossing test.
 *
 * @author hal.hildebrand
 */
public record EtaPhiWindow(double minEta, double maxEta, double minPhi, double maxPhi) {

    /** Number of z error sigmas the vertex may be displaced by */
    public static final double SAFETY_MARGIN = 5.0;

    /** Points sampled along each edge; angular extremes of a plane not containing the origin lie on its edges */
    private static final int EDGE_SAMPLES = 8;

    /** Padding on both ranges, covering extremes falling between edge samples */
    private static final double TOLERANCE = 1e-3;

    /**
     * Compute the window of a quadrilateral.
     *
     * @param corners the four corners of the module
     * @param zError  spread of the vertex along z
     * @return the window
     */
    public static EtaPhiWindow of(Point3d[] corners, double zError) {
        var samples = samplePoints(corners);

        var minEta = Double.POSITIVE_INFINITY;
        var maxEta = Double.NEGATIVE_INFINITY;
        var shift = zError * SAFETY_MARGIN;
        for (var z = -shift; z <= shift; z += shift) {
            for (var p : samples) {
                var eta = Pseudorapidity.etaOf(Math.hypot(p.x, p.y), p.z - z);
                minEta = Math.min(minEta, eta);
                maxEta = Math.max(maxEta, eta);
            }
            if (shift == 0) {
                break;
            }
        }

        // Rotate modules sitting across +-pi away from the discontinuity before taking the phi extent
        var mean = new Point3d();
        for (var c : corners) {
            mean.add(c);
        }
        mean.scale(1.0 / corners.length);
        var averagePhi = Pseudorapidity.phiOf(mean);
        var rotation = 0.0;
        if (averagePhi > Math.PI / 2) {
            rotation = -Math.PI / 2;
        } else if (averagePhi < -Math.PI / 2) {
            rotation = Math.PI / 2;
        }
        var cos = Math.cos(rotation);
        var sin = Math.sin(rotation);
        var minPhi = Double.POSITIVE_INFINITY;
        var maxPhi = Double.NEGATIVE_INFINITY;
        for (var p : samples) {
            var phi = Math.atan2(sin * p.x + cos * p.y, cos * p.x - sin * p.y);
            minPhi = Math.min(minPhi, phi);
            maxPhi = Math.max(maxPhi, phi);
        }
        return new EtaPhiWindow(minEta, maxEta, minPhi - rotation, maxPhi - rotation);
    }

    /**
     * @return true if a line with this direction may cross the module
     */
    public boolean couldHit(double eta, double phi) {
        if (eta < minEta - TOLERANCE || eta > maxEta + TOLERANCE) {
            return false;
        }
        return withinPhi(phi) || withinPhi(phi - 2 * Math.PI) || withinPhi(phi + 2 * Math.PI);
    }

    private boolean withinPhi(double phi) {
        return phi >= minPhi - TOLERANCE && phi <= maxPhi + TOLERANCE;
    }

    private static Point3d[] samplePoints(Point3d[] corners) {
        var samples = new Point3d[corners.length * EDGE_SAMPLES];
        for (int i = 0; i < corners.length; i++) {
            var next = corners[(i + 1) % corners.length];
            for (int j = 0; j < EDGE_SAMPLES; j++) {
                var p = new Point3d(corners[i]);
                p.interpolate(next, (double) j / EDGE_SAMPLES);
                samples[i * EDGE_SAMPLES + j] = p;
            }
        }
        return samples;
    }
}

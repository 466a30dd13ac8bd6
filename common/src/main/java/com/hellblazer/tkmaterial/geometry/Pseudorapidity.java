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

import javax.vecmath.Tuple3d;
import javax.vecmath.Vector3d;

/**
 * Conversions between pseudorapidity, polar angle and detector coordinates.
 * <p>
 * Pseudorapidity is eta = -ln(tan(theta / 2)) where theta is the polar angle measured from the +z (beam) axis. Radii
 * are transverse distances from the beam line.
 *
 * @author hal.hildebrand
 */
public final class Pseudorapidity {

    private Pseudorapidity() {
    }

    /**
     * @param eta pseudorapidity
     * @return polar angle theta = 2 atan(exp(-eta))
     */
    public static double theta(double eta) {
        return 2.0 * Math.atan(Math.exp(-eta));
    }

    /**
     * @param theta polar angle in radians
     * @return pseudorapidity -ln(tan(theta / 2))
     */
    public static double eta(double theta) {
        return -Math.log(Math.tan(theta / 2.0));
    }

    /**
     * Pseudorapidity of a point seen from the origin, given its transverse radius and z
     *
     * @param r transverse radius
     * @param z longitudinal coordinate
     * @return the pseudorapidity of the direction to (r, z)
     */
    public static double etaOf(double r, double z) {
        return eta(Math.atan2(r, z));
    }

    /**
     * Pseudorapidity of a point seen from the origin
     *
     * @param point the point
     * @return eta of the direction to the point
     */
    public static double etaOf(Tuple3d point) {
        return etaOf(Math.hypot(point.x, point.y), point.z);
    }

    /**
     * Azimuth of a point, in (-pi, pi]
     *
     * @param point the point
     * @return atan2(y, x)
     */
    public static double phiOf(Tuple3d point) {
        return Math.atan2(point.y, point.x);
    }

    /**
     * Unit direction vector for the given pseudorapidity and azimuth
     *
     * @param eta pseudorapidity
     * @param phi azimuth in radians
     * @return (cos(phi) sin(theta), sin(phi) sin(theta), cos(theta))
     */
    public static Vector3d direction(double eta, double phi) {
        var theta = theta(eta);
        var sinTheta = Math.sin(theta);
        return new Vector3d(Math.cos(phi) * sinTheta, Math.sin(phi) * sinTheta, Math.cos(theta));
    }
}

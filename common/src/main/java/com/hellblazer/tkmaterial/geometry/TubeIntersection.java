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

/**
 * Closed form crossing of a straight line from the origin with rotationally symmetric volumes: disks (planes of
 * constant z) and cylinders (surfaces of constant radius). The line is given by its polar angle alone since both
 * shapes are symmetric around the beam axis.
 *
 * @author hal.hildebrand
 */
public final class TubeIntersection {

    /**
     * Crossing of a line with a disk or cylinder.
     *
     * @param distance path length from the origin to the crossing point
     * @param r        transverse radius of the crossing point
     * @param z        longitudinal coordinate of the crossing point
     */
    public record Crossing(double distance, double r, double z) {
    }

    private TubeIntersection() {
    }

    /**
     * Crossing with the plane z = const.
     *
     * @param z     plane position, &gt; 0
     * @param theta polar angle of the line
     * @return the crossing; the radius is z tan(theta)
     */
    public static Crossing atPlane(double z, double theta) {
        var r = z * Math.tan(theta);
        return new Crossing(z / Math.cos(theta), r, z);
    }

    /**
     * Crossing with the cylinder r = const.
     *
     * @param r     cylinder radius, &gt; 0
     * @param theta polar angle of the line
     * @return the crossing; the z coordinate is r / tan(theta)
     */
    public static Crossing atCylinder(double r, double theta) {
        if (theta == 0) {
            return new Crossing(r, r, Double.POSITIVE_INFINITY);
        }
        return new Crossing(r / Math.sin(theta), r, r / Math.tan(theta));
    }
}

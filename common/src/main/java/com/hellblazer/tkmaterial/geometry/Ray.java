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
import javax.vecmath.Vector3d;

/**
 * Straight line trajectory defined by an origin point and a direction vector. The direction is kept as given (it is
 * not normalized); crossing parameters computed against it are in units of the direction's own length.
 *
 * @author hal.hildebrand
 */
public record Ray(Point3d origin, Vector3d direction) {

    /**
     * Create a ray with validation
     *
     * @param origin    the starting point of the ray
     * @param direction the direction vector (non-zero)
     */
    public Ray {
        if (origin == null || direction == null) {
            throw new IllegalArgumentException("Ray origin and direction are required");
        }
        if (direction.lengthSquared() == 0) {
            throw new IllegalArgumentException("Ray direction cannot be zero vector");
        }
        origin = new Point3d(origin);
        direction = new Vector3d(direction);
    }

    /**
     * Ray from the nominal interaction point along the given pseudorapidity and azimuth
     *
     * @param eta pseudorapidity of the trajectory
     * @param phi azimuthal angle in radians
     * @return unit direction ray starting at the origin
     */
    public static Ray fromOrigin(double eta, double phi) {
        return new Ray(new Point3d(), Pseudorapidity.direction(eta, phi));
    }

    /**
     * Ray from a displaced vertex along the given pseudorapidity and azimuth
     *
     * @param vertexZ z position of the vertex on the beam line
     * @param eta     pseudorapidity of the trajectory
     * @param phi     azimuthal angle in radians
     * @return unit direction ray starting at (0, 0, vertexZ)
     */
    public static Ray fromVertex(double vertexZ, double eta, double phi) {
        return new Ray(new Point3d(0, 0, vertexZ), Pseudorapidity.direction(eta, phi));
    }

    /**
     * @return the magnitude of the direction vector
     */
    public double directionLength() {
        return direction.length();
    }

    /**
     * Get a point along the ray at parameter t
     *
     * @param t the parameter, in units of the direction vector
     * @return the point at origin + t * direction
     */
    public Point3d pointAt(double t) {
        return new Point3d(origin.x + t * direction.x, origin.y + t * direction.y, origin.z + t * direction.z);
    }
}

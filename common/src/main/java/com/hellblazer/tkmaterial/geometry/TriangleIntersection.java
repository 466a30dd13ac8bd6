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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

/**
 * Ray-triangle and ray-quadrilateral crossing.
 * <p>
 * The crossing point satisfies both the triangle parametrization t = P1 + alpha (P2 - P1) + beta (P3 - P1) and the
 * line parametrization l = O + gamma U. Solving for (alpha, beta, gamma) gives the 3x3 system
 * <pre>
 *   d = A v,  d = O - P1,  A = (P2 - P1, P3 - P1, -U)
 * </pre>
 * which is solved in closed form (Cramer's rule). The line crosses the triangle when the system is regular and
 * alpha &gt;= 0, beta &gt;= 0, alpha + beta &lt;= 1. gamma is expressed in units of U.
 * <p>
 * A planar quadrilateral with corners 0-1-2-3 is split along the 0-2 diagonal into triangles 0-1-2 and 0-2-3.
 *
 * @author hal.hildebrand
 */
public final class TriangleIntersection {

    /** Returned when the line does not cross */
    public static final double MISS = -1.0;

    private static final Logger log = LoggerFactory.getLogger(TriangleIntersection.class);

    /** Relative determinant threshold below which the line is taken as parallel to the triangle */
    private static final double SINGULAR_EPSILON = 1e-14;

    /** Rounding allowance on the triangle coordinates, so lines through the shared diagonal are never lost */
    private static final double EDGE_EPSILON = 1e-12;

    /**
     * Result of a single triangle crossing test.
     */
    public static final class TriangleResult {
        public boolean hit;
        public double  alpha;
        public double  beta;
        public double  gamma;

        public TriangleResult() {
            reset();
        }

        public void reset() {
            hit = false;
            alpha = 0;
            beta = 0;
            gamma = MISS;
        }
    }

    // Reusable scratch vectors to avoid allocation
    private final Vector3d d     = new Vector3d();
    private final Vector3d edge1 = new Vector3d();
    private final Vector3d edge2 = new Vector3d();
    private final Vector3d minusU = new Vector3d();
    private final Vector3d cross = new Vector3d();

    private TriangleIntersection() {
    }

    /**
     * Create a new intersection tester (instance scratch space, not shareable between threads).
     */
    public static TriangleIntersection create() {
        return new TriangleIntersection();
    }

    /**
     * Static convenience for a single triangle test.
     *
     * @return gamma of the crossing, or {@link #MISS}
     */
    public static double triangleCross(Point3d p1, Point3d p2, Point3d p3, Ray ray) {
        var result = new TriangleResult();
        return create().intersectTriangle(p1, p2, p3, ray, result) ? result.gamma : MISS;
    }

    /**
     * Static convenience for a single quadrilateral test.
     *
     * @return distance from the ray origin to the crossing, or {@link #MISS}
     */
    public static double quadrilateralCross(Point3d[] corners, Ray ray) {
        return create().crossQuadrilateral(corners, ray);
    }

    /**
     * Solve the triangle system for the line.
     *
     * @param p1     triangle vertex 1 (the parametrization origin)
     * @param p2     triangle vertex 2
     * @param p3     triangle vertex 3
     * @param ray    the line
     * @param result result to fill
     * @return true if the line crosses the triangle
     */
    public boolean intersectTriangle(Point3d p1, Point3d p2, Point3d p3, Ray ray, TriangleResult result) {
        result.reset();
        var origin = ray.origin();
        var u = ray.direction();

        d.set(origin.x - p1.x, origin.y - p1.y, origin.z - p1.z);
        edge1.set(p2.x - p1.x, p2.y - p1.y, p2.z - p1.z);
        edge2.set(p3.x - p1.x, p3.y - p1.y, p3.z - p1.z);
        minusU.set(-u.x, -u.y, -u.z);

        // det(A) = c0 . (c1 x c2)
        cross.cross(edge2, minusU);
        var determinant = edge1.dot(cross);
        var scale = edge1.length() * edge2.length() * minusU.length();
        if (scale == 0 || Math.abs(determinant) <= SINGULAR_EPSILON * scale) {
            log.trace("Singular crossing system, line parallel to triangle {} {} {}", p1, p2, p3);
            return false;
        }

        // Cramer's rule: replace one column of A with d
        var alpha = d.dot(cross) / determinant;
        cross.cross(d, minusU);
        var beta = edge1.dot(cross) / determinant;
        cross.cross(edge2, d);
        var gamma = edge1.dot(cross) / determinant;

        result.alpha = alpha;
        result.beta = beta;
        if (alpha >= -EDGE_EPSILON && beta >= -EDGE_EPSILON && alpha + beta <= 1 + EDGE_EPSILON) {
            result.hit = true;
            result.gamma = gamma;
            return true;
        }
        return false;
    }

    /**
     * Crossing distance of the ray with a planar quadrilateral
     *
     * @param corners the four corners, in perimeter order
     * @param ray     the line
     * @return the positive distance from the ray origin, in length units, or {@link #MISS}
     */
    public double crossQuadrilateral(Point3d[] corners, Ray ray) {
        if (corners.length != 4) {
            throw new IllegalArgumentException("Quadrilateral requires 4 corners, got " + corners.length);
        }
        var result = new TriangleResult();
        var gamma = MISS;
        if (intersectTriangle(corners[0], corners[1], corners[2], ray, result) && result.gamma > 0) {
            gamma = result.gamma;
        } else if (intersectTriangle(corners[0], corners[2], corners[3], ray, result) && result.gamma > 0) {
            gamma = result.gamma;
        }
        if (gamma <= 0) {
            return MISS;
        }
        return gamma * ray.directionLength();
    }
}

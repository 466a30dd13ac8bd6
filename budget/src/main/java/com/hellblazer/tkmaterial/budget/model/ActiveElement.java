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

import com.hellblazer.tkmaterial.geometry.EtaPhiWindow;
import com.hellblazer.tkmaterial.geometry.Pseudorapidity;
import com.hellblazer.tkmaterial.geometry.Ray;
import com.hellblazer.tkmaterial.geometry.TriangleIntersection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;

/**
 * A sensor module: a planar quadrilateral with the radiation and interaction length of one perpendicular crossing.
 * Placement is done by the geometry model; this class only holds the resulting corners.
 * <p>
 * The hit counter is shared by all scans running over the module and is safe for concurrent updates.
 *
 * @author hal.hildebrand
 */
public final class ActiveElement {
    private static final Logger log = LoggerFactory.getLogger(ActiveElement.class);

    private final String      type;
    private final Subdetector subdetector;
    private final Point3d[]   corners;
    private final Material    material;
    private final boolean     degenerate;
    private final LongAdder   hits = new LongAdder();
    private volatile EtaPhiWindow window;

    /**
     * @param type        module type name (used to group occupancy statistics)
     * @param subdetector barrel or endcap family
     * @param corners     the four corners in perimeter order
     * @param material    radiation and interaction length for a perpendicular crossing
     */
    public ActiveElement(String type, Subdetector subdetector, Point3d[] corners, Material material) {
        this.type = Objects.requireNonNull(type, "type");
        this.subdetector = Objects.requireNonNull(subdetector, "subdetector");
        this.material = Objects.requireNonNull(material, "material");
        if (corners == null || corners.length != 4) {
            throw new IllegalArgumentException("Module requires 4 corners");
        }
        this.corners = new Point3d[4];
        for (int i = 0; i < 4; i++) {
            this.corners[i] = new Point3d(corners[i]);
        }
        this.degenerate = area() == 0;
        if (degenerate) {
            log.warn("Zero area {} module at {}, it will never be hit", type, Arrays.toString(corners));
        }
    }

    /**
     * Flat rectangular barrel module tangent to the cylinder of radius r.
     *
     * @param type      module type name
     * @param r         radius of the module plane
     * @param phi       azimuth of the module center
     * @param halfWidth half width in r-phi
     * @param zMin      lower z edge
     * @param zMax      upper z edge
     * @param material  perpendicular crossing material
     */
    public static ActiveElement barrel(String type, double r, double phi, double halfWidth, double zMin, double zMax,
                                       Material material) {
        var cx = r * Math.cos(phi);
        var cy = r * Math.sin(phi);
        var tx = -Math.sin(phi) * halfWidth;
        var ty = Math.cos(phi) * halfWidth;
        return new ActiveElement(type, Subdetector.BARREL,
                                 new Point3d[] { new Point3d(cx - tx, cy - ty, zMin), new Point3d(cx + tx, cy + ty, zMin),
                                                 new Point3d(cx + tx, cy + ty, zMax),
                                                 new Point3d(cx - tx, cy - ty, zMax) }, material);
    }

    /**
     * Flat trapezoidal endcap module in the plane z, spanning [rMin, rMax] along the radial direction phi.
     *
     * @param type           module type name
     * @param z              position of the module plane
     * @param rMin           inner radius
     * @param rMax           outer radius
     * @param phi            azimuth of the module axis
     * @param halfWidthInner half width at the inner edge
     * @param halfWidthOuter half width at the outer edge
     * @param material       perpendicular crossing material
     */
    public static ActiveElement endcap(String type, double z, double rMin, double rMax, double phi,
                                       double halfWidthInner, double halfWidthOuter, Material material) {
        var ux = Math.cos(phi);
        var uy = Math.sin(phi);
        var tx = -uy;
        var ty = ux;
        return new ActiveElement(type, Subdetector.ENDCAP, new Point3d[] {
        new Point3d(rMin * ux - halfWidthInner * tx, rMin * uy - halfWidthInner * ty, z),
        new Point3d(rMin * ux + halfWidthInner * tx, rMin * uy + halfWidthInner * ty, z),
        new Point3d(rMax * ux + halfWidthOuter * tx, rMax * uy + halfWidthOuter * ty, z),
        new Point3d(rMax * ux - halfWidthOuter * tx, rMax * uy - halfWidthOuter * ty, z) }, material);
    }

    /**
     * Pre-compute the bounding window used by {@link #couldHit(double, double)}
     *
     * @param zError spread of the vertex along the beam
     */
    public void computeBoundaries(double zError) {
        window = EtaPhiWindow.of(corners, zError);
    }

    /**
     * Cheap pre-check. Without computed boundaries every direction is a candidate.
     */
    public boolean couldHit(double eta, double phi) {
        var w = window;
        return w == null || w.couldHit(eta, phi);
    }

    /**
     * Exact crossing test. Does not touch the hit counter.
     *
     * @return distance from the ray origin to the crossing, or {@link TriangleIntersection#MISS}
     */
    public double crossDistance(Ray ray) {
        if (degenerate) {
            return TriangleIntersection.MISS;
        }
        return TriangleIntersection.quadrilateralCross(corners, ray);
    }

    public void registerHit() {
        hits.increment();
    }

    public long hitCount() {
        return hits.sum();
    }

    public void resetHits() {
        hits.reset();
    }

    public Point3d[] corners() {
        var copy = new Point3d[4];
        for (int i = 0; i < 4; i++) {
            copy[i] = new Point3d(corners[i]);
        }
        return copy;
    }

    public Point3d meanPoint() {
        var mean = new Point3d();
        for (var c : corners) {
            mean.add(c);
        }
        mean.scale(0.25);
        return mean;
    }

    public double maxZ() {
        return Math.max(Math.max(corners[0].z, corners[1].z), Math.max(corners[2].z, corners[3].z));
    }

    public double minZ() {
        return Math.min(Math.min(corners[0].z, corners[1].z), Math.min(corners[2].z, corners[3].z));
    }

    /**
     * @return pseudorapidity of the module center seen from the origin
     */
    public double centerEta() {
        return Pseudorapidity.etaOf(meanPoint());
    }

    public EtaPhiWindow window() {
        return window;
    }

    public Material material() {
        return material;
    }

    public double radiationLength() {
        return material.radiation();
    }

    public double interactionLength() {
        return material.interaction();
    }

    public Subdetector subdetector() {
        return subdetector;
    }

    public String type() {
        return type;
    }

    public boolean isDegenerate() {
        return degenerate;
    }

    private double area() {
        var d1 = new Vector3d();
        d1.sub(corners[2], corners[0]);
        var d2 = new Vector3d();
        d2.sub(corners[3], corners[1]);
        var normal = new Vector3d();
        normal.cross(d1, d2);
        return normal.length() / 2.0;
    }

    @Override
    public String toString() {
        return "ActiveElement[" + type + ", " + subdetector + ", center=" + meanPoint() + "]";
    }
}

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

import com.hellblazer.tkmaterial.geometry.Pseudorapidity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * A passive volume (service, cooling, support) with rotational symmetry around the beam: a ring or tube of
 * rectangular (r, z) cross section. Vertical elements are thin in z (disks, flanges), horizontal elements are thin in r
 * (cylinders).
 *
 * @author hal.hildebrand
 */
public final class InactiveElement {
    private static final Logger log = LoggerFactory.getLogger(InactiveElement.class);

    private final double   innerRadius;
    private final double   rWidth;
    private final double   zOffset;
    private final double   zLength;
    private final boolean  vertical;
    private final Category category;
    private final boolean  inTrackingVolume;
    private final Material material;
    private final double   etaMin;
    private final double   etaMax;
    private final boolean  degenerate;

    private InactiveElement(Builder builder) {
        this.innerRadius = builder.innerRadius;
        this.rWidth = builder.rWidth;
        this.zOffset = builder.zOffset;
        this.zLength = builder.zLength;
        this.vertical = builder.vertical;
        this.category = builder.category;
        this.inTrackingVolume = builder.inTrackingVolume;
        this.material = builder.material;
        this.degenerate = innerRadius < 0 || rWidth <= 0 || zLength <= 0;
        if (degenerate) {
            log.warn("Degenerate {} element r={} dr={} z={} dz={}, it will never be hit", category, innerRadius,
                     rWidth, zOffset, zLength);
        }
        if (builder.etaRange != null) {
            this.etaMin = builder.etaRange[0];
            this.etaMax = builder.etaRange[1];
        } else {
            var outer = innerRadius + rWidth;
            var zEnd = zOffset + zLength;
            this.etaMin = Math.min(Pseudorapidity.etaOf(outer, zOffset), Pseudorapidity.etaOf(innerRadius, zOffset));
            this.etaMax = Math.max(Pseudorapidity.etaOf(innerRadius, zEnd), Pseudorapidity.etaOf(outer, zEnd));
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return true if a track of this pseudorapidity crosses the element
     */
    public boolean covers(double eta) {
        return !degenerate && etaMin < eta && etaMax > eta;
    }

    /**
     * @return true if any part of the element lies at z &gt; 0
     */
    public boolean reachesPositiveZ() {
        return zOffset + zLength > 0;
    }

    public Orientation orientation() {
        return vertical ? Orientation.VERTICAL : Orientation.HORIZONTAL;
    }

    public double innerRadius() {
        return innerRadius;
    }

    public double rWidth() {
        return rWidth;
    }

    public double zOffset() {
        return zOffset;
    }

    public double zLength() {
        return zLength;
    }

    public boolean isVertical() {
        return vertical;
    }

    public Category category() {
        return category;
    }

    /**
     * @return true if the element is declared inside the tracking volume
     */
    public boolean isInTrackingVolume() {
        return inTrackingVolume;
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

    public double etaMin() {
        return etaMin;
    }

    public double etaMax() {
        return etaMax;
    }

    public boolean isDegenerate() {
        return degenerate;
    }

    @Override
    public String toString() {
        return "InactiveElement[" + category + (vertical ? ", vertical" : ", horizontal") + ", r=" + innerRadius
        + "+" + rWidth + ", z=" + zOffset + "+" + zLength + "]";
    }

    public static class Builder {
        private double   innerRadius;
        private double   rWidth;
        private double   zOffset;
        private double   zLength;
        private boolean  vertical;
        private Category category         = Category.NONE;
        private boolean  inTrackingVolume = true;
        private Material material         = Material.ZERO;
        private double[] etaRange;

        public Builder radius(double innerRadius, double rWidth) {
            this.innerRadius = innerRadius;
            this.rWidth = rWidth;
            return this;
        }

        public Builder z(double zOffset, double zLength) {
            this.zOffset = zOffset;
            this.zLength = zLength;
            return this;
        }

        public Builder vertical(boolean vertical) {
            this.vertical = vertical;
            return this;
        }

        public Builder category(Category category) {
            this.category = Objects.requireNonNull(category, "category");
            return this;
        }

        public Builder inTrackingVolume(boolean inTrackingVolume) {
            this.inTrackingVolume = inTrackingVolume;
            return this;
        }

        public Builder material(Material material) {
            this.material = Objects.requireNonNull(material, "material");
            return this;
        }

        public Builder material(double radiation, double interaction) {
            return material(new Material(radiation, interaction));
        }

        /**
         * Override the coverage computed from the (r, z) cross section
         */
        public Builder etaRange(double etaMin, double etaMax) {
            if (etaMin > etaMax) {
                throw new IllegalArgumentException("etaMin > etaMax: " + etaMin + " > " + etaMax);
            }
            this.etaRange = new double[] { etaMin, etaMax };
            return this;
        }

        public InactiveElement build() {
            return new InactiveElement(this);
        }
    }
}

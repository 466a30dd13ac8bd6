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

/**
 * Orientation of a detector surface with respect to the beam axis. It selects how the material of the surface, given
 * for perpendicular incidence, is scaled for a straight track of polar angle theta.
 *
 * @author hal.hildebrand
 */
public enum Orientation {
    /** Surface parallel to the beam (barrel layers, support tubes): path grows as 1/sin(theta) */
    HORIZONTAL {
        @Override
        public double pathFactor(double theta) {
            return 1.0 / Math.sin(theta);
        }
    },
    /** Surface perpendicular to the beam (endcap disks, flanges): path grows as 1/cos(theta) */
    VERTICAL {
        @Override
        public double pathFactor(double theta) {
            return 1.0 / Math.cos(theta);
        }
    };

    /**
     * @param theta polar angle of the track
     * @return ratio of the traversed path to the surface thickness
     */
    public abstract double pathFactor(double theta);

    /**
     * @return the material scaled for a track of polar angle theta
     */
    public Material scale(Material material, double theta) {
        return material.scale(pathFactor(theta));
    }
}

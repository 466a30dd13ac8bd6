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
 * Radiation and interaction length pair, both as fractions of the respective physical length. Values are additive
 * along a path.
 *
 * @author hal.hildebrand
 */
public record Material(double radiation, double interaction) {

    public static final Material ZERO = new Material(0, 0);

    /**
     * @return the pairwise sum of this and the other material
     */
    public Material plus(Material other) {
        return new Material(radiation + other.radiation, interaction + other.interaction);
    }

    /**
     * @return both lengths multiplied by the factor
     */
    public Material scale(double factor) {
        return new Material(radiation * factor, interaction * factor);
    }

    public boolean isZero() {
        return radiation == 0 && interaction == 0;
    }
}

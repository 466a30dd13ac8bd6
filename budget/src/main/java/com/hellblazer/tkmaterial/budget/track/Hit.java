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
package com.hellblazer.tkmaterial.budget.track;

import com.hellblazer.tkmaterial.budget.model.ActiveElement;
import com.hellblazer.tkmaterial.budget.model.Material;
import com.hellblazer.tkmaterial.budget.model.Orientation;

import java.util.Objects;
import java.util.Optional;

/**
 * One crossing of a track with a detector element.
 *
 * @param distance    path length from the origin to the crossing
 * @param orientation orientation of the crossed surface
 * @param kind        sensor or passive material
 * @param material    material traversed, already corrected for the crossing angle
 * @param element     the crossed module, null for passive material (not owned)
 * @author hal.hildebrand
 */
public record Hit(double distance, Orientation orientation, HitKind kind, Material material, ActiveElement element) {

    public Hit {
        Objects.requireNonNull(orientation, "orientation");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(material, "material");
    }

    public static Hit active(double distance, ActiveElement element, Material corrected) {
        return new Hit(distance, element.subdetector().orientation(), HitKind.ACTIVE, corrected, element);
    }

    public static Hit inactive(double distance, Orientation orientation, Material corrected) {
        return new Hit(distance, orientation, HitKind.INACTIVE, corrected, null);
    }

    public Optional<ActiveElement> module() {
        return Optional.ofNullable(element);
    }

    /**
     * @return the same crossing without material
     */
    public Hit withoutMaterial() {
        return new Hit(distance, orientation, kind, Material.ZERO, element);
    }
}
